package com.example.scene.latexmath;

import com.example.latexmath.model.CommandCategory;
import com.example.latexmath.model.CommandDef;
import com.example.latexmath.rule.CommandRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandRegistryTest {

    private final CommandRegistry registry = FsmFixtures.REGISTRY;

    @Test
    void holdsAtLeastTwoHundredEntries() {
        assertTrue(registry.size() >= 200, "size=" + registry.size());
        assertEquals(registry.size(), registry.all().size());
    }

    @Test
    void arityFollowsCategory() {
        assertEquals(2, registry.arity("frac"));
        assertEquals(1, registry.arity("sqrt"));
        assertEquals(1, registry.arity("text"));
        assertEquals(1, registry.arity("begin"));
        assertEquals(0, registry.arity("alpha"));
        assertEquals(0, registry.arity("sum"));
        assertEquals(0, registry.arity("int"));
        assertEquals(0, registry.arity("\\"));
        assertEquals(-1, registry.arity("unknown"));
        assertNull(registry.get("unknown"));
        assertFalse(registry.isKnown(null));
    }

    @Test
    void bigOperatorsAreCategorisedForLimits() {
        assertEquals(CommandCategory.BIG_OPERATOR, registry.get("sum").category());
        assertEquals(CommandCategory.BIG_OPERATOR, registry.get("int").category());
        assertEquals(CommandCategory.LIMITS_MODIFIER, registry.get("limits").category());
    }

    @Test
    void everyEntryHasConsistentArity() {
        for (CommandDef def : registry.all()) {
            assertEquals(def.category().getArity(), def.arity(), def.name());
            assertTrue(def.arity() >= 0 && def.arity() <= 2, def.name());
            assertEquals("\\" + def.name(), def.literal());
        }
    }

    @Test
    void catalogueIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> registry.all().clear());
    }

    @Test
    void environmentPrefixes() {
        assertTrue(registry.isEnvironment("pmatrix"));
        assertTrue(registry.isEnvironmentPrefix(""));
        assertTrue(registry.isEnvironmentPrefix("pma"));
        assertFalse(registry.isEnvironmentPrefix("equation"));
        assertFalse(registry.isEnvironment("pma"));
    }
}
