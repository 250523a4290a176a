package com.example.latexmath.rule;

import com.example.latexmath.model.CommandCategory;
import com.example.latexmath.model.CommandDef;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 已知控制序列目录，按行为类别分组。
 * 进程内只构建一次，之后只读；多个自动机实例共享同一个引用。
 *
 * 注意：这里的名字不带反斜杠，要和 Token.commandName() 完全一致。
 */
@Component
public class CommandRegistry {

    private static final Map<CommandCategory, List<String>> CATALOGUE = new EnumMap<>(CommandCategory.class);

    static {
        CATALOGUE.put(CommandCategory.GREEK_LETTER, List.of(
                "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "zeta", "eta",
                "theta", "vartheta", "iota", "kappa", "lambda", "mu", "nu", "xi",
                "pi", "varpi", "rho", "varrho", "sigma", "varsigma", "tau", "upsilon",
                "phi", "varphi", "chi", "psi", "omega",
                "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon",
                "Phi", "Psi", "Omega"
        ));

        CATALOGUE.put(CommandCategory.SYMBOL, List.of(
                "infty", "nabla", "partial", "emptyset", "varnothing", "exists", "nexists", "forall",
                "therefore", "because", "dots", "ldots", "cdots", "vdots", "ddots",
                "prime", "hbar", "ell", "Re", "Im", "aleph", "angle", "triangle", "neg", "lnot",
                "top", "bot", "wp", "surd",
                // 转义符号：\$ \% \& \# \_
                "$", "%", "&", "#", "_"
        ));

        CATALOGUE.put(CommandCategory.BINARY_OPERATOR, List.of(
                "cdot", "times", "div", "pm", "mp", "ast", "star", "circ", "bullet",
                "cap", "cup", "sqcap", "sqcup", "vee", "wedge", "land", "lor",
                "setminus", "oplus", "ominus", "otimes", "oslash", "odot", "uplus", "amalg"
        ));

        CATALOGUE.put(CommandCategory.RELATION, List.of(
                "leq", "le", "geq", "ge", "neq", "ne", "equiv", "approx", "sim", "simeq",
                "cong", "propto", "parallel", "perp", "subset", "supset", "subseteq", "supseteq",
                "in", "ni", "notin", "ll", "gg", "prec", "succ", "preceq", "succeq",
                "mid", "models", "vdash", "dashv", "asymp", "doteq"
        ));

        CATALOGUE.put(CommandCategory.ARROW, List.of(
                "rightarrow", "leftarrow", "leftrightarrow", "Rightarrow", "Leftarrow",
                "Leftrightarrow", "mapsto", "longmapsto", "to", "gets", "implies", "iff",
                "longrightarrow", "longleftarrow", "Longrightarrow", "Longleftarrow",
                "uparrow", "downarrow", "Uparrow", "Downarrow", "hookrightarrow", "hookleftarrow"
        ));

        CATALOGUE.put(CommandCategory.BIG_OPERATOR, List.of(
                "sum", "prod", "coprod", "int", "iint", "iiint", "oint",
                "bigcup", "bigcap", "bigoplus", "bigotimes", "bigvee", "bigwedge", "bigsqcup"
        ));

        CATALOGUE.put(CommandCategory.FUNCTION, List.of(
                "sin", "cos", "tan", "sec", "csc", "cot", "sinh", "cosh", "tanh", "coth",
                "arcsin", "arccos", "arctan", "ln", "log", "lg", "exp", "det", "dim",
                "ker", "hom", "deg", "gcd", "lim", "liminf", "limsup", "max", "min",
                "sup", "inf", "arg", "Pr"
        ));

        CATALOGUE.put(CommandCategory.DELIMITER, List.of(
                "left", "right", "big", "Big", "bigg", "Bigg", "bigl", "bigr",
                "langle", "rangle", "lceil", "rceil", "lfloor", "rfloor", "vert", "Vert",
                // \{ \} \|
                "{", "}", "|"
        ));

        CATALOGUE.put(CommandCategory.SPACING, List.of(
                "quad", "qquad", "enspace", "thinspace", "medspace", "thickspace",
                // \, \; \: \! 以及控制空格 "\ "
                ",", ";", ":", "!", " "
        ));

        CATALOGUE.put(CommandCategory.LIMITS_MODIFIER, List.of("limits", "nolimits"));

        CATALOGUE.put(CommandCategory.ROW_SEPARATOR, List.of("\\"));

        CATALOGUE.put(CommandCategory.ACCENT, List.of(
                "hat", "widehat", "bar", "overline", "underline", "vec", "tilde", "widetilde",
                "dot", "ddot", "acute", "grave", "check", "breve",
                "overrightarrow", "overleftarrow", "overbrace", "underbrace"
        ));

        CATALOGUE.put(CommandCategory.FONT, List.of(
                "mathbf", "mathit", "mathcal", "mathbb", "mathfrak", "mathrm",
                "mathsf", "mathtt", "boldsymbol", "mathscr"
        ));

        CATALOGUE.put(CommandCategory.TEXT, List.of("text", "textrm", "textbf", "textit", "mbox", "operatorname"));

        CATALOGUE.put(CommandCategory.ROOT, List.of("sqrt"));

        CATALOGUE.put(CommandCategory.FRACTION, List.of(
                "frac", "dfrac", "tfrac", "cfrac", "binom", "dbinom", "tbinom"
        ));

        CATALOGUE.put(CommandCategory.STACKED, List.of("overset", "underset", "stackrel"));

        CATALOGUE.put(CommandCategory.ENVIRONMENT, List.of("begin", "end"));
    }

    /** \begin{...} 支持的数学环境（都以 & 分列、\\ 分行） */
    private static final Set<String> ENVIRONMENTS = Set.of(
            "matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix", "smallmatrix",
            "cases", "aligned", "gathered", "split"
    );

    private final Map<String, CommandDef> commands;

    public CommandRegistry() {
        Map<String, CommandDef> map = new LinkedHashMap<>();
        for (Map.Entry<CommandCategory, List<String>> e : CATALOGUE.entrySet()) {
            for (String name : e.getValue()) {
                CommandDef prev = map.put(name, new CommandDef(name, e.getKey()));
                if (prev != null) {
                    throw new IllegalArgumentException("duplicate command in registry: \\" + name);
                }
            }
        }
        this.commands = Collections.unmodifiableMap(map);
    }

    public boolean isKnown(String name) {
        return name != null && commands.containsKey(name);
    }

    /** 未知命令返回 null */
    public CommandDef get(String name) {
        return name == null ? null : commands.get(name);
    }

    /** 参数个数 0/1/2；未知命令返回 -1 */
    public int arity(String name) {
        CommandDef def = get(name);
        return def == null ? -1 : def.arity();
    }

    public Collection<CommandDef> all() {
        return commands.values();
    }

    public int size() {
        return commands.size();
    }

    public boolean isEnvironment(String name) {
        return ENVIRONMENTS.contains(name);
    }

    /** 是否某个已知环境名的前缀（空串也算） */
    public boolean isEnvironmentPrefix(String prefix) {
        for (String env : ENVIRONMENTS) {
            if (env.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
