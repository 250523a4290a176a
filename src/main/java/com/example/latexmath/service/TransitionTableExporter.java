package com.example.latexmath.service;

import com.example.latexmath.config.LatexFsmProperties;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.TokenKind;
import com.example.latexmath.rule.TransitionRule;
import com.example.latexmath.rule.TransitionTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 把静态转移表导出成 JSON，图表/文档工具直接读数据，不执行引擎。
 *
 * {
 *   "states":      [{name, code, type, desc}],
 *   "tokenKinds":  [...],
 *   "transitions": [{from, kind, action, targets, error, description}]
 * }
 */
@Service
public class TransitionTableExporter {

    private static final Logger log = LoggerFactory.getLogger(TransitionTableExporter.class);

    private final TransitionTable table;
    private final ObjectMapper objectMapper;
    private final LatexFsmProperties props;

    public TransitionTableExporter(TransitionTable table, ObjectMapper objectMapper, LatexFsmProperties props) {
        this.table = table;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public ObjectNode toJsonTree(boolean includeRejects) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode states = root.putArray("states");
        for (FsmState s : FsmState.values()) {
            ObjectNode n = states.addObject();
            n.put("name", s.name());
            n.put("code", s.getCode());
            n.put("type", s.getType().name());
            n.put("desc", s.getDesc());
        }

        ArrayNode kinds = root.putArray("tokenKinds");
        for (TokenKind k : TokenKind.values()) {
            kinds.add(k.name());
        }

        ArrayNode transitions = root.putArray("transitions");
        for (TransitionRule r : table.all()) {
            if (r.isReject() && !includeRejects) {
                continue;
            }
            ObjectNode n = transitions.addObject();
            n.put("from", r.from().name());
            n.put("kind", r.kind().name());
            n.put("action", r.action().name());
            ArrayNode targets = n.putArray("targets");
            for (FsmState t : FsmState.values()) {
                // 按枚举顺序输出，保证导出稳定
                if (r.targets().contains(t)) {
                    targets.add(t.name());
                }
            }
            if (r.error() != null) {
                n.put("error", r.error().name());
            } else {
                n.putNull("error");
            }
            n.put("description", r.description());
        }
        return root;
    }

    public String toJson(boolean includeRejects) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonTree(includeRejects));
    }

    /** 写到配置的 exportFile */
    public Map<String, Object> export() {
        return export(props.exportFilePath());
    }

    public Map<String, Object> export(Path target) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(true), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to export transition table. file={}", target, e);
            return Map.of("status", 1, "msg", String.valueOf(e.getMessage()));
        }
        log.info("Transition table exported. file={}, transitions={}", target, table.all().size());
        return Map.of("status", 0, "file", target.toString());
    }
}
