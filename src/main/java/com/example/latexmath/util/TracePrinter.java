package com.example.latexmath.util;

import com.example.latexmath.model.TraceStep;
import com.example.latexmath.model.ValidationResult;

import java.util.List;
import java.util.Set;

/**
 * 把校验结果/逐步轨迹排成文本表格，方便控制台查看。
 */
public class TracePrinter {

    private static final String IND = "  ";
    private static final int MAX_EXPECTED = 15;

    public static String prettyPrint(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        if (result == null) {
            return "ValidationResult: null\n";
        }

        sb.append("ValidationResult {\n");
        appendKV(sb, 1, "input", result.getInput());
        appendKV(sb, 1, "valid", result.isValid());
        appendKV(sb, 1, "tokenCount", result.getTokenCount());
        appendKV(sb, 1, "finalState", result.getFinalState());

        if (!result.isValid()) {
            appendKV(sb, 1, "error", result.getError());
            appendKV(sb, 1, "failingIndex", result.getFailingIndex());
            appendKV(sb, 1, "failingToken",
                    result.getFailingToken() == null ? "<end of input>" : result.getFailingToken().literal());
            appendKV(sb, 1, "expected", abbreviate(result.getExpected()));
        }

        if (result.getTrace() != null && !result.getTrace().isEmpty()) {
            sb.append(indent(1)).append("trace [\n");
            sb.append(formatTrace(result.getTrace(), 2));
            sb.append(indent(1)).append("]\n");
        } else {
            sb.append(indent(1)).append("trace: null/empty\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    /** 每步一行：序号 | token | before -> after | OK/REJECT(原因) */
    public static String formatTrace(List<TraceStep> trace, int level) {
        StringBuilder sb = new StringBuilder();
        int width = 5;
        for (TraceStep step : trace) {
            width = Math.max(width, step.token().literal().length() + 2);
        }
        for (TraceStep step : trace) {
            sb.append(indent(level))
                    .append(String.format("%3d | %-" + width + "s | %-19s -> %-19s | ",
                            step.index(),
                            "'" + step.token().literal() + "'",
                            step.before().getCode(),
                            step.after().getCode()))
                    .append(step.accepted() ? "OK" : "REJECT(" + step.error() + ")")
                    .append('\n');
        }
        return sb.toString();
    }

    private static String abbreviate(Set<String> expected) {
        if (expected == null || expected.isEmpty()) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        int i = 0;
        for (String s : expected) {
            if (i == MAX_EXPECTED) {
                sb.append(", ... (").append(expected.size()).append(" total)");
                break;
            }
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(s);
            i++;
        }
        return sb.append(']').toString();
    }

    private static void appendKV(StringBuilder sb, int level, String key, Object value) {
        sb.append(indent(level)).append(key).append(": ").append(value).append('\n');
    }

    private static String indent(int level) {
        return IND.repeat(Math.max(0, level));
    }
}
