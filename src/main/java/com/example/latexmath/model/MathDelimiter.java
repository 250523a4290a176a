package com.example.latexmath.model;

/**
 * 数学模式定界符：开符记录在 START，END 要求对应的闭符。
 */
public enum MathDelimiter {
    INLINE("$", "$"),
    DISPLAY_DOLLAR("$$", "$$"),
    DISPLAY_BRACKET("\\[", "\\]");

    private final String opener;
    private final String closer;

    MathDelimiter(String opener, String closer) {
        this.opener = opener;
        this.closer = closer;
    }

    public String getOpener() {
        return opener;
    }

    public String getCloser() {
        return closer;
    }

    /** 按开符查找，不是开符返回 null */
    public static MathDelimiter fromOpener(String literal) {
        for (MathDelimiter d : values()) {
            if (d.opener.equals(literal)) {
                return d;
            }
        }
        return null;
    }

    /** 该文本是否是任意一种定界符的闭符 */
    public static boolean isCloser(String literal) {
        for (MathDelimiter d : values()) {
            if (d.closer.equals(literal)) {
                return true;
            }
        }
        return false;
    }
}
