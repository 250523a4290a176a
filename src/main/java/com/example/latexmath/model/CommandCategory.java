package com.example.latexmath.model;

/**
 * 命令的行为类别，参数个数由类别决定。
 */
public enum CommandCategory {
    GREEK_LETTER(0, "希腊字母"),
    SYMBOL(0, "普通符号"),
    BINARY_OPERATOR(0, "二元运算符"),
    RELATION(0, "关系符"),
    ARROW(0, "箭头"),
    BIG_OPERATOR(0, "大型运算符，可带上下限"),
    FUNCTION(0, "函数名"),
    DELIMITER(0, "定界符/尺寸"),
    SPACING(0, "间距"),
    LIMITS_MODIFIER(0, "\\limits / \\nolimits，只能紧跟大型运算符"),
    ROW_SEPARATOR(0, "环境内换行 \\\\"),
    ACCENT(1, "重音"),
    FONT(1, "字体"),
    TEXT(1, "文本"),
    ROOT(1, "根号"),
    FRACTION(2, "分式/二项式"),
    STACKED(2, "上下堆叠"),
    ENVIRONMENT(1, "\\begin / \\end");

    private final int arity;
    private final String desc;

    CommandCategory(int arity, String desc) {
        this.arity = arity;
        this.desc = desc;
    }

    public int getArity() {
        return arity;
    }

    public String getDesc() {
        return desc;
    }
}
