package com.example.latexmath.model;

/**
 * 自动机状态（封闭枚举）。
 * START / END 不是中间态；MATH_MODE、CONTENT、MATRIX_MODE 是可以承载公式正文的“正文态”。
 */
public enum FsmState {
    START("start", StateType.INITIAL, "初始态，等待数学模式开符"),
    MATH_MODE("math_mode", StateType.INTERMEDIATE, "数学模式最外层正文"),
    COMMAND_PENDING_ARG("command_pending_arg", StateType.INTERMEDIATE, "命令等待下一个 {参数}"),
    CONTENT("content", StateType.INTERMEDIATE, "花括号分组内的正文"),
    SUPERSCRIPT("superscript", StateType.INTERMEDIATE, "^ 之后等待上标"),
    SUBSCRIPT("subscript", StateType.INTERMEDIATE, "_ 之后等待下标"),
    FRACTION_NUM("fraction_num", StateType.INTERMEDIATE, "\\frac 之后等待分子"),
    FRACTION_DEN("fraction_den", StateType.INTERMEDIATE, "分子结束，等待分母"),
    MATRIX_MODE("matrix_mode", StateType.INTERMEDIATE, "\\begin{...} 环境正文"),
    ENVIRONMENT_NAME("environment_name", StateType.INTERMEDIATE, "读取 \\begin / \\end 的环境名"),
    END("end_state", StateType.FINAL, "数学模式已按开符闭合");

    public enum StateType {
        INITIAL,
        INTERMEDIATE,
        FINAL
    }

    private final String code;
    private final StateType type;
    private final String desc;

    FsmState(String code, StateType type, String desc) {
        this.code = code;
        this.type = type;
        this.desc = desc;
    }

    public String getCode() {
        return code;
    }

    public StateType getType() {
        return type;
    }

    public String getDesc() {
        return desc;
    }

    /** 正文态：字母、数字、运算符、命令、分组、上下标都能出现 */
    public boolean isBody() {
        return this == MATH_MODE || this == CONTENT || this == MATRIX_MODE;
    }

    /** 等待 {参数} 的状态；入栈时同时充当“参数分组”标记 */
    public boolean isAwaitingArgument() {
        return this == COMMAND_PENDING_ARG || this == FRACTION_NUM || this == FRACTION_DEN;
    }

    public boolean isScript() {
        return this == SUPERSCRIPT || this == SUBSCRIPT;
    }
}
