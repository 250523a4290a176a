package com.example.latexmath.model;

/**
 * 拒绝原因分类（全部可恢复，不抛异常）。
 */
public enum ErrorKind {
    /** 词法上无法归类的字符（OTHER），状态机拒绝 */
    UNKNOWN_TOKEN,
    /** 当前状态对该类词法单元没有定义转移 */
    INVALID_TRANSITION,
    /** 输入结束或闭合数学模式时，深度计数/栈未清空 */
    UNBALANCED_DELIMITER,
    /** 命令名（或环境名）不在注册表中 */
    UNKNOWN_COMMAND,
    /** 闭符与开符不匹配，例如 $ 开、\] 闭 */
    DELIMITER_MISMATCH
}
