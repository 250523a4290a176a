package com.example.latexmath.rule;

/**
 * 转移表条目要执行的动作；引擎只按动作分派，不再按状态写条件分支。
 */
public enum TransitionAction {
    /** START 遇到开符：记录开符，进入 MATH_MODE */
    OPEN_MATH,
    /** MATH_MODE 遇到闭符：开闭匹配且全部平衡时进入 END */
    CLOSE_MATH,
    /** 字母/数字/运算符，停留在当前正文态 */
    STAY,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    /** ^ / _：压入调用方，进入上/下标态 */
    ENTER_SCRIPT,
    /** 正文态中的 {：压入当前态，进入 CONTENT */
    OPEN_GROUP,
    /** CONTENT 中的 }：弹出返回栈，恢复或转去等下一个参数 */
    CLOSE_GROUP,
    /** 正文态中的命令：按注册表的类别/参数个数分派 */
    DISPATCH_COMMAND,
    /** 等待参数态中的 {：压入参数标记，消耗一个参数 */
    OPEN_ARGUMENT,
    /** 上/下标的单个操作数（字母、数字、零参数命令） */
    SCRIPT_OPERAND,
    /** 上/下标后的 {：调用方帧直接作为分组帧 */
    OPEN_SCRIPT_GROUP,
    /** MATRIX_MODE 中的 & */
    ALIGNMENT_TAB,
    /** ENVIRONMENT_NAME 中的字母 */
    ENVIRONMENT_NAME_CHAR,
    /** ENVIRONMENT_NAME 中的 }：完成 \begin / \end */
    CLOSE_ENVIRONMENT_NAME,
    REJECT
}
