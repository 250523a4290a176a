package com.example.latexmath.model;

/**
 * 词法单元类别：
 *  - MATH_DELIMITER：数学模式定界符 $ / $$ / \[ / \]
 *  - COMMAND：控制序列（\frac、\alpha、\{ 这种转义符号也算）
 *  - OTHER：识别不了的字符，词法阶段照样产出，由状态机拒绝
 */
public enum TokenKind {
    MATH_DELIMITER,
    COMMAND,
    LETTER,
    DIGIT,
    OPERATOR,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_PAREN,
    CLOSE_PAREN,
    CARET_SUP,
    UNDERSCORE_SUB,
    OTHER
}
