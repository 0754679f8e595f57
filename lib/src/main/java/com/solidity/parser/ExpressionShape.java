package com.solidity.parser;

/** The alternatives of the {@code expression} rule, told apart by child count and operator tokens. */
enum ExpressionShape {
    PRIMARY,
    NEW,
    PREFIX_UNARY,
    POSTFIX_UNARY,
    PARENTHESIZED,
    MEMBER_ACCESS,
    BINARY,
    FUNCTION_CALL,
    INDEX_ACCESS,
    OPEN_RANGE,
    NAME_VALUE_CALL,
    CONDITIONAL,
    RANGE_END_ONLY,
    RANGE_START_ONLY,
    RANGE_BOTH
}
