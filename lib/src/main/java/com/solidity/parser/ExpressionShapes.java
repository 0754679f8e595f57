package com.solidity.parser;

import com.solidity.parser.ast.BinaryOperator;
import com.solidity.parser.ast.UnaryOperator;
import java.util.List;

/**
 * Classifies an {@code expression} context from its children.
 *
 * <p>The input holds one entry per child: the token text for terminal children and {@code null} for
 * sub-rule children. Only the arrangements below are accepted; anything else is a reduction error.</p>
 *
 * <pre>
 * 1  e                  primary
 * 2  new T | op e | e ++
 * 3  ( e ) | e . m | e op e
 * 4  e ( a ) | e [ : ] | e [ e ] | e { l }
 * 5  e ? e : e | e [ : e ] | e [ e : ]
 * 6  e [ e : e ]
 * </pre>
 */
final class ExpressionShapes {

    private ExpressionShapes() {}

    static ExpressionShape classify(List<String> children) {
        switch (children.size()) {
            case 1:
                if (isRule(children, 0)) {
                    return ExpressionShape.PRIMARY;
                }
                break;
            case 2:
                if ("new".equals(children.get(0)) && isRule(children, 1)) {
                    return ExpressionShape.NEW;
                }
                if (isUnaryOperator(children.get(0)) && isRule(children, 1)) {
                    return ExpressionShape.PREFIX_UNARY;
                }
                if (isRule(children, 0) && isIncrementOrDecrement(children.get(1))) {
                    return ExpressionShape.POSTFIX_UNARY;
                }
                break;
            case 3:
                if (is(children, 0, "(") && isRule(children, 1) && is(children, 2, ")")) {
                    return ExpressionShape.PARENTHESIZED;
                }
                if (isRule(children, 0) && is(children, 1, ".")) {
                    return ExpressionShape.MEMBER_ACCESS;
                }
                if (isRule(children, 0) && isBinaryOperator(children.get(1)) && isRule(children, 2)) {
                    return ExpressionShape.BINARY;
                }
                break;
            case 4:
                if (isRule(children, 0) && is(children, 1, "(") && is(children, 3, ")")) {
                    return ExpressionShape.FUNCTION_CALL;
                }
                if (isRule(children, 0) && is(children, 1, "[") && is(children, 3, "]")) {
                    if (is(children, 2, ":")) {
                        return ExpressionShape.OPEN_RANGE;
                    }
                    if (isRule(children, 2)) {
                        return ExpressionShape.INDEX_ACCESS;
                    }
                }
                if (isRule(children, 0) && is(children, 1, "{") && is(children, 3, "}")) {
                    return ExpressionShape.NAME_VALUE_CALL;
                }
                break;
            case 5:
                if (isRule(children, 0) && is(children, 1, "?") && isRule(children, 2) && is(children, 3, ":")
                        && isRule(children, 4)) {
                    return ExpressionShape.CONDITIONAL;
                }
                if (isRule(children, 0) && is(children, 1, "[") && is(children, 2, ":") && isRule(children, 3)
                        && is(children, 4, "]")) {
                    return ExpressionShape.RANGE_END_ONLY;
                }
                if (isRule(children, 0) && is(children, 1, "[") && isRule(children, 2) && is(children, 3, ":")
                        && is(children, 4, "]")) {
                    return ExpressionShape.RANGE_START_ONLY;
                }
                break;
            case 6:
                if (isRule(children, 0) && is(children, 1, "[") && isRule(children, 2) && is(children, 3, ":")
                        && isRule(children, 4) && is(children, 5, "]")) {
                    return ExpressionShape.RANGE_BOTH;
                }
                break;
            default:
                break;
        }
        throw new ReductionException("Unrecognized expression shape " + describe(children));
    }

    private static boolean isRule(List<String> children, int index) {
        return children.get(index) == null;
    }

    private static boolean is(List<String> children, int index, String token) {
        return token.equals(children.get(index));
    }

    private static boolean isUnaryOperator(String text) {
        return text != null && UnaryOperator.fromSymbol(text).isPresent();
    }

    private static boolean isIncrementOrDecrement(String text) {
        return "++".equals(text) || "--".equals(text);
    }

    private static boolean isBinaryOperator(String text) {
        return text != null && BinaryOperator.fromSymbol(text).isPresent();
    }

    private static String describe(List<String> children) {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                builder.append(' ');
            }
            String text = children.get(i);
            builder.append(text == null ? "<rule>" : "'" + text + "'");
        }
        return builder.append(']').toString();
    }
}
