package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionShapesTest {

    // null stands for a sub-rule child
    private static final String E = null;

    private static ExpressionShape classify(String... children) {
        return ExpressionShapes.classify(Arrays.asList(children));
    }

    @Test
    void classifiesSingleAndTwoChildShapes() {
        assertEquals(ExpressionShape.PRIMARY, classify(E));
        assertEquals(ExpressionShape.NEW, classify("new", E));
        assertEquals(ExpressionShape.PREFIX_UNARY, classify("!", E));
        assertEquals(ExpressionShape.PREFIX_UNARY, classify("delete", E));
        assertEquals(ExpressionShape.PREFIX_UNARY, classify("++", E));
        assertEquals(ExpressionShape.POSTFIX_UNARY, classify(E, "--"));
    }

    @Test
    void classifiesThreeChildShapes() {
        assertEquals(ExpressionShape.PARENTHESIZED, classify("(", E, ")"));
        assertEquals(ExpressionShape.MEMBER_ACCESS, classify(E, ".", E));
        assertEquals(ExpressionShape.MEMBER_ACCESS, classify(E, ".", "address"));
        assertEquals(ExpressionShape.BINARY, classify(E, "**", E));
        assertEquals(ExpressionShape.BINARY, classify(E, ">>>=", E));
    }

    @Test
    void classifiesBracketedShapes() {
        assertEquals(ExpressionShape.FUNCTION_CALL, classify(E, "(", E, ")"));
        assertEquals(ExpressionShape.INDEX_ACCESS, classify(E, "[", E, "]"));
        assertEquals(ExpressionShape.OPEN_RANGE, classify(E, "[", ":", "]"));
        assertEquals(ExpressionShape.NAME_VALUE_CALL, classify(E, "{", E, "}"));
        assertEquals(ExpressionShape.CONDITIONAL, classify(E, "?", E, ":", E));
        assertEquals(ExpressionShape.RANGE_END_ONLY, classify(E, "[", ":", E, "]"));
        assertEquals(ExpressionShape.RANGE_START_ONLY, classify(E, "[", E, ":", "]"));
        assertEquals(ExpressionShape.RANGE_BOTH, classify(E, "[", E, ":", E, "]"));
    }

    @Test
    void rejectsUnknownArrangements() {
        List<List<String>> malformed =
                List.of(
                        List.of(),
                        List.of("x"),
                        Arrays.asList(E, E),
                        Arrays.asList(E, "++", E),
                        Arrays.asList(E, "@", E),
                        Arrays.asList(E, "[", "]", "]"),
                        Arrays.asList(E, "?", E, "?", E),
                        Arrays.asList(E, "[", E, ":", E, ")"),
                        Arrays.asList(E, E, E, E, E, E, E));

        for (List<String> children : malformed) {
            ReductionException ex =
                    assertThrows(ReductionException.class, () -> ExpressionShapes.classify(children), children::toString);
            assertTrue(ex.getMessage().startsWith("Unrecognized expression shape"), ex.getMessage());
        }
    }

    @Test
    void fiveAndSixChildShapesNeedRuleOperands() {
        List<List<String>> terminalOperands =
                List.of(
                        Arrays.asList("a", "?", E, ":", E),
                        Arrays.asList(E, "?", "b", ":", E),
                        Arrays.asList(E, "?", E, ":", "c"),
                        Arrays.asList("a", "[", ":", E, "]"),
                        Arrays.asList(E, "[", ":", "]", "]"),
                        Arrays.asList(E, "[", "[", ":", "]"),
                        Arrays.asList(E, "[", ":", ":", E, "]"),
                        Arrays.asList(E, "[", E, ":", ":", "]"));

        for (List<String> children : terminalOperands) {
            assertThrows(ReductionException.class, () -> ExpressionShapes.classify(children), children::toString);
        }
    }

    @Test
    void describesRuleChildrenInMessages() {
        ReductionException ex = assertThrows(ReductionException.class, () -> classify(E, "@", E));

        assertEquals("Unrecognized expression shape [<rule> '@' <rule>]", ex.getMessage());
    }
}
