package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.solidity.parser.ast.ArrayTypeName;
import com.solidity.parser.ast.BinaryOperation;
import com.solidity.parser.ast.BinaryOperator;
import com.solidity.parser.ast.BooleanLiteral;
import com.solidity.parser.ast.Conditional;
import com.solidity.parser.ast.ElementaryTypeName;
import com.solidity.parser.ast.Expression;
import com.solidity.parser.ast.FunctionCall;
import com.solidity.parser.ast.HexLiteral;
import com.solidity.parser.ast.Identifier;
import com.solidity.parser.ast.IndexAccess;
import com.solidity.parser.ast.IndexRangeAccess;
import com.solidity.parser.ast.MemberAccess;
import com.solidity.parser.ast.NameValueExpression;
import com.solidity.parser.ast.NewExpression;
import com.solidity.parser.ast.NumberLiteral;
import com.solidity.parser.ast.StringLiteral;
import com.solidity.parser.ast.TupleExpression;
import com.solidity.parser.ast.UnaryOperation;
import com.solidity.parser.ast.UnaryOperator;
import com.solidity.parser.ast.UserDefinedTypeName;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionReductionTest {

    private static String name(Expression expression) {
        return assertInstanceOf(Identifier.class, expression).getName();
    }

    @Test
    void binaryOperatorsFollowPrecedence() throws Exception {
        BinaryOperation sum = assertInstanceOf(BinaryOperation.class, TestSources.expression("a + b * c"));

        assertEquals(BinaryOperator.ADD, sum.getOperator());
        assertEquals("a", name(sum.getLeft()));
        BinaryOperation product = assertInstanceOf(BinaryOperation.class, sum.getRight());
        assertEquals(BinaryOperator.MULTIPLY, product.getOperator());
        assertEquals("b", name(product.getLeft()));
        assertEquals("c", name(product.getRight()));
    }

    @Test
    void compoundAssignmentIsABinaryOperation() throws Exception {
        BinaryOperation assignment = assertInstanceOf(BinaryOperation.class, TestSources.expression("total += 1"));

        assertEquals(BinaryOperator.ASSIGN_ADD, assignment.getOperator());
        assertTrue(assignment.getOperator().isAssignment());
        assertEquals("total", name(assignment.getLeft()));
    }

    @Test
    void prefixAndPostfixUnaryOperations() throws Exception {
        UnaryOperation not = assertInstanceOf(UnaryOperation.class, TestSources.expression("!ready"));
        assertEquals(UnaryOperator.NOT, not.getOperator());
        assertTrue(not.isPrefix());

        UnaryOperation increment = assertInstanceOf(UnaryOperation.class, TestSources.expression("i++"));
        assertEquals(UnaryOperator.INCREMENT, increment.getOperator());
        assertFalse(increment.isPrefix());
        assertEquals("i", name(increment.getSubExpression()));

        UnaryOperation delete = assertInstanceOf(UnaryOperation.class, TestSources.expression("delete balances"));
        assertEquals(UnaryOperator.DELETE, delete.getOperator());
        assertTrue(delete.isPrefix());
    }

    @Test
    void conditionalKeepsAllThreeOperands() throws Exception {
        Conditional conditional = assertInstanceOf(Conditional.class, TestSources.expression("ok ? 1 : 2"));

        assertEquals("ok", name(conditional.getCondition()));
        assertEquals("1", assertInstanceOf(NumberLiteral.class, conditional.getTrueExpression()).getNumber());
        assertEquals("2", assertInstanceOf(NumberLiteral.class, conditional.getFalseExpression()).getNumber());
    }

    @Test
    void memberAccessAndCalls() throws Exception {
        FunctionCall call = assertInstanceOf(FunctionCall.class, TestSources.expression("token.transfer(to, 5)"));

        MemberAccess callee = assertInstanceOf(MemberAccess.class, call.getExpression());
        assertEquals("token", name(callee.getExpression()));
        assertEquals("transfer", callee.getMemberName());
        assertEquals(2, call.getArguments().size());
        assertEquals(List.of(), call.getNames());
    }

    @Test
    void namedCallArgumentsKeepTheirNames() throws Exception {
        FunctionCall call = assertInstanceOf(FunctionCall.class, TestSources.expression("f({value: 1, gas: g})"));

        assertEquals(List.of("value", "gas"), call.getNames());
        assertEquals(2, call.getArguments().size());
        assertEquals("g", name(call.getArguments().get(1)));
    }

    @Test
    void callOptionsBecomeNameValueExpression() throws Exception {
        FunctionCall call =
                assertInstanceOf(FunctionCall.class, TestSources.expression("target.call{value: 1}(data)"));

        NameValueExpression options = assertInstanceOf(NameValueExpression.class, call.getExpression());
        assertEquals(List.of("value"), options.getArguments().getNames());
        assertInstanceOf(MemberAccess.class, options.getExpression());
    }

    @Test
    void newArrayExpression() throws Exception {
        FunctionCall call = assertInstanceOf(FunctionCall.class, TestSources.expression("new uint256[](3)"));

        NewExpression created = assertInstanceOf(NewExpression.class, call.getExpression());
        ArrayTypeName array = assertInstanceOf(ArrayTypeName.class, created.getTypeName());
        assertEquals("uint256", assertInstanceOf(ElementaryTypeName.class, array.getBaseTypeName()).getName());
        assertNull(array.getLength());
    }

    @Test
    void indexAccessAndOpenRanges() throws Exception {
        IndexAccess index = assertInstanceOf(IndexAccess.class, TestSources.expression("values[i]"));
        assertEquals("values", name(index.getBase()));
        assertEquals("i", name(index.getIndex()));

        IndexRangeAccess all = assertInstanceOf(IndexRangeAccess.class, TestSources.expression("data[:]"));
        assertNull(all.getIndexStart());
        assertNull(all.getIndexEnd());

        IndexRangeAccess tail = assertInstanceOf(IndexRangeAccess.class, TestSources.expression("data[4:]"));
        assertInstanceOf(NumberLiteral.class, tail.getIndexStart());
        assertNull(tail.getIndexEnd());

        IndexRangeAccess head = assertInstanceOf(IndexRangeAccess.class, TestSources.expression("data[:4]"));
        assertNull(head.getIndexStart());
        assertInstanceOf(NumberLiteral.class, head.getIndexEnd());
    }

    @Test
    void tuplesKeepHolesAndArraysAreFlagged() throws Exception {
        TupleExpression tuple = assertInstanceOf(TupleExpression.class, TestSources.expression("(a, , b)"));
        assertFalse(tuple.isArray());
        assertEquals(3, tuple.getComponents().size());
        assertEquals("a", name(tuple.getComponents().get(0)));
        assertNull(tuple.getComponents().get(1));
        assertEquals("b", name(tuple.getComponents().get(2)));

        TupleExpression array = assertInstanceOf(TupleExpression.class, TestSources.expression("[1, 2, 3]"));
        assertTrue(array.isArray());
        assertEquals(3, array.getComponents().size());

        TupleExpression parenthesized = assertInstanceOf(TupleExpression.class, TestSources.expression("(x)"));
        assertFalse(parenthesized.isArray());
        assertEquals("x", name(parenthesized.getComponents().get(0)));
    }

    @Test
    void literals() throws Exception {
        assertTrue(assertInstanceOf(BooleanLiteral.class, TestSources.expression("true")).getValue());
        assertFalse(assertInstanceOf(BooleanLiteral.class, TestSources.expression("false")).getValue());

        NumberLiteral ether = assertInstanceOf(NumberLiteral.class, TestSources.expression("1 ether"));
        assertEquals("1", ether.getNumber());
        assertEquals("ether", ether.getSubdenomination());

        NumberLiteral hexNumber = assertInstanceOf(NumberLiteral.class, TestSources.expression("0xff"));
        assertEquals("0xff", hexNumber.getNumber());
        assertNull(hexNumber.getSubdenomination());

        HexLiteral hex = assertInstanceOf(HexLiteral.class, TestSources.expression("hex\"00ff\" hex'aa'"));
        assertEquals(List.of("00ff", "aa"), hex.getParts());
        assertEquals("00ffaa", hex.getValue());
    }

    @Test
    void stringLiteralsUnescapeTheirQuoteAndTrackUnicodeParts() throws Exception {
        StringLiteral escaped = assertInstanceOf(StringLiteral.class, TestSources.expression("\"say \\\"hi\\\"\""));
        assertEquals("say \"hi\"", escaped.getValue());

        StringLiteral joined =
                assertInstanceOf(StringLiteral.class, TestSources.expression("'ab' unicode\"cd\" \"e\\n\""));
        assertEquals(List.of("ab", "cd", "e\\n"), joined.getParts());
        assertEquals(Arrays.asList(false, true, false), joined.getIsUnicode());
        assertEquals("abcde\\n", joined.getValue());
    }

    @Test
    void typeAndPayableKeywordsAreIdentifiers() throws Exception {
        MemberAccess max = assertInstanceOf(MemberAccess.class, TestSources.expression("type(uint8).max"));
        FunctionCall typeCall = assertInstanceOf(FunctionCall.class, max.getExpression());
        assertEquals("type", name(typeCall.getExpression()));
        assertInstanceOf(ElementaryTypeName.class, typeCall.getArguments().get(0));

        FunctionCall payable = assertInstanceOf(FunctionCall.class, TestSources.expression("payable(owner)"));
        assertEquals("payable", name(payable.getExpression()));
    }

    @Test
    void typeNamesInExpressionPosition() throws Exception {
        FunctionCall cast = assertInstanceOf(FunctionCall.class, TestSources.expression("address(0)"));
        ElementaryTypeName address = assertInstanceOf(ElementaryTypeName.class, cast.getExpression());
        assertEquals("address", address.getName());

        FunctionCall decode =
                assertInstanceOf(FunctionCall.class, TestSources.expression("abi.decode(data, (Item[]))"));
        TupleExpression types = assertInstanceOf(TupleExpression.class, decode.getArguments().get(1));
        ArrayTypeName items = assertInstanceOf(ArrayTypeName.class, types.getComponents().get(0));
        assertEquals("Item", assertInstanceOf(UserDefinedTypeName.class, items.getBaseTypeName()).getNamePath());
        assertNull(items.getLength());
    }

    @Test
    void memberNamedAddressIsAccepted() throws Exception {
        MemberAccess access = assertInstanceOf(MemberAccess.class, TestSources.expression("this.address"));

        assertEquals("address", access.getMemberName());
        assertEquals("this", name(access.getExpression()));
    }
}
