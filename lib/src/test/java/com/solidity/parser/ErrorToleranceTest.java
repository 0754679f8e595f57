package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.solidity.parser.ast.ContractDefinition;
import com.solidity.parser.ast.SourceUnit;
import com.solidity.parser.ast.SyntaxDiagnostic;
import com.solidity.parser.grammar.SolidityParser;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.tree.ErrorNodeImpl;
import org.junit.jupiter.api.Test;

class ErrorToleranceTest {

    private static final String UNCLOSED_CONTRACT = "contract A { uint256 a; }\ncontract B {";

    @Test
    void unclosedContractStillYieldsBothContracts() throws Exception {
        SourceUnit unit = new SolidityAstParser().parse(UNCLOSED_CONTRACT);

        assertEquals(1, unit.getErrors().size());
        assertEquals(2, unit.getChildren().size());
        assertEquals("B", assertInstanceOf(ContractDefinition.class, unit.getChildren().get(1)).getName());
        SyntaxDiagnostic error = unit.getErrors().get(0);
        assertEquals(2, error.getLine());
    }

    @Test
    void strictModeReportsTheFirstError() {
        SolidityParseException ex =
                assertThrows(
                        SolidityParseException.class,
                        () -> new SolidityAstParser()
                                .parse(UNCLOSED_CONTRACT, ParseOptions.builder().tolerant(false).build()));

        assertEquals(ex.getFirstError().toString(), ex.getMessage());
        assertTrue(ex.getMessage().endsWith("(2:12)"), ex.getMessage());
    }

    @Test
    void validInputHasNoErrors() throws Exception {
        SourceUnit unit = new SolidityAstParser().parse("contract A { }");

        assertTrue(unit.getErrors().isEmpty());
    }

    @Test
    void damagedMemberThatCannotBeReducedIsDropped() {
        SolidityParser.SourceUnitContext root = new SolidityParser.SourceUnitContext(null, 0);
        SolidityParser.ContractDefinitionContext damaged = new SolidityParser.ContractDefinitionContext(root, 0);
        damaged.exception = new RecognitionException(null, null, damaged);
        root.addChild(damaged);

        SourceUnit unit = new AstReducer(new NodeMetadata(false, false), 100).reduceSourceUnit(root);

        assertTrue(unit.getChildren().isEmpty());
    }

    @Test
    void memberWithErrorNodeCountsAsDamaged() {
        SolidityParser.SourceUnitContext root = new SolidityParser.SourceUnitContext(null, 0);
        SolidityParser.ContractDefinitionContext damaged = new SolidityParser.ContractDefinitionContext(root, 0);
        damaged.addErrorNode(new ErrorNodeImpl(new CommonToken(SolidityParser.Identifier, "oops")));
        root.addChild(damaged);

        assertTrue(SyntaxDamage.isDamaged(damaged));
        SourceUnit unit = new AstReducer(new NodeMetadata(false, false), 100).reduceSourceUnit(root);
        assertTrue(unit.getChildren().isEmpty());
    }

    @Test
    void undamagedMemberThatCannotBeReducedIsRethrown() {
        SolidityParser.SourceUnitContext root = new SolidityParser.SourceUnitContext(null, 0);
        SolidityParser.ContractDefinitionContext empty = new SolidityParser.ContractDefinitionContext(root, 0);
        root.addChild(empty);

        assertFalse(SyntaxDamage.isDamaged(empty));
        AstReducer reducer = new AstReducer(new NodeMetadata(false, false), 100);
        assertThrows(ReductionException.class, () -> reducer.reduceSourceUnit(root));
    }

    @Test
    void foldedRulesCannotBeReducedOnTheirOwn() {
        AstReducer reducer = new AstReducer(new NodeMetadata(false, false), 100);

        ReductionException ex =
                assertThrows(
                        ReductionException.class,
                        () -> reducer.visitParameterList(new SolidityParser.ParameterListContext(null, 0)));
        assertEquals("parameterList is reduced by its enclosing rule", ex.getMessage());
    }
}
