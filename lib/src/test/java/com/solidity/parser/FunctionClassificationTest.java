package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.solidity.parser.ast.ContractDefinition;
import com.solidity.parser.ast.FunctionDefinition;
import com.solidity.parser.ast.NodeType;
import com.solidity.parser.ast.SourceUnit;
import com.solidity.parser.ast.Visibility;
import com.solidity.parser.walk.AstWalker;
import com.solidity.parser.walk.NodeCallbacks;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunctionClassificationTest {

    private static FunctionDefinition onlyFunction(String member) throws Exception {
        ContractDefinition contract = TestSources.contract(member);
        return assertInstanceOf(FunctionDefinition.class, contract.getChildren().get(0));
    }

    @Test
    void constructorKeyword() throws Exception {
        FunctionDefinition function = onlyFunction("constructor(uint x) public { }");

        assertTrue(function.isConstructor());
        assertFalse(function.isFallback());
        assertFalse(function.isReceiveEther());
        assertNull(function.getName());
        assertEquals(Visibility.PUBLIC, function.getVisibility());
        assertEquals(1, function.getParameters().size());
        assertNull(function.getReturnParameters());
    }

    @Test
    void constructorWithoutVisibilityHasDefaultVisibility() throws Exception {
        FunctionDefinition function = onlyFunction("constructor() payable { }");

        assertTrue(function.isConstructor());
        assertEquals(Visibility.DEFAULT, function.getVisibility());
        assertEquals("payable", function.getStateMutability());
    }

    @Test
    void legacyConstructorMatchesEnclosingContractName() throws Exception {
        FunctionDefinition function = onlyFunction("function C() public { }");

        assertTrue(function.isConstructor());
        assertEquals("C", function.getName());
        assertEquals(Visibility.PUBLIC, function.getVisibility());
    }

    @Test
    void legacyConstructorOnlyMatchesTheInnermostContract() throws Exception {
        SourceUnit unit = TestSources.parse("contract A { } contract B { function A() public { } }");

        ContractDefinition b = assertInstanceOf(ContractDefinition.class, unit.getChildren().get(1));
        FunctionDefinition function = assertInstanceOf(FunctionDefinition.class, b.getChildren().get(0));
        assertFalse(function.isConstructor());
        assertEquals("A", function.getName());
    }

    @Test
    void unnamedFunctionIsLegacyFallback() throws Exception {
        FunctionDefinition function = onlyFunction("function () external payable { }");

        assertTrue(function.isFallback());
        assertFalse(function.isConstructor());
        assertEquals("", function.getName());
        assertEquals(Visibility.EXTERNAL, function.getVisibility());
    }

    @Test
    void fallbackAndReceiveKeywords() throws Exception {
        ContractDefinition contract =
                TestSources.contract(
                        "fallback(bytes calldata input) external returns (bytes memory) { }\n"
                                + "receive() external payable { }");

        FunctionDefinition fallback = assertInstanceOf(FunctionDefinition.class, contract.getChildren().get(0));
        assertTrue(fallback.isFallback());
        assertNull(fallback.getName());
        assertEquals(Visibility.EXTERNAL, fallback.getVisibility());
        assertEquals(1, fallback.getReturnParameters().size());

        FunctionDefinition receive = assertInstanceOf(FunctionDefinition.class, contract.getChildren().get(1));
        assertTrue(receive.isReceiveEther());
        assertFalse(receive.isFallback());
        assertEquals(Visibility.EXTERNAL, receive.getVisibility());
        assertEquals(List.of(), receive.getParameters());
    }

    @Test
    void receiveDropsWrittenParameters() throws Exception {
        ContractDefinition contract = TestSources.contract("receive(uint x) external payable {}");

        FunctionDefinition receive = assertInstanceOf(FunctionDefinition.class, contract.getChildren().get(0));
        assertTrue(receive.isReceiveEther());
        assertEquals(List.of(), receive.getParameters());
        assertNull(receive.getReturnParameters());
    }

    @Test
    void topLevelFunctionIsNeverALegacyConstructor() throws Exception {
        SourceUnit unit = TestSources.parse("function helper(uint a) pure returns (uint) { return a; }");

        FunctionDefinition function = assertInstanceOf(FunctionDefinition.class, unit.getChildren().get(0));
        assertFalse(function.isConstructor());
        assertEquals("pure", function.getStateMutability());
        assertEquals(Visibility.DEFAULT, function.getVisibility());
    }

    @Test
    void visibilityVirtualAndOverride() throws Exception {
        ContractDefinition contract =
                TestSources.contract(
                        String.join(
                                "\n",
                                "function a() internal virtual { }",
                                "function b() private view override returns (uint) { }",
                                "function c() external override(Base, Other) { }",
                                "function d() public;"));

        FunctionDefinition a = (FunctionDefinition) contract.getChildren().get(0);
        assertEquals(Visibility.INTERNAL, a.getVisibility());
        assertTrue(a.isVirtual());
        assertNull(a.getOverride());

        FunctionDefinition b = (FunctionDefinition) contract.getChildren().get(1);
        assertEquals(Visibility.PRIVATE, b.getVisibility());
        assertEquals("view", b.getStateMutability());
        assertEquals(List.of(), b.getOverride());

        FunctionDefinition c = (FunctionDefinition) contract.getChildren().get(2);
        assertEquals(2, c.getOverride().size());
        assertEquals("Other", c.getOverride().get(1).getNamePath());

        FunctionDefinition d = (FunctionDefinition) contract.getChildren().get(3);
        assertNull(d.getBody());
    }

    @Test
    void modifierInvocationArgumentForms() throws Exception {
        FunctionDefinition function = onlyFunction("function f() public onlyOwner guarded() limit(10, x) { }");

        assertEquals(3, function.getModifiers().size());
        assertEquals("onlyOwner", function.getModifiers().get(0).getName());
        assertEquals(List.of(), function.getModifiers().get(0).getArguments());
        assertNull(function.getModifiers().get(1).getArguments());
        assertEquals(2, function.getModifiers().get(2).getArguments().size());
    }

    @Test
    void atMostOneKindFlagIsSetAcrossAFixture() throws Exception {
        SourceUnit unit = TestSources.parse(TestSources.fixture("Token.sol"));
        List<FunctionDefinition> functions = new ArrayList<>();
        NodeCallbacks callbacks =
                NodeCallbacks.builder()
                        .on("FunctionDefinition", (node, parent) -> functions.add((FunctionDefinition) node))
                        .build();

        new AstWalker(callbacks).walk(unit);

        assertEquals(4, functions.size());
        for (FunctionDefinition function : functions) {
            int flags =
                    (function.isConstructor() ? 1 : 0)
                            + (function.isFallback() ? 1 : 0)
                            + (function.isReceiveEther() ? 1 : 0);
            assertTrue(flags <= 1, function.toString());
        }
        assertTrue(functions.get(0).isConstructor());
        assertTrue(functions.get(3).isReceiveEther());
        assertEquals(NodeType.FUNCTION_DEFINITION, functions.get(1).getType());
    }
}
