package com.solidity.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.solidity.parser.ast.ArrayTypeName;
import com.solidity.parser.ast.ContractDefinition;
import com.solidity.parser.ast.ContractKind;
import com.solidity.parser.ast.ElementaryTypeName;
import com.solidity.parser.ast.EnumDefinition;
import com.solidity.parser.ast.EventDefinition;
import com.solidity.parser.ast.FileLevelConstant;
import com.solidity.parser.ast.FunctionTypeName;
import com.solidity.parser.ast.ImportDirective;
import com.solidity.parser.ast.InheritanceSpecifier;
import com.solidity.parser.ast.Mapping;
import com.solidity.parser.ast.ModifierDefinition;
import com.solidity.parser.ast.NumberLiteral;
import com.solidity.parser.ast.PragmaDirective;
import com.solidity.parser.ast.SourceUnit;
import com.solidity.parser.ast.StateVariableDeclaration;
import com.solidity.parser.ast.StateVariableDeclarationVariable;
import com.solidity.parser.ast.StructDefinition;
import com.solidity.parser.ast.TypeDefinition;
import com.solidity.parser.ast.UserDefinedTypeName;
import com.solidity.parser.ast.UsingForDeclaration;
import com.solidity.parser.ast.Visibility;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeclarationReductionTest {

    private static StateVariableDeclarationVariable stateVariable(String member) throws Exception {
        ContractDefinition contract = TestSources.contract(member);
        StateVariableDeclaration declaration =
                assertInstanceOf(StateVariableDeclaration.class, contract.getChildren().get(0));
        return declaration.getVariables().get(0);
    }

    @Test
    void pragmaVersionConstraintsAreJoinedWithSpaces() throws Exception {
        SourceUnit unit =
                TestSources.parse("pragma solidity >=0.5.0 <0.7.0;\npragma experimental ABIEncoderV2;");

        PragmaDirective range = (PragmaDirective) unit.getChildren().get(0);
        assertEquals("solidity", range.getName());
        assertEquals(">=0.5.0 <0.7.0", range.getValue());
        PragmaDirective experimental = (PragmaDirective) unit.getChildren().get(1);
        assertEquals("experimental", experimental.getName());
        assertEquals("ABIEncoderV2", experimental.getValue());
    }

    @Test
    void importForms() throws Exception {
        SourceUnit unit =
                TestSources.parse(
                        String.join(
                                "\n",
                                "import \"./A.sol\";",
                                "import \"./B.sol\" as B;",
                                "import * as C from './C.sol';",
                                "import {X as Y, Z} from \"./D.sol\";"));

        ImportDirective plain = (ImportDirective) unit.getChildren().get(0);
        assertEquals("./A.sol", plain.getPath());
        assertEquals("./A.sol", plain.getPathLiteral().getValue());
        assertNull(plain.getUnitAlias());
        assertNull(plain.getSymbolAliases());

        assertEquals("B", ((ImportDirective) unit.getChildren().get(1)).getUnitAlias());
        ImportDirective star = (ImportDirective) unit.getChildren().get(2);
        assertEquals("./C.sol", star.getPath());
        assertEquals("C", star.getUnitAlias());

        ImportDirective symbols = (ImportDirective) unit.getChildren().get(3);
        assertNull(symbols.getUnitAlias());
        assertEquals(2, symbols.getSymbolAliases().size());
        assertEquals("X", symbols.getSymbolAliases().get(0).getSymbolName());
        assertEquals("Y", symbols.getSymbolAliases().get(0).getAliasName());
        assertEquals("Z", symbols.getSymbolAliases().get(1).getSymbolName());
        assertNull(symbols.getSymbolAliases().get(1).getAlias());
    }

    @Test
    void contractKindsAndInheritance() throws Exception {
        SourceUnit unit =
                TestSources.parse(
                        "abstract contract A is B, C(1, 2) { }\ninterface I { }\nlibrary L { }");

        ContractDefinition a = (ContractDefinition) unit.getChildren().get(0);
        assertTrue(a.isAbstract());
        assertEquals(ContractKind.CONTRACT, a.getKind());
        List<InheritanceSpecifier> bases = a.getBaseContracts();
        assertEquals("B", bases.get(0).getBaseName().getNamePath());
        assertEquals(List.of(), bases.get(0).getArguments());
        assertEquals(2, bases.get(1).getArguments().size());

        assertEquals(ContractKind.INTERFACE, ((ContractDefinition) unit.getChildren().get(1)).getKind());
        assertEquals(ContractKind.LIBRARY, ((ContractDefinition) unit.getChildren().get(2)).getKind());
    }

    @Test
    void stateVariableModifiers() throws Exception {
        StateVariableDeclarationVariable constant = stateVariable("uint256 public constant MAX = 10;");
        assertEquals(Visibility.PUBLIC, constant.getVisibility());
        assertTrue(constant.isDeclaredConst());
        assertEquals("10", ((NumberLiteral) constant.getExpression()).getNumber());

        StateVariableDeclarationVariable immutable = stateVariable("address private immutable owner;");
        assertEquals(Visibility.PRIVATE, immutable.getVisibility());
        assertTrue(immutable.isImmutable());
        assertFalse(immutable.isDeclaredConst());
        assertNull(immutable.getOverride());

        StateVariableDeclarationVariable overriding = stateVariable("uint internal override(Base) fee;");
        assertEquals(Visibility.INTERNAL, overriding.getVisibility());
        assertEquals("Base", overriding.getOverride().get(0).getNamePath());
    }

    @Test
    void mappingsWithAndWithoutNames() throws Exception {
        Mapping plain = (Mapping) stateVariable("mapping(address => uint) balances;").getTypeName();
        assertEquals("address", ((ElementaryTypeName) plain.getKeyType()).getName());
        assertNull(plain.getKeyName());
        assertEquals("uint", ((ElementaryTypeName) plain.getValueType()).getName());

        Mapping named =
                (Mapping) stateVariable("mapping(Token owner => mapping(address => bool) allowed) approvals;")
                        .getTypeName();
        assertEquals("Token", ((UserDefinedTypeName) named.getKeyType()).getNamePath());
        assertEquals("owner", named.getKeyName().getName());
        assertInstanceOf(Mapping.class, named.getValueType());
        assertEquals("allowed", named.getValueName().getName());
    }

    @Test
    void arrayAndFunctionTypes() throws Exception {
        ArrayTypeName fixed = (ArrayTypeName) stateVariable("bytes32[4][] roots;").getTypeName();
        assertNull(fixed.getLength());
        ArrayTypeName inner = assertInstanceOf(ArrayTypeName.class, fixed.getBaseTypeName());
        assertEquals("4", ((NumberLiteral) inner.getLength()).getNumber());

        FunctionTypeName callback =
                (FunctionTypeName) stateVariable("function (uint) external view returns (bool) hook;").getTypeName();
        assertEquals(1, callback.getParameterTypes().size());
        assertEquals(1, callback.getReturnTypes().size());
        assertEquals(Visibility.EXTERNAL, callback.getVisibility());
        assertEquals("view", callback.getStateMutability());

        ElementaryTypeName payable = (ElementaryTypeName) stateVariable("address payable wallet;").getTypeName();
        assertEquals("payable", payable.getStateMutability());
    }

    @Test
    void structEnumEventAndModifier() throws Exception {
        ContractDefinition contract =
                TestSources.contract(
                        String.join(
                                "\n",
                                "struct Point { int x; int y; }",
                                "enum Color { Red, Green }",
                                "event Moved(address indexed who, Point to) anonymous;",
                                "modifier guarded virtual { _; }",
                                "modifier limited(uint n) override;"));

        StructDefinition point = (StructDefinition) contract.getChildren().get(0);
        assertEquals("Point", point.getName());
        assertEquals(2, point.getMembers().size());

        EnumDefinition color = (EnumDefinition) contract.getChildren().get(1);
        assertEquals("Green", color.getMembers().get(1).getName());

        EventDefinition moved = (EventDefinition) contract.getChildren().get(2);
        assertTrue(moved.isAnonymous());
        assertTrue(moved.getParameters().get(0).isIndexed());
        assertFalse(moved.getParameters().get(1).isIndexed());

        ModifierDefinition guarded = (ModifierDefinition) contract.getChildren().get(3);
        assertNull(guarded.getParameters());
        assertTrue(guarded.isVirtual());
        assertEquals(1, guarded.getBody().getStatements().size());

        ModifierDefinition limited = (ModifierDefinition) contract.getChildren().get(4);
        assertEquals(1, limited.getParameters().size());
        assertEquals(List.of(), limited.getOverride());
        assertNull(limited.getBody());
    }

    @Test
    void fileLevelDeclarations() throws Exception {
        SourceUnit unit =
                TestSources.parse(
                        String.join(
                                "\n",
                                "uint256 constant LIMIT = 100;",
                                "type Price is uint128;",
                                "using SafeMath for uint256;",
                                "using {add, sub as -} for Price global;",
                                "using Lib for *;"));

        FileLevelConstant limit = (FileLevelConstant) unit.getChildren().get(0);
        assertEquals("LIMIT", limit.getName());
        assertTrue(limit.isDeclaredConst());

        TypeDefinition price = (TypeDefinition) unit.getChildren().get(1);
        assertEquals("Price", price.getName());
        assertEquals("uint128", price.getDefinition().getName());

        UsingForDeclaration safeMath = (UsingForDeclaration) unit.getChildren().get(2);
        assertEquals("SafeMath", safeMath.getLibraryName());
        assertFalse(safeMath.isGlobal());

        UsingForDeclaration operators = (UsingForDeclaration) unit.getChildren().get(3);
        assertNull(operators.getLibraryName());
        assertEquals(List.of("add", "sub"), operators.getFunctions());
        assertEquals(Arrays.asList(null, "-"), operators.getOperators());
        assertTrue(operators.isGlobal());

        UsingForDeclaration wildcard = (UsingForDeclaration) unit.getChildren().get(4);
        assertNull(wildcard.getTypeName());
    }
}
