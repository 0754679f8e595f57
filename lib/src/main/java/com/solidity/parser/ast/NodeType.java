package com.solidity.parser.ast;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Closed set of node kinds. The kind name is the string downstream tools key on. */
public enum NodeType {
    SOURCE_UNIT("SourceUnit"),
    PRAGMA_DIRECTIVE("PragmaDirective"),
    IMPORT_DIRECTIVE("ImportDirective"),
    CONTRACT_DEFINITION("ContractDefinition"),
    INHERITANCE_SPECIFIER("InheritanceSpecifier"),
    FILE_LEVEL_CONSTANT("FileLevelConstant"),
    TYPE_DEFINITION("TypeDefinition"),
    CUSTOM_ERROR_DEFINITION("CustomErrorDefinition"),
    USING_FOR_DECLARATION("UsingForDeclaration"),
    STATE_VARIABLE_DECLARATION("StateVariableDeclaration"),
    STRUCT_DEFINITION("StructDefinition"),
    ENUM_DEFINITION("EnumDefinition"),
    ENUM_VALUE("EnumValue"),
    EVENT_DEFINITION("EventDefinition"),
    MODIFIER_DEFINITION("ModifierDefinition"),
    MODIFIER_INVOCATION("ModifierInvocation"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    ELEMENTARY_TYPE_NAME("ElementaryTypeName"),
    USER_DEFINED_TYPE_NAME("UserDefinedTypeName"),
    ARRAY_TYPE_NAME("ArrayTypeName"),
    MAPPING("Mapping"),
    FUNCTION_TYPE_NAME("FunctionTypeName"),
    BLOCK("Block"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    IF_STATEMENT("IfStatement"),
    WHILE_STATEMENT("WhileStatement"),
    DO_WHILE_STATEMENT("DoWhileStatement"),
    FOR_STATEMENT("ForStatement"),
    TRY_STATEMENT("TryStatement"),
    CATCH_CLAUSE("CatchClause"),
    UNCHECKED_STATEMENT("UncheckedStatement"),
    INLINE_ASSEMBLY_STATEMENT("InlineAssemblyStatement"),
    EMIT_STATEMENT("EmitStatement"),
    REVERT_STATEMENT("RevertStatement"),
    RETURN_STATEMENT("ReturnStatement"),
    THROW_STATEMENT("ThrowStatement"),
    BREAK_STATEMENT("BreakStatement"),
    CONTINUE_STATEMENT("ContinueStatement"),
    VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement"),
    IDENTIFIER("Identifier"),
    BOOLEAN_LITERAL("BooleanLiteral"),
    NUMBER_LITERAL("NumberLiteral"),
    STRING_LITERAL("StringLiteral"),
    HEX_LITERAL("HexLiteral"),
    UNARY_OPERATION("UnaryOperation"),
    BINARY_OPERATION("BinaryOperation"),
    CONDITIONAL("Conditional"),
    MEMBER_ACCESS("MemberAccess"),
    INDEX_ACCESS("IndexAccess"),
    INDEX_RANGE_ACCESS("IndexRangeAccess"),
    TUPLE_EXPRESSION("TupleExpression"),
    FUNCTION_CALL("FunctionCall"),
    NEW_EXPRESSION("NewExpression"),
    NAME_VALUE_EXPRESSION("NameValueExpression"),
    NAME_VALUE_LIST("NameValueList"),
    ASSEMBLY_BLOCK("AssemblyBlock"),
    ASSEMBLY_CALL("AssemblyCall"),
    ASSEMBLY_LOCAL_DEFINITION("AssemblyLocalDefinition"),
    ASSEMBLY_ASSIGNMENT("AssemblyAssignment"),
    ASSEMBLY_STACK_ASSIGNMENT("AssemblyStackAssignment"),
    LABEL_DEFINITION("LabelDefinition"),
    ASSEMBLY_SWITCH("AssemblySwitch"),
    ASSEMBLY_CASE("AssemblyCase"),
    ASSEMBLY_FUNCTION_DEFINITION("AssemblyFunctionDefinition"),
    ASSEMBLY_FOR("AssemblyFor"),
    ASSEMBLY_IF("AssemblyIf"),
    ASSEMBLY_MEMBER_ACCESS("AssemblyMemberAccess"),
    DECIMAL_NUMBER("DecimalNumber"),
    HEX_NUMBER("HexNumber"),
    BREAK("Break"),
    CONTINUE("Continue");

    private static final Map<String, NodeType> BY_KIND_NAME = new HashMap<>();

    static {
        for (NodeType type : values()) {
            BY_KIND_NAME.put(type.kindName, type);
        }
    }

    private final String kindName;

    NodeType(String kindName) {
        this.kindName = kindName;
    }

    public String getKindName() {
        return kindName;
    }

    public static Optional<NodeType> fromKindName(String kindName) {
        return Optional.ofNullable(BY_KIND_NAME.get(kindName));
    }
}
