package com.solidity.parser.ast;

import java.util.List;

/**
 * A declared variable: a parameter, struct member, local variable or (through the subclass) a state
 * variable. The type name is absent only for the legacy {@code var (a, b) = ...} form.
 */
public class VariableDeclaration extends AstNode {
    private final TypeName typeName;
    private final Identifier identifier;
    private final String storageLocation;
    private final boolean isStateVar;
    private final boolean isIndexed;
    private final boolean isDeclaredConst;
    private final Expression expression;
    private final Visibility visibility;

    public VariableDeclaration(
            TypeName typeName, Identifier identifier, String storageLocation, boolean isIndexed) {
        this(typeName, identifier, storageLocation, false, isIndexed, false, null, null);
    }

    VariableDeclaration(
            TypeName typeName,
            Identifier identifier,
            String storageLocation,
            boolean isStateVar,
            boolean isIndexed,
            boolean isDeclaredConst,
            Expression expression,
            Visibility visibility) {
        super(NodeType.VARIABLE_DECLARATION);
        this.typeName = typeName;
        this.identifier = identifier;
        this.storageLocation = storageLocation;
        this.isStateVar = isStateVar;
        this.isIndexed = isIndexed;
        this.isDeclaredConst = isDeclaredConst;
        this.expression = expression;
        this.visibility = visibility;
    }

    public TypeName getTypeName() {
        return typeName;
    }

    /** Declared name, or {@code null} for unnamed parameters. */
    public String getName() {
        return identifier == null ? null : identifier.getName();
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    /** {@code memory}, {@code storage}, {@code calldata} or {@code null}. */
    public String getStorageLocation() {
        return storageLocation;
    }

    public boolean isStateVar() {
        return isStateVar;
    }

    public boolean isIndexed() {
        return isIndexed;
    }

    public boolean isDeclaredConst() {
        return isDeclaredConst;
    }

    public Expression getExpression() {
        return expression;
    }

    /** Visibility of a state variable; {@code null} for every other kind of declaration. */
    public Visibility getVisibility() {
        return visibility;
    }

    @Override
    protected List<Object> components() {
        return fields(
                typeName,
                identifier,
                storageLocation,
                isStateVar,
                isIndexed,
                isDeclaredConst,
                expression,
                visibility);
    }
}
