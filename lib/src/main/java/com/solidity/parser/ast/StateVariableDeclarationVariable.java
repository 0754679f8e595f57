package com.solidity.parser.ast;

import java.util.ArrayList;
import java.util.List;

public final class StateVariableDeclarationVariable extends VariableDeclaration {
    private final boolean isImmutable;
    private final List<UserDefinedTypeName> override;

    public StateVariableDeclarationVariable(
            TypeName typeName,
            Identifier identifier,
            Expression expression,
            Visibility visibility,
            boolean isDeclaredConst,
            boolean isImmutable,
            List<UserDefinedTypeName> override) {
        super(typeName, identifier, null, true, false, isDeclaredConst, expression, visibility);
        this.isImmutable = isImmutable;
        this.override = copyOrNull(override);
    }

    public boolean isImmutable() {
        return isImmutable;
    }

    /** Overridden bases, empty for a bare {@code override}, {@code null} when not overriding. */
    public List<UserDefinedTypeName> getOverride() {
        return override;
    }

    @Override
    protected List<Object> components() {
        List<Object> components = new ArrayList<>(super.components());
        components.add(isImmutable);
        components.add(override);
        return components;
    }
}
