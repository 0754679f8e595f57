package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ModifierDefinition extends AstNode implements ContractPart {
    private final String name;
    private final List<VariableDeclaration> parameters;
    private final boolean isVirtual;
    private final List<UserDefinedTypeName> override;
    private final Block body;

    public ModifierDefinition(
            String name,
            List<VariableDeclaration> parameters,
            boolean isVirtual,
            List<UserDefinedTypeName> override,
            Block body) {
        super(NodeType.MODIFIER_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = copyOrNull(parameters);
        this.isVirtual = isVirtual;
        this.override = copyOrNull(override);
        this.body = body;
    }

    public String getName() {
        return name;
    }

    /** Parameters, or {@code null} when the modifier is declared without a parameter list. */
    public List<VariableDeclaration> getParameters() {
        return parameters;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public List<UserDefinedTypeName> getOverride() {
        return override;
    }

    /** Body, or {@code null} for an unimplemented modifier. */
    public Block getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(name, parameters, isVirtual, override, body);
    }
}
