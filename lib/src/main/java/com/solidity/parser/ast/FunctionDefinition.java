package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function, constructor, fallback or receive function.
 *
 * <p>At most one of {@link #isConstructor()}, {@link #isFallback()} and {@link #isReceiveEther()} is set.
 * The name is {@code null} for the keyword forms and the empty string for an unnamed legacy fallback.</p>
 */
public final class FunctionDefinition extends AstNode implements SourceUnitPart, ContractPart {
    private final String name;
    private final List<VariableDeclaration> parameters;
    private final List<ModifierInvocation> modifiers;
    private final String stateMutability;
    private final Visibility visibility;
    private final List<VariableDeclaration> returnParameters;
    private final Block body;
    private final List<UserDefinedTypeName> override;
    private final boolean isConstructor;
    private final boolean isReceiveEther;
    private final boolean isFallback;
    private final boolean isVirtual;

    public FunctionDefinition(
            String name,
            List<VariableDeclaration> parameters,
            List<ModifierInvocation> modifiers,
            String stateMutability,
            Visibility visibility,
            List<VariableDeclaration> returnParameters,
            Block body,
            List<UserDefinedTypeName> override,
            boolean isConstructor,
            boolean isReceiveEther,
            boolean isFallback,
            boolean isVirtual) {
        super(NodeType.FUNCTION_DEFINITION);
        if ((isConstructor ? 1 : 0) + (isReceiveEther ? 1 : 0) + (isFallback ? 1 : 0) > 1) {
            throw new IllegalArgumentException(
                    "A function is at most one of constructor, fallback and receive");
        }
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.modifiers = List.copyOf(modifiers);
        this.stateMutability = stateMutability;
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.returnParameters = copyOrNull(returnParameters);
        this.body = body;
        this.override = copyOrNull(override);
        this.isConstructor = isConstructor;
        this.isReceiveEther = isReceiveEther;
        this.isFallback = isFallback;
        this.isVirtual = isVirtual;
    }

    public String getName() {
        return name;
    }

    public List<VariableDeclaration> getParameters() {
        return parameters;
    }

    public List<ModifierInvocation> getModifiers() {
        return modifiers;
    }

    /** {@code pure}, {@code view}, {@code payable}, {@code constant} or {@code null}. */
    public String getStateMutability() {
        return stateMutability;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public List<VariableDeclaration> getReturnParameters() {
        return returnParameters;
    }

    /** Body, or {@code null} for a declaration without implementation. */
    public Block getBody() {
        return body;
    }

    public List<UserDefinedTypeName> getOverride() {
        return override;
    }

    public boolean isConstructor() {
        return isConstructor;
    }

    public boolean isReceiveEther() {
        return isReceiveEther;
    }

    public boolean isFallback() {
        return isFallback;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    @Override
    protected List<Object> components() {
        return fields(
                name,
                parameters,
                modifiers,
                stateMutability,
                visibility,
                returnParameters,
                body,
                override,
                isConstructor,
                isReceiveEther,
                isFallback,
                isVirtual);
    }
}
