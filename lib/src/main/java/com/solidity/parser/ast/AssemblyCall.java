package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** Builtin or user function call in assembly. A bare name without parentheses has no arguments. */
public final class AssemblyCall extends AstNode implements AssemblyExpression {
    private final String functionName;
    private final List<AssemblyExpression> arguments;

    public AssemblyCall(String functionName, List<AssemblyExpression> arguments) {
        super(NodeType.ASSEMBLY_CALL);
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.arguments = List.copyOf(arguments);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<AssemblyExpression> getArguments() {
        return arguments;
    }

    @Override
    protected List<Object> components() {
        return fields(functionName, arguments);
    }
}
