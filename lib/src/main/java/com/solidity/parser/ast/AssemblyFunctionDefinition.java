package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblyFunctionDefinition extends AstNode implements AssemblyItem {
    private final String name;
    private final List<Identifier> arguments;
    private final List<Identifier> returnArguments;
    private final AssemblyBlock body;

    public AssemblyFunctionDefinition(
            String name,
            List<Identifier> arguments,
            List<Identifier> returnArguments,
            AssemblyBlock body) {
        super(NodeType.ASSEMBLY_FUNCTION_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
        this.returnArguments = List.copyOf(returnArguments);
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public List<Identifier> getArguments() {
        return arguments;
    }

    public List<Identifier> getReturnArguments() {
        return returnArguments;
    }

    public AssemblyBlock getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(name, arguments, returnArguments, body);
    }
}
