package com.solidity.parser.ast;

import java.util.List;

public final class Block extends AstNode implements Statement {
    private final List<Statement> statements;

    public Block(List<? extends Statement> statements) {
        super(NodeType.BLOCK);
        this.statements = List.copyOf(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    protected List<Object> components() {
        return fields(statements);
    }
}
