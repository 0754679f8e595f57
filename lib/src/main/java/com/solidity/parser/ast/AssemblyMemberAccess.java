package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class AssemblyMemberAccess extends AstNode implements AssemblyExpression {
    private final Identifier expression;
    private final Identifier memberName;

    public AssemblyMemberAccess(Identifier expression, Identifier memberName) {
        super(NodeType.ASSEMBLY_MEMBER_ACCESS);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.memberName = Objects.requireNonNull(memberName, "memberName");
    }

    public Identifier getExpression() {
        return expression;
    }

    public Identifier getMemberName() {
        return memberName;
    }

    @Override
    protected List<Object> components() {
        return fields(expression, memberName);
    }
}
