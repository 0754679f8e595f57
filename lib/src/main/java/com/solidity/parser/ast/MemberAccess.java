package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class MemberAccess extends AstNode implements Expression {
    private final Expression expression;
    private final String memberName;

    public MemberAccess(Expression expression, String memberName) {
        super(NodeType.MEMBER_ACCESS);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.memberName = Objects.requireNonNull(memberName, "memberName");
    }

    public Expression getExpression() {
        return expression;
    }

    public String getMemberName() {
        return memberName;
    }

    @Override
    protected List<Object> components() {
        return fields(expression, memberName);
    }
}
