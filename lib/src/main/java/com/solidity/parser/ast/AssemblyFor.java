package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/** {@code for pre condition post body}. Pre and post are blocks or single expressions. */
public final class AssemblyFor extends AstNode implements AssemblyItem {
    private final AssemblyItem pre;
    private final AssemblyExpression condition;
    private final AssemblyItem post;
    private final AssemblyBlock body;

    public AssemblyFor(
            AssemblyItem pre, AssemblyExpression condition, AssemblyItem post, AssemblyBlock body) {
        super(NodeType.ASSEMBLY_FOR);
        this.pre = Objects.requireNonNull(pre, "pre");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.post = Objects.requireNonNull(post, "post");
        this.body = Objects.requireNonNull(body, "body");
    }

    public AssemblyItem getPre() {
        return pre;
    }

    public AssemblyExpression getCondition() {
        return condition;
    }

    public AssemblyItem getPost() {
        return post;
    }

    public AssemblyBlock getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(pre, condition, post, body);
    }
}
