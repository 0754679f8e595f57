package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class InlineAssemblyStatement extends AstNode implements Statement {
    private final String language;
    private final List<String> flags;
    private final AssemblyBlock body;

    public InlineAssemblyStatement(String language, List<String> flags, AssemblyBlock body) {
        super(NodeType.INLINE_ASSEMBLY_STATEMENT);
        this.language = language;
        this.flags = List.copyOf(flags);
        this.body = Objects.requireNonNull(body, "body");
    }

    /** Dialect tag such as {@code evmasm}, without quotes, or {@code null}. */
    public String getLanguage() {
        return language;
    }

    /** Flags such as {@code memory-safe}, without quotes. */
    public List<String> getFlags() {
        return flags;
    }

    public AssemblyBlock getBody() {
        return body;
    }

    @Override
    protected List<Object> components() {
        return fields(language, flags, body);
    }
}
