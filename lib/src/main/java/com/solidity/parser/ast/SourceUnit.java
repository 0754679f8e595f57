package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed compilation unit.
 *
 * <p>Besides its declarations a source unit can carry the syntax errors collected by a tolerant parse
 * and the token list when one was requested. Both are empty by default and are not part of equality.</p>
 */
public final class SourceUnit extends AstNode {
    private final List<SourceUnitPart> children;
    private List<SyntaxDiagnostic> errors = List.of();
    private List<SourceToken> tokens = List.of();

    public SourceUnit(List<? extends SourceUnitPart> children) {
        super(NodeType.SOURCE_UNIT);
        this.children = List.copyOf(children);
    }

    public List<SourceUnitPart> getChildren() {
        return children;
    }

    public List<SyntaxDiagnostic> getErrors() {
        return errors;
    }

    public List<SourceToken> getTokens() {
        return tokens;
    }

    public void attachErrors(List<SyntaxDiagnostic> errors) {
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public void attachTokens(List<SourceToken> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    @Override
    protected List<Object> components() {
        return fields(children);
    }
}
