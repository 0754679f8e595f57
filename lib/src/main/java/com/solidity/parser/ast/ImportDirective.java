package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ImportDirective extends AstNode implements SourceUnitPart {
    private final String path;
    private final StringLiteral pathLiteral;
    private final Identifier unitAliasIdentifier;
    private final List<SymbolAlias> symbolAliases;

    public ImportDirective(
            String path,
            StringLiteral pathLiteral,
            Identifier unitAliasIdentifier,
            List<SymbolAlias> symbolAliases) {
        super(NodeType.IMPORT_DIRECTIVE);
        this.path = Objects.requireNonNull(path, "path");
        this.pathLiteral = Objects.requireNonNull(pathLiteral, "pathLiteral");
        this.unitAliasIdentifier = unitAliasIdentifier;
        this.symbolAliases = copyOrNull(symbolAliases);
    }

    /** Import path without the surrounding quotes. */
    public String getPath() {
        return path;
    }

    public StringLiteral getPathLiteral() {
        return pathLiteral;
    }

    public String getUnitAlias() {
        return unitAliasIdentifier == null ? null : unitAliasIdentifier.getName();
    }

    public Identifier getUnitAliasIdentifier() {
        return unitAliasIdentifier;
    }

    /** Symbol aliases of {@code import {a as b, c} from "p"}, or {@code null} for other import forms. */
    public List<SymbolAlias> getSymbolAliases() {
        return symbolAliases;
    }

    @Override
    protected List<Object> components() {
        return fields(path, pathLiteral, unitAliasIdentifier, symbolAliases);
    }

    @Override
    public List<AstNode> getChildNodes() {
        List<AstNode> children = super.getChildNodes();
        if (symbolAliases != null) {
            for (SymbolAlias symbolAlias : symbolAliases) {
                children.add(symbolAlias.getSymbol());
                if (symbolAlias.getAlias() != null) {
                    children.add(symbolAlias.getAlias());
                }
            }
        }
        return children;
    }
}
