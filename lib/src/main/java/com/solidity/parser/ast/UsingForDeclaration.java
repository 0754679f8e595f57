package com.solidity.parser.ast;

import java.util.List;

/**
 * {@code using L for T;} or {@code using {f, g as +} for T global;}.
 *
 * <p>The library form sets {@link #getLibraryName()}; the braced form fills {@link #getFunctions()} and
 * the parallel {@link #getOperators()} list, whose entries are {@code null} for plain functions.</p>
 */
public final class UsingForDeclaration extends AstNode implements SourceUnitPart, ContractPart {
    private final TypeName typeName;
    private final String libraryName;
    private final List<String> functions;
    private final List<String> operators;
    private final boolean isGlobal;

    public UsingForDeclaration(
            TypeName typeName,
            String libraryName,
            List<String> functions,
            List<String> operators,
            boolean isGlobal) {
        super(NodeType.USING_FOR_DECLARATION);
        if (functions.size() != operators.size()) {
            throw new IllegalArgumentException("functions and operators must have the same length");
        }
        this.typeName = typeName;
        this.libraryName = libraryName;
        this.functions = List.copyOf(functions);
        this.operators = holeyCopy(operators);
        this.isGlobal = isGlobal;
    }

    /** Target type, or {@code null} for {@code using L for *}. */
    public TypeName getTypeName() {
        return typeName;
    }

    public String getLibraryName() {
        return libraryName;
    }

    public List<String> getFunctions() {
        return functions;
    }

    public List<String> getOperators() {
        return operators;
    }

    public boolean isGlobal() {
        return isGlobal;
    }

    @Override
    protected List<Object> components() {
        return fields(typeName, libraryName, functions, operators, isGlobal);
    }
}
