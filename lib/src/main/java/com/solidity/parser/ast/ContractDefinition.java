package com.solidity.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ContractDefinition extends AstNode implements SourceUnitPart {
    private final String name;
    private final ContractKind kind;
    private final boolean isAbstract;
    private final List<InheritanceSpecifier> baseContracts;
    private final List<ContractPart> children;

    public ContractDefinition(
            String name,
            ContractKind kind,
            boolean isAbstract,
            List<InheritanceSpecifier> baseContracts,
            List<? extends ContractPart> children) {
        super(NodeType.CONTRACT_DEFINITION);
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.isAbstract = isAbstract;
        this.baseContracts = List.copyOf(baseContracts);
        this.children = List.copyOf(children);
    }

    public String getName() {
        return name;
    }

    public ContractKind getKind() {
        return kind;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public List<InheritanceSpecifier> getBaseContracts() {
        return baseContracts;
    }

    public List<ContractPart> getChildren() {
        return children;
    }

    @Override
    protected List<Object> components() {
        return fields(name, kind, isAbstract, baseContracts, children);
    }
}
