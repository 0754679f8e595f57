package com.solidity.parser.ast;

import java.util.Objects;

/** One {@code symbol as alias} entry of an {@code import {...} from "path"} directive. */
public final class SymbolAlias {
    private final Identifier symbol;
    private final Identifier alias;

    public SymbolAlias(Identifier symbol, Identifier alias) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.alias = alias;
    }

    public Identifier getSymbol() {
        return symbol;
    }

    /** Alias identifier, or {@code null} when the symbol is imported under its own name. */
    public Identifier getAlias() {
        return alias;
    }

    public String getSymbolName() {
        return symbol.getName();
    }

    public String getAliasName() {
        return alias == null ? null : alias.getName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SymbolAlias)) {
            return false;
        }
        SymbolAlias other = (SymbolAlias) obj;
        return symbol.equals(other.symbol) && Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, alias);
    }

    @Override
    public String toString() {
        return alias == null ? symbol.getName() : symbol.getName() + " as " + alias.getName();
    }
}
