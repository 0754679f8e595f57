package com.solidity.parser.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of every syntax tree node.
 *
 * <p>A node is immutable apart from its source metadata, which the reducer attaches once right after
 * construction. Each variant lists its semantic fields through {@link #components()}; equality, hashing
 * and child enumeration are all derived from that list, so metadata never takes part in equality.</p>
 */
public abstract class AstNode {
    private final NodeType type;
    private SourceLocation location;
    private SourceRange range;
    private boolean metadataAttached;

    AstNode(NodeType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public final NodeType getType() {
        return type;
    }

    /** Line/column span, or {@code null} when location tracking was disabled. */
    public final SourceLocation getLocation() {
        return location;
    }

    /** Character offset span, or {@code null} when range tracking was disabled. */
    public final SourceRange getRange() {
        return range;
    }

    public final void attachMetadata(SourceLocation location, SourceRange range) {
        if (metadataAttached) {
            throw new IllegalStateException("Metadata already attached to " + type.getKindName());
        }
        this.location = location;
        this.range = range;
        this.metadataAttached = true;
    }

    /** Semantic fields in declaration order. Entries may be {@code null}. */
    protected abstract List<Object> components();

    /** Direct child nodes in field order, flattening list-valued fields and skipping absent values. */
    public List<AstNode> getChildNodes() {
        List<AstNode> children = new ArrayList<>();
        for (Object component : components()) {
            collectNodes(component, children);
        }
        return children;
    }

    static void collectNodes(Object component, List<AstNode> sink) {
        if (component instanceof AstNode) {
            sink.add((AstNode) component);
        } else if (component instanceof List) {
            for (Object element : (List<?>) component) {
                if (element instanceof AstNode) {
                    sink.add((AstNode) element);
                }
            }
        }
    }

    static List<Object> fields(Object... values) {
        return Arrays.asList(values);
    }

    /** Unmodifiable copy that, unlike {@link List#copyOf}, keeps {@code null} holes. */
    static <T> List<T> holeyCopy(List<? extends T> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    static <T> List<T> copyOrNull(List<? extends T> values) {
        return values == null ? null : List.copyOf(values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return components().equals(((AstNode) obj).components());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, components());
    }

    @Override
    public String toString() {
        return type.getKindName() + components();
    }
}
