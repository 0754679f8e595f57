package com.solidity.parser.walk;

import com.solidity.parser.ast.AstNode;
import com.solidity.parser.ast.NodeType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Enter and exit callbacks keyed by node kind.
 *
 * <p>Selectors are kind names such as {@code "FunctionDefinition"} for enter callbacks and
 * {@code "FunctionDefinition:exit"} for exit callbacks.</p>
 */
public final class NodeCallbacks {
    static final String EXIT_SUFFIX = ":exit";

    /** Called before a node's children. Returning {@code false} skips the children and the exit callbacks. */
    @FunctionalInterface
    public interface Enter {
        boolean enter(AstNode node, AstNode parent);
    }

    /** Called after a node's children. */
    @FunctionalInterface
    public interface Exit {
        void exit(AstNode node, AstNode parent);
    }

    private final Map<NodeType, List<Enter>> enters;
    private final Map<NodeType, List<Exit>> exits;

    private NodeCallbacks(Builder builder) {
        this.enters = freeze(builder.enters);
        this.exits = freeze(builder.exits);
    }

    private static <T> Map<NodeType, List<T>> freeze(Map<NodeType, List<T>> source) {
        Map<NodeType, List<T>> copy = new EnumMap<>(NodeType.class);
        for (Map.Entry<NodeType, List<T>> entry : source.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    List<Enter> enterCallbacks(NodeType type) {
        return enters.getOrDefault(type, List.of());
    }

    List<Exit> exitCallbacks(NodeType type) {
        return exits.getOrDefault(type, List.of());
    }

    public static final class Builder {
        private final Map<NodeType, List<Enter>> enters = new EnumMap<>(NodeType.class);
        private final Map<NodeType, List<Exit>> exits = new EnumMap<>(NodeType.class);

        private Builder() {}

        public Builder onEnter(NodeType type, Enter callback) {
            enters.computeIfAbsent(Objects.requireNonNull(type, "type"), t -> new ArrayList<>())
                    .add(Objects.requireNonNull(callback, "callback"));
            return this;
        }

        public Builder onExit(NodeType type, Exit callback) {
            exits.computeIfAbsent(Objects.requireNonNull(type, "type"), t -> new ArrayList<>())
                    .add(Objects.requireNonNull(callback, "callback"));
            return this;
        }

        /**
         * Registers a callback by selector. A plain kind name registers an enter callback that always
         * continues into the children; a {@code :exit} selector registers an exit callback.
         *
         * @throws IllegalArgumentException if the selector names no node kind
         */
        public Builder on(String selector, BiConsumer<AstNode, AstNode> callback) {
            Objects.requireNonNull(selector, "selector");
            Objects.requireNonNull(callback, "callback");
            if (selector.endsWith(EXIT_SUFFIX)) {
                String kindName = selector.substring(0, selector.length() - EXIT_SUFFIX.length());
                return onExit(resolve(kindName), callback::accept);
            }
            return onEnter(
                    resolve(selector),
                    (node, parent) -> {
                        callback.accept(node, parent);
                        return true;
                    });
        }

        private static NodeType resolve(String kindName) {
            return NodeType.fromKindName(kindName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown node kind '" + kindName + "'"));
        }

        public NodeCallbacks build() {
            return new NodeCallbacks(this);
        }
    }
}
