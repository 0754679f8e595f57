package com.solidity.parser;

import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Parse settings. Every option has a default, so {@link #defaults()} is always a valid choice. */
public final class ParseOptions {
    private static final Logger LOGGER = Logger.getLogger(ParseOptions.class.getName());

    public static final String LOC_PROPERTY = "loc";
    public static final String RANGE_PROPERTY = "range";
    public static final String TOKENS_PROPERTY = "tokens";
    public static final String TOLERANT_PROPERTY = "tolerant";
    public static final String MAX_DEPTH_PROPERTY = "maxDepth";

    static final int DEFAULT_MAX_DEPTH = 1000;

    private final boolean loc;
    private final boolean range;
    private final boolean tokens;
    private final boolean tolerant;
    private final int maxDepth;

    private ParseOptions(Builder builder) {
        this.loc = builder.loc;
        this.range = builder.range;
        this.tokens = builder.tokens;
        this.tolerant = builder.tolerant;
        this.maxDepth = builder.maxDepth;
    }

    public static ParseOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from properties using the keys {@code loc}, {@code range}, {@code tokens},
     * {@code tolerant} and {@code maxDepth}. Missing or malformed values keep their defaults.
     */
    public static ParseOptions fromProperties(Properties properties) {
        Builder builder = builder();
        builder.loc(readBoolean(properties, LOC_PROPERTY, builder.loc));
        builder.range(readBoolean(properties, RANGE_PROPERTY, builder.range));
        builder.tokens(readBoolean(properties, TOKENS_PROPERTY, builder.tokens));
        builder.tolerant(readBoolean(properties, TOLERANT_PROPERTY, builder.tolerant));
        builder.maxDepth(readPositiveInt(properties, MAX_DEPTH_PROPERTY, builder.maxDepth));
        return builder.build();
    }

    private static boolean readBoolean(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        LOGGER.log(Level.WARNING, "Ignoring malformed value ''{0}'' for option {1}", new Object[] {value, key});
        return fallback;
    }

    private static int readPositiveInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            parsed = -1;
        }
        if (parsed > 0) {
            return parsed;
        }
        LOGGER.log(Level.WARNING, "Ignoring malformed value ''{0}'' for option {1}", new Object[] {value, key});
        return fallback;
    }

    /** Attach line/column locations to every node. */
    public boolean isLoc() {
        return loc;
    }

    /** Attach character offset ranges to every node. */
    public boolean isRange() {
        return range;
    }

    /** Attach the token list to the source unit. */
    public boolean isTokens() {
        return tokens;
    }

    /** Return a best-effort tree with errors attached instead of throwing on syntax errors. */
    public boolean isTolerant() {
        return tolerant;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public Builder toBuilder() {
        return builder().loc(loc).range(range).tokens(tokens).tolerant(tolerant).maxDepth(maxDepth);
    }

    @Override
    public String toString() {
        return "ParseOptions{loc="
                + loc
                + ", range="
                + range
                + ", tokens="
                + tokens
                + ", tolerant="
                + tolerant
                + ", maxDepth="
                + maxDepth
                + "}";
    }

    public static final class Builder {
        private boolean loc = true;
        private boolean range = true;
        private boolean tokens;
        private boolean tolerant = true;
        private int maxDepth = DEFAULT_MAX_DEPTH;

        private Builder() {}

        public Builder loc(boolean loc) {
            this.loc = loc;
            return this;
        }

        public Builder range(boolean range) {
            this.range = range;
            return this;
        }

        public Builder tokens(boolean tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder tolerant(boolean tolerant) {
            this.tolerant = tolerant;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public ParseOptions build() {
            return new ParseOptions(this);
        }
    }
}
