package com.solidity.parser.ast;

/** Type names. They double as expressions, as in {@code uint(x)} or {@code new T[](n)}. */
public interface TypeName extends Expression {}
