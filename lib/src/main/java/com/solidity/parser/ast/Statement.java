package com.solidity.parser.ast;

/** Nodes usable as a statement inside a block. */
public interface Statement {}
