package com.solidity.parser.ast;

/** Nodes allowed as an operation of an inline assembly block. */
public interface AssemblyItem {}
