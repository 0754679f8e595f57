package com.solidity.parser.ast;

/** Assembly nodes that produce a value. */
public interface AssemblyExpression extends AssemblyItem {}
