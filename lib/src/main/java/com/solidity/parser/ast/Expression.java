package com.solidity.parser.ast;

/** Nodes usable in expression position. */
public interface Expression {}
