package com.solidity.parser.ast;

/** Declarations allowed inside a contract body. */
public interface ContractPart {}
