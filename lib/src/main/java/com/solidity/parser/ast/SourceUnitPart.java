package com.solidity.parser.ast;

/** Declarations allowed at file level. */
public interface SourceUnitPart {}
