package com.places.display.parser.ast;

/** Node of a parsed display options expression. */
public sealed interface DisplayNode permits SequenceNode, IdentifierNode, FilterNode, FallbackNode {}
