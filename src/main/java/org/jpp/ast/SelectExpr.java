package org.jpp.ast;

/**
 * {@code condition ? ifTrue : ifFalse}. Not produced by the parser.
 */
public record SelectExpr(Node condition, Node ifTrue, Node ifFalse) implements Node
{
}
