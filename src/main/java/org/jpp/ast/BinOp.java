package org.jpp.ast;

public record BinOp(Node left, String op, Node right) implements Node
{
}
