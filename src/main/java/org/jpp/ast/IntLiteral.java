package org.jpp.ast;

public record IntLiteral(int value) implements Node
{
}
