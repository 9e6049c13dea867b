package org.jpp.ast;

public record FloatLiteral(double value) implements Node
{
}
