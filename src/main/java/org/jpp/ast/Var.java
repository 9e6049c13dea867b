package org.jpp.ast;

public record Var(String name) implements Node
{
}
