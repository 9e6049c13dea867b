package org.jpp.ast;

public record ArrayAccess(String array, Node index) implements Node
{
}
