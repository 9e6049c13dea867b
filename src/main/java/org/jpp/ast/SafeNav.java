package org.jpp.ast;

/**
 * {@code object?.field}: null when the object is null.
 */
public record SafeNav(Node object, String field) implements Node
{
}
