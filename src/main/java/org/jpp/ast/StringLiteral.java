package org.jpp.ast;

/**
 * The text between the quotes, escape sequences left as written.
 */
public record StringLiteral(String value) implements Node
{
}
