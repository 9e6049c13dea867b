package org.jpp.ast;

import java.util.List;

/**
 * Interpolated string. Literal text fragments are {@link StringLiteral} parts, the rest
 * are embedded expressions. Not produced by the parser.
 */
public record FString(List<Node> parts) implements Node
{
	public FString
	{
		parts = List.copyOf(parts);
	}
}
