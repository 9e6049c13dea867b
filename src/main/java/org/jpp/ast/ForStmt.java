package org.jpp.ast;

import java.util.List;

/**
 * {@code for variable : range(start, end):} counts from start up to end, exclusive.
 */
public record ForStmt(String variable, Node start, Node end, List<Node> body) implements Node
{
	public ForStmt
	{
		body = List.copyOf(body);
	}
}
