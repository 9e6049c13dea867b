package org.jpp.ast;

import java.util.List;

public record WhileStmt(Node condition, List<Node> body) implements Node
{
	public WhileStmt
	{
		body = List.copyOf(body);
	}
}
