package org.jpp.ast;

import java.util.List;

public record IfStmt(
		Node condition,
		List<Node> body,
		List<Node> orElse // Null when there is no else branch
) implements Node
{
	public IfStmt
	{
		body = List.copyOf(body);
		orElse = orElse == null ? null : List.copyOf(orElse);
	}

	public boolean hasElse()
	{
		return orElse != null;
	}
}
