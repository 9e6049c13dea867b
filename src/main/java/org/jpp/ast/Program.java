package org.jpp.ast;

import java.util.List;

public record Program(List<Node> statements) implements Node
{
	public Program
	{
		statements = List.copyOf(statements);
	}
}
