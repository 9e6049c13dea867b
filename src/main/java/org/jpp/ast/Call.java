package org.jpp.ast;

import java.util.List;

public record Call(String name, List<Node> args) implements Node
{
	public Call
	{
		args = List.copyOf(args);
	}
}
