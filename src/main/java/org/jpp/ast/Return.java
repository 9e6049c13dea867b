package org.jpp.ast;

public record Return(
		Node expr // Null for a bare 'return'
) implements Node
{
	public boolean hasValue()
	{
		return expr != null;
	}
}
