package org.jpp.ast;

/**
 * Assignment to a plain name ({@link Var}) or to an array element ({@link ArrayAccess}).
 */
public record Assign(Node target, Node expr) implements Node
{
	public Assign
	{
		if (!(target instanceof Var) && !(target instanceof ArrayAccess))
		{
			throw new IllegalArgumentException("Assignment target must be a name or an array element, got " + target.kind());
		}
	}

	public Assign(String name, Node expr)
	{
		this(new Var(name), expr);
	}

	public boolean isIndexed()
	{
		return target instanceof ArrayAccess;
	}
}
