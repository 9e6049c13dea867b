package org.jpp.ast;

/**
 * Common supertype of every AST node. Nodes are immutable and own their children;
 * there are no parent links and no sharing between subtrees.
 */
public interface Node
{
	/**
	 * The node variant's name, used in diagnostics and AST dumps.
	 */
	default String kind()
	{
		return getClass().getSimpleName();
	}
}
