package org.jpp.codegen;

import org.jpp.ast.Node;
import org.jpp.util.CompilationException;

public class CodeGenException extends CompilationException
{
	private final String nodeKind;

	public CodeGenException(String category, Node node)
	{
		super(Stage.CODEGEN, "Unsupported " + category + ": " + node.kind());
		this.nodeKind = node.kind();
	}

	public CodeGenException(String message, String nodeKind)
	{
		super(Stage.CODEGEN, message);
		this.nodeKind = nodeKind;
	}

	public String getNodeKind()
	{
		return nodeKind;
	}
}
