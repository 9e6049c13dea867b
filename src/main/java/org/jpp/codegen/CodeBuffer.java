package org.jpp.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lines of Java source at a tracked indentation level.
 */
public class CodeBuffer
{
	private static final String INDENT = "    ";

	private final List<String> lines = new ArrayList<>();
	private int indent;

	public CodeBuffer(int baseIndent)
	{
		this.indent = baseIndent;
	}

	public void emit(String line)
	{
		lines.add(INDENT.repeat(indent) + line);
	}

	public void indent()
	{
		indent++;
	}

	public void dedent()
	{
		if (indent == 0)
		{
			throw new IllegalStateException("Unbalanced dedent");
		}
		indent--;
	}

	public List<String> getLines()
	{
		return Collections.unmodifiableList(lines);
	}
}
