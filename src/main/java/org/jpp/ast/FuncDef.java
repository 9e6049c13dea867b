package org.jpp.ast;

import java.util.List;

/**
 * {@code def name(p: type, ...): returnType:} followed by a body block.
 * {@code paramTypes} is parallel to {@code params}.
 */
public record FuncDef(
		String name,
		List<String> params,
		List<String> paramTypes,
		String returnType,
		List<Node> body
) implements Node
{
	public FuncDef
	{
		if (params.size() != paramTypes.size())
		{
			throw new IllegalArgumentException("Parameter names and types differ in length for function " + name);
		}
		params = List.copyOf(params);
		paramTypes = List.copyOf(paramTypes);
		body = List.copyOf(body);
	}
}
