package org.jpp.ast;

import java.util.List;

/**
 * A class declaration. No grammar rule produces one; the generator rejects it.
 */
public record ClassDef(
		String name,
		List<String> fields,
		List<FuncDef> methods,
		String implementsName // Null if the class implements nothing
) implements Node
{
	public ClassDef
	{
		fields = List.copyOf(fields);
		methods = List.copyOf(methods);
	}
}
