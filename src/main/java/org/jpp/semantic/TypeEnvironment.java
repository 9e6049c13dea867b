package org.jpp.semantic;

import org.jpp.util.Debug;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-compilation name tables: variable name to type tag, and function name to result tag.
 * There is no nesting; a variable is known from its first assignment on.
 */
public class TypeEnvironment
{
	private static final Map<String, String> BUILTIN_RESULTS = Map.of(
			"floats", TypeTags.arrayOf(TypeTags.FLOAT),
			"ints", TypeTags.arrayOf(TypeTags.INT),
			"len", TypeTags.INT
	);

	private final Map<String, String> variables = new LinkedHashMap<>();
	private final Map<String, String> functions;
	private final Set<String> programFunctions;

	public TypeEnvironment()
	{
		this(new HashMap<>(BUILTIN_RESULTS), new HashSet<>());
	}

	private TypeEnvironment(Map<String, String> sharedFunctions, Set<String> sharedProgramFunctions)
	{
		this.functions = sharedFunctions;
		this.programFunctions = sharedProgramFunctions;
	}

	/**
	 * A fresh variable table for a function body that shares this environment's function table.
	 */
	public TypeEnvironment forFunction()
	{
		return new TypeEnvironment(functions, programFunctions);
	}

	/**
	 * Records a variable's type. The first registration wins; later calls leave the tag untouched.
	 *
	 * @return true if the name was new.
	 */
	public boolean registerVariable(String name, String tag)
	{
		String previous = variables.putIfAbsent(name, tag);
		if (previous != null && !previous.equals(tag))
		{
			Debug.logDebug("TypeEnvironment: keeping '" + name + "' as " + previous + " (ignored " + tag + ")");
		}
		return previous == null;
	}

	/**
	 * Records a function defined by the program. A definition named like a builtin replaces it.
	 */
	public void registerFunction(String name, String resultTag)
	{
		functions.put(name, resultTag);
		programFunctions.add(name);
	}

	public boolean isProgramFunction(String name)
	{
		return programFunctions.contains(name);
	}

	public boolean isDeclared(String name)
	{
		return variables.containsKey(name);
	}

	/**
	 * The variable's tag, or null when the name was never assigned.
	 */
	public String typeOf(String name)
	{
		return variables.get(name);
	}

	/**
	 * The function's result tag, or null when the function is unknown.
	 */
	public String resultOf(String function)
	{
		return functions.get(function);
	}

	/**
	 * Names whose tag carries the array suffix, sorted.
	 */
	public Set<String> arrayVariables()
	{
		Set<String> arrays = new TreeSet<>();
		variables.forEach((name, tag) ->
		{
			if (TypeTags.isArray(tag))
			{
				arrays.add(name);
			}
		});
		return arrays;
	}
}
