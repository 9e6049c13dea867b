package org.jpp.codegen;

import java.util.Set;

/**
 * What a vectorized main loop works with: the vector class ({@code FloatVector} or
 * {@code IntVector}), the name of the species variable, and the arrays loaded into
 * vector registers.
 */
public record VectorLane(String vectorClass, String species, Set<String> arrays)
{
	public static final String REGISTER_PREFIX = "v_";

	public VectorLane
	{
		arrays = Set.copyOf(arrays);
	}

	public boolean isLoaded(String array)
	{
		return arrays.contains(array);
	}

	public String register(String array)
	{
		return REGISTER_PREFIX + array;
	}

	public String broadcast(String scalar)
	{
		return vectorClass + ".broadcast(" + species + ", " + scalar + ")";
	}
}
