package org.jpp.semantic;

/**
 * Coarse type tags. Tags are plain strings spelled the way Java spells the type, so a
 * declaration can print its tag directly; arrays are any tag ending in {@code []}.
 */
public final class TypeTags
{
	public static final String INT = "int";
	public static final String FLOAT = "float";
	public static final String STRING = "String";
	public static final String VOID = "void";
	public static final String UNTYPED = "var";
	public static final String ARRAY_SUFFIX = "[]";

	private TypeTags()
	{
	}

	public static boolean isArray(String tag)
	{
		return tag != null && tag.endsWith(ARRAY_SUFFIX);
	}

	public static String arrayOf(String elementTag)
	{
		return elementTag + ARRAY_SUFFIX;
	}

	/**
	 * Element tag of an array tag, or {@link #UNTYPED} for anything else.
	 */
	public static String elementOf(String arrayTag)
	{
		if (!isArray(arrayTag))
		{
			return UNTYPED;
		}
		return arrayTag.substring(0, arrayTag.length() - ARRAY_SUFFIX.length());
	}

	/**
	 * The tag as a Java type in positions where {@code var} is not allowed
	 * (parameters, return types).
	 */
	public static String toJavaSignatureType(String tag)
	{
		return UNTYPED.equals(tag) ? "Object" : tag;
	}
}
