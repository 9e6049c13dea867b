package org.jpp.semantic;

import org.jpp.ast.*;

/**
 * Best-effort type tags for expressions. Never fails: anything it cannot classify is
 * {@link TypeTags#UNTYPED}.
 */
public class TypeInferencer
{
	private final TypeEnvironment env;

	public TypeInferencer(TypeEnvironment env)
	{
		this.env = env;
	}

	public String infer(Node node)
	{
		if (node instanceof IntLiteral)
		{
			return TypeTags.INT;
		}
		if (node instanceof FloatLiteral)
		{
			return TypeTags.FLOAT;
		}
		if (node instanceof StringLiteral)
		{
			return TypeTags.STRING;
		}
		if (node instanceof Var var)
		{
			String tag = env.typeOf(var.name());
			return tag != null ? tag : TypeTags.UNTYPED;
		}
		if (node instanceof ArrayAccess access)
		{
			// An array nobody declared is assumed to hold ints
			String arrayTag = env.typeOf(access.array());
			return TypeTags.elementOf(arrayTag != null ? arrayTag : TypeTags.arrayOf(TypeTags.INT));
		}
		if (node instanceof BinOp binOp)
		{
			return dominant(infer(binOp.left()), infer(binOp.right()));
		}
		if (node instanceof Call call)
		{
			String result = env.resultOf(call.name());
			return result != null ? result : TypeTags.UNTYPED;
		}
		if (node instanceof SelectExpr select)
		{
			return dominant(infer(select.ifTrue()), infer(select.ifFalse()));
		}
		if (node instanceof FString)
		{
			return TypeTags.STRING;
		}
		return TypeTags.UNTYPED;
	}

	/**
	 * String beats float, float beats int.
	 */
	private static String dominant(String a, String b)
	{
		if (TypeTags.STRING.equals(a) || TypeTags.STRING.equals(b))
		{
			return TypeTags.STRING;
		}
		if (TypeTags.FLOAT.equals(a) || TypeTags.FLOAT.equals(b))
		{
			return TypeTags.FLOAT;
		}
		return TypeTags.INT;
	}
}
