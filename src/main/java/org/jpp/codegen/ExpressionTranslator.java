package org.jpp.codegen;

import org.jpp.ast.*;
import org.jpp.semantic.TypeEnvironment;
import org.jpp.semantic.TypeInferencer;
import org.jpp.semantic.TypeTags;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders expression nodes as Java expressions.
 * <p>
 * With a {@link VectorLane} the arithmetic operators become vector intrinsic calls and
 * loaded arrays are read from their vector registers. The checks run in a fixed order:
 * vector intrinsics, then string equality, then the plain infix form.
 */
public class ExpressionTranslator
{
	public static final String PRINT_ALIAS = "print";
	private static final String CONSOLE_OUTPUT = "System.out.println";

	private static final Map<String, String> INTRINSICS = Map.of(
			"+", "add",
			"-", "sub",
			"*", "mul",
			"/", "div"
	);

	private final TypeEnvironment env;
	private final TypeInferencer inferencer;

	public ExpressionTranslator(TypeEnvironment env, TypeInferencer inferencer)
	{
		this.env = env;
		this.inferencer = inferencer;
	}

	public String translate(Node node)
	{
		return translate(node, null);
	}

	public String translate(Node node, VectorLane lane)
	{
		if (node instanceof IntLiteral lit)
		{
			return String.valueOf(lit.value());
		}

		if (node instanceof FloatLiteral lit)
		{
			return lit.value() + "f";
		}

		if (node instanceof StringLiteral lit)
		{
			return "\"" + lit.value() + "\"";
		}

		if (node instanceof Var var)
		{
			if (lane != null && lane.isLoaded(var.name()))
			{
				return lane.register(var.name());
			}
			return var.name();
		}

		if (node instanceof ArrayAccess access)
		{
			if (lane != null && lane.isLoaded(access.array()))
			{
				return lane.register(access.array());
			}
			return access.array() + "[" + translate(access.index(), lane) + "]";
		}

		if (node instanceof Call call)
		{
			return translateCall(call, lane);
		}

		if (node instanceof BinOp binOp)
		{
			return translateBinOp(binOp, lane);
		}

		if (node instanceof SelectExpr select)
		{
			return "(" + translate(select.condition(), lane) + " ? " + translate(select.ifTrue(), lane) + " : " + translate(select.ifFalse(), lane) + ")";
		}

		if (node instanceof SafeNav nav)
		{
			String obj = translate(nav.object());
			return "(" + obj + " != null ? " + obj + "." + nav.field() + " : null)";
		}

		if (node instanceof FString fString)
		{
			if (fString.parts().isEmpty())
			{
				return "\"\"";
			}
			return fString.parts().stream()
					.map(this::translate)
					.collect(Collectors.joining(" + ", "(", ")"));
		}

		throw new CodeGenException("expression", node);
	}

	/**
	 * Like {@link #translate(Node)}, without the outer parentheses of an infix operator, for
	 * positions that supply their own ({@code if (...)}, {@code while (...)}).
	 */
	public String translateCondition(Node node)
	{
		if (node instanceof BinOp binOp && !isStringEquality(binOp))
		{
			return translate(binOp.left()) + " " + binOp.op() + " " + translate(binOp.right());
		}
		return translate(node);
	}

	/**
	 * True if the node, translated under the lane, is a vector rather than a scalar.
	 */
	public static boolean producesVector(Node node, VectorLane lane)
	{
		if (node instanceof Var var)
		{
			return lane.isLoaded(var.name());
		}
		if (node instanceof ArrayAccess access)
		{
			return lane.isLoaded(access.array());
		}
		if (node instanceof BinOp binOp)
		{
			return INTRINSICS.containsKey(binOp.op());
		}
		return false;
	}

	public static boolean hasIntrinsic(String op)
	{
		return INTRINSICS.containsKey(op);
	}

	private String translateBinOp(BinOp node, VectorLane lane)
	{
		String l = translate(node.left(), lane);
		String r = translate(node.right(), lane);

		if (lane != null)
		{
			String intrinsic = INTRINSICS.get(node.op());
			if (intrinsic != null)
			{
				if (!producesVector(node.left(), lane))
				{
					l = lane.broadcast(l);
				}
				return l + "." + intrinsic + "(" + r + ")";
			}
		}

		// Java's == compares String references
		if (isStringEquality(node))
		{
			return l + ".equals(" + r + ")";
		}

		return "(" + l + " " + node.op() + " " + r + ")";
	}

	private boolean isStringEquality(BinOp node)
	{
		return node.op().equals("==") && TypeTags.STRING.equals(inferencer.infer(node.left()));
	}

	private String translateCall(Call call, VectorLane lane)
	{
		List<String> args = call.args().stream()
				.map(arg -> translate(arg, lane))
				.collect(Collectors.toList());

		if (env.isProgramFunction(call.name()))
		{
			return call.name() + "(" + String.join(", ", args) + ")";
		}

		switch (call.name())
		{
			case PRINT_ALIAS:
				return CONSOLE_OUTPUT + "(" + String.join(", ", args) + ")";
			case "floats":
				return "new float[" + singleArgument(call, args) + "]";
			case "ints":
				return "new int[" + singleArgument(call, args) + "]";
			case "len":
				return singleArgument(call, args) + ".length";
			default:
				return call.name() + "(" + String.join(", ", args) + ")";
		}
	}

	private static String singleArgument(Call call, List<String> args)
	{
		if (args.size() != 1)
		{
			throw new CodeGenException("Built-in '" + call.name() + "' takes exactly one argument, got " + args.size(), call.kind());
		}
		return args.get(0);
	}
}
