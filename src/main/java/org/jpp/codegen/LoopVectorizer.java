package org.jpp.codegen;

import org.jpp.ast.*;
import org.jpp.semantic.TypeEnvironment;
import org.jpp.semantic.TypeTags;
import org.jpp.util.Debug;

import java.util.Set;
import java.util.TreeSet;

/**
 * Generates {@code for} loops. With no int or float arrays in scope the loop is a plain
 * counting loop. Otherwise it becomes a main loop over whole vector widths using the
 * {@code jdk.incubator.vector} API, followed by a scalar tail loop for the remainder.
 * <p>
 * Only indexed array assignments are carried into the main loop. Every other body
 * statement is left out there and runs in the tail loop alone.
 */
public class LoopVectorizer
{
	static final String VECTOR_IMPORT = "jdk.incubator.vector.*";

	private final JavaGenerator gen;

	LoopVectorizer(JavaGenerator gen)
	{
		this.gen = gen;
	}

	public void generate(ForStmt loop)
	{
		TypeEnvironment env = gen.environment();
		Set<String> candidates = new TreeSet<>();
		for (String array : env.arrayVariables())
		{
			String element = TypeTags.elementOf(env.typeOf(array));
			if (TypeTags.FLOAT.equals(element) || TypeTags.INT.equals(element))
			{
				candidates.add(array);
			}
		}

		if (candidates.isEmpty())
		{
			generateScalar(loop);
			return;
		}

		boolean floatLane = candidates.stream().anyMatch(a -> TypeTags.FLOAT.equals(TypeTags.elementOf(env.typeOf(a))));
		String element = floatLane ? TypeTags.FLOAT : TypeTags.INT;
		String vectorClass = floatLane ? "FloatVector" : "IntVector";

		Set<String> loaded = new TreeSet<>();
		for (String array : candidates)
		{
			if (element.equals(TypeTags.elementOf(env.typeOf(array))))
			{
				loaded.add(array);
			}
		}

		if (!canVectorize(loop, loaded, element, env))
		{
			Debug.logDebug("Codegen: loop over '" + loop.variable() + "' is not lane-wise over " + loaded + "; generating scalar loop.");
			generateScalar(loop);
			return;
		}

		generateVectorized(loop, vectorClass, loaded);
	}

	private void generateScalar(ForStmt loop)
	{
		ExpressionTranslator expressions = gen.expressions();
		String var = loop.variable();
		String start = expressions.translate(loop.start());
		String end = expressions.translate(loop.end());

		gen.buffer().emit("for (int " + var + " = " + start + "; " + var + " < " + end + "; " + var + "++) {");
		gen.generateBlock(loop.body());
		gen.buffer().emit("}");
	}

	private void generateVectorized(ForStmt loop, String vectorClass, Set<String> arrays)
	{
		gen.requireImport(VECTOR_IMPORT);

		CodeBuffer out = gen.buffer();
		ExpressionTranslator expressions = gen.expressions();
		String suffix = gen.nextVectorLoopSuffix();
		String species = "species" + suffix;
		String bound = "bound" + suffix;
		String width = species + ".length()";
		String var = loop.variable();
		String start = expressions.translate(loop.start());
		String end = expressions.translate(loop.end());
		VectorLane lane = new VectorLane(vectorClass, species, arrays);

		Debug.logDebug("Codegen: vectorizing loop over '" + var + "' with " + vectorClass + " for arrays " + arrays);

		out.emit("var " + species + " = " + vectorClass + ".SPECIES_PREFERRED;");
		if (isZero(loop.start()))
		{
			out.emit("int " + bound + " = " + end + " - " + end + " % " + width + ";");
		}
		else
		{
			out.emit("int " + bound + " = " + end + " - (" + end + " - " + start + ") % " + width + ";");
		}

		// Main loop: whole vector widths
		out.emit("for (int " + var + " = " + start + "; " + var + " < " + bound + "; " + var + " += " + width + ") {");
		out.indent();
		for (String array : arrays)
		{
			out.emit("var " + lane.register(array) + " = " + vectorClass + ".fromArray(" + species + ", " + array + ", " + var + ");");
		}
		for (Node stmt : loop.body())
		{
			if (stmt instanceof Assign assign && assign.target() instanceof ArrayAccess target)
			{
				String value = expressions.translate(assign.expr(), lane);
				if (!ExpressionTranslator.producesVector(assign.expr(), lane))
				{
					value = lane.broadcast(value);
				}
				out.emit(lane.register(target.array()) + " = " + value + ";");
			}
		}
		for (String array : arrays)
		{
			out.emit(lane.register(array) + ".intoArray(" + array + ", " + var + ");");
		}
		out.dedent();
		out.emit("}");

		// Tail loop: the remaining elements, every statement, scalar
		out.emit("for (int " + var + " = " + bound + "; " + var + " < " + end + "; " + var + "++) {");
		gen.generateBlock(loop.body());
		out.emit("}");
	}

	/**
	 * Every indexed assignment in the body must write a loaded array at the loop variable,
	 * and its value must be computable lane by lane.
	 */
	private static boolean canVectorize(ForStmt loop, Set<String> loaded, String element, TypeEnvironment env)
	{
		for (Node stmt : loop.body())
		{
			if (!(stmt instanceof Assign assign) || !(assign.target() instanceof ArrayAccess target))
			{
				continue;
			}

			if (!isLaneAccess(target, loaded, loop.variable()) || !isLaneWise(assign.expr(), loaded, loop.variable(), element, env))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * True if the expression is built only from literals and scalars the lane can widen,
	 * lane accesses to loaded arrays, and operators that have a vector intrinsic.
	 */
	private static boolean isLaneWise(Node node, Set<String> loaded, String loopVariable, String element, TypeEnvironment env)
	{
		if (node instanceof IntLiteral)
		{
			return true;
		}
		if (node instanceof FloatLiteral)
		{
			return TypeTags.FLOAT.equals(element);
		}
		if (node instanceof Var var)
		{
			// The loop variable differs per lane; a broadcast would repeat the block offset
			if (var.name().equals(loopVariable) || loaded.contains(var.name()))
			{
				return false;
			}
			String tag = env.typeOf(var.name());
			return TypeTags.INT.equals(tag) || (TypeTags.FLOAT.equals(element) && TypeTags.FLOAT.equals(tag));
		}
		if (node instanceof ArrayAccess access)
		{
			return isLaneAccess(access, loaded, loopVariable);
		}
		if (node instanceof BinOp binOp)
		{
			return ExpressionTranslator.hasIntrinsic(binOp.op())
					&& isLaneWise(binOp.left(), loaded, loopVariable, element, env)
					&& isLaneWise(binOp.right(), loaded, loopVariable, element, env);
		}
		return false;
	}

	private static boolean isLaneAccess(ArrayAccess access, Set<String> loaded, String loopVariable)
	{
		return loaded.contains(access.array()) && isLoopIndex(access.index(), loopVariable);
	}

	private static boolean isLoopIndex(Node index, String loopVariable)
	{
		return index instanceof Var var && var.name().equals(loopVariable);
	}

	private static boolean isZero(Node node)
	{
		return node instanceof IntLiteral lit && lit.value() == 0;
	}
}
