package org.jpp.codegen;

import org.jpp.ast.*;
import org.jpp.semantic.TypeEnvironment;
import org.jpp.semantic.TypeInferencer;
import org.jpp.semantic.TypeTags;
import org.jpp.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Translates a {@link Program} into a single Java compilation unit.
 * <p>
 * Top-level statements become the body of {@code main}; every {@link FuncDef}, wherever it
 * appears, becomes a static method of the same class. Statements are generated in order,
 * in one pass. The first assignment to a name declares it with the inferred type and
 * later ones are plain reassignments.
 */
public class JavaGenerator
{
	static final int METHOD_BODY_INDENT = 2;

	private final String className;
	private final Set<String> imports = new TreeSet<>();
	private final CodeBuffer mainBody = new CodeBuffer(METHOD_BODY_INDENT);
	private final List<CodeBuffer> methods = new ArrayList<>();
	private final LoopVectorizer vectorizer = new LoopVectorizer(this);
	private final TypeEnvironment mainEnv;

	// State of the method currently being generated, swapped while a FuncDef is generated
	private MethodScope scope;

	public JavaGenerator(String className)
	{
		this(className, new TypeEnvironment());
	}

	/**
	 * @param env environment for the top-level statements; may be pre-populated.
	 */
	public JavaGenerator(String className, TypeEnvironment env)
	{
		this.className = className;
		this.mainEnv = env;
		this.scope = new MethodScope(mainBody, env);
	}

	/**
	 * Registers all function result types, generates every statement and returns the unit.
	 */
	public String generate(Program program)
	{
		registerFunctions(program.statements());
		for (Node stmt : program.statements())
		{
			generateStatement(stmt);
		}
		Debug.logDebug("Codegen: generated " + mainBody.getLines().size() + " line(s) in main and " + methods.size() + " method(s).");
		return getOutput();
	}

	/**
	 * Records the declared result type of every function in the tree, nested ones included.
	 */
	public void registerFunctions(List<Node> stmts)
	{
		for (Node stmt : stmts)
		{
			if (stmt instanceof FuncDef func)
			{
				scope.env.registerFunction(func.name(), func.returnType());
				Debug.logDebug("Codegen: registered function " + func.name() + " -> " + func.returnType());
				registerFunctions(func.body());
			}
			else if (stmt instanceof IfStmt ifStmt)
			{
				registerFunctions(ifStmt.body());
				if (ifStmt.hasElse())
				{
					registerFunctions(ifStmt.orElse());
				}
			}
			else if (stmt instanceof WhileStmt whileStmt)
			{
				registerFunctions(whileStmt.body());
			}
			else if (stmt instanceof ForStmt forStmt)
			{
				registerFunctions(forStmt.body());
			}
		}
	}

	public void generateStatement(Node node)
	{
		CodeBuffer out = scope.body;

		if (node instanceof Assign assign)
		{
			generateAssign(assign);
		}
		else if (node instanceof IfStmt ifStmt)
		{
			out.emit("if (" + scope.expressions.translateCondition(ifStmt.condition()) + ") {");
			generateBlock(ifStmt.body());
			if (ifStmt.hasElse())
			{
				out.emit("} else {");
				generateBlock(ifStmt.orElse());
			}
			out.emit("}");
		}
		else if (node instanceof WhileStmt whileStmt)
		{
			out.emit("while (" + scope.expressions.translateCondition(whileStmt.condition()) + ") {");
			generateBlock(whileStmt.body());
			out.emit("}");
		}
		else if (node instanceof ForStmt forStmt)
		{
			vectorizer.generate(forStmt);
		}
		else if (node instanceof Call call)
		{
			out.emit(scope.expressions.translate(call) + ";");
		}
		else if (node instanceof Return ret)
		{
			out.emit(ret.hasValue() ? "return " + scope.expressions.translate(ret.expr()) + ";" : "return;");
		}
		else if (node instanceof FuncDef func)
		{
			generateFunction(func);
		}
		else
		{
			throw new CodeGenException("statement", node);
		}
	}

	private void generateAssign(Assign assign)
	{
		String value = scope.expressions.translate(assign.expr());

		if (assign.target() instanceof ArrayAccess access)
		{
			scope.body.emit(access.array() + "[" + scope.expressions.translate(access.index()) + "] = " + value + ";");
			return;
		}

		String name = ((Var) assign.target()).name();
		if (scope.env.isDeclared(name))
		{
			scope.body.emit(name + " = " + value + ";");
		}
		else
		{
			String type = scope.inferencer.infer(assign.expr());
			scope.body.emit(type + " " + name + " = " + value + ";");
			scope.env.registerVariable(name, type);
		}
	}

	private void generateFunction(FuncDef func)
	{
		CodeBuffer body = new CodeBuffer(METHOD_BODY_INDENT - 1);
		// Reserve the slot first so nested functions land after their parent
		methods.add(body);

		List<String> params = new ArrayList<>();
		for (int i = 0; i < func.params().size(); i++)
		{
			params.add(TypeTags.toJavaSignatureType(func.paramTypes().get(i)) + " " + func.params().get(i));
		}
		body.emit("static " + TypeTags.toJavaSignatureType(func.returnType()) + " " + func.name() + "(" + String.join(", ", params) + ") {");
		body.indent();

		MethodScope outer = scope;
		scope = new MethodScope(body, outer.env.forFunction());
		for (int i = 0; i < func.params().size(); i++)
		{
			scope.env.registerVariable(func.params().get(i), func.paramTypes().get(i));
		}

		try
		{
			for (Node stmt : func.body())
			{
				generateStatement(stmt);
			}
		}
		finally
		{
			scope = outer;
		}

		body.dedent();
		body.emit("}");
	}

	/**
	 * Generates the statements one level deeper than the current line.
	 */
	void generateBlock(List<Node> stmts)
	{
		scope.body.indent();
		for (Node stmt : stmts)
		{
			generateStatement(stmt);
		}
		scope.body.dedent();
	}

	// --- Accessors for LoopVectorizer ---

	CodeBuffer buffer()
	{
		return scope.body;
	}

	TypeEnvironment environment()
	{
		return scope.env;
	}

	ExpressionTranslator expressions()
	{
		return scope.expressions;
	}

	void requireImport(String importName)
	{
		imports.add(importName);
	}

	/**
	 * Suffix for the species/bound variables of the next vectorized loop in this method:
	 * empty for the first one, then "2", "3", ...
	 */
	String nextVectorLoopSuffix()
	{
		scope.vectorLoops++;
		return scope.vectorLoops == 1 ? "" : String.valueOf(scope.vectorLoops);
	}

	// --- Output ---

	public boolean isVectorized()
	{
		return !imports.isEmpty();
	}

	/**
	 * The environment of the top-level statements.
	 */
	public TypeEnvironment getEnvironment()
	{
		return mainEnv;
	}

	public String getOutput()
	{
		List<String> out = new ArrayList<>();

		for (String imp : imports)
		{
			out.add("import " + imp + ";");
		}
		if (!imports.isEmpty())
		{
			out.add("");
		}

		out.add("public class " + className + " {");
		out.add("    public static void main(String[] args) {");
		out.addAll(mainBody.getLines());
		out.add("    }");
		for (CodeBuffer method : methods)
		{
			out.add("");
			out.addAll(method.getLines());
		}
		out.add("}");

		return out.stream().collect(Collectors.joining("\n", "", "\n"));
	}

	private static final class MethodScope
	{
		final CodeBuffer body;
		final TypeEnvironment env;
		final TypeInferencer inferencer;
		final ExpressionTranslator expressions;
		int vectorLoops = 0;

		MethodScope(CodeBuffer body, TypeEnvironment env)
		{
			this.body = body;
			this.env = env;
			this.inferencer = new TypeInferencer(env);
			this.expressions = new ExpressionTranslator(env, inferencer);
		}
	}
}
