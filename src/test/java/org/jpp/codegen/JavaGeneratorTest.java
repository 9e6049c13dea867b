package org.jpp.codegen;

import org.jpp.ast.*;
import org.jpp.lexer.Lexer;
import org.jpp.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaGeneratorTest
{
	private static Program parse(String source)
	{
		return new Parser(Lexer.tokenize(source)).parseProgram();
	}

	private static String generate(String source)
	{
		return new JavaGenerator("Demo").generate(parse(source));
	}

	@Test
	void firstAssignmentDeclaresLaterOnesReassign()
	{
		String expected = """
				public class Demo {
				    public static void main(String[] args) {
				        int x = 1;
				        x = 2;
				    }
				}
				""";

		assertEquals(expected, generate("x = 1\nx = 2\n"));
	}

	@Test
	void typeIsNotReinferredOnReassignment()
	{
		JavaGenerator gen = new JavaGenerator("Demo");
		String out = gen.generate(parse("x = 1\nx = \"text\"\n"));

		assertTrue(out.contains("x = \"text\";"));
		assertFalse(out.contains("String x"));
		assertEquals("int", gen.getEnvironment().typeOf("x"));
	}

	@Test
	void declarationsUseInferredTypes()
	{
		String out = generate("f = 1.5\ns = \"a\" + 1\nr = mystery(2)\n");

		assertTrue(out.contains("        float f = 1.5f;\n"));
		assertTrue(out.contains("        String s = (\"a\" + 1);\n"));
		assertTrue(out.contains("        var r = mystery(2);\n"));
	}

	@Test
	void printIsConsoleOutput()
	{
		assertTrue(generate("print(\"hi\")\n").contains("        System.out.println(\"hi\");\n"));
	}

	@Test
	void stringEqualityUsesEquals()
	{
		String out = generate("s = \"a\"\nif s == \"b\":\n  print(s)\n");

		assertTrue(out.contains("        if (s.equals(\"b\")) {\n"));
		assertTrue(out.contains("            System.out.println(s);\n"));
		assertFalse(out.contains("s == \"b\""));
	}

	@Test
	void numericEqualityStaysNative()
	{
		String out = generate("n = 1\nif n == 2:\n  print(n)\n");

		assertTrue(out.contains("        if (n == 2) {\n"));
	}

	@Test
	void nestedEqualityInsideExpression()
	{
		String out = generate("s = \"a\"\nok = s == \"a\"\n");

		assertTrue(out.contains("ok = s.equals(\"a\");"));
	}

	@Test
	void ifElse()
	{
		String expected = """
				public class Demo {
				    public static void main(String[] args) {
				        if (a) {
				            int x = 1;
				        } else {
				            x = 2;
				        }
				    }
				}
				""";

		assertEquals(expected, generate("if a:\n  x = 1\nelse:\n  x = 2\n"));
	}

	@Test
	void whileLoop()
	{
		String expected = """
				public class Demo {
				    public static void main(String[] args) {
				        int n = 0;
				        while (n < 3) {
				            n = (n + 1);
				        }
				    }
				}
				""";

		assertEquals(expected, generate("n = 0\nwhile n < 3:\n  n = n + 1\n"));
	}

	@Test
	void returnWithAndWithoutValue()
	{
		JavaGenerator gen = new JavaGenerator("Demo");
		gen.generateStatement(new Return(null));
		gen.generateStatement(new Return(new IntLiteral(4)));

		assertTrue(gen.getOutput().contains("        return;\n        return 4;\n"));
	}

	@Test
	void indexedStoreNeverDeclares()
	{
		String out = generate("a[0] = 5\n");

		assertTrue(out.contains("        a[0] = 5;\n"));
	}

	@Test
	void functionsBecomeStaticMethods()
	{
		String expected = """
				public class Demo {
				    public static void main(String[] args) {
				    }

				    static int add(int a, int b) {
				        return (a + b);
				    }
				}
				""";

		assertEquals(expected, generate("def add(a: int, b: int): int:\n  return a + b\n"));
	}

	@Test
	void untypedParametersAreObjects()
	{
		assertTrue(generate("def show(v):\n  print(v)\n").contains("    static void show(Object v) {\n"));
	}

	@Test
	void functionResultTypesAreRegisteredBeforeGeneration()
	{
		String out = generate("y = half(3.0)\ndef half(x: float): float:\n  return x / 2.0\n");

		assertTrue(out.contains("        float y = half(3.0f);\n"));
		assertTrue(out.contains("        return (x / 2.0f);\n"));
	}

	@Test
	void functionBodiesHaveTheirOwnVariables()
	{
		String out = generate("x = 1\ndef f():\n  x = 2\n");

		assertTrue(out.contains("        int x = 1;\n"));
		assertTrue(out.contains("    static void f() {\n        int x = 2;\n    }\n"));
	}

	@Test
	void nestedFunctionsAreHoistedInSourceOrder()
	{
		String out = generate("def outer():\n  print(1)\ndef inner():\n  print(2)\n");

		int outer = out.indexOf("static void outer()");
		int inner = out.indexOf("static void inner()");
		assertTrue(outer >= 0 && inner > outer, out);
	}

	@Test
	void builtins()
	{
		String out = generate("a = floats(8)\nb = ints(4)\nn = len(a)\n");

		assertTrue(out.contains("        float[] a = new float[8];\n"));
		assertTrue(out.contains("        int[] b = new int[4];\n"));
		assertTrue(out.contains("        int n = a.length;\n"));
	}

	@Test
	void builtinArityIsChecked()
	{
		assertThrows(CodeGenException.class, () -> generate("a = floats(1, 2)\n"));
	}

	@Test
	void unreachableNodeVariantsStillTranslate()
	{
		JavaGenerator gen = new JavaGenerator("Demo");
		gen.generateStatement(new Assign("t", new SelectExpr(new Var("c"), new IntLiteral(1), new IntLiteral(2))));
		gen.generateStatement(new Assign("msg", new FString(List.of(new StringLiteral("n="), new Var("n")))));
		gen.generateStatement(new Assign("name", new SafeNav(new Var("p"), "name")));
		String out = gen.getOutput();

		assertTrue(out.contains("        int t = (c ? 1 : 2);\n"));
		assertTrue(out.contains("        String msg = (\"n=\" + n);\n"));
		assertTrue(out.contains("        var name = (p != null ? p.name : null);\n"));
	}

	@Test
	void classDefinitionsAreRejected()
	{
		JavaGenerator gen = new JavaGenerator("Demo");
		CodeGenException e = assertThrows(CodeGenException.class,
				() -> gen.generateStatement(new ClassDef("Point", List.of("x", "y"), List.of(), null)));

		assertEquals("ClassDef", e.getNodeKind());
		assertTrue(e.getMessage().contains("ClassDef"));
	}

	@Test
	void unknownExpressionIsRejected()
	{
		JavaGenerator gen = new JavaGenerator("Demo");
		CodeGenException e = assertThrows(CodeGenException.class,
				() -> gen.generateStatement(new Assign("x", new Program(List.of()))));

		assertEquals("Program", e.getNodeKind());
	}

	@Test
	void generationIsRepeatable()
	{
		Program program = parse("a = floats(16)\nb = floats(16)\nfor i : range(0, 16):\n  a[i] = a[i] + b[i]\n  print(i)\n");

		String first = new JavaGenerator("Demo").generate(program);
		String second = new JavaGenerator("Demo").generate(program);

		assertEquals(first, second);
	}

	@Test
	void programFunctionsShadowBuiltins()
	{
		String out = generate("n = len(3)\nprint(n)\ndef len(x: int): float:\n  return x * 2.0\n");

		assertTrue(out.contains("float n = len(3);"));
		assertTrue(out.contains("System.out.println(n);"));
		assertTrue(out.contains("static float len(int x) {"));
		assertFalse(out.contains(".length"));
	}

	@Test
	void chainedAssignmentIsNestedJavaAssignment()
	{
		String out = generate("y = 0\nx = y = 3\n");

		assertTrue(out.contains("int x = (y = 3);"));
	}
}
