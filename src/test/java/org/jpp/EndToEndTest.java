package org.jpp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Compiles generated Java with javac and checks what it does at run time.
 */
class EndToEndTest
{
	@TempDir
	Path workDir;

	@BeforeEach
	void requireCompiler()
	{
		assumeTrue(GeneratedProgram.compilerAvailable(), "no system Java compiler");
	}

	@Test
	void scalarLoopPrintsEachIndex() throws Exception
	{
		GeneratedProgram program = GeneratedProgram.build("Count", "for i : range(0, 3):\n  print(i)\n", workDir);

		assertEquals("0\n1\n2\n", program.runMain());
	}

	@Test
	void stringEqualityComparesContent() throws Exception
	{
		String source = "s = \"a1\"\nn = 1\nt = \"a\" + n\nif s == t:\n  print(1)\nelse:\n  print(0)\n";

		GeneratedProgram program = GeneratedProgram.build("Strings", source, workDir);

		assertEquals("1\n", program.runMain());
	}

	@Test
	void functionsAreCallableFromMain() throws Exception
	{
		String source = "print(twice(21))\ndef twice(x: int): int:\n  return x * 2\n";

		GeneratedProgram program = GeneratedProgram.build("Twice", source, workDir);

		assertEquals("42\n", program.runMain());
	}

	@Test
	void whileLoopRunsUntilConditionFails() throws Exception
	{
		GeneratedProgram program = GeneratedProgram.build("Loop", "n = 0\nwhile n < 3:\n  print(n)\n  n = n + 1\n", workDir);

		assertEquals("0\n1\n2\n", program.runMain());
	}

	@Test
	void vectorizedLoopTouchesEveryElementOnce() throws Exception
	{
		assumeTrue(GeneratedProgram.vectorModuleLoaded(), "jdk.incubator.vector not in the boot layer");

		String source = "def scale(a: float[], n: int):\n  for i : range(0, n):\n    a[i] = a[i] + a[i]\n";
		GeneratedProgram program = GeneratedProgram.build("Scale", source, workDir);
		assertTrue(program.source().contains("FloatVector"));

		for (int n = 0; n <= 40; n++)
		{
			float[] values = new float[n];
			for (int i = 0; i < n; i++)
			{
				values[i] = i + 0.5f;
			}

			program.invoke("scale", new Class<?>[]{float[].class, int.class}, values, n);

			for (int i = 0; i < n; i++)
			{
				assertEquals(2 * (i + 0.5f), values[i], "n=" + n + " index " + i);
			}
		}
	}

	@Test
	void vectorizedIntLoopWithScalarOperand() throws Exception
	{
		assumeTrue(GeneratedProgram.vectorModuleLoaded(), "jdk.incubator.vector not in the boot layer");

		String source = "def bump(a: int[], n: int):\n  for i : range(0, n):\n    a[i] = a[i] + 1\n";
		GeneratedProgram program = GeneratedProgram.build("Bump", source, workDir);

		int[] values = new int[37];
		Arrays.fill(values, 5);
		program.invoke("bump", new Class<?>[]{int[].class, int.class}, values, values.length);

		int[] expected = new int[37];
		Arrays.fill(expected, 6);
		assertArrayEquals(expected, values);
	}

	@Test
	void vectorizedLoopHonoursStartIndex() throws Exception
	{
		assumeTrue(GeneratedProgram.vectorModuleLoaded(), "jdk.incubator.vector not in the boot layer");

		String source = "def scale(a: float[], n: int):\n  for i : range(3, n):\n    a[i] = a[i] * 2.0\n";
		GeneratedProgram program = GeneratedProgram.build("Offset", source, workDir);

		for (int n = 3; n <= 29; n++)
		{
			float[] values = new float[n];
			Arrays.fill(values, 1.0f);

			program.invoke("scale", new Class<?>[]{float[].class, int.class}, values, n);

			for (int i = 0; i < n; i++)
			{
				assertEquals(i < 3 ? 1.0f : 2.0f, values[i], "n=" + n + " index " + i);
			}
		}
	}

	@Test
	void loopVariableAsValueMatchesScalarResult() throws Exception
	{
		String source = "def fill(a: int[], n: int):\n  for i : range(0, n):\n    a[i] = a[i] + i\n";
		GeneratedProgram program = GeneratedProgram.build("Fill", source, workDir);

		int[] values = new int[40];
		program.invoke("fill", new Class<?>[]{int[].class, int.class}, values, values.length);

		for (int i = 0; i < values.length; i++)
		{
			assertEquals(i, values[i], "index " + i);
		}
	}

	@Test
	void remainderLoopCompilesAndRuns() throws Exception
	{
		String source = "def parity(a: int[], n: int):\n  for i : range(0, n):\n    a[i] = a[i] % 2\n";
		GeneratedProgram program = GeneratedProgram.build("Parity", source, workDir);

		int[] values = new int[21];
		for (int i = 0; i < values.length; i++)
		{
			values[i] = i + 10;
		}
		program.invoke("parity", new Class<?>[]{int[].class, int.class}, values, values.length);

		for (int i = 0; i < values.length; i++)
		{
			assertEquals(i % 2, values[i], "index " + i);
		}
	}
}
