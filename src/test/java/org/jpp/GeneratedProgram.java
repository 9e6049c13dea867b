package org.jpp;

import org.jpp.codegen.JavaGenerator;
import org.jpp.lexer.Lexer;
import org.jpp.parser.Parser;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Translates a Java++ program, compiles the result with the in-process javac and loads it.
 */
final class GeneratedProgram
{
	static final String VECTOR_MODULE = "jdk.incubator.vector";

	private final Class<?> type;
	private final String source;

	private GeneratedProgram(Class<?> type, String source)
	{
		this.type = type;
		this.source = source;
	}

	static boolean compilerAvailable()
	{
		return ToolProvider.getSystemJavaCompiler() != null;
	}

	static boolean vectorModuleLoaded()
	{
		return ModuleLayer.boot().findModule(VECTOR_MODULE).isPresent();
	}

	static GeneratedProgram build(String className, String jppSource, Path workDir) throws IOException, ClassNotFoundException
	{
		JavaGenerator generator = new JavaGenerator(className);
		String javaSource = generator.generate(new Parser(Lexer.tokenize(jppSource)).parseProgram());

		Path javaFile = workDir.resolve(className + ".java");
		Files.writeString(javaFile, javaSource);

		List<String> options = new ArrayList<>();
		if (generator.isVectorized())
		{
			options.add("--add-modules");
			options.add(VECTOR_MODULE);
		}
		options.add("-d");
		options.add(workDir.toString());
		options.add(javaFile.toString());

		JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
		ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();
		int status = javac.run(null, diagnostics, diagnostics, options.toArray(new String[0]));
		assertEquals(0, status, () -> "javac rejected:\n" + javaSource + "\n" + diagnostics.toString(StandardCharsets.UTF_8));

		URLClassLoader loader = new URLClassLoader(new URL[]{workDir.toUri().toURL()}, GeneratedProgram.class.getClassLoader());
		return new GeneratedProgram(loader.loadClass(className), javaSource);
	}

	String source()
	{
		return source;
	}

	/**
	 * Runs {@code main} and returns what it printed.
	 */
	String runMain() throws ReflectiveOperationException
	{
		PrintStream original = System.out;
		ByteArrayOutputStream captured = new ByteArrayOutputStream();
		System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
		try
		{
			type.getMethod("main", String[].class).invoke(null, (Object) new String[0]);
		}
		finally
		{
			System.setOut(original);
		}
		return captured.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	Object invoke(String name, Class<?>[] parameterTypes, Object... args) throws ReflectiveOperationException
	{
		Method method = type.getDeclaredMethod(name, parameterTypes);
		method.setAccessible(true);
		return method.invoke(null, args);
	}
}
