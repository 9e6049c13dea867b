package org.jpp;

import org.jpp.ast.Program;
import org.jpp.codegen.CodeGenerator;
import org.jpp.codegen.JavaGenerator;
import org.jpp.lexer.Lexer;
import org.jpp.lexer.Token;
import org.jpp.parser.Parser;
import org.jpp.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.jpp.util.ProcessUtils.executeCommand;

/**
 * Command-line driver: source file in, {@code <Name>.java} out, optionally compiled and run.
 */
public class Main
{
	public static final String VERSION = "jppc (Java++ Compiler) version 4.2.0";
	private static final String VECTOR_MODULE = "jdk.incubator.vector";
	private static final String SOURCE_EXTENSION = ".jpp";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * @return the process exit status.
	 */
	public static int run(String[] args)
	{
		CompilerArguments arguments = CompilerArguments.parse(args);

		if (arguments.hasError())
		{
			Debug.logError(arguments.getError());
			CompilerArguments.printUsage();
			return 1;
		}
		if (arguments.isHelpFlag())
		{
			CompilerArguments.printUsage();
			return 0;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println(VERSION);
			return 0;
		}

		ErrorHandler errorHandler = new ErrorHandler();
		try
		{
			return compile(arguments, errorHandler);
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 1;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			Debug.logError("Interrupted while waiting for the Java toolchain.");
			return 1;
		}
	}

	private static int compile(CompilerArguments args, ErrorHandler errorHandler) throws IOException, InterruptedException
	{
		Path source = args.getInputFile();
		if (!Files.exists(source))
		{
			errorHandler.report("File not found: " + source);
			return 1;
		}

		if (!SOURCE_EXTENSION.equals(FileUtils.getFileExtension(source)))
		{
			Debug.logWarning("Source file " + source + " does not have the " + SOURCE_EXTENSION + " extension.");
		}

		String code = Files.readString(source);
		String className = FileUtils.toUnitName(source);
		Path outputDir = args.getOutputDirectory() != null ? args.getOutputDirectory() : source.toAbsolutePath().getParent();
		Path javaPath = outputDir.resolve(className + ".java");

		JavaGenerator generator;
		try
		{
			Debug.logDebug("Tokenizing " + source + "...");
			List<Token> tokens = Lexer.tokenize(code);

			Debug.logDebug("Parsing...");
			Program program = new Parser(tokens).parseProgram();

			if (args.isEmitAst())
			{
				writeAst(program, outputDir.resolve(className + ".ast.json"));
			}

			Debug.logDebug("Generating Java...");
			generator = new CodeGenerator(program, className, javaPath).generate();
		}
		catch (CompilationException e)
		{
			errorHandler.report(e);
			return 1;
		}

		Debug.logInfo("Wrote " + javaPath);

		if (args.isRunFlag())
		{
			return compileAndRun(javaPath, className, generator.isVectorized(), errorHandler);
		}
		return 0;
	}

	private static void writeAst(Program program, Path outPath) throws IOException
	{
		Files.createDirectories(outPath.toAbsolutePath().getParent());
		Files.writeString(outPath, AstDTOConverter.toJson(program));
		Debug.logInfo("Wrote AST to " + outPath);
	}

	private static int compileAndRun(Path javaPath, String className, boolean vectorized, ErrorHandler errorHandler) throws InterruptedException
	{
		List<String> modules = vectorized ? List.of("--add-modules", VECTOR_MODULE) : List.of();

		List<String> javac = new ArrayList<>();
		javac.add("javac");
		javac.addAll(modules);
		javac.add(javaPath.toString());

		List<String> java = new ArrayList<>();
		java.add("java");
		java.addAll(modules);
		java.add("-cp");
		java.add(javaPath.toAbsolutePath().getParent().toString());
		java.add(className);

		try
		{
			Debug.logInfo("Running javac...");
			executeCommand(new ProcessBuilder(javac));

			Debug.logInfo("Running " + className + "...");
			executeCommand(new ProcessBuilder(java));
		}
		catch (ToolchainException e)
		{
			errorHandler.report("Java compilation or execution failed: " + e.getMessage());
			return 1;
		}
		catch (IOException e)
		{
			errorHandler.report("javac/java not found. Install a JDK and add it to PATH. (" + e.getMessage() + ")");
			return 1;
		}
		return 0;
	}
}
