package org.jpp.codegen;

import org.jpp.ast.Program;
import org.jpp.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Generates the Java unit for a program and writes it to disk.
 */
public class CodeGenerator
{
	private final Program program;
	private final String className;
	private final Path outputPath;

	public CodeGenerator(Program program, String className, Path outputPath)
	{
		this.program = program;
		this.className = className;
		this.outputPath = outputPath;
	}

	/**
	 * @return the generator, for callers that need to know whether vector intrinsics were used.
	 */
	public JavaGenerator generate() throws IOException
	{
		JavaGenerator generator = new JavaGenerator(className);
		String source = generator.generate(program);

		if (outputPath.getParent() != null)
		{
			Files.createDirectories(outputPath.getParent());
		}
		Files.writeString(outputPath, source);
		Debug.logDebug("Java source written to " + outputPath);

		return generator;
	}
}
