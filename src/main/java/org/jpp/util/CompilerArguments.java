package org.jpp.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the jppc driver.
 */
public class CompilerArguments
{
	private Path inputFile = null;
	private Path outputDirectory = null; // Default: null (next to the source file)
	private boolean runFlag = false;
	private boolean emitAst = false;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private String error = null;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("-r") || arg.equals("--run"))
				{
					parsedArgs.runFlag = true;
					continue;
				}
				if (arg.equals("--emit-ast"))
				{
					parsedArgs.emitAst = true;
					continue;
				}
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputDirectory = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one source file is accepted, got " + parsedArgs.inputFile + " and " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}

			if (parsedArgs.inputFile == null)
			{
				throw new IllegalArgumentException("No input file provided.");
			}
		}
		catch (IllegalArgumentException e)
		{
			parsedArgs.error = e.getMessage();
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Translates Java++ (.jpp) programs into Java source.");
		System.out.println("\nUSAGE: jppc [options] <file.jpp>");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show compiler version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <dir>        Write generated files to <dir> instead of next to the source.");
		System.out.println("  -r, --run                 Compile the generated file with javac and run it.");
		System.out.println("  --emit-ast                Also write the parsed AST as <Name>.ast.json.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputDirectory()
	{
		return outputDirectory;
	}

	public boolean isRunFlag()
	{
		return runFlag;
	}

	public boolean isEmitAst()
	{
		return emitAst;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	/**
	 * The reason parsing failed, or null.
	 */
	public String getError()
	{
		return error;
	}

	public boolean hasError()
	{
		return error != null;
	}
}
