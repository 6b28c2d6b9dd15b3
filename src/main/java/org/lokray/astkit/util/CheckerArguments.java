package org.lokray.astkit.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the state machine checker.
 */
public class CheckerArguments
{
	private Path inputFile = null;
	private Path reportPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean visitOnly = false; // collect without checking
	private boolean invalid = false;

	// Private constructor, use parse()
	private CheckerArguments()
	{
	}

	public static CheckerArguments parse(String[] args)
	{
		CheckerArguments parsedArgs = new CheckerArguments();

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

				// --- Flags with no argument ---
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
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("--visit"))
				{
					parsedArgs.visitOnly = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-r") || arg.equals("--report"))
				{
					parsedArgs.reportPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}
				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one input file is accepted, got " + parsedArgs.inputFile + " and " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.invalid = true;
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
		Debug.log("OVERVIEW: Checks state machine descriptions.");
		Debug.log("\nUSAGE: astkit [options] file");
		Debug.log("\nOPTIONS:");
		Debug.log("  -h, --help                Show this help message and exit.");
		Debug.log("  --version                 Show version and exit.");
		Debug.log("  -v, --verbose             Enable verbose debug logging.");
		Debug.log("  --visit                   Only collect states, do not check them.");
		Debug.log("  -r, --report <file>       Write the collected symbols as JSON.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getReportPath()
	{
		return reportPath;
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

	public boolean isVisitOnly()
	{
		return visitOnly;
	}

	/**
	 * Whether the command line could not be parsed; help is shown in that case.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}
}
