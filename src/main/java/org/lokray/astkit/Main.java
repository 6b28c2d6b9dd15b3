package org.lokray.astkit;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.error.CodedException;
import org.lokray.astkit.statemachine.StateMachine;
import org.lokray.astkit.statemachine.StateMachineChecker;
import org.lokray.astkit.statemachine.StateMachineLoader;
import org.lokray.astkit.statemachine.StateMachineVisitor;
import org.lokray.astkit.util.CheckerArguments;
import org.lokray.astkit.util.Debug;
import org.lokray.astkit.util.ErrorHandler;
import org.lokray.astkit.util.FileLoader;
import org.lokray.astkit.util.SymbolReportConverter;
import org.lokray.astkit.visit.VisitException;
import org.lokray.astkit.visit.VisitFlags;
import org.lokray.astkit.visit.Visitor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point: loads a state machine file, checks it and prints what it describes.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit code, 0 when the file was read and passed the check
	 */
	public static int run(String[] args)
	{
		CheckerArguments arguments = CheckerArguments.parse(args);

		if (arguments.isHelpFlag())
		{
			CheckerArguments.printUsage();
			return arguments.isInvalid() ? 2 : 0;
		}
		if (arguments.isVersionFlag())
		{
			Debug.log("astkit version " + VERSION);
			return 0;
		}
		if (arguments.getInputFile() == null)
		{
			Debug.logError("No input file provided. Use -h for help.");
			return 2;
		}

		Path file = arguments.getInputFile();
		if (!Files.exists(file))
		{
			Debug.logError("The specified file does not exist: " + file);
			return 2;
		}

		ErrorHandler errorHandler = new ErrorHandler();
		try
		{
			FileLoader loader = new FileLoader(file);
			loader.load();
			String source = file.toString();

			Debug.logDebug("Parsing " + source + "...");
			StateMachine machine = StateMachineLoader.parse(loader.getText(), source);

			if (arguments.isVisitOnly())
			{
				StateMachineVisitor visitor = new StateMachineVisitor(visitOptions(arguments));
				if (!visitReported(visitor, machine, source, errorHandler))
				{
					return 1;
				}
				for (String state : visitor.getStates())
				{
					printState(state, visitor.getStateActions(state), visitor.getStateTransitions(state));
				}
				return 0;
			}

			StateMachineChecker checker = new StateMachineChecker(loader.getText(), visitOptions(arguments));
			if (!visitReported(checker, machine, source, errorHandler))
			{
				return 1;
			}

			for (String state : checker.getStates())
			{
				printState(state, checker.getStateActions(state), checker.getStateTransitions(state));
			}
			if (arguments.getReportPath() != null)
			{
				SymbolReportConverter.write(SymbolReportConverter.toReport(source, checker), arguments.getReportPath());
			}
			Debug.logInfo("Check passed: " + source);
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			errorHandler.logError(file.toString(), e.getMessage());
			return 1;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
			return 2;
		}
	}

	/**
	 * Visits {@code root}, reporting a failed handler through {@code errorHandler}.
	 *
	 * @return whether the visit completed
	 */
	static boolean visitReported(Visitor visitor, Node root, String source, ErrorHandler errorHandler)
	{
		try
		{
			visitor.visit(root);
			return true;
		}
		catch (CodedException e)
		{
			errorHandler.logError(source, e);
		}
		catch (VisitException e)
		{
			errorHandler.logError(source, e.getMessage());
		}
		return false;
	}

	private static Map<String, ?> visitOptions(CheckerArguments arguments)
	{
		return arguments.isVerboseFlag() ? Map.of(VisitFlags.DEBUG_VISIT, true) : Map.of();
	}

	private static void printState(String state, List<String> actions, Map<String, String> transitions)
	{
		Debug.log("state " + state);
		if (!actions.isEmpty())
		{
			Debug.log("  actions: " + String.join(", ", actions));
		}
		transitions.forEach((event, target) -> Debug.log("  " + event + " => " + target));
	}
}
