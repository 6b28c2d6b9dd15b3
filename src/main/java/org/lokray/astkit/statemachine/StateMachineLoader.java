package org.lokray.astkit.statemachine;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.astkit.statemachine.parser.StateMachineLexer;
import org.lokray.astkit.statemachine.parser.StateMachineParser;
import org.lokray.astkit.util.SyntaxErrorListener;

/**
 * Parses state machine text into a node tree.
 */
public final class StateMachineLoader
{
	private StateMachineLoader()
	{
	}

	/**
	 * @param sourceName name used in error messages
	 * @throws IllegalArgumentException on syntax errors or unresolved names
	 */
	public static StateMachine parse(String text, String sourceName)
	{
		SyntaxErrorListener errorListener = new SyntaxErrorListener(sourceName);

		CharStream input = CharStreams.fromString(text, sourceName);
		StateMachineLexer lexer = new StateMachineLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		StateMachineParser parser = new StateMachineParser(tokens);

		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);

		StateMachineParser.StateMachineContext tree = parser.stateMachine();
		if (errorListener.getErrorCount() > 0)
		{
			throw new IllegalArgumentException(errorListener.getErrorCount() + " syntax error(s) in " + sourceName);
		}

		StateMachineTreeBuilder builder = new StateMachineTreeBuilder();
		StateMachine machine = (StateMachine) builder.visit(tree);
		if (builder.hasErrors())
		{
			throw new IllegalArgumentException("unresolved names in " + sourceName + ": " + String.join("; ", builder.getErrors()));
		}
		return machine;
	}
}
