package org.lokray.astkit.statemachine;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.astkit.ast.Node;
import org.lokray.astkit.statemachine.parser.StateMachineBaseVisitor;
import org.lokray.astkit.statemachine.parser.StateMachineParser;
import org.lokray.astkit.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the node tree of a state machine from its parse tree and resolves the names used by reset
 * events, actions and transitions.
 */
public class StateMachineTreeBuilder extends StateMachineBaseVisitor<Node>
{
	private final Map<String, Event> declaredEvents = new LinkedHashMap<>();
	private final Map<String, Command> declaredCommands = new LinkedHashMap<>();
	private final Map<String, State> declaredStates = new LinkedHashMap<>();
	private final List<String> errors = new ArrayList<>();

	public List<String> getErrors()
	{
		return errors;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	@Override
	public Node visitStateMachine(StateMachineParser.StateMachineContext ctx)
	{
		List<Event> events = new ArrayList<>();
		for (StateMachineParser.EventDeclContext eventCtx : ctx.eventsBlock().eventDecl())
		{
			Event event = (Event) visit(eventCtx);
			declaredEvents.putIfAbsent(event.getName(), event);
			events.add(event);
		}

		List<Command> commands = new ArrayList<>();
		if (ctx.commandsBlock() != null)
		{
			for (StateMachineParser.CommandDeclContext commandCtx : ctx.commandsBlock().commandDecl())
			{
				Command command = (Command) visit(commandCtx);
				declaredCommands.putIfAbsent(command.getName(), command);
				commands.add(command);
			}
		}

		List<Event> resetEvents = new ArrayList<>();
		if (ctx.resetEventsBlock() != null)
		{
			for (TerminalNode id : ctx.resetEventsBlock().ID())
			{
				Event event = resolve(declaredEvents, id.getSymbol(), "event");
				if (event != null)
				{
					resetEvents.add(event);
				}
			}
		}

		// Declare every state first, transitions may point forward
		List<State> states = new ArrayList<>();
		for (StateMachineParser.StateDeclContext stateCtx : ctx.stateDecl())
		{
			State state = new State();
			state.set("name", stateCtx.name.getText());
			setPosition(state, stateCtx);
			declaredStates.putIfAbsent(state.getName(), state);
			states.add(state);
		}
		for (int i = 0; i < states.size(); i++)
		{
			fillState(states.get(i), ctx.stateDecl(i));
		}

		StateMachine machine = new StateMachine(events, resetEvents, commands, states);
		setPosition(machine, ctx);
		Debug.logDebug("Built state machine with " + events.size() + " event(s), " + commands.size()
				+ " command(s) and " + states.size() + " state(s)");
		return machine;
	}

	@Override
	public Node visitEventDecl(StateMachineParser.EventDeclContext ctx)
	{
		Event event = new Event(ctx.name.getText(), ctx.code.getText());
		setPosition(event, ctx);
		return event;
	}

	@Override
	public Node visitCommandDecl(StateMachineParser.CommandDeclContext ctx)
	{
		Command command = new Command(ctx.name.getText(), ctx.code.getText());
		setPosition(command, ctx);
		return command;
	}

	private void fillState(State state, StateMachineParser.StateDeclContext ctx)
	{
		List<Action> actions = new ArrayList<>();
		if (ctx.actionsBlock() != null)
		{
			for (TerminalNode id : ctx.actionsBlock().ID())
			{
				Command command = resolve(declaredCommands, id.getSymbol(), "command");
				if (command != null)
				{
					Action action = new Action(command);
					action.setPosition(id.getSymbol().getStartIndex(), id.getSymbol().getStopIndex() + 1);
					actions.add(action);
				}
			}
		}

		List<Transition> transitions = new ArrayList<>();
		for (StateMachineParser.TransitionDeclContext transitionCtx : ctx.transitionDecl())
		{
			Event event = resolve(declaredEvents, transitionCtx.event, "event");
			State target = resolve(declaredStates, transitionCtx.target, "state");
			if (event != null && target != null)
			{
				Transition transition = new Transition(event, target);
				setPosition(transition, transitionCtx);
				transitions.add(transition);
			}
		}

		state.set("actions", actions);
		state.set("transitions", transitions);
	}

	private <T extends Node> T resolve(Map<String, T> declared, Token name, String what)
	{
		T found = declared.get(name.getText());
		if (found == null)
		{
			String err = String.format("line %d:%d - unknown %s '%s'", name.getLine(), name.getCharPositionInLine() + 1, what,
					name.getText());
			Debug.logError("[Reference Error] " + err);
			errors.add(err);
		}
		return found;
	}

	private static void setPosition(Node node, ParserRuleContext ctx)
	{
		int end = ctx.stop != null ? ctx.stop.getStopIndex() + 1 : ctx.start.getStartIndex();
		node.setPosition(ctx.start.getStartIndex(), end);
	}
}
