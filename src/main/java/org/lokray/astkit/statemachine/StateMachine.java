package org.lokray.astkit.statemachine;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

/**
 * Root of a state machine description.
 */
public class StateMachine extends Node
{
	private static final List<Slot> SLOTS = List.of(
			Slot.nodes("events", Event.class),
			Slot.references("resetEvents", Event.class),
			Slot.nodes("commands", Command.class),
			Slot.nodes("states", State.class));

	public StateMachine()
	{
		super(true);
	}

	public StateMachine(List<Event> events, List<Event> resetEvents, List<Command> commands, List<State> states)
	{
		this();
		set("events", events);
		set("resetEvents", resetEvents);
		set("commands", commands);
		set("states", states);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new StateMachine();
	}

	public List<Event> getEvents()
	{
		return getList("events");
	}

	public List<Event> getResetEvents()
	{
		return getList("resetEvents");
	}

	public List<Command> getCommands()
	{
		return getList("commands");
	}

	public List<State> getStates()
	{
		return getList("states");
	}
}
