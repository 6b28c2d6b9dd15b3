package org.lokray.astkit.statemachine;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

/**
 * Use of a command as an entry action of a state.
 */
public class Action extends Node
{
	private static final List<Slot> SLOTS = List.of(Slot.reference("command", Command.class));

	public Action()
	{
	}

	public Action(Command command)
	{
		set("command", command);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Action();
	}

	public Command getCommand()
	{
		return (Command) get("command");
	}
}
