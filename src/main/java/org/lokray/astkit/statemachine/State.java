package org.lokray.astkit.statemachine;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;
import org.lokray.astkit.check.ScopeNode;

import java.util.List;

/**
 * A state with its entry actions and outgoing transitions. Each state is a scope for the events it
 * reacts to.
 */
public class State extends Node implements ScopeNode
{
	private static final List<Slot> SLOTS = List.of(
			Slot.value("name", String.class),
			Slot.nodes("actions", Action.class),
			Slot.nodes("transitions", Transition.class));

	public State()
	{
	}

	public State(String name, List<Action> actions, List<Transition> transitions)
	{
		set("name", name);
		set("actions", actions);
		set("transitions", transitions);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new State();
	}

	public String getName()
	{
		return getString("name");
	}

	public List<Action> getActions()
	{
		return getList("actions");
	}

	public List<Transition> getTransitions()
	{
		return getList("transitions");
	}
}
