package org.lokray.astkit.statemachine;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

/**
 * {@code event => target}. Both ends are references, not children.
 */
public class Transition extends Node
{
	private static final List<Slot> SLOTS = List.of(
			Slot.reference("event", Event.class),
			Slot.reference("toState", State.class));

	public Transition()
	{
	}

	public Transition(Event event, State toState)
	{
		set("event", event);
		set("toState", toState);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Transition();
	}

	public Event getEvent()
	{
		return (Event) get("event");
	}

	public State getToState()
	{
		return (State) get("toState");
	}
}
