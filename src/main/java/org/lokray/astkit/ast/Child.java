package org.lokray.astkit.ast;

import java.util.List;

/**
 * A slot of a node together with its current value.
 */
public final class Child
{
	private final Slot slot;
	private final Object value;

	public Child(Slot slot, Object value)
	{
		this.slot = slot;
		this.value = value;
	}

	public Slot getSlot()
	{
		return slot;
	}

	public Object getValue()
	{
		return value;
	}

	public String getName()
	{
		return slot.getName();
	}

	public boolean isVisitable()
	{
		return slot.isVisitable();
	}

	public boolean isNode()
	{
		return value instanceof Node;
	}

	public boolean isSequence()
	{
		return value instanceof List<?>;
	}
}
