package org.lokray.astkit.fixture;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

public class Num extends Node
{
	private static final List<Slot> SLOTS = List.of(Slot.value("value", Integer.class));

	public Num()
	{
	}

	public Num(int value)
	{
		set("value", value);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Num();
	}

	public int getValue()
	{
		return (Integer) get("value");
	}
}
