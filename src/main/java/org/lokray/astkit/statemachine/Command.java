package org.lokray.astkit.statemachine;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

public class Command extends Node
{
	private static final List<Slot> SLOTS = List.of(
			Slot.value("name", String.class),
			Slot.value("code", String.class));

	public Command()
	{
	}

	public Command(String name, String code)
	{
		set("name", name);
		set("code", code);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Command();
	}

	public String getName()
	{
		return getString("name");
	}

	public String getCode()
	{
		return getString("code");
	}
}
