package org.lokray.astkit.fixture;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;

import java.util.List;

public class Add extends Node
{
	private static final List<Slot> SLOTS = List.of(
			Slot.node("left", Node.class),
			Slot.node("right", Node.class));

	public Add()
	{
	}

	public Add(Node left, Node right)
	{
		set("left", left);
		set("right", right);
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Add();
	}

	public Node getLeft()
	{
		return getNode("left");
	}

	public Node getRight()
	{
		return getNode("right");
	}
}
