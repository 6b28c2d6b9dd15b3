package org.lokray.astkit.fixture;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.ast.Slot;
import org.lokray.astkit.check.ScopeNode;

import java.util.List;

public class Block extends Node implements ScopeNode
{
	private static final List<Slot> SLOTS = List.of(Slot.nodes("body", Node.class));

	public Block(Node... body)
	{
		set("body", List.of(body));
	}

	@Override
	public List<Slot> getSlots()
	{
		return SLOTS;
	}

	@Override
	protected Node newInstance()
	{
		return new Block();
	}

	public List<Node> getBody()
	{
		return getList("body");
	}
}
