package org.lokray.astkit.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Node whose kind and slots are given at construction instead of by a dedicated class. Useful for trees
 * assembled on the fly and for kinds that carry no behavior of their own.
 */
public class GenericNode extends Node
{
	private final String kind;
	private final List<Slot> slots;

	public GenericNode(String kind, List<Slot> slots)
	{
		this(kind, slots, false);
	}

	public GenericNode(String kind, List<Slot> slots, boolean root)
	{
		super(root);
		this.kind = kind;
		this.slots = List.copyOf(slots);
	}

	/**
	 * Creates a node with one untyped visitable slot per map entry, in the map's iteration order.
	 */
	public static GenericNode of(String kind, Map<String, ?> members)
	{
		List<Slot> slots = new ArrayList<>();
		for (String name : members.keySet())
		{
			Object value = members.get(name);
			slots.add(value instanceof List<?> ? new Slot(name, true, null, true) : Slot.untyped(name));
		}
		GenericNode ret = new GenericNode(kind, slots);
		members.forEach(ret::set);
		return ret;
	}

	@Override
	public String getKind()
	{
		return kind;
	}

	@Override
	public List<Slot> getSlots()
	{
		return slots;
	}

	@Override
	protected Node newInstance()
	{
		return new GenericNode(kind, slots, isRoot());
	}
}
