package org.lokray.astkit.ast;

/**
 * Declares one named attribute of a node kind.
 * <p>
 * Visitable slots are part of the tree and are descended into by visitors; non-visitable slots hold
 * opaque data such as cross references and are never traversed or re-parented.
 */
public final class Slot
{
	private final String name;
	private final boolean visitable;
	private final Class<?> type;
	private final boolean sequence;

	/**
	 * @param name      slot name, unique within a kind
	 * @param visitable whether the slot is part of the tree
	 * @param type      accepted value type (element type for sequences), or null for untyped slots
	 * @param sequence  whether the slot holds an ordered list of values
	 */
	public Slot(String name, boolean visitable, Class<?> type, boolean sequence)
	{
		this.name = name;
		this.visitable = visitable;
		this.type = type;
		this.sequence = sequence;
	}

	public static Slot node(String name, Class<? extends Node> type)
	{
		return new Slot(name, true, type, false);
	}

	public static Slot nodes(String name, Class<? extends Node> type)
	{
		return new Slot(name, true, type, true);
	}

	public static Slot value(String name, Class<?> type)
	{
		return new Slot(name, true, type, false);
	}

	public static Slot untyped(String name)
	{
		return new Slot(name, true, null, false);
	}

	public static Slot reference(String name, Class<?> type)
	{
		return new Slot(name, false, type, false);
	}

	public static Slot references(String name, Class<?> type)
	{
		return new Slot(name, false, type, true);
	}

	public String getName()
	{
		return name;
	}

	public boolean isVisitable()
	{
		return visitable;
	}

	public Class<?> getType()
	{
		return type;
	}

	public boolean isSequence()
	{
		return sequence;
	}

	/**
	 * Checks a value against the declared type. Null is always accepted.
	 */
	public boolean accepts(Object value)
	{
		if (value == null || type == null)
		{
			return true;
		}
		if (sequence)
		{
			if (!(value instanceof java.util.List<?> list))
			{
				return false;
			}
			for (Object element : list)
			{
				if (element != null && !type.isInstance(element))
				{
					return false;
				}
			}
			return true;
		}
		return type.isInstance(value);
	}

	@Override
	public String toString()
	{
		return name + (visitable ? "" : " (reference)");
	}
}
