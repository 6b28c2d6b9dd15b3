package org.lokray.astkit.ast;

/**
 * Thrown when a typed slot is assigned a value of the wrong type.
 */
public class TypeMismatchException extends RuntimeException
{
	private final String kind;
	private final String slotName;

	public TypeMismatchException(String kind, Slot slot, Object value)
	{
		super(String.format("slot '%s' of %s expects %s%s, got %s",
				slot.getName(), kind, slot.isSequence() ? "a list of " : "", slot.getType().getSimpleName(),
				value.getClass().getSimpleName()));
		this.kind = kind;
		this.slotName = slot.getName();
	}

	public String getKind()
	{
		return kind;
	}

	public String getSlotName()
	{
		return slotName;
	}
}
