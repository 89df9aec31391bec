package com.jeffdisher.folderlinks.types;


/**
 * The opaque identifier of a chat, channel, group, or user ("peer") within an account's universe.
 * We only ever compare these or use them as keys so the numeric value is never interpreted.
 */
public class EntityId
{
	/**
	 * @param value The raw identifier value.
	 * @return The EntityId wrapping this value.
	 */
	public static EntityId fromLong(long value)
	{
		return new EntityId(value);
	}


	private final long _value;

	private EntityId(long value)
	{
		_value = value;
	}

	public long toLong()
	{
		return _value;
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof EntityId)
		{
			isEqual = (_value == ((EntityId)obj)._value);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return Long.hashCode(_value);
	}

	@Override
	public String toString()
	{
		return "EntityId(" + _value + ")";
	}
}
