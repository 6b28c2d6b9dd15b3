package org.lokray.astkit.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form data attached to a node. Never traversed.
 */
public class NodeMetadata
{
	private boolean copy;
	private int originalStart = -1;
	private int originalEnd = -1;
	private final Map<String, Object> attributes = new LinkedHashMap<>();

	public boolean isCopy()
	{
		return copy;
	}

	public int getOriginalStart()
	{
		return originalStart;
	}

	public int getOriginalEnd()
	{
		return originalEnd;
	}

	public Object get(String key)
	{
		return attributes.get(key);
	}

	public void put(String key, Object value)
	{
		attributes.put(key, value);
	}

	public Map<String, Object> getAttributes()
	{
		return attributes;
	}

	/**
	 * Metadata for a copy of the node that owns this metadata, recording the span of the original.
	 */
	NodeMetadata copyOf(int start, int end)
	{
		NodeMetadata ret = new NodeMetadata();
		ret.attributes.putAll(attributes);
		ret.copy = true;
		// a copy of a copy keeps pointing at the first original
		ret.originalStart = copy ? originalStart : start;
		ret.originalEnd = copy ? originalEnd : end;
		return ret;
	}
}
