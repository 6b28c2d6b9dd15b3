package org.lokray.astkit.error;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps error codes to their descriptors.
 */
public class ErrorRegistry
{
	private final Map<ErrorCode, ErrorDescriptor> descriptors = new LinkedHashMap<>();

	public void register(ErrorDescriptor descriptor)
	{
		descriptors.put(descriptor.getCode(), descriptor);
	}

	public void registerAll(Collection<ErrorDescriptor> descriptors)
	{
		descriptors.forEach(this::register);
	}

	public boolean contains(ErrorCode code)
	{
		return descriptors.containsKey(code);
	}

	public ErrorDescriptor get(ErrorCode code)
	{
		ErrorDescriptor descriptor = descriptors.get(code);
		if (descriptor == null)
		{
			throw new IllegalArgumentException("unknown error code: " + (code == null ? null : code.code()));
		}
		return descriptor;
	}

	public String getErrorFromCode(ErrorCode code, Map<String, ?> values)
	{
		return getErrorFromCode(code, values, "", "");
	}

	/**
	 * Renders the message of an error. The descriptor's debug callback, if any, sees the raw values first.
	 */
	public String getErrorFromCode(ErrorCode code, Map<String, ?> values, String prefix, String suffix)
	{
		ErrorDescriptor err = get(code);
		if (err.getDebugCallback() != null)
		{
			err.getDebugCallback().accept(err, values);
		}
		return (prefix == null ? "" : prefix) + err.getMessage(values) + (suffix == null ? "" : suffix);
	}
}
