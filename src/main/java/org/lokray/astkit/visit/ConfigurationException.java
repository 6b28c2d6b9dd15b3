package org.lokray.astkit.visit;

/**
 * Thrown when the traversal configuration of a visitor is changed while it is visiting.
 */
public class ConfigurationException extends RuntimeException
{
	public ConfigurationException(String message)
	{
		super(message);
	}
}
