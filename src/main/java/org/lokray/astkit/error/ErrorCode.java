package org.lokray.astkit.error;

/**
 * Code identifying an error. Each checker declares its codes as an enum implementing this interface.
 */
public interface ErrorCode
{
	/**
	 * Code as shown in messages, e.g. {@code 10} or {@code err1}.
	 */
	String code();
}
