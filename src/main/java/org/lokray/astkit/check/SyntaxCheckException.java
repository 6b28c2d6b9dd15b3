package org.lokray.astkit.check;

import org.lokray.astkit.error.CodedException;
import org.lokray.astkit.error.ErrorCode;

/**
 * Error found by a {@link SyntaxChecker}. The message starts with the source location when it is known.
 */
public class SyntaxCheckException extends CodedException
{
	public SyntaxCheckException(String message, ErrorCode code, Throwable cause)
	{
		super(message, code, cause);
	}

	public SyntaxCheckException(String message, ErrorCode code)
	{
		super(message, code);
	}
}
