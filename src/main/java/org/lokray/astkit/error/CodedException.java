package org.lokray.astkit.error;

/**
 * Exception carrying an {@link ErrorCode}.
 */
public class CodedException extends RuntimeException
{
	private final ErrorCode code;

	public CodedException(String message, ErrorCode code, Throwable cause)
	{
		super(message, cause);
		this.code = code;
	}

	public CodedException(String message, ErrorCode code)
	{
		this(message, code, null);
	}

	public ErrorCode getCode()
	{
		return code;
	}

	@Override
	public String toString()
	{
		String errCode = code != null ? "(#" + code.code() + ")" : "";
		return errCode + " " + getMessage();
	}
}
