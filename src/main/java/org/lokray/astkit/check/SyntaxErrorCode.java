package org.lokray.astkit.check;

import org.lokray.astkit.error.ErrorCode;

public enum SyntaxErrorCode implements ErrorCode
{
	GLOBAL_NAME_REDEFINED("10"),
	LOCAL_NAME_REDEFINED("11"),
	INVALID_IDENTIFIER("12");

	private final String code;

	SyntaxErrorCode(String code)
	{
		this.code = code;
	}

	@Override
	public String code()
	{
		return code;
	}
}
