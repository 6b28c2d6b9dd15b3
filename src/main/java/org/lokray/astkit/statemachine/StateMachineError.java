package org.lokray.astkit.statemachine;

import org.lokray.astkit.error.ErrorCode;

public enum StateMachineError implements ErrorCode
{
	EVENT_REDECLARED("err1"),
	EVENT_NO_EFFECT("err2");

	private final String code;

	StateMachineError(String code)
	{
		this.code = code;
	}

	@Override
	public String code()
	{
		return code;
	}
}
