package org.lokray.astkit.util;

import org.lokray.astkit.error.CodedException;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics reported during a run.
 */
public class ErrorHandler
{
	private final List<String> errors = new ArrayList<>();

	public void logError(String source, String msg)
	{
		String err = String.format("[Check Error] %s - %s", source, msg);
		Debug.logError(err);
		errors.add(err);
	}

	public void logError(String source, CodedException ex)
	{
		logError(source, ex.toString());
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return errors;
	}
}
