package org.lokray.astkit.visit;

/**
 * Wraps an exception thrown by a handler or hook during a visit.
 */
public class VisitException extends RuntimeException
{
	public VisitException(Throwable cause)
	{
		super(cause == null ? "error while visiting" : "error while visiting: " + cause.getMessage(), cause);
	}

	public VisitException(String message)
	{
		super(message);
	}

	/**
	 * The innermost cause that is not itself a {@link VisitException}. Visits started from inside a
	 * handler nest these wrappers.
	 */
	public Throwable findEmbeddedException()
	{
		Throwable cause = getCause();
		if (cause instanceof VisitException nested)
		{
			return nested.findEmbeddedException();
		}
		if (cause == null)
		{
			return new IllegalStateException("unknown error in visit");
		}
		return cause;
	}
}
