package org.lokray.astkit.visit;

/**
 * Wraps handlers with common walk-control behavior.
 */
public final class VisitControl
{
	private VisitControl()
	{
	}

	/**
	 * Sets a flag on the visitor before running the handler.
	 */
	public static PostVisitHandler setFlag(String flag, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			visitor.setFlag(flag);
			return handler.visit(visitor, node);
		};
	}

	public static PostVisitHandler setFlagAfter(String flag, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			VisitResult ret = handler.visit(visitor, node);
			visitor.setFlag(flag);
			return ret;
		};
	}

	public static PostVisitHandler clearFlag(String flag, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			visitor.clearFlag(flag);
			return handler.visit(visitor, node);
		};
	}

	public static PostVisitHandler clearFlagAfter(String flag, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			VisitResult ret = handler.visit(visitor, node);
			visitor.clearFlag(flag);
			return ret;
		};
	}

	/**
	 * Runs the handler only while the flag is set (or cleared, if {@code inverted}); otherwise keeps the
	 * node.
	 */
	public static PostVisitHandler conditional(String flag, boolean inverted, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			if (visitor.getFlagState(flag) != inverted)
			{
				return handler.visit(visitor, node);
			}
			return VisitResult.keep();
		};
	}

	public static PreVisitHandler conditionalPre(String flag, boolean inverted, PreVisitHandler handler)
	{
		return (visitor, node) ->
		{
			if (visitor.getFlagState(flag) != inverted)
			{
				handler.preVisit(visitor, node);
			}
		};
	}

	/**
	 * Traces entry and exit of the handler through the visitor's debug output.
	 */
	public static PostVisitHandler trace(String name, PostVisitHandler handler)
	{
		return (visitor, node) ->
		{
			visitor.debugVisit("entering " + name + ", node is: " + node.describe());
			VisitResult ret = handler.visit(visitor, node);
			visitor.debugVisit("exiting " + name + ", returned: " + ret);
			return ret;
		};
	}

	/**
	 * Sets {@link VisitFlags#STOP_VISIT} once the handler is done. The walk goes on; handlers wrapped with
	 * {@link #conditional} on that flag (inverted) become no-ops.
	 */
	public static PostVisitHandler stopVisiting(PostVisitHandler handler)
	{
		return setFlagAfter(VisitFlags.STOP_VISIT, handler);
	}

	public static PreVisitHandler noChildVisits(PreVisitHandler handler)
	{
		return (visitor, node) ->
		{
			handler.preVisit(visitor, node);
			visitor.dontVisitChildren();
		};
	}

	public static PreVisitHandler reverseVisitOrder(PreVisitHandler handler)
	{
		return (visitor, node) ->
		{
			handler.preVisit(visitor, node);
			visitor.reverseVisitOrder();
		};
	}
}
