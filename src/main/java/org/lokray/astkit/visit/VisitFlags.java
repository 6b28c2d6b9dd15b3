package org.lokray.astkit.visit;

/**
 * Names of the flags the visitor itself reacts to. Any other name can be used as a caller-defined flag.
 */
public final class VisitFlags
{
	/** Only descend into slots whose name matches an allowed pattern. Implies {@link #MINIMAL_DEPTH}. */
	public static final String EXCLUSIVE_VISIT = "exclusive_visit";
	/** Do not descend below nodes whose kind has its own post-visit handler. */
	public static final String MINIMAL_DEPTH = "minimal_depth";
	/** Do not call the post-visit handler twice for the same node. */
	public static final String IGNORE_VISITED = "ignore_visited";
	/** Walk the children of the next node in reverse order. Cleared once used. */
	public static final String REVERSE_VISIT = "reverse_visit";
	/** Skip the children of the current node. Cleared once used. */
	public static final String NO_CHILDREN_VISITS = "no_children_visits";
	/** Trace the walk through the logger. */
	public static final String DEBUG_VISIT = "debug_visit";
	/** Set by {@link VisitControl#stopVisiting}; only handlers check it. */
	public static final String STOP_VISIT = "stop_visit";

	public static final String OPTION_HISTORY_LEN = "history_len";
	public static final String OPTION_LOGGER = "logger";

	private VisitFlags()
	{
	}
}
