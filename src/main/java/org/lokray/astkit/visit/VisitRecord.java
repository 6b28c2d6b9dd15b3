package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

/**
 * One entry of the visit history.
 */
public class VisitRecord
{
	private final VisitResult result;
	private final Node replaces;
	private final int depth;

	public VisitRecord(VisitResult result, Node replaces, int depth)
	{
		this.result = result;
		this.replaces = replaces;
		this.depth = depth;
	}

	/**
	 * What the post-visit produced.
	 */
	public VisitResult getResult()
	{
		return result;
	}

	/**
	 * The visited node when the result changed the tree, otherwise null.
	 */
	public Node getReplaces()
	{
		return replaces;
	}

	/**
	 * Depth of the visited node, the root being 1.
	 */
	public int getDepth()
	{
		return depth;
	}
}
