package org.lokray.astkit.ast;

/**
 * Thrown when the parent of a root node is requested. A root has no parent, which is not the same as an
 * orphaned node whose parent is null.
 */
public class RootNodeException extends IllegalStateException
{
	public RootNodeException(Node node)
	{
		super(node.describe() + " is a root node and has no parent");
	}
}
