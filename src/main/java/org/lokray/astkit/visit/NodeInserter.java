package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts nodes next to a given node inside the sequence slot that holds it.
 */
public class NodeInserter extends Visitor
{
	private final Node tree;
	private Node matchingNode;
	private List<Node> contents = List.of();
	private boolean after = true;
	private boolean inserted;

	public NodeInserter(Node tree)
	{
		this.tree = tree;
		onPostVisit(DEFAULT_KIND, (visitor, node) -> insertAt(node));
	}

	/**
	 * @param what  nodes to insert
	 * @param where node next to which to insert; must be an element of a sequence slot
	 * @param after whether to insert after {@code where} rather than before
	 * @return whether {@code where} was found in the tree
	 */
	public boolean insert(List<? extends Node> what, Node where, boolean after)
	{
		this.matchingNode = where;
		this.contents = List.copyOf(what);
		this.after = after;
		this.inserted = false;
		try
		{
			visit(tree);
		}
		finally
		{
			matchingNode = null;
		}
		return inserted;
	}

	public boolean insert(Node what, Node where, boolean after)
	{
		return insert(List.of(what), where, after);
	}

	private VisitResult insertAt(Node node)
	{
		if (node != matchingNode || inserted)
		{
			return VisitResult.keep();
		}
		if (node.isRoot() || node.getParent() == null || node.getParentKey() == null
				|| !node.getParent().getSlot(node.getParentKey()).isSequence())
		{
			throw new IllegalStateException("can only insert next to an element of a sequence slot");
		}
		inserted = true;
		List<Node> replacement = new ArrayList<>();
		if (!after)
		{
			replacement.addAll(contents);
		}
		replacement.add(node);
		if (after)
		{
			replacement.addAll(contents);
		}
		return VisitResult.replaceMany(replacement);
	}
}
