package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Deletes every node of the given kinds, optionally only those accepted by a predicate.
 */
public class NodeRemover extends Visitor
{
	private final Predicate<Node> decide;

	public NodeRemover(String... kinds)
	{
		this(node -> true, Map.of(), kinds);
	}

	public NodeRemover(Predicate<Node> decide, Map<String, ?> options, String... kinds)
	{
		super(options);
		this.decide = decide;
		for (String kind : kinds)
		{
			onPostVisit(kind, (visitor, node) -> deleteNode(node));
		}
	}

	private VisitResult deleteNode(Node node)
	{
		if (!decide.test(node))
		{
			return VisitResult.keep();
		}
		debugVisit("removing node " + node.describe());
		return VisitResult.delete();
	}
}
