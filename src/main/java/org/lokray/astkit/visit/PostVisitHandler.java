package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

/**
 * Called after the children of a node were walked. The result tells the visitor how to update the slot
 * holding the node.
 */
@FunctionalInterface
public interface PostVisitHandler
{
	VisitResult visit(Visitor visitor, Node node);
}
