package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

/**
 * Called before the children of a node are walked. Cannot change the tree, but may tell the visitor not
 * to descend with {@link Visitor#dontVisitChildren()}.
 */
@FunctionalInterface
public interface PreVisitHandler
{
	void preVisit(Visitor visitor, Node node);
}
