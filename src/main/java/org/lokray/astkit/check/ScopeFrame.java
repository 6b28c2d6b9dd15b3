package org.lokray.astkit.check;

import org.lokray.astkit.ast.Node;

import java.util.Map;

/**
 * Entry of the scope stack: the node that opened a scope and the locals of the enclosing scope, restored
 * when the scope is left.
 */
public class ScopeFrame
{
	private final Node location;
	private final Map<String, Node> enclosingLocals;

	public ScopeFrame(Node location, Map<String, Node> enclosingLocals)
	{
		this.location = location;
		this.enclosingLocals = enclosingLocals;
	}

	public Node getLocation()
	{
		return location;
	}

	public Map<String, Node> getEnclosingLocals()
	{
		return enclosingLocals;
	}
}
