package org.lokray.astkit.check;

import org.lokray.astkit.ast.Node;

import java.util.Map;

/**
 * Symbols of a closed scope, kept so that a later pass over the same tree finds them again.
 */
public class ArchivedScope
{
	private Node location;
	private final Node endLocation;
	private final Map<String, Node> symbols;

	public ArchivedScope(Node location, Node endLocation, Map<String, Node> symbols)
	{
		this.location = location;
		this.endLocation = endLocation;
		this.symbols = symbols;
	}

	/**
	 * Node that opened the scope.
	 */
	public Node getLocation()
	{
		return location;
	}

	void setLocation(Node location)
	{
		this.location = location;
	}

	/**
	 * Node at which the scope was closed.
	 */
	public Node getEndLocation()
	{
		return endLocation;
	}

	public Map<String, Node> getSymbols()
	{
		return symbols;
	}
}
