package org.lokray.astkit.check;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.visit.PreVisitHandler;
import org.lokray.astkit.visit.Visitor;

/**
 * Pre-visit wrappers that declare the visited node as a symbol before running the handler.
 */
public final class SymbolCollectors
{
	private SymbolCollectors()
	{
	}

	/**
	 * Collects the node under the name held by its {@code nameSlot}.
	 */
	public static PreVisitHandler autoCollect(String nameSlot, PreVisitHandler handler)
	{
		return (visitor, node) ->
		{
			checker(visitor).collectSymbol(symbolName(node, nameSlot), node);
			handler.preVisit(visitor, node);
		};
	}

	/**
	 * Like {@link #autoCollect} but only while the given flag is set on the checker.
	 */
	public static PreVisitHandler autoCollectConditional(String nameSlot, String flag, PreVisitHandler handler)
	{
		return (visitor, node) ->
		{
			String name = symbolName(node, nameSlot);
			if (visitor.getFlagState(flag))
			{
				checker(visitor).collectSymbol(name, node);
			}
			handler.preVisit(visitor, node);
		};
	}

	private static String symbolName(Node node, String nameSlot)
	{
		if (!node.hasSlot(nameSlot))
		{
			throw new IllegalArgumentException("invalid attribute for node " + node.getKind() + ": " + nameSlot);
		}
		return node.getString(nameSlot);
	}

	private static SyntaxChecker checker(Visitor visitor)
	{
		if (!(visitor instanceof SyntaxChecker checker))
		{
			throw new IllegalStateException("symbols can only be collected by a SyntaxChecker");
		}
		return checker;
	}
}
