package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Node;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a post-visit handler: keep the node, replace it with one node, splice several nodes in its
 * place, or delete it.
 */
public final class VisitResult
{
	public enum Kind
	{
		KEEP, REPLACE, REPLACE_MANY, DELETE
	}

	private static final VisitResult KEEP = new VisitResult(Kind.KEEP, List.of());
	private static final VisitResult DELETE = new VisitResult(Kind.DELETE, List.of());

	private final Kind kind;
	private final List<Node> nodes;

	private VisitResult(Kind kind, List<Node> nodes)
	{
		this.kind = kind;
		this.nodes = nodes;
	}

	public static VisitResult keep()
	{
		return KEEP;
	}

	public static VisitResult delete()
	{
		return DELETE;
	}

	public static VisitResult replace(Node node)
	{
		return new VisitResult(Kind.REPLACE, List.of(Objects.requireNonNull(node, "node")));
	}

	public static VisitResult replaceMany(List<? extends Node> nodes)
	{
		return new VisitResult(Kind.REPLACE_MANY, List.copyOf(nodes));
	}

	public static VisitResult replaceMany(Node... nodes)
	{
		return replaceMany(List.of(nodes));
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * Replacement node of a {@link Kind#REPLACE} result.
	 */
	public Node getNode()
	{
		if (kind != Kind.REPLACE)
		{
			throw new IllegalStateException("not a single replacement: " + kind);
		}
		return nodes.get(0);
	}

	public List<Node> getNodes()
	{
		return nodes;
	}

	public boolean isKeep()
	{
		return kind == Kind.KEEP;
	}

	public boolean isDelete()
	{
		return kind == Kind.DELETE;
	}

	/**
	 * Whether applying this result to {@code original} leaves the tree as it is.
	 */
	public boolean leavesUnchanged(Node original)
	{
		return kind == Kind.KEEP || (kind == Kind.REPLACE && nodes.get(0) == original);
	}

	@Override
	public String toString()
	{
		return kind == Kind.KEEP || kind == Kind.DELETE ? kind.name() : kind + nodes.toString();
	}
}
