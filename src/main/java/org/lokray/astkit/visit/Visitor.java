package org.lokray.astkit.visit;

import org.lokray.astkit.ast.Child;
import org.lokray.astkit.ast.Node;
import org.lokray.astkit.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Depth-first walker over a tree of {@link Node}s.
 * <p>
 * For every node the visitor calls the pre-visit handler registered for its kind, walks the visitable
 * slots in declaration order, then calls the post-visit handler and applies the {@link VisitResult} to
 * the slot that holds the node. Handlers registered under {@link #DEFAULT_KIND} apply to every kind that
 * has no handler of its own.
 * <p>
 * A visitor holds mutable walk state and must not be shared between threads.
 */
public class Visitor
{
	public static final String DEFAULT_KIND = "Default";

	private final Map<String, PreVisitHandler> preHandlers = new LinkedHashMap<>();
	private final Map<String, PostVisitHandler> postHandlers = new LinkedHashMap<>();
	private Map<String, PreVisitHandler> preTable = Map.of();
	private Map<String, PostVisitHandler> postTable = Map.of();

	private final Map<String, Boolean> flags = new HashMap<>();
	private final Map<String, Object> options = new HashMap<>();
	private final Map<String, Set<Consumer<Node>>> hooks = new HashMap<>();
	private final Deque<VisitRecord> history = new ArrayDeque<>();
	private final Set<Long> visitedNodes = new HashSet<>();

	private final Set<String> allowedPatterns = new LinkedHashSet<>();
	private final Set<String> disallowedPatterns = new LinkedHashSet<>();
	private List<Pattern> allowedMatches = List.of();
	private List<Pattern> disallowedMatches = List.of();

	private boolean visiting = false;
	private boolean paused = false;
	private int visitDepth = 0;

	public Visitor()
	{
		this(Map.of());
	}

	/**
	 * @param options boolean values are stored as flags, anything else as options
	 */
	public Visitor(Map<String, ?> options)
	{
		this.options.put(VisitFlags.OPTION_HISTORY_LEN, 0);
		this.options.put(VisitFlags.OPTION_LOGGER, null);
		clearFlag(VisitFlags.EXCLUSIVE_VISIT);
		clearFlag(VisitFlags.MINIMAL_DEPTH);
		clearFlag(VisitFlags.NO_CHILDREN_VISITS);
		clearFlag(VisitFlags.DEBUG_VISIT);

		options.forEach((name, value) ->
		{
			if (value instanceof Boolean flag)
			{
				if (flag)
				{
					setFlag(name);
				}
				else
				{
					clearFlag(name);
				}
			}
			else
			{
				setOption(name, value);
			}
		});
	}

	public static Builder builder()
	{
		return new Builder();
	}

	// --- Handler registration ---

	protected final void onPreVisit(String kind, PreVisitHandler handler)
	{
		preHandlers.put(kind, handler);
	}

	protected final void onPostVisit(String kind, PostVisitHandler handler)
	{
		postHandlers.put(kind, handler);
	}

	public boolean hasPostVisitHandler(String kind)
	{
		return postHandlers.containsKey(kind);
	}

	/**
	 * Registers a callback fired after the post-visit of every node of the given kind, whether or not the
	 * kind has a handler.
	 */
	public void addVisitHook(String kind, Consumer<Node> hook)
	{
		hooks.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(hook);
	}

	// --- Flags and options ---

	public void setFlag(String name)
	{
		flags.put(name, true);
	}

	public void clearFlag(String name)
	{
		flags.put(name, false);
	}

	public boolean getFlagState(String name)
	{
		return flags.getOrDefault(name, false);
	}

	public void setOption(String name, Object value)
	{
		if (VisitFlags.OPTION_HISTORY_LEN.equals(name))
		{
			if (!(value instanceof Integer length) || length < 0)
			{
				throw new IllegalArgumentException("history_len must be a non-negative integer, got " + value);
			}
		}
		options.put(name, value);
	}

	public Object getOption(String name)
	{
		if (!options.containsKey(name))
		{
			throw new IllegalArgumentException("unknown option: " + name);
		}
		return options.get(name);
	}

	// --- Walk control, used from handlers ---

	public void dontVisitChildren()
	{
		setFlag(VisitFlags.NO_CHILDREN_VISITS);
	}

	public void reverseVisitOrder()
	{
		setFlag(VisitFlags.REVERSE_VISIT);
	}

	/**
	 * Stops calling handlers and hooks. The walk itself goes on until {@link #resumeVisiting()}.
	 */
	public void pauseVisiting()
	{
		paused = true;
	}

	public void resumeVisiting()
	{
		paused = false;
	}

	public boolean isPaused()
	{
		return paused;
	}

	public boolean isVisiting()
	{
		return visiting;
	}

	public int getVisitDepth()
	{
		return visitDepth;
	}

	// --- Slot filtering ---

	/**
	 * Slot names matching any of these patterns are not descended into.
	 */
	public void addDisallowedPrefixes(String... patterns)
	{
		if (visiting)
		{
			throw new ConfigurationException("cannot alter disallowed prefixes while visiting");
		}
		Collections.addAll(disallowedPatterns, patterns);
	}

	/**
	 * Slot names descended into in exclusive visit mode, in addition to the registered kind names.
	 */
	public void addAllowedPrefixes(String... patterns)
	{
		if (visiting)
		{
			throw new ConfigurationException("cannot alter allowed prefixes while visiting");
		}
		Collections.addAll(allowedPatterns, patterns);
	}

	/**
	 * Whether the slot with this name should be walked. Subclasses may narrow this further.
	 */
	protected boolean isVisitAllowed(String slotName)
	{
		if (getFlagState(VisitFlags.EXCLUSIVE_VISIT))
		{
			for (Pattern allowed : allowedMatches)
			{
				if (allowed.matcher(slotName).lookingAt())
				{
					return true;
				}
			}
			return false;
		}
		for (Pattern disallowed : disallowedMatches)
		{
			if (disallowed.matcher(slotName).lookingAt())
			{
				return false;
			}
		}
		return true;
	}

	// --- Visit record ---

	public boolean hasBeenVisited(Node node)
	{
		return visitedNodes.contains(node.getId());
	}

	public void resetVisits()
	{
		visitedNodes.clear();
	}

	/**
	 * Most recent history entry, or null when history is disabled or empty.
	 */
	public VisitRecord getLastVisited()
	{
		return history.peekLast();
	}

	public List<VisitRecord> getVisitHistory()
	{
		return List.copyOf(history);
	}

	// --- Visiting ---

	public Node visit(Node root)
	{
		return visit(root, true);
	}

	/**
	 * Walks the tree below {@code root}.
	 *
	 * @param cleanup whether to forget visited nodes and reset per-visit state afterwards
	 * @return the root, its replacement, or null if the root was deleted
	 * @throws VisitException if a handler or hook failed
	 */
	public Node visit(Node root, boolean cleanup)
	{
		if (visiting)
		{
			throw new ConfigurationException("visitor is already visiting");
		}
		buildDispatchTables();

		VisitResult ret;
		visiting = true;
		try
		{
			ret = walk(root);
		}
		finally
		{
			visiting = false;
			visitDepth = 0;
			if (cleanup)
			{
				cleanupVisit();
			}
		}

		switch (ret.getKind())
		{
			case KEEP:
				return root;
			case REPLACE:
				return ret.getNode();
			case DELETE:
				return null;
			default:
				if (ret.getNodes().size() == 1)
				{
					return ret.getNodes().get(0);
				}
				throw new VisitException("cannot replace the root node by " + ret.getNodes().size() + " nodes");
		}
	}

	/**
	 * Resets per-visit state. Subclasses holding their own per-visit data extend this.
	 */
	protected void cleanupVisit()
	{
		visitedNodes.clear();
	}

	/**
	 * Runs before the pre-visit handler of every node, while handlers are not paused. Every call is
	 * matched by one call of {@link #afterPostVisit(Node, VisitResult)} for the same node.
	 */
	protected void beforePreVisit(Node node)
	{
	}

	/**
	 * Runs after the post-visit handler and hooks of every node whose {@link #beforePreVisit(Node)} ran.
	 * If handlers were paused meanwhile, it runs alone with a {@code Keep} result that is then ignored.
	 *
	 * @return the result to apply, normally {@code result} itself
	 */
	protected VisitResult afterPostVisit(Node node, VisitResult result)
	{
		return result;
	}

	protected void debugVisit(String message)
	{
		if (!getFlagState(VisitFlags.DEBUG_VISIT))
		{
			return;
		}
		@SuppressWarnings("unchecked")
		Consumer<String> logger = (Consumer<String>) options.get(VisitFlags.OPTION_LOGGER);
		if (logger != null)
		{
			logger.accept(message);
		}
		else
		{
			Debug.log(message);
		}
	}

	private void buildDispatchTables()
	{
		preTable = Map.copyOf(preHandlers);
		postTable = Map.copyOf(postHandlers);

		disallowedMatches = compile(disallowedPatterns);
		Set<String> allowed = new LinkedHashSet<>(allowedPatterns);
		if (getFlagState(VisitFlags.EXCLUSIVE_VISIT))
		{
			setFlag(VisitFlags.MINIMAL_DEPTH);
			for (String kind : postHandlers.keySet())
			{
				if (!DEFAULT_KIND.equals(kind))
				{
					allowed.add("^" + Pattern.quote(kind) + "$");
				}
			}
		}
		allowedMatches = compile(allowed);
	}

	private static List<Pattern> compile(Set<String> patterns)
	{
		List<Pattern> ret = new ArrayList<>();
		for (String pattern : patterns)
		{
			ret.add(Pattern.compile(pattern));
		}
		return ret;
	}

	private VisitResult walk(Node node)
	{
		visitDepth++;
		try
		{
			String kind = node.getKind();
			boolean entered = !paused;
			if (entered)
			{
				callPreVisit(kind, node);
			}

			if (getFlagState(VisitFlags.NO_CHILDREN_VISITS))
			{
				// reverse order only lasts for the children it was set for
				clearFlag(VisitFlags.NO_CHILDREN_VISITS);
				clearFlag(VisitFlags.REVERSE_VISIT);
			}
			else
			{
				walkChildren(node);
			}

			if (paused)
			{
				if (entered)
				{
					leavePaused(node);
				}
				return VisitResult.keep();
			}
			VisitResult ret = callPostVisit(kind, node, entered);
			storeVisit(node, ret);
			return ret;
		}
		finally
		{
			visitDepth--;
		}
	}

	private void callPreVisit(String kind, Node node)
	{
		try
		{
			beforePreVisit(node);

			// prune below kinds that are handled explicitly
			if (getFlagState(VisitFlags.MINIMAL_DEPTH) && postTable.containsKey(kind))
			{
				setFlag(VisitFlags.NO_CHILDREN_VISITS);
			}

			PreVisitHandler handler = preTable.get(kind);
			if (handler == null)
			{
				handler = preTable.get(DEFAULT_KIND);
			}
			if (handler != null)
			{
				handler.preVisit(this, node);
			}
		}
		catch (RuntimeException e)
		{
			debugVisit("exception caught while visiting: \"" + e.getMessage() + "\"");
			throw new VisitException(e);
		}
	}

	private void leavePaused(Node node)
	{
		try
		{
			afterPostVisit(node, VisitResult.keep());
		}
		catch (RuntimeException e)
		{
			debugVisit("exception caught while visiting: \"" + e.getMessage() + "\"");
			throw new VisitException(e);
		}
	}

	private VisitResult callPostVisit(String kind, Node node, boolean entered)
	{
		try
		{
			VisitResult ret;
			if (getFlagState(VisitFlags.IGNORE_VISITED) && hasBeenVisited(node))
			{
				ret = VisitResult.keep();
			}
			else
			{
				visitedNodes.add(node.getId());
				PostVisitHandler handler = postTable.get(kind);
				if (handler == null)
				{
					handler = postTable.get(DEFAULT_KIND);
				}
				ret = handler == null ? null : handler.visit(this, node);
				if (ret == null)
				{
					ret = VisitResult.keep();
				}
				callVisitHooks(kind, node);
			}
			return entered ? afterPostVisit(node, ret) : ret;
		}
		catch (RuntimeException e)
		{
			debugVisit("exception caught while visiting: \"" + e.getMessage() + "\"");
			throw new VisitException(e);
		}
	}

	private void callVisitHooks(String kind, Node node)
	{
		Set<Consumer<Node>> registered = hooks.get(kind);
		if (registered == null)
		{
			return;
		}
		for (Consumer<Node> hook : List.copyOf(registered))
		{
			hook.accept(node);
		}
	}

	private void storeVisit(Node node, VisitResult result)
	{
		int historyLength = (Integer) options.get(VisitFlags.OPTION_HISTORY_LEN);
		if (historyLength == 0)
		{
			return;
		}
		if (history.size() >= historyLength)
		{
			history.pollFirst();
		}
		history.addLast(new VisitRecord(result, result.leavesUnchanged(node) ? null : node, visitDepth));
	}

	private void walkChildren(Node node)
	{
		List<Child> children = node.children();
		if (getFlagState(VisitFlags.REVERSE_VISIT))
		{
			children = new ArrayList<>(children);
			Collections.reverse(children);
			clearFlag(VisitFlags.REVERSE_VISIT);
		}

		for (Child child : children)
		{
			String name = child.getName();
			if (!child.isVisitable() || !isVisitAllowed(name))
			{
				continue;
			}
			// re-read, a sibling's handler may have reassigned the slot
			Object value = node.get(name);
			if (value instanceof Node sub)
			{
				walkSingle(node, name, sub);
			}
			else if (value instanceof List<?> list)
			{
				walkSequence(node, name, list);
			}
			// anything else is a leaf
		}
	}

	private void walkSingle(Node owner, String slotName, Node child)
	{
		VisitResult result = walk(child);
		if (result.leavesUnchanged(child))
		{
			return;
		}

		Node replacement;
		switch (result.getKind())
		{
			case DELETE:
				replacement = null;
				break;
			case REPLACE:
				replacement = result.getNode();
				break;
			default:
				if (result.getNodes().size() > 1)
				{
					throw new VisitException("cannot place " + result.getNodes().size() + " nodes in single-valued slot '"
							+ slotName + "' of " + owner.describe());
				}
				replacement = result.getNodes().isEmpty() ? null : result.getNodes().get(0);
				break;
		}
		applyEdit(() -> owner.set(slotName, replacement));
		if (replacement != null)
		{
			visitedNodes.remove(child.getId());
		}
	}

	private void walkSequence(Node owner, String slotName, List<?> list)
	{
		List<Object> elements = new ArrayList<>(list);
		Map<Integer, List<Node>> splices = new TreeMap<>();
		List<Integer> deletions = new ArrayList<>();
		boolean modified = false;

		for (int idx = 0; idx < elements.size(); idx++)
		{
			if (!(elements.get(idx) instanceof Node element))
			{
				continue;
			}
			VisitResult result = walk(element);
			switch (result.getKind())
			{
				case KEEP:
					break;
				case DELETE:
					deletions.add(idx);
					break;
				case REPLACE:
					if (result.getNode() != element)
					{
						elements.set(idx, result.getNode());
						// the new node has not been visited at this position yet
						visitedNodes.remove(element.getId());
						modified = true;
					}
					break;
				default:
					splices.put(idx, result.getNodes());
					break;
			}
		}
		if (!modified && splices.isEmpty() && deletions.isEmpty())
		{
			return;
		}

		// splices first, remembering where each original index ended up
		int[] positions = new int[elements.size()];
		int insertionOffset = 0;
		for (int idx = 0; idx < elements.size(); idx++)
		{
			positions[idx] = idx + insertionOffset;
			List<Node> inserted = splices.get(idx);
			if (inserted != null)
			{
				insertionOffset += inserted.size() - 1;
			}
		}
		List<Object> updated = new ArrayList<>(elements);
		for (Map.Entry<Integer, List<Node>> splice : splices.entrySet())
		{
			int at = positions[splice.getKey()];
			updated.remove(at);
			updated.addAll(at, splice.getValue());
		}

		int deletionOffset = 0;
		for (int idx : deletions)
		{
			updated.remove(positions[idx] + deletionOffset);
			deletionOffset--;
		}

		applyEdit(() -> owner.set(slotName, updated));
	}

	private static void applyEdit(Runnable edit)
	{
		try
		{
			edit.run();
		}
		catch (RuntimeException e)
		{
			throw new VisitException(e);
		}
	}

	// --- Tree queries ---

	/**
	 * First node of the given type found depth-first below {@code node}, honoring slot filters.
	 *
	 * @param inclusive whether {@code node} itself may be returned
	 */
	public <T extends Node> T findFirstOccurrence(Node node, Class<T> type, boolean inclusive)
	{
		if (inclusive && type.isInstance(node))
		{
			return type.cast(node);
		}
		for (Child child : node.children())
		{
			if (!child.isVisitable() || !isVisitAllowed(child.getName()))
			{
				continue;
			}
			for (Node sub : nodesOf(child.getValue()))
			{
				T found = findFirstOccurrence(sub, type, true);
				if (found != null)
				{
					return found;
				}
			}
		}
		return null;
	}

	/**
	 * Every node of the given type below {@code root}, in walk order. The root itself is not included.
	 */
	public <T extends Node> List<T> findAllOccurrences(Node root, Class<T> type)
	{
		List<T> occurrences = new ArrayList<>();
		for (Child child : root.children())
		{
			if (!child.isVisitable())
			{
				continue;
			}
			for (Node sub : nodesOf(child.getValue()))
			{
				if (type.isInstance(sub))
				{
					occurrences.add(type.cast(sub));
				}
				occurrences.addAll(findAllOccurrences(sub, type));
			}
		}
		return occurrences;
	}

	/**
	 * Walks up from {@code node} to the {@code level}-th ancestor of the given kind.
	 *
	 * @return the ancestor, or null if there is none
	 */
	public Node findParentByType(Node node, String kind, int level)
	{
		Node current = node;
		int remaining = level;
		while (!current.isRoot())
		{
			Node parent = current.getParent();
			if (parent == null)
			{
				return null;
			}
			if (parent.getKind().equals(kind))
			{
				if (remaining <= 1)
				{
					return parent;
				}
				remaining--;
			}
			current = parent;
		}
		return null;
	}

	private static List<Node> nodesOf(Object value)
	{
		if (value instanceof Node node)
		{
			return List.of(node);
		}
		List<Node> ret = new ArrayList<>();
		if (value instanceof List<?> list)
		{
			for (Object element : list)
			{
				if (element instanceof Node node)
				{
					ret.add(node);
				}
			}
		}
		return ret;
	}

	/**
	 * Assembles a visitor from a {@code kind -> handler} table.
	 */
	public static class Builder
	{
		private final Map<String, PreVisitHandler> pre = new LinkedHashMap<>();
		private final Map<String, PostVisitHandler> post = new LinkedHashMap<>();
		private final Map<String, Object> options = new LinkedHashMap<>();
		private final Map<String, List<Consumer<Node>>> hooks = new LinkedHashMap<>();
		private final List<String> disallowed = new ArrayList<>();
		private final List<String> allowed = new ArrayList<>();

		private Builder()
		{
		}

		public Builder pre(String kind, PreVisitHandler handler)
		{
			pre.put(kind, handler);
			return this;
		}

		public Builder post(String kind, PostVisitHandler handler)
		{
			post.put(kind, handler);
			return this;
		}

		public Builder flag(String name)
		{
			options.put(name, true);
			return this;
		}

		public Builder option(String name, Object value)
		{
			options.put(name, value);
			return this;
		}

		public Builder hook(String kind, Consumer<Node> hook)
		{
			hooks.computeIfAbsent(kind, k -> new ArrayList<>()).add(hook);
			return this;
		}

		public Builder disallow(String... patterns)
		{
			Collections.addAll(disallowed, patterns);
			return this;
		}

		public Builder allow(String... patterns)
		{
			Collections.addAll(allowed, patterns);
			return this;
		}

		public Visitor build()
		{
			Visitor visitor = new Visitor(options);
			pre.forEach(visitor::onPreVisit);
			post.forEach(visitor::onPostVisit);
			hooks.forEach((kind, list) -> list.forEach(hook -> visitor.addVisitHook(kind, hook)));
			visitor.addDisallowedPrefixes(disallowed.toArray(new String[0]));
			visitor.addAllowedPrefixes(allowed.toArray(new String[0]));
			return visitor;
		}
	}
}
