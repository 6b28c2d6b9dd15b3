package org.lokray.astkit.check;

import org.lokray.astkit.ast.Node;
import org.lokray.astkit.error.CodedException;
import org.lokray.astkit.error.ErrorCode;
import org.lokray.astkit.error.ErrorDescriptor;
import org.lokray.astkit.error.ErrorRegistry;
import org.lokray.astkit.visit.VisitException;
import org.lokray.astkit.visit.VisitResult;
import org.lokray.astkit.visit.Visitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Visitor that builds nested symbol tables while walking.
 * <p>
 * Nodes implementing {@link ScopeNode} open a scope. Handlers declare symbols with
 * {@link #collectSymbol(String, Node)} and resolve them with {@link #scopedSymbolLookup(String)}. Closed
 * scopes are archived by the node that opened them, so that a second pass over the same tree sees the
 * symbols of the first one.
 */
public class SyntaxChecker extends Visitor
{
	private final String text;
	private final SourceLocator locator;
	private final ErrorRegistry errors = new ErrorRegistry();

	private boolean passRun;
	private Map<String, Node> collectedGlobals;
	private Map<String, Node> collectedLocals;
	private Map<Long, ArchivedScope> collectedScopes;
	private Deque<ScopeFrame> scopeStack;

	/**
	 * @param text the source text the tree was parsed from, used to locate errors; may be null
	 */
	public SyntaxChecker(String text)
	{
		this(text, Map.of());
	}

	public SyntaxChecker(String text, Map<String, ?> options)
	{
		super(options);
		this.text = text;
		this.locator = new SourceLocator(text);
		registerError(SyntaxErrorCode.GLOBAL_NAME_REDEFINED, "Re-definition of global name",
				"re-definition of global name \"{n}\"");
		registerError(SyntaxErrorCode.LOCAL_NAME_REDEFINED, "Re-definition of local name",
				"re-definition of local name \"{n}\"");
		registerError(SyntaxErrorCode.INVALID_IDENTIFIER, "Invalid identifier", "invalid identifier: \"{id}\"");
		initialize(Map.of());
	}

	/**
	 * Forgets everything collected so far and declares the given symbols as globals.
	 */
	protected void initialize(Map<String, ? extends Node> symbols)
	{
		passRun = false;
		collectedGlobals = new LinkedHashMap<>();
		collectedLocals = new LinkedHashMap<>();
		collectedScopes = new LinkedHashMap<>();
		scopeStack = new ArrayDeque<>();
		symbols.forEach(this::collectSymbol);
	}

	protected final void registerError(ErrorCode code, String brief, String template)
	{
		errors.register(new ErrorDescriptor(code, brief, template, SyntaxCheckException::new));
	}

	public ErrorRegistry getErrorRegistry()
	{
		return errors;
	}

	public String getText()
	{
		return text;
	}

	public boolean isPassRun()
	{
		return passRun;
	}

	// --- Visiting ---

	@Override
	public Node visit(Node root)
	{
		return check(root, true);
	}

	/**
	 * Visits and re-throws coded errors raised by handlers as themselves rather than wrapped.
	 */
	@Override
	public Node visit(Node root, boolean cleanup)
	{
		try
		{
			return super.visit(root, cleanup);
		}
		catch (VisitException err)
		{
			if (err.findEmbeddedException() instanceof CodedException coded)
			{
				throw coded;
			}
			throw err;
		}
	}

	/**
	 * Runs one pass.
	 *
	 * @param flagRun whether this pass locks in the archived scopes; later passes then re-enter them
	 *                instead of archiving again
	 */
	public Node check(Node root, boolean flagRun)
	{
		Node ret = visit(root, true);
		if (flagRun)
		{
			passRun = true;
		}
		return ret;
	}

	@Override
	protected void beforePreVisit(Node node)
	{
		if (node instanceof ScopeNode)
		{
			enterScope(node);
		}
	}

	@Override
	protected VisitResult afterPostVisit(Node node, VisitResult result)
	{
		if (node instanceof ScopeNode)
		{
			exitScope(node);
		}
		return result;
	}

	// --- Scopes ---

	/**
	 * Opens a scope at {@code location}. A scope this node opened and closed in an earlier pass is
	 * re-entered with its symbols.
	 */
	protected void enterScope(Node location)
	{
		ArchivedScope archived = collectedScopes.get(location.getId());
		scopeStack.push(new ScopeFrame(location, collectedLocals));
		if (archived != null)
		{
			debugVisit("RE-ENTERING scope at " + location.describe());
			collectedLocals = archived.getSymbols();
		}
		else
		{
			debugVisit("entering scope at " + location.describe());
			collectedLocals = new LinkedHashMap<>();
		}
	}

	/**
	 * Closes the innermost scope. Before the first pass completes, its symbols are archived.
	 */
	protected void exitScope(Node location)
	{
		debugVisit("exiting scope, depth = " + scopeStack.size());
		if (scopeStack.isEmpty())
		{
			throw new IllegalStateException("no open scope to exit at " + location.describe());
		}
		ScopeFrame frame = scopeStack.pop();
		if (!passRun)
		{
			Map<String, Node> closing = new LinkedHashMap<>(collectedLocals);
			collectedScopes.put(frame.getLocation().getId(), new ArchivedScope(frame.getLocation(), location, closing));
		}
		collectedLocals = frame.getEnclosingLocals();
	}

	/**
	 * Moves the scope opened by {@code oldLocation} to {@code newLocation}, e.g. after a handler replaced
	 * the scope node.
	 */
	public void swapScopeNode(Node oldLocation, Node newLocation)
	{
		ArchivedScope archived = collectedScopes.get(oldLocation.getId());
		if (archived == null || collectedScopes.containsKey(newLocation.getId()))
		{
			throw new IllegalStateException("cannot replace scope " + oldLocation.describe());
		}
		debugVisit("replacing scope " + oldLocation.describe() + " -> " + newLocation.describe());

		Deque<ScopeFrame> swapped = new ArrayDeque<>();
		for (ScopeFrame frame : scopeStack)
		{
			swapped.addLast(frame.getLocation() == oldLocation ? new ScopeFrame(newLocation, frame.getEnclosingLocals()) : frame);
		}
		scopeStack = swapped;

		collectedScopes.remove(oldLocation.getId());
		archived.setLocation(newLocation);
		collectedScopes.put(newLocation.getId(), archived);
	}

	public int getCurrentScopeDepth()
	{
		return scopeStack.size();
	}

	public void clearCollectedScopes()
	{
		collectedScopes = new LinkedHashMap<>();
	}

	public List<ArchivedScope> getArchivedScopes()
	{
		return List.copyOf(collectedScopes.values());
	}

	// --- Symbols ---

	public void collectSymbol(String name, Node node)
	{
		collectSymbol(name, node, false, false);
	}

	/**
	 * Declares a symbol in the innermost open scope, or as a global when no scope is open or
	 * {@code global} is set.
	 *
	 * @param ignoreRedefine accept a name that is already declared at this level, keeping the first node
	 * @throws SyntaxCheckException on an invalid identifier or a re-definition
	 */
	public void collectSymbol(String name, Node node, boolean global, boolean ignoreRedefine)
	{
		if (!isValidIdentifier(name))
		{
			throw getErrorFromCode(node, SyntaxErrorCode.INVALID_IDENTIFIER, Collections.singletonMap("id", name));
		}
		if (scopeStack.isEmpty() || global)
		{
			debugVisit("collecting global symbol: \"" + name + "\"");
			if (collectedGlobals.containsKey(name) && !ignoreRedefine)
			{
				throw getErrorFromCode(node, SyntaxErrorCode.GLOBAL_NAME_REDEFINED, Map.of("n", name));
			}
			collectedGlobals.putIfAbsent(name, node);
		}
		else
		{
			debugVisit("collecting local symbol: \"" + name + "\"");
			if (collectedLocals.containsKey(name) && !ignoreRedefine)
			{
				throw getErrorFromCode(node, SyntaxErrorCode.LOCAL_NAME_REDEFINED, Map.of("n", name));
			}
			collectedLocals.putIfAbsent(name, node);
		}
	}

	/**
	 * Lexical lookup: current scope, then enclosing scopes from the innermost outwards, then globals.
	 *
	 * @return the declaring node, or null
	 */
	public Node scopedSymbolLookup(String name)
	{
		if (collectedLocals.containsKey(name))
		{
			return collectedLocals.get(name);
		}
		for (ScopeFrame frame : scopeStack)
		{
			if (frame.getEnclosingLocals().containsKey(name))
			{
				return frame.getEnclosingLocals().get(name);
			}
		}
		return collectedGlobals.get(name);
	}

	/**
	 * Every declaration of {@code name}: the global one first, then those of each archived scope, regardless
	 * of nesting.
	 */
	public List<Node> symbolLookup(String name)
	{
		List<Node> ret = new ArrayList<>();
		if (collectedGlobals.containsKey(name))
		{
			ret.add(collectedGlobals.get(name));
		}
		for (ArchivedScope scope : collectedScopes.values())
		{
			if (scope.getSymbols().containsKey(name))
			{
				ret.add(scope.getSymbols().get(name));
			}
		}
		return ret;
	}

	/**
	 * Symbol table of the scope in which {@code node} is declared, or null.
	 */
	public Map<String, Node> getNodeScope(Node node)
	{
		for (ArchivedScope scope : collectedScopes.values())
		{
			if (scope.getSymbols().containsValue(node))
			{
				return Collections.unmodifiableMap(scope.getSymbols());
			}
		}
		if (collectedGlobals.containsValue(node))
		{
			return Collections.unmodifiableMap(collectedGlobals);
		}
		return null;
	}

	public Map<String, Node> getGlobalSymbols()
	{
		return Collections.unmodifiableMap(collectedGlobals);
	}

	public <T extends Node> Map<String, T> getGlobalSymbolsByType(Class<T> type)
	{
		Map<String, T> ret = new LinkedHashMap<>();
		collectedGlobals.forEach((name, symbol) ->
		{
			if (type.isInstance(symbol))
			{
				ret.put(name, type.cast(symbol));
			}
		});
		return ret;
	}

	/**
	 * All collected symbols: {@code globals}, then one {@code scope_<node>} entry per archived scope.
	 */
	public Map<String, Map<String, Node>> reportSymbols()
	{
		Map<String, Map<String, Node>> ret = new LinkedHashMap<>();
		ret.put("globals", new LinkedHashMap<>(collectedGlobals));
		for (ArchivedScope scope : collectedScopes.values())
		{
			ret.put("scope_" + scope.getLocation().describe(), new LinkedHashMap<>(scope.getSymbols()));
		}
		return ret;
	}

	/**
	 * Identifier format; null accepts every identifier.
	 */
	protected Pattern getIdentifierPattern()
	{
		return null;
	}

	public boolean isValidIdentifier(String identifier)
	{
		Pattern pattern = getIdentifierPattern();
		if (pattern == null)
		{
			return true;
		}
		return identifier != null && pattern.matcher(identifier).lookingAt();
	}

	// --- Errors ---

	/**
	 * Location of a node in the source text. Copies without a position of their own are located at their
	 * original.
	 *
	 * @param alternate node to locate when {@code node} cannot be located, may be null
	 * @return the location, or null
	 */
	public SourceLocation findNodeLine(Node node, Node alternate)
	{
		int offset = offsetOf(node);
		if (offset < 0 && alternate != null)
		{
			offset = offsetOf(alternate);
		}
		if (offset < 0 || text == null)
		{
			return null;
		}
		return locator.locate(offset);
	}

	private static int offsetOf(Node node)
	{
		if (node == null)
		{
			return -1;
		}
		if (node.hasPosition())
		{
			return node.getPosition();
		}
		return node.getMetadata().isCopy() ? node.getMetadata().getOriginalStart() : -1;
	}

	public SyntaxCheckException getError(Node node, String message, ErrorCode code, Throwable cause, Node alternate)
	{
		return new SyntaxCheckException(locate(node, alternate, message), code, cause);
	}

	public CodedException getErrorFromCode(Node node, ErrorCode code, Map<String, ?> values)
	{
		return getErrorFromCode(node, code, values, null, null, "", "");
	}

	/**
	 * Builds the exception registered for {@code code}, its message prefixed with the node's location.
	 */
	public CodedException getErrorFromCode(Node node, ErrorCode code, Map<String, ?> values, Node alternate, Throwable cause,
			String prefix, String suffix)
	{
		String msg = errors.getErrorFromCode(code, values, prefix, suffix);
		return errors.get(code).getExceptionFactory().create(locate(node, alternate, msg), code, cause);
	}

	private String locate(Node node, Node alternate, String message)
	{
		SourceLocation location = findNodeLine(node, alternate);
		if (location == null)
		{
			return message;
		}
		return "at (" + location + "): " + message;
	}
}
