package org.lokray.astkit.check;

/**
 * Marks node kinds that open a lexical scope. {@link SyntaxChecker} enters a scope before the pre-visit
 * of such a node and leaves it after its post-visit.
 */
public interface ScopeNode
{
}
