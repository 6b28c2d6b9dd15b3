package org.lokray.astkit.check;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lokray.astkit.ast.Node;
import org.lokray.astkit.error.CodedException;
import org.lokray.astkit.fixture.Block;
import org.lokray.astkit.fixture.Decl;
import org.lokray.astkit.fixture.Num;
import org.lokray.astkit.fixture.Program;
import org.lokray.astkit.fixture.Ref;
import org.lokray.astkit.visit.VisitException;
import org.lokray.astkit.visit.VisitResult;
import org.lokray.astkit.visit.Visitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

@RunWith(JUnit4.class)
public class SyntaxCheckerTest
{
	/**
	 * Declares {@link Decl} names and links each {@link Ref} to the declaration it resolves to.
	 */
	private static class DeclChecker extends SyntaxChecker
	{
		final List<Integer> depthsAtRefs = new ArrayList<>();

		DeclChecker(String text)
		{
			this(text, Map.of());
		}

		DeclChecker(String text, Map<String, ? extends Node> predefined)
		{
			super(text);
			initialize(predefined);
			onPreVisit("Decl", (visitor, node) -> collectSymbol(((Decl) node).getName(), node, false, isPassRun()));
			onPostVisit("Ref", (visitor, node) ->
			{
				Ref ref = (Ref) node;
				depthsAtRefs.add(getCurrentScopeDepth());
				ref.set("target", scopedSymbolLookup(ref.getName()));
				return VisitResult.keep();
			});
		}
	}

	private static class LowercaseChecker extends DeclChecker
	{
		LowercaseChecker()
		{
			super(null);
		}

		@Override
		protected Pattern getIdentifierPattern()
		{
			return Pattern.compile("[a-z_]");
		}
	}

	@Test
	public void innerDeclarationShadowsOuter()
	{
		Decl outer = new Decl("x", new Num(1));
		Decl inner = new Decl("x", new Num(2));
		Ref insideRef = new Ref("x");
		Ref outsideRef = new Ref("x");
		Program program = new Program(outer, new Block(inner, insideRef), outsideRef);
		DeclChecker checker = new DeclChecker(null);

		checker.visit(program);

		assertThat(insideRef.getTarget()).isSameInstanceAs(inner);
		assertThat(outsideRef.getTarget()).isSameInstanceAs(outer);
		assertThat(checker.depthsAtRefs).containsExactly(1, 0).inOrder();
		assertThat(checker.isPassRun()).isTrue();
	}

	@Test
	public void enclosingScopesAreSearchedOutwards()
	{
		Decl y = new Decl("y", null);
		Ref ref = new Ref("y");
		Program program = new Program(new Block(y, new Block(new Block(ref))));
		DeclChecker checker = new DeclChecker(null);

		checker.visit(program);

		assertThat(ref.getTarget()).isSameInstanceAs(y);
		assertThat(checker.depthsAtRefs).containsExactly(3);
		assertThat(checker.getCurrentScopeDepth()).isEqualTo(0);
	}

	@Test
	public void unresolvedNameIsNull()
	{
		Ref ref = new Ref("nowhere");
		Ref early = new Ref("late");
		DeclChecker checker = new DeclChecker(null);

		checker.visit(new Program(ref, new Block(new Decl("nowhere", null)), early, new Decl("late", null)));

		assertThat(ref.getTarget()).isNull();
		assertThat(early.getTarget()).isNull();
	}

	@Test
	public void globalRedefinitionIsLocated()
	{
		String text = "x = 1\nx = 2\n";
		Decl first = new Decl("x", new Num(1));
		first.setPosition(0, 5);
		Decl second = new Decl("x", new Num(2));
		second.setPosition(6, 11);
		DeclChecker checker = new DeclChecker(text);

		CodedException e = assertThrows(CodedException.class, () -> checker.visit(new Program(first, second)));

		assertThat(e).isInstanceOf(SyntaxCheckException.class);
		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.GLOBAL_NAME_REDEFINED);
		assertThat(e).hasMessageThat().isEqualTo("at (2.1): re-definition of global name \"x\"");
	}

	@Test
	public void localRedefinitionWithoutPositionHasNoLocation()
	{
		DeclChecker checker = new DeclChecker("irrelevant");
		Block block = new Block(new Decl("y", null), new Decl("y", null));

		CodedException e = assertThrows(CodedException.class, () -> checker.visit(new Program(block)));

		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.LOCAL_NAME_REDEFINED);
		assertThat(e).hasMessageThat().isEqualTo("re-definition of local name \"y\"");
		assertThat(e.toString()).isEqualTo("(#11) re-definition of local name \"y\"");
	}

	@Test
	public void sameNameInSiblingScopesIsAllowed()
	{
		DeclChecker checker = new DeclChecker(null);

		checker.visit(new Program(new Block(new Decl("y", null)), new Block(new Decl("y", null))));

		assertThat(checker.symbolLookup("y")).hasSize(2);
	}

	@Test
	public void predefinedSymbolsAreGlobals()
	{
		Decl builtin = new Decl("print", null);
		DeclChecker checker = new DeclChecker(null, Map.of("print", builtin));
		Ref ref = new Ref("print");

		checker.visit(new Program(new Block(ref)));
		assertThat(checker.getGlobalSymbols()).containsEntry("print", builtin);

		DeclChecker clashing = new DeclChecker(null, Map.of("print", builtin));
		CodedException e = assertThrows(CodedException.class, () -> clashing.visit(new Program(new Decl("print", null))));
		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.GLOBAL_NAME_REDEFINED);
	}

	@Test
	public void invalidIdentifierIsRejected()
	{
		LowercaseChecker checker = new LowercaseChecker();

		CodedException e = assertThrows(CodedException.class, () -> checker.visit(new Program(new Decl("Bad", null))));

		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.INVALID_IDENTIFIER);
		assertThat(e).hasMessageThat().isEqualTo("invalid identifier: \"Bad\"");
		assertThat(checker.isValidIdentifier("good")).isTrue();
		assertThat(checker.isValidIdentifier(null)).isFalse();
		assertThat(new DeclChecker(null).isValidIdentifier("Anything goes")).isTrue();
	}

	@Test
	public void missingNameIsAnInvalidIdentifier()
	{
		LowercaseChecker checker = new LowercaseChecker();

		SyntaxCheckException e = assertThrows(SyntaxCheckException.class, () -> checker.collectSymbol(null, new Decl()));

		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.INVALID_IDENTIFIER);
		assertThat(e).hasMessageThat().isEqualTo("invalid identifier: \"null\"");
	}

	@Test
	public void autoCollectOfUnsetNameIsAnInvalidIdentifier()
	{
		SyntaxChecker checker = new SyntaxChecker(null)
		{
			{
				onPreVisit("Decl", SymbolCollectors.autoCollect("name", (visitor, node) -> { }));
			}

			@Override
			protected Pattern getIdentifierPattern()
			{
				return Pattern.compile("[a-z]");
			}
		};

		CodedException e = assertThrows(CodedException.class, () -> checker.visit(new Program(new Decl())));

		assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.INVALID_IDENTIFIER);
		assertThat(checker.getGlobalSymbols()).isEmpty();
	}

	@Test
	public void pauseInsideScopeStillClosesIt()
	{
		SyntaxChecker checker = new SyntaxChecker(null)
		{
			{
				onPreVisit("Num", (visitor, node) -> visitor.pauseVisiting());
			}
		};
		Block block = new Block(new Num(1));

		checker.visit(new Program(block));

		assertThat(checker.isPaused()).isTrue();
		assertThat(checker.getCurrentScopeDepth()).isEqualTo(0);
		assertThat(checker.getArchivedScopes()).hasSize(1);

		checker.resumeVisiting();
		Decl g = new Decl("g", null);
		checker.collectSymbol("g", g);
		assertThat(checker.getGlobalSymbols()).containsExactly("g", g);
	}

	@Test
	public void secondPassReusesArchivedScopes()
	{
		Decl inner = new Decl("z", null);
		Ref ref = new Ref("z");
		Block block = new Block(inner, ref);
		Program program = new Program(new Decl("g", null), block);
		DeclChecker checker = new DeclChecker(null);

		checker.check(program, true);
		Map<String, Map<String, Node>> firstReport = checker.reportSymbols();
		ref.set("target", null);
		checker.check(program, false);

		assertThat(ref.getTarget()).isSameInstanceAs(inner);
		assertThat(checker.reportSymbols()).isEqualTo(firstReport);
		assertThat(checker.getArchivedScopes()).hasSize(1);
		assertThat(checker.getArchivedScopes().get(0).getLocation()).isSameInstanceAs(block);
		assertThat(checker.getArchivedScopes().get(0).getEndLocation()).isSameInstanceAs(block);
	}

	@Test
	public void archivedScopeIsVisibleOnReentryBeforeDeclaration()
	{
		Ref early = new Ref("w");
		Decl decl = new Decl("w", null);
		Program program = new Program(new Block(early, decl));
		DeclChecker checker = new DeclChecker(null);

		checker.visit(program);
		assertThat(early.getTarget()).isNull();

		checker.visit(program);
		assertThat(early.getTarget()).isSameInstanceAs(decl);
	}

	@Test
	public void lookupsAcrossScopes()
	{
		Decl global = new Decl("x", null);
		Decl local = new Decl("x", null);
		Decl other = new Decl("other", null);
		Block block = new Block(local, other);
		DeclChecker checker = new DeclChecker(null);

		checker.visit(new Program(global, block));

		assertThat(checker.symbolLookup("x")).containsExactly(global, local).inOrder();
		assertThat(checker.symbolLookup("missing")).isEmpty();
		assertThat(checker.getNodeScope(local)).containsExactly("x", local, "other", other).inOrder();
		assertThat(checker.getNodeScope(global)).containsExactly("x", global);
		assertThat(checker.getNodeScope(new Num(1))).isNull();
		assertThat(checker.getGlobalSymbolsByType(Decl.class)).containsExactly("x", global);
		assertThat(checker.getGlobalSymbolsByType(Num.class)).isEmpty();
	}

	@Test
	public void reportListsGlobalsThenScopes()
	{
		Decl global = new Decl("g", null);
		Decl local = new Decl("l", null);
		Block block = new Block(local);
		DeclChecker checker = new DeclChecker(null);

		checker.visit(new Program(global, block));
		Map<String, Map<String, Node>> report = checker.reportSymbols();

		assertThat(report.keySet()).containsExactly("globals", "scope_" + block.describe()).inOrder();
		assertThat(report.get("globals")).containsExactly("g", global);
		assertThat(report.get("scope_" + block.describe())).containsExactly("l", local);
	}

	@Test
	public void swappedScopeFollowsNewNode()
	{
		Block block = new Block(new Decl("a", null));
		Program program = new Program(block);
		DeclChecker checker = new DeclChecker(null);
		checker.visit(program);
		Block replacement = new Block();

		checker.swapScopeNode(block, replacement);

		assertThat(checker.getArchivedScopes().get(0).getLocation()).isSameInstanceAs(replacement);
		assertThat(checker.reportSymbols()).containsKey("scope_" + replacement.describe());
		assertThrows(IllegalStateException.class, () -> checker.swapScopeNode(block, new Block()));
	}

	@Test
	public void clearedScopesAreCollectedAgain()
	{
		Program program = new Program(new Block(new Decl("a", null)));
		DeclChecker checker = new DeclChecker(null);
		checker.visit(program);

		checker.clearCollectedScopes();

		assertThat(checker.getArchivedScopes()).isEmpty();
		assertThat(checker.reportSymbols().keySet()).containsExactly("globals");
	}

	@Test
	public void copiesAreLocatedAtTheirOriginal()
	{
		DeclChecker checker = new DeclChecker("ab\ncd");
		Num num = new Num(1);
		num.setPosition(4, 5);
		Num copy = (Num) num.copy(null);
		Num unplaced = new Num(2);

		assertThat(checker.findNodeLine(num, null)).isEqualTo(new SourceLocation(2, 2));
		assertThat(checker.findNodeLine(copy, null)).isEqualTo(new SourceLocation(2, 2));
		assertThat(checker.findNodeLine(unplaced, null)).isNull();
		assertThat(checker.findNodeLine(unplaced, num)).isEqualTo(new SourceLocation(2, 2));
		assertThat(new DeclChecker(null).findNodeLine(num, null)).isNull();
	}

	@Test
	public void customErrorsUseTheAlternateLocation()
	{
		DeclChecker checker = new DeclChecker("abc");
		Num placed = new Num(1);
		placed.setPosition(1, 2);
		IllegalStateException cause = new IllegalStateException("root cause");

		SyntaxCheckException e = checker.getError(new Num(2), "something odd", SyntaxErrorCode.INVALID_IDENTIFIER, cause, placed);
		CodedException fromCode = checker.getErrorFromCode(new Num(3), SyntaxErrorCode.INVALID_IDENTIFIER, Map.of("id", "?"), placed,
				cause, "[", "]");

		assertThat(e).hasMessageThat().isEqualTo("at (1.2): something odd");
		assertThat(e).hasCauseThat().isSameInstanceAs(cause);
		assertThat(fromCode).hasMessageThat().isEqualTo("at (1.2): [invalid identifier: \"?\"]");
	}

	@Test
	public void autoCollectDeclaresVisitedNodes()
	{
		SyntaxChecker checker = new SyntaxChecker(null)
		{
			{
				onPreVisit("Decl", SymbolCollectors.autoCollect("name", (visitor, node) -> { }));
			}
		};
		Decl decl = new Decl("auto", null);

		checker.visit(new Program(decl));

		assertThat(checker.getGlobalSymbols()).containsExactly("auto", decl);
	}

	@Test
	public void autoCollectConditionalHonorsFlag()
	{
		SyntaxChecker checker = new SyntaxChecker(null, Map.of("collecting", false))
		{
			{
				onPreVisit("Decl", SymbolCollectors.autoCollectConditional("name", "collecting", (visitor, node) -> { }));
			}
		};
		Program program = new Program(new Decl("first", null));

		checker.visit(program);
		assertThat(checker.getGlobalSymbols()).isEmpty();

		checker.setFlag("collecting");
		checker.visit(program);
		assertThat(checker.getGlobalSymbols()).containsKey("first");
	}

	@Test
	public void autoCollectNeedsNameSlotAndChecker()
	{
		SyntaxChecker badSlot = new SyntaxChecker(null)
		{
			{
				onPreVisit("Decl", SymbolCollectors.autoCollect("label", (visitor, node) -> { }));
			}
		};
		Visitor plain = Visitor.builder()
				.pre("Decl", SymbolCollectors.autoCollect("name", (visitor, node) -> { }))
				.build();

		VisitException slotError = assertThrows(VisitException.class, () -> badSlot.visit(new Program(new Decl("a", null))));
		VisitException checkerError = assertThrows(VisitException.class, () -> plain.visit(new Program(new Decl("a", null))));

		assertThat(slotError.findEmbeddedException()).isInstanceOf(IllegalArgumentException.class);
		assertThat(checkerError.findEmbeddedException()).isInstanceOf(IllegalStateException.class);
	}
}
