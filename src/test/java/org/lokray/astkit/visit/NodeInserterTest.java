package org.lokray.astkit.visit;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lokray.astkit.fixture.Block;
import org.lokray.astkit.fixture.Decl;
import org.lokray.astkit.fixture.Num;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

@RunWith(JUnit4.class)
public class NodeInserterTest
{
	@Test
	public void insertsAfterTarget()
	{
		Num one = new Num(1);
		Num two = new Num(2);
		Num added = new Num(9);
		Block block = new Block(one, two);

		boolean found = new NodeInserter(block).insert(added, one, true);

		assertThat(found).isTrue();
		assertThat(block.getBody()).containsExactly(one, added, two).inOrder();
		assertThat(added.getParent()).isSameInstanceAs(block);
	}

	@Test
	public void insertsSeveralBeforeTarget()
	{
		Num one = new Num(1);
		Num two = new Num(2);
		Num a = new Num(7);
		Num b = new Num(8);
		Block inner = new Block(one, two);
		Block outer = new Block(inner);

		boolean found = new NodeInserter(outer).insert(List.of(a, b), two, false);

		assertThat(found).isTrue();
		assertThat(inner.getBody()).containsExactly(one, a, b, two).inOrder();
	}

	@Test
	public void reportsMissingTarget()
	{
		Block block = new Block(new Num(1));

		assertThat(new NodeInserter(block).insert(new Num(2), new Num(3), true)).isFalse();
		assertThat(block.getBody()).hasSize(1);
	}

	@Test
	public void targetMustSitInSequence()
	{
		Num value = new Num(1);
		Block block = new Block(new Decl("x", value));

		VisitException e = assertThrows(VisitException.class, () -> new NodeInserter(block).insert(new Num(2), value, true));

		assertThat(e.findEmbeddedException()).isInstanceOf(IllegalStateException.class);
	}

	@Test
	public void inserterIsReusable()
	{
		Num one = new Num(1);
		Block block = new Block(one);
		NodeInserter inserter = new NodeInserter(block);
		Num last = new Num(3);

		inserter.insert(last, one, true);
		inserter.insert(new Num(2), last, false);

		assertThat(block.getBody()).hasSize(3);
		assertThat(block.getBody().get(2)).isSameInstanceAs(last);
	}
}
