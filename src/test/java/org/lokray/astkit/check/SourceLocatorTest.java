package org.lokray.astkit.check;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static com.google.common.truth.Truth.assertThat;

@RunWith(JUnit4.class)
public class SourceLocatorTest
{
	private final SourceLocator locator = new SourceLocator("ab\ncd\n\nef");

	@Test
	public void firstLine()
	{
		assertThat(locator.locate(0)).isEqualTo(new SourceLocation(1, 1));
		assertThat(locator.locate(1)).isEqualTo(new SourceLocation(1, 2));
	}

	@Test
	public void newlineBelongsToItsLine()
	{
		assertThat(locator.locate(2)).isEqualTo(new SourceLocation(1, 3));
	}

	@Test
	public void laterLines()
	{
		assertThat(locator.locate(3)).isEqualTo(new SourceLocation(2, 1));
		assertThat(locator.locate(6)).isEqualTo(new SourceLocation(3, 1));
		assertThat(locator.locate(8)).isEqualTo(new SourceLocation(4, 2));
		assertThat(locator.getLineCount()).isEqualTo(4);
	}

	@Test
	public void endOfTextIsLocatable()
	{
		assertThat(locator.locate(9)).isEqualTo(new SourceLocation(4, 3));
	}

	@Test
	public void outOfRangeIsNull()
	{
		assertThat(locator.locate(-1)).isNull();
		assertThat(locator.locate(10)).isNull();
		assertThat(new SourceLocator(null).locate(1)).isNull();
	}

	@Test
	public void rendersAsLineDotColumn()
	{
		assertThat(new SourceLocation(3, 14).toString()).isEqualTo("3.14");
	}
}
