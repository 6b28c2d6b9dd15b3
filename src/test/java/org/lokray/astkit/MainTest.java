package org.lokray.astkit;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lokray.astkit.fixture.Block;
import org.lokray.astkit.fixture.Num;
import org.lokray.astkit.util.Debug;
import org.lokray.astkit.util.ErrorHandler;
import org.lokray.astkit.visit.Visitor;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static com.google.common.truth.Truth.assertThat;

@RunWith(JUnit4.class)
public class MainTest
{
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@Before
	public void captureOutput()
	{
		Debug.redirect(new PrintStream(out, true), new PrintStream(err, true));
	}

	@After
	public void resetDebug()
	{
		Debug.reset();
	}

	private String output()
	{
		return out.toString(StandardCharsets.UTF_8);
	}

	private String errors()
	{
		return err.toString(StandardCharsets.UTF_8);
	}

	private File write(String name, String text) throws Exception
	{
		File file = tmp.newFile(name);
		Files.writeString(file.toPath(), text, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void validMachinePasses() throws Exception
	{
		File file = write("ok.sm", "events go GOGO end\nstate A go => B end\nstate B end\n");
		File report = new File(tmp.getRoot(), "report.json");

		int code = Main.run(new String[]{file.getPath(), "-r", report.getPath()});

		assertThat(code).isEqualTo(0);
		assertThat(report.exists()).isTrue();
		assertThat(output()).contains(String.join(System.lineSeparator(), "state A", "  go => B", "state B"));
		assertThat(output()).contains("Check passed: " + file.getPath());
	}

	@Test
	public void checkErrorFails() throws Exception
	{
		File file = write("loop.sm", "events go GOGO end\nstate A go => A end\n");

		assertThat(Main.run(new String[]{file.getPath()})).isEqualTo(1);
		assertThat(errors()).contains("[Check Error] " + file.getPath() + " - (#err2) at (2.9): In state A: event go has no effect");
	}

	@Test
	public void visitOnlySkipsChecks() throws Exception
	{
		File file = write("loop.sm", "events go GOGO end\nstate A go => A end\n");

		assertThat(Main.run(new String[]{"--visit", "-v", file.getPath()})).isEqualTo(0);
		assertThat(output()).contains("  go => A");
		assertThat(output()).doesNotContain("Check passed");
	}

	@Test
	public void unparsableFileFails() throws Exception
	{
		File file = write("bad.sm", "state A\n");

		assertThat(Main.run(new String[]{file.getPath()})).isEqualTo(1);
		assertThat(errors()).contains("[Syntax Error] " + file.getPath());
	}

	@Test
	public void failingHandlerIsReported()
	{
		Visitor visitor = Visitor.builder()
				.post("Num", (v, node) ->
				{
					throw new IllegalStateException("broken handler");
				})
				.build();
		ErrorHandler errorHandler = new ErrorHandler();

		boolean completed = Main.visitReported(visitor, new Block(new Num(1)), "inline", errorHandler);

		assertThat(completed).isFalse();
		assertThat(errorHandler.getErrors()).containsExactly("[Check Error] inline - error while visiting: broken handler");
		assertThat(errors()).contains("broken handler");
	}

	@Test
	public void usageErrors()
	{
		assertThat(Main.run(new String[]{"--help"})).isEqualTo(0);
		assertThat(Main.run(new String[]{"--version"})).isEqualTo(0);
		assertThat(output()).contains("USAGE: astkit [options] file");
		assertThat(output()).contains("astkit version " + Main.VERSION);
		assertThat(Main.run(new String[]{"--bogus"})).isEqualTo(2);
		assertThat(Main.run(new String[]{"-v"})).isEqualTo(2);
		assertThat(Main.run(new String[]{new File(tmp.getRoot(), "missing.sm").getPath()})).isEqualTo(2);
	}
}
