package org.metricshub.tinyscript;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.tinyscript.util.TinySettings;

/**
 * Reusable helpers for building and executing TinyScript tests. The fluent
 * builders ({@link #tinyTest(String)} and {@link #cliTest(String)}) let tests
 * describe their script, settings and expectations declaratively, then
 * capture the output of either {@link TinyScript} or {@link Main}.
 */
public final class TinyScriptTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("tinyscript-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private TinyScriptTestSupport() {}

	/**
	 * Creates a builder for a test that exercises the {@link TinyScript} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static TinyTestBuilder tinyTest(String description) {
		return new TinyTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that exercises the command line through
	 * {@link Main#invoke(String[], PrintStream, PrintStream)}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Writes a file in the shared temporary directory.
	 *
	 * @param name file name
	 * @param content UTF-8 content
	 * @return the path of the written file
	 * @throws IOException if the file cannot be written
	 */
	public static Path tempFile(String name, String content) throws IOException {
		Path path = SHARED_TEMP_DIR.resolve(name);
		Files.write(path, content.getBytes(StandardCharsets.UTF_8));
		path.toFile().deleteOnExit();
		return path;
	}

	/**
	 * @param name file name
	 * @return a path in the shared temporary directory, not created
	 */
	public static Path tempPath(String name) {
		Path path = SHARED_TEMP_DIR.resolve(name);
		path.toFile().deleteOnExit();
		return path;
	}

	/**
	 * Captures the outcome of a test: standard output, standard error, exit
	 * code and exception, along with the expectations of the builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final int exitCode;
		private final Throwable thrownException;
		private final BaseTestBuilder<?> expectations;

		TestResult(
				String description,
				String output,
				String errorOutput,
				int exitCode,
				Throwable thrownException,
				BaseTestBuilder<?> expectations) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.exitCode = exitCode;
			this.thrownException = thrownException;
			this.expectations = expectations;
		}

		public String output() {
			return output;
		}

		public String errorOutput() {
			return errorOutput;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @return the output split into lines, line separators normalised
		 */
		public List<String> lines() {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}

		/**
		 * Verifies the captured result against the expectations of the builder.
		 */
		public void assertExpected() {
			if (expectations.expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.expectedException.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expectations.expectedException.isInstance(thrownException)) {
					AssertionError error = new AssertionError(
							"Expected exception "
									+ expectations.expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName());
					error.initCause(thrownException);
					throw error;
				}
				return;
			}
			if (thrownException != null) {
				AssertionError error = new AssertionError("Unexpected exception for " + description);
				error.initCause(thrownException);
				throw error;
			}
			if (expectations.expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectations.expectedLines, lines());
			}
			if (expectations.expectedErrorFragment != null && !errorOutput.contains(expectations.expectedErrorFragment)) {
				throw new AssertionError(
						"Expected standard error of "
								+ description
								+ " to contain <"
								+ expectations.expectedErrorFragment
								+ "> but was <"
								+ errorOutput
								+ ">");
			}
			int expectedExitCode = expectations.expectedExitCode != null ? expectations.expectedExitCode.intValue() : 0;
			assertEquals("Unexpected exit code for " + description, expectedExitCode, exitCode);
		}
	}

	/**
	 * Shared configuration of the builders.
	 *
	 * @param <B> the builder type used for fluent chaining
	 */
	private abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script;
		protected List<String> expectedLines;
		protected Integer expectedExitCode;
		protected String expectedErrorFragment;
		protected Class<? extends Throwable> expectedException;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		public B script(String scriptParam) {
			this.script = scriptParam;
			return (B) this;
		}

		/**
		 * Expects the printed output, one entry per line.
		 *
		 * @param lines expected lines
		 * @return this builder for method chaining
		 */
		@SuppressWarnings("unchecked")
		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return (B) this;
		}

		/**
		 * Expects one <code>Output: n</code> line per value, in order.
		 *
		 * @param values expected printed values
		 * @return this builder for method chaining
		 */
		@SuppressWarnings("unchecked")
		public B expectPrinted(long... values) {
			List<String> lines = new ArrayList<String>();
			for (long value : values) {
				lines.add("Output: " + value);
			}
			this.expectedLines = lines;
			return (B) this;
		}

		@SuppressWarnings("unchecked")
		public B expectExit(int code) {
			this.expectedExitCode = code;
			return (B) this;
		}

		@SuppressWarnings("unchecked")
		public B expectError(String fragment) {
			this.expectedErrorFragment = fragment;
			return (B) this;
		}

		@SuppressWarnings("unchecked")
		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return (B) this;
		}

		/**
		 * Executes the test and returns the captured result without asserting it.
		 *
		 * @return the captured result
		 * @throws Exception when the execution fails unexpectedly
		 */
		public abstract TestResult run() throws Exception;

		/**
		 * Executes the test and asserts the expectations.
		 *
		 * @throws Exception when the execution fails unexpectedly
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Fluent builder for tests that run a script through {@link TinyScript}.
	 */
	public static final class TinyTestBuilder extends BaseTestBuilder<TinyTestBuilder> {
		private final TinySettings settings = new TinySettings();

		private TinyTestBuilder(String description) {
			super(description);
		}

		public TinyTestBuilder stackCapacity(int capacity) {
			settings.setStackCapacity(capacity);
			return this;
		}

		public TinyTestBuilder strict() {
			settings.setStrictVariables(true);
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			PrintStream ps = new PrintStream(out, true, StandardCharsets.UTF_8);
			settings.setOutputStream(ps);
			Throwable thrown = null;
			try {
				new TinyScript(settings).invoke(script);
			} catch (RuntimeException e) {
				thrown = e;
			}
			ps.flush();
			return new TestResult(description, out.toString(StandardCharsets.UTF_8), "", 0, thrown, this);
		}
	}

	/**
	 * Fluent builder for tests that run the command line. The script, if any,
	 * is appended as the inline script argument.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<String>();

		private CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			List<String> args = new ArrayList<String>(arguments);
			if (script != null) {
				args.add(script);
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
			PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);
			int exitCode = Main.invoke(args.toArray(new String[0]), outStream, errStream);
			outStream.flush();
			errStream.flush();
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8),
					err.toString(StandardCharsets.UTF_8),
					exitCode,
					null,
					this);
		}
	}
}
