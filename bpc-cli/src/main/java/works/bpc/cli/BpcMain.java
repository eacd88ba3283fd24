package works.bpc.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bpc.BpcCompiler;
import works.bpc.CompilationResult;
import works.bpc.cli.CommandLineOptions.Invocation;
import works.bpc.exceptions.CompilationException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static works.bpc.cli.CommandLineOptions.STANDARD_STREAM;

/**
 * Compiles one source file into a Python program.
 * <p>
 * Exit status is 0 on success, 1 if the program or settings are invalid or
 * a file can't be read or written, and 2 if the command line itself is malformed.
 */
public final class BpcMain {
	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private final InputStream stdin;
	private final PrintStream stdout;
	private final PrintStream stderr;

	BpcMain(InputStream stdin, PrintStream stdout, PrintStream stderr) {
		this.stdin = stdin;
		this.stdout = stdout;
		this.stderr = stderr;
	}

	public static void main(String[] args) {
		System.exit(new BpcMain(System.in, System.out, System.err).run(args));
	}

	int run(String... args) {
		Invocation invocation;
		try {
			invocation = CommandLineOptions.parse(args);
		} catch (ParseException e) {
			stderr.println("error: " + e.getMessage());
			printUsage(stderr);
			return USAGE;
		}
		if (invocation.help()) {
			printUsage(stdout);
			return OK;
		}

		try {
			String source = readSource(invocation.input());
			CompilationResult result = compile(invocation, source);
			writeCode(invocation.output(), result.code());
			LOGGER.info("Compiled {} instructions from {} into {} statements in {}",
				result.instructions(), invocation.input(), result.statements(), invocation.output());
			return OK;
		} catch (CompilationException e) {
			stderr.println("error: " + e.getMessage());
			return FAILED;
		} catch (IOException e) {
			LOGGER.debug("I/O failure", e);
			stderr.println("error: " + e);
			return FAILED;
		}
	}

	private static CompilationResult compile(Invocation invocation, String source) {
		try {
			return BpcCompiler.using(invocation.settings()).compileWithStatistics(source);
		} catch (CompilationException e) {
			throw CompilationException.wrap(e, invocation.input());
		}
	}

	private String readSource(String input) throws IOException {
		if (STANDARD_STREAM.equals(input)) {
			return new String(stdin.readAllBytes(), UTF_8);
		} else {
			return Files.readString(Path.of(input), UTF_8);
		}
	}

	private void writeCode(String output, String code) throws IOException {
		String text = code + "\n";
		if (STANDARD_STREAM.equals(output)) {
			stdout.print(text);
			stdout.flush();
		} else {
			Files.writeString(Path.of(output), text, UTF_8);
		}
	}

	private static void printUsage(PrintStream out) {
		PrintWriter writer = new PrintWriter(out);
		new HelpFormatter().printHelp(
			writer,
			HelpFormatter.DEFAULT_WIDTH,
			"bpc [OPTIONS] INPUT",
			"Compile INPUT ('-' for stdin) into a Python program.",
			CommandLineOptions.options(),
			HelpFormatter.DEFAULT_LEFT_PAD,
			HelpFormatter.DEFAULT_DESC_PAD,
			null);
		writer.flush();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BpcMain.class);
}
