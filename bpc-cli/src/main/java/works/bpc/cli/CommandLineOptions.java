package works.bpc.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import works.bpc.CompilerSettings;
import works.bpc.IndentStyle;

/**
 * The command-line interface: which options exist, and how they map onto {@link CompilerSettings}.
 */
final class CommandLineOptions {
	static final String STANDARD_STREAM = "-";
	static final String DEFAULT_OUTPUT = "a.py";

	private CommandLineOptions() { }

	/**
	 * What the user asked for.
	 *
	 * @param input path of the source file, or {@value #STANDARD_STREAM} for standard input
	 * @param output path of the generated file, or {@value #STANDARD_STREAM} for standard output
	 */
	record Invocation(String input, String output, CompilerSettings settings, boolean help) { }

	static Options options() {
		return new Options()
			.addOption(Option.builder("o").longOpt("output").hasArg().argName("FILE")
				.desc("Compiled python file name or '-' for stdout (default " + DEFAULT_OUTPUT + ")").build())
			.addOption(Option.builder("m").longOpt("memory").hasArg().argName("N")
				.desc("The size of the memory used by the program (default " + CompilerSettings.DEFAULT.memorySize() + ")").build())
			.addOption(Option.builder("c").longOpt("comments")
				.desc("Include comments in generated file").build())
			.addOption(Option.builder().longOpt("no-comments")
				.desc("Leave comments out of the generated file (default)").build())
			.addOption(Option.builder("d").longOpt("dump")
				.desc("Dump the memory and the pointer at the end of the program").build())
			.addOption(Option.builder().longOpt("no-dump")
				.desc("Don't dump the memory (default)").build())
			.addOption(Option.builder("i").longOpt("indent").hasArg().argName("N")
				.desc("Number of characters used to indent the code (default " + CompilerSettings.DEFAULT.indentWidth() + ")").build())
			.addOption(Option.builder("t").longOpt("tab-indent")
				.desc("Indent with tabs").build())
			.addOption(Option.builder().longOpt("space-indent")
				.desc("Indent with spaces (default)").build())
			.addOption(Option.builder("O").longOpt("optimizations").hasArg().argName("LEVEL")
				.desc("Optimization level: 0, 1 or 2 (default " + CompilerSettings.DEFAULT.optimizationLevel() + ")").build())
			.addOption(Option.builder("h").longOpt("help")
				.desc("Show this message").build());
	}

	/**
	 * Numeric values are parsed here, but range checks are left to
	 * {@link CompilerSettings#validate()} so they are reported the same way as for library callers.
	 *
	 * @throws ParseException if the arguments can't be understood
	 */
	static Invocation parse(String... args) throws ParseException {
		CommandLine cmd = new DefaultParser().parse(options(), args);
		if (cmd.hasOption("help")) {
			return new Invocation(null, null, CompilerSettings.DEFAULT, true);
		}

		String[] positional = cmd.getArgs();
		if (positional.length != 1) {
			throw new ParseException("Expected exactly one input file but got " + positional.length);
		}

		CompilerSettings defaults = CompilerSettings.DEFAULT;
		CompilerSettings settings = new CompilerSettings(
			intValue(cmd, "memory", defaults.memorySize()),
			intValue(cmd, "indent", defaults.indentWidth()),
			flag(cmd, "tab-indent", "space-indent", false) ? IndentStyle.TABS : IndentStyle.SPACES,
			flag(cmd, "comments", "no-comments", defaults.comments()),
			flag(cmd, "dump", "no-dump", defaults.dumpMemory()),
			intValue(cmd, "optimizations", defaults.optimizationLevel())
		);
		return new Invocation(positional[0], cmd.getOptionValue("output", DEFAULT_OUTPUT), settings, false);
	}

	private static int intValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
		String value = cmd.getOptionValue(option);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			ParseException parseException = new ParseException("Option --" + option + " expects an integer, not \"" + value + "\"");
			parseException.initCause(e);
			throw parseException;
		}
	}

	/**
	 * A {@code --x/--no-x} pair. If both are given, the negative one wins.
	 */
	private static boolean flag(CommandLine cmd, String positive, String negative, boolean defaultValue) {
		if (cmd.hasOption(negative)) {
			return false;
		} else if (cmd.hasOption(positive)) {
			return true;
		} else {
			return defaultValue;
		}
	}
}
