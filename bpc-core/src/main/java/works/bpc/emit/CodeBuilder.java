package works.bpc.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import works.bpc.exceptions.StructuralException;

import static java.util.Objects.requireNonNull;

/**
 * Accumulates lines of generated code, prefixing each with the current indentation.
 * <p>
 * Make one of these per compilation. Blocks are opened and closed explicitly
 * with {@link #startBlock()} and {@link #endBlock()};
 * the builder never infers structure from the text it is given.
 */
public final class CodeBuilder {
	private final List<String> lines = new ArrayList<>();
	private final int indentWidth;
	private final char indentChar;
	private final String commentMarker;
	private int indentation = 0;

	/**
	 * @param indentWidth number of {@code indentChar}s per block level
	 * @param commentMarker lines starting with this (after leading whitespace) are comments
	 */
	public CodeBuilder(int indentWidth, char indentChar, String commentMarker) {
		if (indentWidth <= 0) {
			throw new IllegalArgumentException("Indentation width must be positive: " + indentWidth);
		}
		this.indentWidth = indentWidth;
		this.indentChar = indentChar;
		this.commentMarker = requireNonNull(commentMarker);
	}

	public void startBlock() {
		indentation += indentWidth;
	}

	/**
	 * @throws StructuralException if no block is open
	 */
	public void endBlock() {
		if (indentation < indentWidth) {
			throw new StructuralException("Block closed at the top level");
		}
		indentation -= indentWidth;
	}

	/**
	 * Adds one line per line of {@code text}, each at the current indentation.
	 */
	public void append(String text) {
		String prefix = String.valueOf(indentChar).repeat(indentation);
		for (String line : text.split("\n", -1)) {
			lines.add(prefix + line);
		}
	}

	/**
	 * @return the current indentation, in characters; always a multiple of the indentation width
	 */
	public int indentation() {
		return indentation;
	}

	/**
	 * @return the number of blocks currently open
	 */
	public int depth() {
		return indentation / indentWidth;
	}

	public boolean isAtTopLevel() {
		return indentation == 0;
	}

	public List<String> lines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return the number of lines that are not comments
	 */
	public int statementCount() {
		int result = 0;
		for (String line : lines) {
			if (!isComment(line)) {
				result++;
			}
		}
		return result;
	}

	public boolean isComment(String line) {
		return line.stripLeading().startsWith(commentMarker);
	}

	/**
	 * Joins the lines, separating each group of consecutive comment lines
	 * from whatever precedes it with one blank line.
	 * Other lines come out exactly as they were appended.
	 */
	public String render() {
		StringBuilder sb = new StringBuilder();
		boolean previousWasComment = false;
		boolean first = true;
		for (String line : lines) {
			boolean comment = isComment(line);
			if (!first) {
				sb.append('\n');
				if (comment && !previousWasComment) {
					sb.append('\n');
				}
			}
			sb.append(line);
			previousWasComment = comment;
			first = false;
		}
		return sb.toString();
	}
}
