package works.bpc.tokenizer;

/**
 * @param offset zero-based character index into the source
 * @param line one-based
 * @param column one-based
 */
public record SourcePosition(int offset, int line, int column) {
	public static final SourcePosition START = new SourcePosition(0, 1, 1);

	@Override
	public String toString() {
		return "line " + line + ", column " + column;
	}
}
