package works.bpc.tokenizer;

/**
 * Something the {@link Tokenizer} found in the source.
 * Events are delivered in source order, and {@link FinishEvent} comes exactly once, last.
 */
public sealed interface SourceEvent {
	EventKind kind();

	record InstructionEvent(Instruction instruction, SourcePosition position) implements SourceEvent {
		@Override
		public EventKind kind() {
			return EventKind.INSTRUCTION;
		}

		public int offset() {
			return position.offset();
		}
	}

	/**
	 * A maximal run of characters that are not instructions.
	 *
	 * @param start offset of the first character
	 * @param end offset just past the last character
	 */
	record CommentEvent(String text, int start, int end) implements SourceEvent {
		@Override
		public EventKind kind() {
			return EventKind.COMMENT;
		}
	}

	/**
	 * @param end the position just past the last character of the source
	 */
	record FinishEvent(SourcePosition end) implements SourceEvent {
		@Override
		public EventKind kind() {
			return EventKind.FINISH;
		}
	}
}
