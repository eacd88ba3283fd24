package works.bpc.tokenizer;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bpc.tokenizer.SourceEvent.CommentEvent;
import works.bpc.tokenizer.SourceEvent.FinishEvent;
import works.bpc.tokenizer.SourceEvent.InstructionEvent;

import static java.util.Objects.requireNonNull;

/**
 * Splits source text into {@link SourceEvent events} and pushes each one,
 * synchronously and in source order, to the listeners registered for its {@link EventKind kind}.
 * <p>
 * Listeners of the same kind are called in registration order.
 * A tokenizer can be run more than once; each run ends with exactly one {@link FinishEvent}.
 */
public final class Tokenizer {
	private final List<InstructionListener> instructionListeners = new ArrayList<>();
	private final List<CommentListener> commentListeners = new ArrayList<>();
	private final List<FinishListener> finishListeners = new ArrayList<>();

	public void registerInstructionListener(InstructionListener listener) {
		instructionListeners.add(requireNonNull(listener));
	}

	public void registerCommentListener(CommentListener listener) {
		commentListeners.add(requireNonNull(listener));
	}

	public void registerFinishListener(FinishListener listener) {
		finishListeners.add(requireNonNull(listener));
	}

	public int listenerCount(EventKind kind) {
		return switch (kind) {
			case INSTRUCTION -> instructionListeners.size();
			case COMMENT -> commentListeners.size();
			case FINISH -> finishListeners.size();
		};
	}

	/**
	 * Scans {@code source} once, left to right.
	 *
	 * @return the number of instructions found
	 */
	public int tokenize(CharSequence source) {
		LOGGER.trace("Tokenizing {} characters for {}/{}/{} listeners",
			source.length(), instructionListeners.size(), commentListeners.size(), finishListeners.size());
		int length = source.length();
		int line = 1;
		int column = 1;
		int instructionCount = 0;
		int i = 0;
		while (i < length) {
			Instruction instruction = Instruction.forSymbol(source.charAt(i));
			if (instruction != null) {
				fire(new InstructionEvent(instruction, new SourcePosition(i, line, column)));
				instructionCount++;
				column++;
				i++;
			} else {
				int start = i;
				do {
					if (source.charAt(i) == '\n') {
						line++;
						column = 1;
					} else {
						column++;
					}
					i++;
				} while (i < length && Instruction.forSymbol(source.charAt(i)) == null);
				if (!commentListeners.isEmpty()) {
					fire(new CommentEvent(source.subSequence(start, i).toString(), start, i));
				}
			}
		}
		fire(new FinishEvent(new SourcePosition(length, line, column)));
		return instructionCount;
	}

	private void fire(InstructionEvent event) {
		for (InstructionListener listener : instructionListeners) {
			listener.onInstruction(event);
		}
	}

	private void fire(CommentEvent event) {
		for (CommentListener listener : commentListeners) {
			listener.onComment(event);
		}
	}

	private void fire(FinishEvent event) {
		for (FinishListener listener : finishListeners) {
			listener.onFinish(event);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Tokenizer.class);
}
