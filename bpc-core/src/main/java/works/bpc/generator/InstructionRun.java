package works.bpc.generator;

import works.bpc.tokenizer.Instruction;

/**
 * A pending run of one {@link Instruction#isAccumulable accumulable} instruction.
 */
final class InstructionRun {
	private Instruction instruction = null;
	private int count = 0;

	/**
	 * What to do with a run once it has ended.
	 * This is where the optimization levels differ.
	 */
	@FunctionalInterface
	interface Flusher {
		void flush(Instruction instruction, int count);
	}

	/**
	 * @return true if {@code next} continues this run, in which case it has been counted
	 */
	boolean extend(Instruction next) {
		if (next.isAccumulable() && next == instruction) {
			count++;
			return true;
		} else {
			return false;
		}
	}

	void start(Instruction first) {
		assert first.isAccumulable();
		assert count == 0: "Must flush before starting a new run";
		instruction = first;
		count = 1;
	}

	/**
	 * Hands the run, if any, to {@code flusher} and leaves this empty.
	 */
	void flush(Flusher flusher) {
		if (instruction != null && count > 0) {
			flusher.flush(instruction, count);
		}
		instruction = null;
		count = 0;
	}

	boolean isEmpty() {
		return count == 0;
	}
}
