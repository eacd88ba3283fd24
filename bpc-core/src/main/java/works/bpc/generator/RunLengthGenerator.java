package works.bpc.generator;

import works.bpc.tokenizer.Instruction;
import works.bpc.tokenizer.SourceEvent.CommentEvent;
import works.bpc.tokenizer.SourceEvent.FinishEvent;
import works.bpc.tokenizer.SourceEvent.InstructionEvent;

/**
 * Optimization level 1: a run of identical {@link Instruction#isAccumulable accumulable}
 * instructions becomes a single statement. {@code +++} becomes {@code m[p] += 3},
 * and {@code <<<<} becomes {@code p = (p - 4) % n}.
 * <p>
 * Comments do not end a run, so turning comments on or off never changes the statements.
 */
final class RunLengthGenerator implements CodeGenerator {
	private final StatementWriter writer;
	private final InstructionRun run = new InstructionRun();

	RunLengthGenerator(StatementWriter writer) {
		this.writer = writer;
	}

	@Override
	public void onInstruction(InstructionEvent event) {
		Instruction instruction = event.instruction();
		if (run.extend(instruction)) {
			return;
		}
		run.flush(this::flushRun);
		if (instruction.isAccumulable()) {
			run.start(instruction);
		} else {
			writer.unfused(event);
		}
	}

	private void flushRun(Instruction instruction, int count) {
		int amount = Math.multiplyExact(instruction.delta(), count);
		if (instruction.isMove()) {
			writer.movePointer(amount);
		} else {
			writer.addToCell(0, amount);
		}
	}

	@Override
	public void onComment(CommentEvent event) {
		writer.comment(event);
	}

	@Override
	public void onFinish(FinishEvent event) {
		run.flush(this::flushRun);
		writer.finish();
	}
}
