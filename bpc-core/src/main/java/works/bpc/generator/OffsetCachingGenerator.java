package works.bpc.generator;

import works.bpc.tokenizer.Instruction;
import works.bpc.tokenizer.SourceEvent.CommentEvent;
import works.bpc.tokenizer.SourceEvent.FinishEvent;
import works.bpc.tokenizer.SourceEvent.InstructionEvent;

/**
 * Optimization level 2: runs are fused as in level 1, and pointer movement is
 * deferred. Between loop boundaries, cells are addressed relative to the pointer
 * variable, so {@code >+>+} becomes {@code m[(p + 1) % n] += 1; m[(p + 2) % n] += 1}
 * with no pointer assignment at all.
 * <p>
 * The deferred offset is committed to the pointer variable
 * right before each loop opens, right before each loop closes, and at the end,
 * because a loop condition must test the cell under the real pointer.
 */
final class OffsetCachingGenerator implements CodeGenerator {
	private final StatementWriter writer;
	private final InstructionRun run = new InstructionRun();
	private PointerOffset offset = PointerOffset.ZERO;

	OffsetCachingGenerator(StatementWriter writer) {
		this.writer = writer;
	}

	@Override
	public void onInstruction(InstructionEvent event) {
		Instruction instruction = event.instruction();
		if (run.extend(instruction)) {
			return;
		}
		run.flush(this::flushRun);
		switch (instruction) {
			case INCREMENT, DECREMENT, MOVE_LEFT, MOVE_RIGHT -> run.start(instruction);
			case READ -> writer.read(offset.value());
			case WRITE -> writer.write(offset.value());
			case LOOP_OPEN -> {
				commit();
				writer.openLoop(event.position());
			}
			case LOOP_CLOSE -> {
				commit();
				writer.closeLoop(event.position());
			}
		}
	}

	private void flushRun(Instruction instruction, int count) {
		int amount = Math.multiplyExact(instruction.delta(), count);
		if (instruction.isMove()) {
			offset = offset.plus(amount);
		} else {
			writer.addToCell(offset.value(), amount);
		}
	}

	private void commit() {
		PointerOffset.Commit commit = offset.commit(writer.memorySize());
		commit.statement().ifPresent(writer::emit);
		offset = commit.remaining();
	}

	@Override
	public void onComment(CommentEvent event) {
		writer.comment(event);
	}

	@Override
	public void onFinish(FinishEvent event) {
		run.flush(this::flushRun);
		commit();
		writer.finish();
	}

	PointerOffset pendingOffset() {
		return offset;
	}
}
