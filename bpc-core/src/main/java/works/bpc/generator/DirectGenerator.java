package works.bpc.generator;

import works.bpc.tokenizer.Instruction;
import works.bpc.tokenizer.SourceEvent.CommentEvent;
import works.bpc.tokenizer.SourceEvent.FinishEvent;
import works.bpc.tokenizer.SourceEvent.InstructionEvent;

/**
 * Optimization level 0: one statement per instruction.
 * This is the reference translation the other levels must agree with.
 */
final class DirectGenerator implements CodeGenerator {
	private final StatementWriter writer;

	DirectGenerator(StatementWriter writer) {
		this.writer = writer;
	}

	@Override
	public void onInstruction(InstructionEvent event) {
		Instruction instruction = event.instruction();
		switch (instruction) {
			case INCREMENT, DECREMENT -> writer.addToCell(0, instruction.delta());
			case MOVE_LEFT, MOVE_RIGHT -> writer.movePointer(instruction.delta());
			default -> writer.unfused(event);
		}
	}

	@Override
	public void onComment(CommentEvent event) {
		writer.comment(event);
	}

	@Override
	public void onFinish(FinishEvent event) {
		writer.finish();
	}
}
