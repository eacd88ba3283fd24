package works.bpc.tokenizer;

import works.bpc.tokenizer.SourceEvent.InstructionEvent;

@FunctionalInterface
public interface InstructionListener {
	void onInstruction(InstructionEvent event);
}
