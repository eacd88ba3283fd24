package works.bpc.tokenizer;

import works.bpc.tokenizer.SourceEvent.FinishEvent;

@FunctionalInterface
public interface FinishListener {
	void onFinish(FinishEvent event);
}
