package works.bpc.tokenizer;

import works.bpc.tokenizer.SourceEvent.CommentEvent;

@FunctionalInterface
public interface CommentListener {
	void onComment(CommentEvent event);
}
