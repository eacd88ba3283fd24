package works.bpc.tokenizer;

public enum EventKind {
	INSTRUCTION,
	COMMENT,
	FINISH,
}
