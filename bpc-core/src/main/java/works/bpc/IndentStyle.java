package works.bpc;

public enum IndentStyle {
	SPACES(' '),
	TABS('\t');

	private final char character;

	IndentStyle(char character) {
		this.character = character;
	}

	public char character() {
		return character;
	}
}
