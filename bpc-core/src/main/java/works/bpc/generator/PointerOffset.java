package works.bpc.generator;

import java.util.Optional;

/**
 * Pointer movement that has been compiled but not yet assigned to the pointer variable.
 */
record PointerOffset(int value) {
	static final PointerOffset ZERO = new PointerOffset(0);

	PointerOffset plus(int delta) {
		return new PointerOffset(Math.addExact(value, delta));
	}

	/**
	 * @return the assignment that makes this offset real, if one is needed,
	 * along with the offset that remains afterward
	 */
	Commit commit(int memorySize) {
		if (value == 0) {
			return new Commit(Optional.empty(), ZERO);
		} else {
			return new Commit(Optional.of(PythonSyntax.movePointer(value, memorySize)), ZERO);
		}
	}

	record Commit(Optional<String> statement, PointerOffset remaining) { }
}
