package works.bpc.generator;

/**
 * The text of every statement the generators can emit.
 * <p>
 * The generated program keeps its memory in a list named {@value #CELLS}
 * and its pointer in {@value #POINTER}. Python's {@code %} is a floored modulo,
 * so {@code (p - k) % n} already lands in {@code [0, n)} without adjustment.
 */
final class PythonSyntax {
	static final String CELLS = "m";
	static final String POINTER = "p";
	static final String COMMENT_MARKER = "#";

	/**
	 * Cells shown per row of the memory dump.
	 */
	static final int DUMP_ROW_WIDTH = 16;

	private PythonSyntax() { }

	static String preamble(int memorySize) {
		return COMMENT_MARKER + " -*- coding: UTF-8 -*-\n"
			+ "import sys\n"
			+ CELLS + " = [0] * " + memorySize + "\n"
			+ POINTER + " = 0";
	}

	/**
	 * @return {@code p}, {@code p + k} or {@code p - k}
	 */
	static String pointerExpression(int offset) {
		if (offset == 0) {
			return POINTER;
		} else if (offset > 0) {
			return POINTER + " + " + offset;
		} else {
			return POINTER + " - " + Math.negateExact(offset);
		}
	}

	/**
	 * The cell {@code offset} places away from the pointer.
	 * A nonzero offset is wrapped like a pointer move, because list indexes
	 * at or past the end are errors in Python.
	 */
	static String cell(int offset, int memorySize) {
		if (offset == 0) {
			return CELLS + "[" + POINTER + "]";
		} else {
			return CELLS + "[(" + pointerExpression(offset) + ") % " + memorySize + "]";
		}
	}

	static String addToCell(String cell, int amount) {
		assert amount != 0;
		return cell + (amount > 0 ? " += " : " -= ") + Math.abs(amount);
	}

	static String movePointer(int delta, int memorySize) {
		assert delta != 0;
		return POINTER + " = (" + pointerExpression(delta) + ") % " + memorySize;
	}

	static String read(String cell) {
		return cell + " = int(sys.stdin.readline().strip() or 0)";
	}

	static String write(String cell) {
		return "print(" + cell + ")";
	}

	static String loopHeader() {
		return "while " + CELLS + "[" + POINTER + "] != 0:";
	}

	static String comment(String text) {
		return COMMENT_MARKER + " " + text;
	}

	/**
	 * Everything in the memory dump up to the row loop's header.
	 * Memory is padded with zeros to a whole number of rows for display.
	 */
	static String dumpPrologue(int memorySize) {
		int padding = (DUMP_ROW_WIDTH - memorySize % DUMP_ROW_WIDTH) % DUMP_ROW_WIDTH;
		StringBuilder sb = new StringBuilder()
			.append("print()\n")
			.append("print('~~~ Program Terminated ~~~')\n")
			.append("print('Pointer:', ").append(POINTER).append(")\n")
			.append("print('Memory:')\n");
		if (padding > 0) {
			sb.append(CELLS).append(" += [0] * ").append(padding).append("\n");
		}
		sb.append("for i in range(0, ").append(memorySize).append(", ").append(DUMP_ROW_WIDTH).append("):");
		return sb.toString();
	}

	static String dumpRow() {
		return "print('{:7d} | '.format(i) + ''.join('{:4d}'.format(c) for c in "
			+ CELLS + "[i:i + " + DUMP_ROW_WIDTH + "]))";
	}
}
