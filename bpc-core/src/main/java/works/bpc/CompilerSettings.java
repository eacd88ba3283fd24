package works.bpc;

import works.bpc.exceptions.ConfigurationException;

import static java.util.Objects.requireNonNull;

/**
 * Everything that controls what a compilation produces.
 * <p>
 * Instances are not validated on construction, so that invalid settings can be
 * described and reported; {@link BpcCompiler#using} calls {@link #validate()}
 * before any source is read.
 *
 * @param memorySize number of cells in the generated program's memory
 * @param indentWidth number of indentation characters per block level
 * @param comments whether comment text in the source is carried into the generated code
 * @param dumpMemory whether the generated program prints its pointer and memory when it ends
 * @param optimizationLevel 0 for direct translation, 1 to fuse repeated instructions,
 *                          2 to also defer pointer movement
 */
public record CompilerSettings(
	int memorySize,
	int indentWidth,
	IndentStyle indentStyle,
	boolean comments,
	boolean dumpMemory,
	int optimizationLevel
) {
	public static final int MAX_OPTIMIZATION_LEVEL = 2;

	public static final CompilerSettings DEFAULT = new CompilerSettings(1024, 4, IndentStyle.SPACES, false, false, MAX_OPTIMIZATION_LEVEL);

	/**
	 * @return {@code this}
	 * @throws ConfigurationException if any setting is out of range
	 */
	public CompilerSettings validate() {
		if (memorySize <= 0) {
			throw new ConfigurationException("Memory size must be larger than 0: " + memorySize);
		}
		if (indentWidth <= 0) {
			throw new ConfigurationException("Indentation width must be larger than 0: " + indentWidth);
		}
		if (indentStyle == null) {
			throw new ConfigurationException("Indentation style must be specified");
		}
		if (optimizationLevel < 0 || optimizationLevel > MAX_OPTIMIZATION_LEVEL) {
			throw new ConfigurationException("Optimization level must be 0, 1 or 2: " + optimizationLevel);
		}
		return this;
	}

	public CompilerSettings withMemorySize(int memorySize) {
		return new CompilerSettings(memorySize, indentWidth, indentStyle, comments, dumpMemory, optimizationLevel);
	}

	public CompilerSettings withComments(boolean comments) {
		return new CompilerSettings(memorySize, indentWidth, indentStyle, comments, dumpMemory, optimizationLevel);
	}

	public CompilerSettings withDumpMemory(boolean dumpMemory) {
		return new CompilerSettings(memorySize, indentWidth, indentStyle, comments, dumpMemory, optimizationLevel);
	}

	public CompilerSettings withOptimizationLevel(int optimizationLevel) {
		return new CompilerSettings(memorySize, indentWidth, indentStyle, comments, dumpMemory, optimizationLevel);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int memorySize;
		private int indentWidth;
		private IndentStyle indentStyle;
		private boolean comments;
		private boolean dumpMemory;
		private int optimizationLevel;

		Builder() {
			memorySize = DEFAULT.memorySize();
			indentWidth = DEFAULT.indentWidth();
			indentStyle = DEFAULT.indentStyle();
			comments = DEFAULT.comments();
			dumpMemory = DEFAULT.dumpMemory();
			optimizationLevel = DEFAULT.optimizationLevel();
		}

		public Builder memorySize(int memorySize) {
			this.memorySize = memorySize;
			return this;
		}

		public Builder indentWidth(int indentWidth) {
			this.indentWidth = indentWidth;
			return this;
		}

		public Builder indentStyle(IndentStyle indentStyle) {
			this.indentStyle = requireNonNull(indentStyle);
			return this;
		}

		public Builder comments(boolean comments) {
			this.comments = comments;
			return this;
		}

		public Builder dumpMemory(boolean dumpMemory) {
			this.dumpMemory = dumpMemory;
			return this;
		}

		public Builder optimizationLevel(int optimizationLevel) {
			this.optimizationLevel = optimizationLevel;
			return this;
		}

		/**
		 * @throws ConfigurationException if any setting is out of range
		 */
		public CompilerSettings build() {
			return new CompilerSettings(memorySize, indentWidth, indentStyle, comments, dumpMemory, optimizationLevel)
				.validate();
		}

		@Override
		public String toString() {
			return "CompilerSettings.Builder(memorySize=" + memorySize
				+ ", indentWidth=" + indentWidth
				+ ", indentStyle=" + indentStyle
				+ ", comments=" + comments
				+ ", dumpMemory=" + dumpMemory
				+ ", optimizationLevel=" + optimizationLevel + ")";
		}
	}
}
