package works.bpc;

/**
 * @param code the generated program
 * @param instructions number of instructions in the source
 * @param statements number of non-comment lines in {@code code}
 * @param loops number of loops in the source
 */
public record CompilationResult(String code, int instructions, int statements, int loops) {
}
