/**
 * A compiler from the eight-instruction tape language to Python.
 * <p>
 * Start with {@link works.bpc.BpcCompiler}, configured by {@link works.bpc.CompilerSettings}.
 * The pipeline is a {@link works.bpc.tokenizer.Tokenizer tokenizer} pushing events into a
 * {@link works.bpc.generator.CodeGenerator code generator}, which writes statements into a
 * {@link works.bpc.emit.CodeBuilder code builder}.
 */
package works.bpc;
