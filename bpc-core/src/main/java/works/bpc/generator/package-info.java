/**
 * Translates tokenizer events into Python statements.
 * <p>
 * {@link works.bpc.generator.CodeGenerator#create CodeGenerator.create} picks one of three
 * implementations according to the optimization level. They share statement rendering and
 * loop bookkeeping by composition rather than by inheritance; each level supplies only its own
 * way of flushing a run of repeated instructions, and level 2 additionally carries a
 * deferred pointer offset.
 */
package works.bpc.generator;
