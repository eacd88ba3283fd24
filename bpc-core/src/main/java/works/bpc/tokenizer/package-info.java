/**
 * Turns source text into a stream of events.
 * <p>
 * The {@link works.bpc.tokenizer.Tokenizer} knows only which characters are
 * {@link works.bpc.tokenizer.Instruction instructions}; everything else is delivered as comment text.
 * It does no bracket matching. Structural checks belong to the code generators.
 */
package works.bpc.tokenizer;
