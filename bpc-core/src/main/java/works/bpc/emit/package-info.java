/**
 * Indentation-aware assembly of generated source text.
 */
package works.bpc.emit;
