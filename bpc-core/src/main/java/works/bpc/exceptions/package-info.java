/**
 * Exceptions thrown by the compiler.
 * Everything here extends {@link works.bpc.exceptions.CompilationException},
 * which is unchecked.
 */
package works.bpc.exceptions;
