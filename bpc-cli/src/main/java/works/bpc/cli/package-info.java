/**
 * Command-line front end. Handles argument parsing and file I/O, which the core leaves out.
 */
package works.bpc.cli;
