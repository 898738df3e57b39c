package com.github.micycle1.tietzej;

public class TietzeConstants {

	/**
	 * Largest generator count rendered with single letters. Presentations with
	 * more generators switch every token to the indexed form <code>x12</code>.
	 */
	public static final int LETTER_ALPHABET_LIMIT = 26;
	public static final char VERBOSE_SEPARATOR = '*';
	public static final String INVERSE_SUFFIX = "^-1";
	public static final char INDEXED_PREFIX = 'x';
	public static final char INDEXED_INVERSE_PREFIX = 'X';
	// ends every relator, peripheral word and move list handed over by the kernel
	public static final int WIRE_TERMINATOR = 0;
}
