package com.github.micycle1.tietzej.word;

import static com.github.micycle1.tietzej.TietzeConstants.INDEXED_INVERSE_PREFIX;
import static com.github.micycle1.tietzej.TietzeConstants.INDEXED_PREFIX;
import static com.github.micycle1.tietzej.TietzeConstants.LETTER_ALPHABET_LIMIT;

/**
 * The two token sets generators are written in. Which one applies depends only
 * on the number of generators of the group, see {@link #forGeneratorCount(int)}.
 */
public enum Alphabet {

	/**
	 * Generators 1..26 are the letters <code>a..z</code>; an upper case letter is
	 * the inverse.
	 */
	LETTERS {
		@Override
		String token(int g) {
			return g > 0 ? String.valueOf((char) ('a' + g - 1)) : String.valueOf((char) ('A' - g - 1));
		}

		@Override
		int scanToken(String text, int start) {
			char c = text.charAt(start);
			return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ? start + 1 : start;
		}

		@Override
		int signedGenerator(String token) {
			char c = token.charAt(0);
			return Character.isLowerCase(c) ? c - 'a' + 1 : -(c - 'A' + 1);
		}
	},

	/**
	 * Generator k is <code>x&lt;k&gt;</code> and its inverse
	 * <code>X&lt;k&gt;</code>, for groups with too many generators for single
	 * letters.
	 */
	INDEXED {
		@Override
		String token(int g) {
			return g > 0 ? INDEXED_PREFIX + Integer.toString(g) : INDEXED_INVERSE_PREFIX + Integer.toString(-g);
		}

		@Override
		int scanToken(String text, int start) {
			char c = text.charAt(start);
			if (c != INDEXED_PREFIX && c != INDEXED_INVERSE_PREFIX) {
				return start;
			}
			int end = start + 1;
			while (end < text.length() && text.charAt(end) >= '0' && text.charAt(end) <= '9') {
				end++;
			}
			return end > start + 1 ? end : start; // prefix without digits is no token
		}

		@Override
		int signedGenerator(String token) {
			long index = 0;
			for (int i = 1; i < token.length(); i++) {
				index = Math.min(index * 10 + (token.charAt(i) - '0'), Integer.MAX_VALUE);
			}
			return token.charAt(0) == INDEXED_PREFIX ? (int) index : (int) -index;
		}
	};

	/**
	 * Selects the alphabet for a group with <code>n</code> generators: letters up
	 * to 26 generators, indexed tokens beyond.
	 */
	public static Alphabet forGeneratorCount(int n) {
		return n <= LETTER_ALPHABET_LIMIT ? LETTERS : INDEXED;
	}

	/**
	 * Compact token of a nonzero signed generator.
	 */
	abstract String token(int g);

	/**
	 * Returns the end (exclusive) of the token starting at <code>start</code>, or
	 * <code>start</code> itself when no token of this alphabet starts there.
	 */
	abstract int scanToken(String text, int start);

	/**
	 * Signed generator named by a token previously found by
	 * {@link #scanToken(String, int)}. The magnitude may be out of range (or 0)
	 * and is checked by the caller.
	 */
	abstract int signedGenerator(String token);
}
