package com.github.micycle1.tietzej.kernel;

import static com.github.micycle1.tietzej.TietzeConstants.WIRE_TERMINATOR;

import java.util.Arrays;

import com.github.micycle1.tietzej.word.Word;

/**
 * The kernel's integer encoding of words: one signed generator index per entry,
 * ended by a 0. Relators, peripheral curves and the move transcript all use it.
 */
public final class WireFormat {

	private WireFormat() {
	}

	/**
	 * Reads the entries before the terminator as a word.
	 *
	 * @throws IllegalArgumentException if no terminator is present
	 */
	public static Word readWord(int[] wire) {
		return Word.reduce(readSequence(wire));
	}

	/**
	 * Returns the entries before the terminator untouched, without reduction.
	 *
	 * @throws IllegalArgumentException if no terminator is present
	 */
	public static int[] readSequence(int[] wire) {
		for (int i = 0; i < wire.length; i++) {
			if (wire[i] == WIRE_TERMINATOR) {
				return Arrays.copyOf(wire, i);
			}
		}
		throw new IllegalArgumentException("Sequence of " + wire.length + " entries has no terminating " + WIRE_TERMINATOR);
	}

	/**
	 * Writes a word followed by the terminator.
	 */
	public static int[] write(Word word) {
		int[] letters = word.toArray();
		int[] wire = Arrays.copyOf(letters, letters.length + 1);
		wire[letters.length] = WIRE_TERMINATOR;
		return wire;
	}
}
