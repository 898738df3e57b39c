package com.github.micycle1.tietzej.word;

import java.util.Arrays;
import java.util.List;

/**
 * An element of a free group, stored as a freely reduced sequence of signed
 * generator indices. Entry <code>g</code> stands for generator <code>|g|</code>
 * when positive and for its inverse when negative; the empty sequence is the
 * identity.
 * <p>
 * Instances are immutable and always reduced: no two consecutive entries are
 * negatives of each other. The only ways to obtain one are {@link #reduce},
 * {@link #generator}, {@link #identity} and the operations on an existing word.
 */
public final class Word {

	private static final Word IDENTITY = new Word(new int[0]);

	private final int[] letters;

	private Word(int[] letters) {
		this.letters = letters;
	}

	/**
	 * Returns the empty word.
	 */
	public static Word identity() {
		return IDENTITY;
	}

	/**
	 * Returns the word made of a single signed generator.
	 *
	 * @param g nonzero signed generator
	 * @return the one-letter word <code>[g]</code>
	 */
	public static Word generator(int g) {
		if (g == 0) {
			throw new IllegalArgumentException("Generator index 0 is not a generator.");
		}
		return new Word(new int[] { g });
	}

	/**
	 * Freely reduces an arbitrary sequence of signed generators. A single left to
	 * right pass over a stack suffices: whenever the incoming entry cancels the top
	 * of the stack the top is popped, which re-exposes the previous entry to the
	 * next comparison.
	 *
	 * @param sequence signed generators, possibly with cancelling neighbours
	 * @return the reduced word
	 * @throws IllegalArgumentException if the sequence contains a 0
	 */
	public static Word reduce(int... sequence) {
		int[] stack = new int[sequence.length];
		int top = 0;
		for (int i = 0; i < sequence.length; i++) {
			int g = sequence[i];
			if (g == 0) {
				throw new IllegalArgumentException("Entry " + i + " of " + Arrays.toString(sequence) + " is 0, which is not a generator.");
			}
			if (top > 0 && stack[top - 1] == -g) {
				top--;
			} else {
				stack[top++] = g;
			}
		}
		if (top == 0) {
			return IDENTITY;
		}
		return new Word(Arrays.copyOf(stack, top));
	}

	/**
	 * Freely reduces a boxed sequence of signed generators.
	 *
	 * @see #reduce(int...)
	 */
	public static Word reduce(List<Integer> sequence) {
		return reduce(sequence.stream().mapToInt(Integer::intValue).toArray());
	}

	/**
	 * Returns the inverse word: the sequence reversed with every entry negated.
	 * The result of reversing a reduced word is reduced, so no further reduction
	 * takes place.
	 */
	public Word inverse() {
		if (letters.length == 0) {
			return this;
		}
		int n = letters.length;
		int[] inv = new int[n];
		for (int i = 0; i < n; i++) {
			inv[i] = -letters[n - 1 - i];
		}
		return new Word(inv);
	}

	/**
	 * Returns the reduced product <code>this * other</code>.
	 */
	public Word concat(Word other) {
		if (other.letters.length == 0) {
			return this;
		}
		if (letters.length == 0) {
			return other;
		}
		int[] joined = Arrays.copyOf(letters, letters.length + other.letters.length);
		System.arraycopy(other.letters, 0, joined, letters.length, other.letters.length);
		return reduce(joined);
	}

	public int length() {
		return letters.length;
	}

	public boolean isIdentity() {
		return letters.length == 0;
	}

	/**
	 * @param index position in the word, 0-based
	 * @return the signed generator at that position
	 */
	public int get(int index) {
		return letters[index];
	}

	/**
	 * Returns the largest generator index used by this word, or 0 for the identity.
	 */
	public int maxGenerator() {
		int max = 0;
		for (int g : letters) {
			max = Math.max(max, Math.abs(g));
		}
		return max;
	}

	/**
	 * @return a copy of the signed generator sequence
	 */
	public int[] toArray() {
		return letters.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Word)) {
			return false;
		}
		return Arrays.equals(letters, ((Word) o).letters);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(letters);
	}

	@Override
	public String toString() {
		return Arrays.toString(letters);
	}
}
