package com.github.micycle1.tietzej.replay;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.tietzej.word.Word;

/**
 * The bookkeeping table of a replay: entry <code>i</code> is generator
 * <code>i</code> of the presentation being simplified, written as a word in the
 * original generators. Indices are 1-based; slot 0 only keeps the numbering
 * natural and is never read.
 * <p>
 * Deletion is a swap-remove: the last entry moves into the freed index, so
 * deleting is O(1) and indices stay dense.
 */
class GeneratorTable {

	private final List<Word> slots;

	/**
	 * Creates the table for <code>originalCount</code> original generators, each
	 * mapped to itself.
	 */
	GeneratorTable(int originalCount) {
		slots = new ArrayList<>(originalCount + 1);
		slots.add(Word.identity()); // placeholder
		for (int i = 1; i <= originalCount; i++) {
			slots.add(Word.generator(i));
		}
	}

	/**
	 * Number of generators currently in the table.
	 */
	int size() {
		return slots.size() - 1;
	}

	Word get(int index) {
		checkIndex(index);
		return slots.get(index);
	}

	/**
	 * Returns entry <code>|g|</code>, inverted when <code>g</code> is negative.
	 */
	Word resolve(int g) {
		Word w = get(Math.abs(g));
		return g < 0 ? w.inverse() : w;
	}

	void set(int index, Word word) {
		checkIndex(index);
		slots.set(index, word);
	}

	/**
	 * Adds a generator at index <code>size() + 1</code>.
	 *
	 * @return the index of the new generator
	 */
	int append(Word word) {
		slots.add(word);
		return size();
	}

	/**
	 * Removes generator <code>index</code> by overwriting it with the last entry
	 * and dropping the last slot. Afterwards <code>index</code> refers to what was
	 * the last generator (unless <code>index</code> was itself the last).
	 *
	 * @return the word that was removed
	 */
	Word swapRemove(int index) {
		checkIndex(index);
		Word removed = slots.get(index);
		Word last = slots.remove(slots.size() - 1);
		if (index < slots.size()) {
			slots.set(index, last);
		}
		return removed;
	}

	/**
	 * The words of generators <code>1..size()</code>, in index order.
	 */
	List<Word> words() {
		return List.copyOf(slots.subList(1, slots.size()));
	}

	private void checkIndex(int index) {
		if (index < 1 || index > size()) {
			throw new IndexOutOfBoundsException("Generator " + index + " is not in 1.." + size());
		}
	}
}
