package com.github.micycle1.tietzej.kernel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A fundamental group presentation as handed over by the kernel. Every word,
 * and the move transcript, is a 0-terminated sequence of signed generator
 * indices (see {@link WireFormat}).
 */
public class RawPresentation {

	private final int numGenerators;
	private final int numOriginalGenerators;
	private final List<int[]> relators;
	private final List<int[]> meridians;
	private final List<int[]> longitudes;
	private final int[] moves;

	/**
	 * @param numGenerators         generators after simplification
	 * @param numOriginalGenerators generators before simplification
	 * @param relators              relators over the current generators
	 * @param meridians             one meridian per cusp
	 * @param longitudes            one longitude per cusp
	 * @param moves                 the transcript of Tietze moves applied
	 */
	public RawPresentation(int numGenerators, int numOriginalGenerators, List<int[]> relators, List<int[]> meridians, List<int[]> longitudes,
			int[] moves) {
		if (numGenerators < 0 || numOriginalGenerators < 0) {
			throw new IllegalArgumentException("Negative generator count: " + numGenerators + ", " + numOriginalGenerators);
		}
		Objects.requireNonNull(relators, "relators");
		Objects.requireNonNull(meridians, "meridians");
		Objects.requireNonNull(longitudes, "longitudes");
		Objects.requireNonNull(moves, "moves");
		if (meridians.size() != longitudes.size()) {
			throw new IllegalArgumentException(meridians.size() + " meridians but " + longitudes.size() + " longitudes");
		}
		this.numGenerators = numGenerators;
		this.numOriginalGenerators = numOriginalGenerators;
		this.relators = copy(relators);
		this.meridians = copy(meridians);
		this.longitudes = copy(longitudes);
		this.moves = moves.clone();
	}

	public int getNumGenerators() {
		return numGenerators;
	}

	public int getNumOriginalGenerators() {
		return numOriginalGenerators;
	}

	public List<int[]> getRelators() {
		return copy(relators);
	}

	public List<int[]> getMeridians() {
		return copy(meridians);
	}

	public List<int[]> getLongitudes() {
		return copy(longitudes);
	}

	public int getNumCusps() {
		return meridians.size();
	}

	public int[] getMoves() {
		return moves.clone();
	}

	private static List<int[]> copy(List<int[]> words) {
		List<int[]> copy = new ArrayList<>(words.size());
		for (int[] w : words) {
			copy.add(w.clone());
		}
		return copy;
	}
}
