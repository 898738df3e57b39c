package com.github.micycle1.tietzej.replay;

import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded move of a transcript. For a {@link MoveType#INTRODUCTION}
 * <code>first</code> is the index of the new generator and the defining word
 * holds signed indices into the generators current at that point; for the paired
 * moves <code>first</code> and <code>second</code> are the two tokens as read.
 */
public class TietzeMove {

	private final MoveType type;
	private final int position;
	private final int first;
	private final int second;
	private final int[] definingWord;

	private TietzeMove(MoveType type, int position, int first, int second, int[] definingWord) {
		this.type = type;
		this.position = position;
		this.first = first;
		this.second = second;
		this.definingWord = definingWord;
	}

	static TietzeMove introduction(int position, int generator, int[] definingWord) {
		return new TietzeMove(MoveType.INTRODUCTION, position, generator, generator, definingWord);
	}

	/**
	 * Classifies a paired move by comparing its tokens.
	 */
	static TietzeMove paired(int position, int a, int b) {
		MoveType type;
		if (a == b) {
			type = MoveType.DELETION;
		} else if (a == -b) {
			type = MoveType.INVERSION;
		} else {
			type = MoveType.SLIDE;
		}
		return new TietzeMove(type, position, a, b, new int[0]);
	}

	public MoveType getType() {
		return type;
	}

	/**
	 * @return offset of the move's first token in the transcript
	 */
	public int getPosition() {
		return position;
	}

	public int getFirst() {
		return first;
	}

	public int getSecond() {
		return second;
	}

	/**
	 * Index of the generator the move changes (or creates).
	 */
	public int getTarget() {
		return Math.abs(first);
	}

	public int[] getDefiningWord() {
		return definingWord.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TietzeMove)) {
			return false;
		}
		TietzeMove other = (TietzeMove) o;
		return type == other.type && position == other.position && first == other.first && second == other.second
				&& Arrays.equals(definingWord, other.definingWord);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, position, first, second, Arrays.hashCode(definingWord));
	}

	@Override
	public String toString() {
		switch (type) {
			case INTRODUCTION :
				return "TietzeMove{INTRODUCTION, gen=" + first + ", def=" + Arrays.toString(definingWord) + ", at=" + position + "}";
			case DELETION :
			case INVERSION :
				return "TietzeMove{" + type + ", gen=" + getTarget() + ", at=" + position + "}";
			default :
				return "TietzeMove{SLIDE, " + first + " by " + second + ", at=" + position + "}";
		}
	}
}
