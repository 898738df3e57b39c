package com.github.micycle1.tietzej.replay;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read cursor over a move transcript: the flat list of integers in which the
 * presentation kernel logs the Tietze moves it applied, without the wire
 * terminator.
 * <p>
 * Grammar, read left to right against the current generator count
 * <code>m</code>:
 * <ul>
 * <li><code>m+1 w1 .. wk m+1</code> introduces generator <code>m+1</code>
 * defined by the word <code>w1..wk</code> in generators <code>1..m</code>. The
 * second <code>m+1</code> is the sentinel closing the definition.</li>
 * <li><code>a a</code> deletes generator <code>a</code>.</li>
 * <li><code>a -a</code> inverts generator <code>|a|</code>.</li>
 * <li><code>a b</code> (any other pair) slides generator <code>|a|</code> along
 * generator <code>|b|</code>.</li>
 * </ul>
 * A leading token with <code>|a| &gt; m</code> can only be an introduction, and
 * must then be exactly <code>m+1</code>; anything else breaks the grammar.
 */
public class MoveTranscript {

	private final int[] tokens;
	private int cursor;

	/**
	 * @param tokens transcript tokens; copied, the caller's array is not read
	 *               again
	 */
	public MoveTranscript(int[] tokens) {
		this.tokens = tokens.clone();
		this.cursor = 0;
	}

	/**
	 * Decodes a whole transcript into its moves without evaluating any words,
	 * tracking only the generator count.
	 *
	 * @param originalCount number of generators before the first move
	 * @param tokens        the transcript
	 * @return moves in the order they were applied
	 * @throws MalformedTranscriptException if the transcript breaks its grammar
	 */
	public static List<TietzeMove> parse(int originalCount, int[] tokens) {
		MoveTranscript transcript = new MoveTranscript(tokens);
		List<TietzeMove> moves = new ArrayList<>();
		int size = originalCount;
		while (transcript.hasNext()) {
			TietzeMove move = transcript.nextMove(size);
			if (move.getType() == MoveType.INTRODUCTION) {
				size++;
			} else if (move.getType() == MoveType.DELETION) {
				size--;
			}
			moves.add(move);
		}
		return moves;
	}

	public boolean hasNext() {
		return cursor < tokens.length;
	}

	/**
	 * @return offset of the next unread token
	 */
	public int position() {
		return cursor;
	}

	public int length() {
		return tokens.length;
	}

	/**
	 * Reads the next move.
	 *
	 * @param generatorCount number of generators in the table before this move
	 * @return the decoded move
	 * @throws MalformedTranscriptException if the tokens at the cursor do not form
	 *                                      a valid move for that generator count
	 */
	public TietzeMove nextMove(int generatorCount) {
		if (!hasNext()) {
			throw new MalformedTranscriptException("Transcript is exhausted", cursor);
		}
		final int start = cursor;
		final int a = tokens[cursor++];
		if (a == 0) {
			throw new MalformedTranscriptException("Token 0 inside the transcript", start);
		}

		if (Math.abs(a) > generatorCount) {
			// only an introduction may name an index past the table
			if (a != generatorCount + 1) {
				throw new MalformedTranscriptException(
						"Token " + a + " is outside 1.." + generatorCount + " and is not the next free generator " + (generatorCount + 1), start);
			}
			int sentinel = indexOf(a);
			if (sentinel < 0) {
				throw new MalformedTranscriptException("Introduction of generator " + a + " has no closing sentinel", start);
			}
			int[] definingWord = Arrays.copyOfRange(tokens, cursor, sentinel);
			for (int g : definingWord) {
				if (g == 0 || Math.abs(g) > generatorCount) {
					throw new MalformedTranscriptException(
							"Definition of generator " + a + " uses " + g + ", which is not one of the current generators 1.." + generatorCount, start);
				}
			}
			cursor = sentinel + 1;
			return TietzeMove.introduction(start, a, definingWord);
		}

		if (!hasNext()) {
			throw new MalformedTranscriptException("Move starting with " + a + " is missing its second token", start);
		}
		final int b = tokens[cursor++];
		if (b == 0 || Math.abs(b) > generatorCount) {
			throw new MalformedTranscriptException("Move " + a + " " + b + " refers to a generator outside 1.." + generatorCount, start);
		}
		return TietzeMove.paired(start, a, b);
	}

	/**
	 * Linear scan for the next occurrence of <code>value</code> at or after the
	 * cursor.
	 *
	 * @return its offset, or -1 if it does not occur
	 */
	int indexOf(int value) {
		for (int i = cursor; i < tokens.length; i++) {
			if (tokens[i] == value) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return a copy of all tokens, regardless of the cursor
	 */
	public int[] toArray() {
		return tokens.clone();
	}
}
