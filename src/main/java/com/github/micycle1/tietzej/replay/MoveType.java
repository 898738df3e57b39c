package com.github.micycle1.tietzej.replay;

/**
 * The elementary Tietze transformations that occur in a move transcript.
 */
public enum MoveType {
	/**
	 * A new generator is added, defined by a word in the current generators.
	 */
	INTRODUCTION,

	/**
	 * A generator is eliminated; the last generator takes over its index.
	 */
	DELETION,

	/**
	 * A generator is replaced by its inverse.
	 */
	INVERSION,

	/**
	 * Nielsen slide: a generator is multiplied (on the right for a positive first
	 * token, on the left for a negative one) by another generator or its inverse.
	 */
	SLIDE
}
