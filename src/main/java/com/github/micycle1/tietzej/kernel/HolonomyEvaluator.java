package com.github.micycle1.tietzej.kernel;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Kernel-side evaluation of the holonomy representation on a word. Words are
 * passed in wire format, i.e. signed generator indices followed by the
 * terminating 0.
 */
public interface HolonomyEvaluator {

	/**
	 * Image of the word in SL(2,C).
	 */
	FieldMatrix<Complex> sl2c(int[] word);

	/**
	 * Image of the word in O(3,1).
	 */
	RealMatrix o31(int[] word);

	/**
	 * Complex length of the geodesic represented by the word.
	 */
	Complex complexLength(int[] word);
}
