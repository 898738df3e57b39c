package com.github.micycle1.tietzej.presentation;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Images of a single word under the holonomy representation, as computed by the
 * kernel.
 */
public class MatrixRepresentation {

	private final String word;
	private final FieldMatrix<Complex> sl2c;
	private final RealMatrix o31;
	private final Complex complexLength;

	MatrixRepresentation(String word, FieldMatrix<Complex> sl2c, RealMatrix o31, Complex complexLength) {
		this.word = word;
		this.sl2c = sl2c;
		this.o31 = o31;
		this.complexLength = complexLength;
	}

	public String getWord() {
		return word;
	}

	/**
	 * 2x2 complex matrix in SL(2,C).
	 */
	public FieldMatrix<Complex> getSl2c() {
		return sl2c;
	}

	/**
	 * 4x4 real matrix in O(3,1).
	 */
	public RealMatrix getO31() {
		return o31;
	}

	public Complex getComplexLength() {
		return complexLength;
	}

	@Override
	public String toString() {
		return "MatrixRepresentation{word=" + word + ", complexLength=" + complexLength + "}";
	}
}
