package com.github.micycle1.tietzej.kernel;

/**
 * The kernel routine that computes (and optionally simplifies) the fundamental
 * group presentation of a triangulation.
 */
public interface PresentationKernel {

	/**
	 * @param triangulation a triangulation with at least one tetrahedron
	 * @param options       simplification flags, passed to the kernel unchanged
	 * @return the presentation in wire format
	 */
	RawPresentation computePresentation(Triangulation triangulation, SimplificationOptions options);
}
