package com.github.micycle1.tietzej.kernel;

/**
 * Handle to a triangulation owned by the geometric kernel. Only the counts the
 * library needs are exposed; construction, file parsing and structure solving
 * stay in the kernel.
 */
public interface Triangulation {

	String getName();

	int getNumTetrahedra();

	int getNumCusps();
}
