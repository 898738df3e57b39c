package com.github.micycle1.tietzej.presentation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.tietzej.kernel.HolonomyEvaluator;
import com.github.micycle1.tietzej.kernel.PresentationKernel;
import com.github.micycle1.tietzej.kernel.RawPresentation;
import com.github.micycle1.tietzej.kernel.SimplificationOptions;
import com.github.micycle1.tietzej.kernel.Triangulation;
import com.github.micycle1.tietzej.kernel.WireFormat;
import com.github.micycle1.tietzej.replay.TransformationReplay;
import com.github.micycle1.tietzej.word.GeneratorCodec;
import com.github.micycle1.tietzej.word.Word;

/**
 * The fundamental group of a triangulation, as a (possibly simplified) finite
 * presentation.
 * <p>
 * The presentation, the peripheral curves and the log of Tietze moves are
 * computed once by the {@link PresentationKernel} at construction. Generators
 * are named <code>a, b, c, ...</code> (or <code>x1, x2, ...</code> past 26
 * generators); see {@link GeneratorCodec} for the word syntax.
 * <p>
 * Instances are immutable.
 */
public class FundamentalGroup {

	private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalGroup.class);

	private final String name;
	private final int numGenerators;
	private final int numOriginalGenerators;
	private final List<Word> relators;
	private final List<PeripheralCurves> peripheralCurves;
	private final TransformationReplay replay;
	private final GeneratorCodec codec;
	private final GeneratorCodec originalCodec;
	private final HolonomyEvaluator holonomy; // may be null

	/**
	 * Computes the presentation with default simplification and no holonomy
	 * evaluator.
	 */
	public FundamentalGroup(Triangulation triangulation, PresentationKernel kernel) {
		this(triangulation, kernel, SimplificationOptions.defaults(), null);
	}

	public FundamentalGroup(Triangulation triangulation, PresentationKernel kernel, SimplificationOptions options) {
		this(triangulation, kernel, options, null);
	}

	/**
	 * Computes the presentation of a triangulation.
	 *
	 * @param triangulation triangulation with at least one tetrahedron
	 * @param kernel        kernel that computes the presentation
	 * @param options       simplification flags, forwarded to the kernel
	 * @param holonomy      evaluator for the matrix representations, or null if
	 *                      they are not needed
	 * @throws IllegalArgumentException if the triangulation has no tetrahedra
	 */
	public FundamentalGroup(Triangulation triangulation, PresentationKernel kernel, SimplificationOptions options, HolonomyEvaluator holonomy) {
		Objects.requireNonNull(triangulation, "triangulation");
		Objects.requireNonNull(kernel, "kernel");
		Objects.requireNonNull(options, "options");
		if (triangulation.getNumTetrahedra() == 0) {
			throw new IllegalArgumentException("The triangulation " + triangulation.getName() + " is empty.");
		}

		RawPresentation raw = kernel.computePresentation(triangulation, options);
		this.name = triangulation.getName();
		this.numGenerators = raw.getNumGenerators();
		this.numOriginalGenerators = raw.getNumOriginalGenerators();
		this.codec = new GeneratorCodec(numGenerators);
		this.originalCodec = new GeneratorCodec(numOriginalGenerators);
		this.holonomy = holonomy;

		List<Word> rels = new ArrayList<>();
		for (int[] r : raw.getRelators()) {
			rels.add(WireFormat.readWord(r));
		}
		this.relators = Collections.unmodifiableList(rels);

		List<int[]> meridians = raw.getMeridians();
		List<int[]> longitudes = raw.getLongitudes();
		List<PeripheralCurves> curves = new ArrayList<>(meridians.size());
		for (int i = 0; i < meridians.size(); i++) {
			curves.add(new PeripheralCurves(i, WireFormat.readWord(meridians.get(i)), WireFormat.readWord(longitudes.get(i))));
		}
		this.peripheralCurves = Collections.unmodifiableList(curves);

		this.replay = new TransformationReplay(numOriginalGenerators, WireFormat.readSequence(raw.getMoves()));
		LOGGER.debug("Presentation of {} ({}): {} generators ({} original), {} relators, {} cusps", name, options, numGenerators, numOriginalGenerators,
				relators.size(), peripheralCurves.size());
	}

	public String getName() {
		return name;
	}

	public int getNumGenerators() {
		return numGenerators;
	}

	/**
	 * Number of generators of the unsimplified presentation, one per face pairing
	 * of the triangulation.
	 */
	public int getNumOriginalGenerators() {
		return numOriginalGenerators;
	}

	public int getNumRelators() {
		return relators.size();
	}

	public int getNumCusps() {
		return peripheralCurves.size();
	}

	/**
	 * Codec for words in the current generators.
	 */
	public GeneratorCodec getCodec() {
		return codec;
	}

	/**
	 * @return the generator names, <code>[a, b, ...]</code>
	 */
	public List<String> generators() {
		return codec.generatorNames();
	}

	/**
	 * @param verbose render as <code>a*b^-1</code> rather than <code>aB</code>
	 */
	public List<String> relators(boolean verbose) {
		List<String> out = new ArrayList<>(relators.size());
		for (Word r : relators) {
			out.add(codec.encode(r, verbose));
		}
		return out;
	}

	public List<String> relators() {
		return relators(false);
	}

	public List<Word> getRelatorWords() {
		return relators;
	}

	/**
	 * Relators as raw signed-integer sequences, without the wire terminator.
	 */
	public List<int[]> relatorsAsIntLists() {
		List<int[]> out = new ArrayList<>(relators.size());
		for (Word r : relators) {
			out.add(r.toArray());
		}
		return out;
	}

	/**
	 * @param cusp cusp index; negative values count from the end, -1 being the
	 *             last cusp
	 * @throws IndexOutOfBoundsException if the index is outside
	 *                                   <code>[-numCusps, numCusps-1]</code>
	 */
	public Word meridianWord(int cusp) {
		return peripheralCurves(cusp).getMeridian();
	}

	public Word longitudeWord(int cusp) {
		return peripheralCurves(cusp).getLongitude();
	}

	public String meridian(int cusp) {
		return codec.encode(meridianWord(cusp), false);
	}

	public String longitude(int cusp) {
		return codec.encode(longitudeWord(cusp), false);
	}

	/**
	 * Meridian and longitude of one cusp.
	 *
	 * @param cusp cusp index; negative values count from the end
	 * @throws IndexOutOfBoundsException if the index is outside
	 *                                   <code>[-numCusps, numCusps-1]</code>
	 */
	public PeripheralCurves peripheralCurves(int cusp) {
		int n = peripheralCurves.size();
		if (cusp < -n || cusp >= n) {
			throw new IndexOutOfBoundsException("Cusp index " + cusp + " is out of range for " + n + " cusps.");
		}
		return peripheralCurves.get(cusp < 0 ? cusp + n : cusp);
	}

	public List<PeripheralCurves> peripheralCurves() {
		return peripheralCurves;
	}

	/**
	 * Meridian and longitude of every cusp, rendered in compact form.
	 */
	public List<Pair<String, String>> peripheralCurveStrings() {
		List<Pair<String, String>> out = new ArrayList<>(peripheralCurves.size());
		for (PeripheralCurves pc : peripheralCurves) {
			out.add(Pair.of(codec.encode(pc.getMeridian(), false), codec.encode(pc.getLongitude(), false)));
		}
		return out;
	}

	/**
	 * Expresses every current generator in the original generators by replaying
	 * the simplification moves.
	 *
	 * @return one word per current generator, over generators
	 *         <code>1..getNumOriginalGenerators()</code>
	 */
	public List<Word> generatorsInOriginalWords() {
		return replay.replay();
	}

	/**
	 * Renders {@link #generatorsInOriginalWords()} with the alphabet of the
	 * original generators.
	 */
	public List<String> generatorsInOriginals(boolean verbose) {
		List<Word> words = generatorsInOriginalWords();
		List<String> out = new ArrayList<>(words.size());
		for (Word w : words) {
			out.add(originalCodec.encode(w, verbose));
		}
		LOGGER.info("Expressed {} generators of {} in {} original generators", out.size(), name, numOriginalGenerators);
		return out;
	}

	public List<String> generatorsInOriginals() {
		return generatorsInOriginals(false);
	}

	/**
	 * The move transcript exactly as the kernel produced it, minus the
	 * terminator.
	 */
	public int[] getMoveTranscript() {
		return replay.getTranscript();
	}

	/**
	 * @param word word in the current generators
	 * @return its image in SL(2,C)
	 */
	public FieldMatrix<Complex> sl2c(String word) {
		return requireHolonomy().sl2c(wire(word));
	}

	/**
	 * @param word word in the current generators
	 * @return its image in O(3,1)
	 */
	public RealMatrix o31(String word) {
		return requireHolonomy().o31(wire(word));
	}

	public Complex complexLength(String word) {
		return requireHolonomy().complexLength(wire(word));
	}

	/**
	 * All three images of a word at once.
	 */
	public MatrixRepresentation representation(String word) {
		HolonomyEvaluator h = requireHolonomy();
		int[] w = wire(word);
		return new MatrixRepresentation(word, h.sl2c(w), h.o31(w), h.complexLength(w));
	}

	public String magmaString() {
		return PresentationExporter.magma(generators(), relators(true));
	}

	public String gapString() {
		return PresentationExporter.gap(generators(), relators(true));
	}

	private int[] wire(String word) {
		return WireFormat.write(codec.decode(word));
	}

	private HolonomyEvaluator requireHolonomy() {
		if (holonomy == null) {
			throw new IllegalStateException("No holonomy evaluator attached to the fundamental group of " + name);
		}
		return holonomy;
	}

	@Override
	public String toString() {
		return "Generators:\n   " + String.join(",", generators()) + "\nRelators:\n   " + String.join("\n   ", relators(false));
	}
}
