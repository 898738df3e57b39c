package com.github.micycle1.tietzej.presentation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.github.micycle1.tietzej.kernel.HolonomyEvaluator;
import com.github.micycle1.tietzej.kernel.PresentationKernel;
import com.github.micycle1.tietzej.kernel.RawPresentation;
import com.github.micycle1.tietzej.kernel.SimplificationOptions;
import com.github.micycle1.tietzej.kernel.Triangulation;
import com.github.micycle1.tietzej.replay.MalformedTranscriptException;
import com.github.micycle1.tietzej.word.InvalidGeneratorException;
import com.github.micycle1.tietzej.word.Word;

@ExtendWith(MockitoExtension.class)
class FundamentalGroupTest {

	@Mock
	private Triangulation triangulation;

	@Mock
	private PresentationKernel kernel;

	@Mock
	private HolonomyEvaluator holonomy;

	/*-
	 * Two generators a, b simplified from three originals:
	 *   slide 1 by 2 (a -> ab), delete 3.
	 * Relators abAB and aab; two cusps.
	 */
	private static RawPresentation twoGeneratorPresentation(int[] moves) {
		return new RawPresentation(2, 3, //
				List.of(new int[] { 1, 2, -1, -2, 0 }, new int[] { 1, 1, 2, 0 }), //
				List.of(new int[] { 1, 0 }, new int[] { -2, 1, 0 }), //
				List.of(new int[] { 2, 0 }, new int[] { 1, 1, -2, 0 }), //
				moves);
	}

	@BeforeEach
	void setUp() {
		lenient().when(triangulation.getName()).thenReturn("m004");
		lenient().when(triangulation.getNumTetrahedra()).thenReturn(2);
		lenient().when(triangulation.getNumCusps()).thenReturn(2);
		lenient().when(kernel.computePresentation(any(), any())).thenReturn(twoGeneratorPresentation(new int[] { 1, 2, 3, 3, 0 }));
	}

	@Test
	void testEmptyTriangulationFailsFast() {
		when(triangulation.getNumTetrahedra()).thenReturn(0);
		assertThrows(IllegalArgumentException.class, () -> new FundamentalGroup(triangulation, kernel));
		verify(kernel, never()).computePresentation(any(), any());
	}

	@Test
	void testOptionsAreForwardedUnchanged() {
		SimplificationOptions options = SimplificationOptions.builder().minimizeNumberOfGenerators(false).build();
		new FundamentalGroup(triangulation, kernel, options);
		verify(kernel).computePresentation(triangulation, options);
	}

	@Test
	void testCounts() {
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals("m004", g.getName());
		assertEquals(2, g.getNumGenerators());
		assertEquals(3, g.getNumOriginalGenerators());
		assertEquals(2, g.getNumRelators());
		assertEquals(2, g.getNumCusps());
	}

	@Test
	void testGeneratorsAndRelators() {
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals(List.of("a", "b"), g.generators());
		assertEquals(List.of("abAB", "aab"), g.relators());
		assertEquals(List.of("a*b*a^-1*b^-1", "a*a*b"), g.relators(true));
		assertArrayEquals(new int[] { 1, 2, -1, -2 }, g.relatorsAsIntLists().get(0));
		assertEquals(Word.reduce(1, 1, 2), g.getRelatorWords().get(1));
	}

	@Nested
	class PeripheralCurveLookup {

		private FundamentalGroup g;

		@BeforeEach
		void setUp() {
			g = new FundamentalGroup(triangulation, kernel);
		}

		@Test
		void testByIndex() {
			assertEquals("a", g.meridian(0));
			assertEquals("b", g.longitude(0));
			assertEquals("Ba", g.meridian(1));
			assertEquals("aaB", g.longitude(1));
			assertEquals(Word.reduce(-2, 1), g.meridianWord(1));
		}

		@Test
		@DisplayName("Negative cusp index counts from the end")
		void testNegativeIndex() {
			assertEquals("Ba", g.meridian(-1));
			assertEquals("b", g.longitude(-2));
			assertSame(g.peripheralCurves(1), g.peripheralCurves(-1));
		}

		@Test
		void testOutOfRange() {
			IndexOutOfBoundsException e = assertThrows(IndexOutOfBoundsException.class, () -> g.meridian(2));
			assertTrue(e.getMessage().contains("2"));
			assertThrows(IndexOutOfBoundsException.class, () -> g.longitude(-3));
		}

		@Test
		void testAllCusps() {
			assertEquals(List.of(Pair.of("a", "b"), Pair.of("Ba", "aaB")), g.peripheralCurveStrings());
			assertEquals(2, g.peripheralCurves().size());
			assertEquals(1, g.peripheralCurves().get(1).getCusp());
		}
	}

	@Test
	@DisplayName("Current generators are expressed in the original generators")
	void testGeneratorsInOriginals() {
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals(List.of("ab", "b"), g.generatorsInOriginals());
		assertEquals(List.of("a*b", "b"), g.generatorsInOriginals(true));
		assertEquals(List.of(Word.reduce(1, 2), Word.generator(2)), g.generatorsInOriginalWords());
		assertArrayEquals(new int[] { 1, 2, 3, 3 }, g.getMoveTranscript());
	}

	@Test
	void testMalformedTranscriptSurfacesOnReplay() {
		when(kernel.computePresentation(any(), any())).thenReturn(twoGeneratorPresentation(new int[] { 5, 1, 0 }));
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertThrows(MalformedTranscriptException.class, g::generatorsInOriginals);
		assertArrayEquals(new int[] { 5, 1 }, g.getMoveTranscript());
	}

	@Nested
	class Holonomy {

		private final FieldMatrix<Complex> sl2c = MatrixUtils.createFieldMatrix(new Complex[][] { { Complex.ONE, Complex.I }, { Complex.ZERO, Complex.ONE } });
		private final RealMatrix o31 = MatrixUtils.createRealIdentityMatrix(4);
		private final Complex length = new Complex(1.0870, 1.7536);

		@Test
		void testWordIsPassedInWireFormat() {
			when(holonomy.sl2c(aryEq(new int[] { 1, -2, 0 }))).thenReturn(sl2c);
			FundamentalGroup g = new FundamentalGroup(triangulation, kernel, SimplificationOptions.defaults(), holonomy);
			assertSame(sl2c, g.sl2c("aB"));
		}

		@Test
		void testRepresentation() {
			when(holonomy.sl2c(aryEq(new int[] { 1, 2, 0 }))).thenReturn(sl2c);
			when(holonomy.o31(aryEq(new int[] { 1, 2, 0 }))).thenReturn(o31);
			when(holonomy.complexLength(aryEq(new int[] { 1, 2, 0 }))).thenReturn(length);
			FundamentalGroup g = new FundamentalGroup(triangulation, kernel, SimplificationOptions.defaults(), holonomy);

			MatrixRepresentation rep = g.representation("a*b");
			assertEquals("a*b", rep.getWord());
			assertSame(sl2c, rep.getSl2c());
			assertSame(o31, rep.getO31());
			assertEquals(length, rep.getComplexLength());
			assertSame(o31, g.o31("ab"));
			assertEquals(length, g.complexLength("abbB"));
		}

		@Test
		void testBadWordNeverReachesKernel() {
			FundamentalGroup g = new FundamentalGroup(triangulation, kernel, SimplificationOptions.defaults(), holonomy);
			InvalidGeneratorException e = assertThrows(InvalidGeneratorException.class, () -> g.sl2c("abc"));
			assertEquals("abc", e.getWord());
			verifyNoInteractions(holonomy);
		}

		@Test
		void testNoEvaluatorAttached() {
			FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
			assertThrows(IllegalStateException.class, () -> g.complexLength("a"));
		}
	}

	@Test
	void testExports() {
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals("Group<a,b|a*b*a^-1*b^-1,a*a*b>", g.magmaString());
		assertEquals("CallFuncList(function() local F, a, b; F := FreeGroup(\"a\",\"b\"); a := F.1; b := F.2; return F/[a*b*a^-1*b^-1,a*a*b]; end,[])",
				g.gapString());
	}

	@Test
	void testToString() {
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals("Generators:\n   a,b\nRelators:\n   abAB\n   aab", g.toString());
	}

	@Test
	@DisplayName("More than 26 generators use indexed names throughout")
	void testIndexedGenerators() {
		when(kernel.computePresentation(any(), any()))
				.thenReturn(new RawPresentation(27, 27, List.of(new int[] { 1, -27, 0 }), List.of(), List.of(), new int[] { 27, -27, 0 }));
		FundamentalGroup g = new FundamentalGroup(triangulation, kernel);
		assertEquals("x27", g.generators().get(26));
		assertEquals(List.of("x1X27"), g.relators());
		assertEquals(List.of("x1*x27^-1"), g.relators(true));
		assertEquals("X27", g.generatorsInOriginals().get(26));
		assertEquals("x27^-1", g.generatorsInOriginals(true).get(26));
		assertThrows(IndexOutOfBoundsException.class, () -> g.meridian(0));
	}
}
