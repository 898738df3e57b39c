package com.github.micycle1.tietzej.kernel;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.micycle1.tietzej.word.Word;

class WireFormatTest {

	@Test
	void testReadWordStopsAtTerminator() {
		assertEquals(Word.reduce(1, -2), WireFormat.readWord(new int[] { 1, -2, 0, 7, 7 }));
		assertTrue(WireFormat.readWord(new int[] { 0 }).isIdentity());
	}

	@Test
	void testReadSequenceDoesNotReduce() {
		// transcripts are instructions, not words
		assertArrayEquals(new int[] { 1, -1, 3, 3 }, WireFormat.readSequence(new int[] { 1, -1, 3, 3, 0 }));
	}

	@Test
	void testMissingTerminator() {
		assertThrows(IllegalArgumentException.class, () -> WireFormat.readWord(new int[] { 1, 2 }));
		assertThrows(IllegalArgumentException.class, () -> WireFormat.readSequence(new int[0]));
	}

	@Test
	void testWriteAppendsTerminator() {
		assertArrayEquals(new int[] { 2, -1, 0 }, WireFormat.write(Word.reduce(2, -1)));
		assertArrayEquals(new int[] { 0 }, WireFormat.write(Word.identity()));
	}
}
