package com.github.micycle1.tietzej.word;

import static com.github.micycle1.tietzej.TietzeConstants.INVERSE_SUFFIX;
import static com.github.micycle1.tietzej.TietzeConstants.VERBOSE_SEPARATOR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between {@link Word words} and their display strings for a group
 * with a fixed number of generators.
 * <p>
 * Two renderings are produced. The compact form concatenates tokens and writes
 * inverses in upper case (<code>abAB</code>, <code>x1x2X1X2</code>). The
 * verbose form joins tokens with <code>*</code> and writes inverses as the
 * lower case token followed by <code>^-1</code> (<code>a*b*a^-1*b^-1</code>).
 * {@link #decode(String)} accepts both, and any mixture of them.
 */
public class GeneratorCodec {

	private final int generatorCount;
	private final Alphabet alphabet;

	/**
	 * @param generatorCount number of generators <code>n</code>; words may use
	 *                       generators <code>1..n</code>
	 */
	public GeneratorCodec(int generatorCount) {
		if (generatorCount < 0) {
			throw new IllegalArgumentException("Negative generator count: " + generatorCount);
		}
		this.generatorCount = generatorCount;
		this.alphabet = Alphabet.forGeneratorCount(generatorCount);
	}

	public int getGeneratorCount() {
		return generatorCount;
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	/**
	 * Parses a word string. Tokens may be separated by <code>*</code> and
	 * followed by <code>^-1</code>; the parsed sequence is freely reduced.
	 *
	 * @param text compact or verbose word, the empty string being the identity
	 * @return the reduced word
	 * @throws InvalidGeneratorException if a token names a generator outside
	 *                                   <code>1..n</code>
	 * @throws IllegalArgumentException  if the text contains anything that is not
	 *                                   a token, separator or inverse suffix
	 */
	public Word decode(String text) {
		int[] sequence = new int[text.length()];
		int count = 0;
		boolean afterSeparator = false;
		int pos = 0;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == VERBOSE_SEPARATOR) {
				if (count == 0 || afterSeparator) {
					throw malformed(text, pos);
				}
				afterSeparator = true;
				pos++;
				continue;
			}
			int end = alphabet.scanToken(text, pos);
			if (end == pos) {
				throw malformed(text, pos);
			}
			String token = text.substring(pos, end);
			int g = alphabet.signedGenerator(token);
			if (g == 0 || Math.abs(g) > generatorCount) {
				throw new InvalidGeneratorException(text, token, generatorCount);
			}
			pos = end;
			if (text.startsWith(INVERSE_SUFFIX, pos)) {
				g = -g;
				pos += INVERSE_SUFFIX.length();
			}
			sequence[count++] = g;
			afterSeparator = false;
		}
		if (afterSeparator) {
			throw malformed(text, text.length() - 1);
		}
		return Word.reduce(Arrays.copyOf(sequence, count));
	}

	/**
	 * Renders a word.
	 *
	 * @param word    word over generators <code>1..n</code>
	 * @param verbose <code>*</code>-separated with <code>^-1</code> inverses if
	 *                true, concatenated tokens otherwise
	 * @throws InvalidGeneratorException if the word uses a generator above
	 *                                   <code>n</code>
	 */
	public String encode(Word word, boolean verbose) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < word.length(); i++) {
			int g = word.get(i);
			if (Math.abs(g) > generatorCount) {
				throw new InvalidGeneratorException(word.toString(), Integer.toString(g), generatorCount);
			}
			if (verbose && i > 0) {
				sb.append(VERBOSE_SEPARATOR);
			}
			sb.append(render(g, verbose));
		}
		return sb.toString();
	}

	/**
	 * Renders a single signed generator with the same rules as
	 * {@link #encode(Word, boolean)}.
	 */
	public String encodeGenerator(int g, boolean verbose) {
		if (g == 0 || Math.abs(g) > generatorCount) {
			throw new InvalidGeneratorException(Integer.toString(g), Integer.toString(g), generatorCount);
		}
		return render(g, verbose);
	}

	/**
	 * Names of the generators <code>1..n</code>, in order.
	 */
	public List<String> generatorNames() {
		List<String> names = new ArrayList<>(generatorCount);
		for (int g = 1; g <= generatorCount; g++) {
			names.add(alphabet.token(g));
		}
		return names;
	}

	private String render(int g, boolean verbose) {
		if (verbose && g < 0) {
			return alphabet.token(-g) + INVERSE_SUFFIX;
		}
		return alphabet.token(g);
	}

	private static IllegalArgumentException malformed(String text, int pos) {
		return new IllegalArgumentException("The word \"" + text + "\" contains an unexpected character '" + text.charAt(pos) + "' at position " + pos);
	}
}
