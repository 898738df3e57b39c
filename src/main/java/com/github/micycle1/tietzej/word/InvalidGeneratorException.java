package com.github.micycle1.tietzej.word;

/**
 * Thrown when a word names a generator outside <code>1..n</code> of the group
 * it is interpreted in.
 */
public class InvalidGeneratorException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String word;
	private final String generator;
	private final int generatorCount;

	/**
	 * @param word           the offending word, as given by the caller
	 * @param generator      the token (or signed index) that is not a generator
	 * @param generatorCount number of generators of the group
	 */
	public InvalidGeneratorException(String word, String generator, int generatorCount) {
		super("The word \"" + word + "\" contains a non-generator: " + generator + " (the group has " + generatorCount + " generators)");
		this.word = word;
		this.generator = generator;
		this.generatorCount = generatorCount;
	}

	public String getWord() {
		return word;
	}

	public String getGenerator() {
		return generator;
	}

	public int getGeneratorCount() {
		return generatorCount;
	}
}
