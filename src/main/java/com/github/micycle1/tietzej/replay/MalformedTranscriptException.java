package com.github.micycle1.tietzej.replay;

/**
 * Thrown when a move transcript breaks its grammar: an introduction without its
 * closing sentinel, a paired move missing its second token, or an index outside
 * the generator table. The transcript comes from the presentation kernel, so
 * this signals a broken contract and is not recoverable.
 */
public class MalformedTranscriptException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int position;

	/**
	 * @param message  description of the violation
	 * @param position offset in the transcript of the move being read
	 */
	public MalformedTranscriptException(String message, int position) {
		super(message + " (move at transcript offset " + position + ")");
		this.position = position;
	}

	public int getPosition() {
		return position;
	}
}
