package com.github.micycle1.tietzej.replay;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.tietzej.word.Word;

/**
 * Replays the Tietze moves recorded during presentation simplification to
 * express every simplified generator as a word in the original (geometric)
 * generators.
 * <p>
 * Each call to {@link #replay()} starts from a fresh table in which original
 * generator <code>i</code> is the word <code>[i]</code>, applies the moves in
 * transcript order, and returns the table. Instances hold only the immutable
 * input and can be replayed any number of times.
 */
public class TransformationReplay {

	private static final Logger LOGGER = LoggerFactory.getLogger(TransformationReplay.class);

	private final int originalGeneratorCount;
	private final int[] transcript;

	/**
	 * @param originalGeneratorCount number of original generators
	 *                               <code>n0</code>
	 * @param transcript             move transcript, without its wire terminator
	 */
	public TransformationReplay(int originalGeneratorCount, int[] transcript) {
		if (originalGeneratorCount < 0) {
			throw new IllegalArgumentException("Negative generator count: " + originalGeneratorCount);
		}
		this.originalGeneratorCount = originalGeneratorCount;
		this.transcript = transcript.clone();
	}

	public int getOriginalGeneratorCount() {
		return originalGeneratorCount;
	}

	/**
	 * Runs the moves.
	 *
	 * @return one word per current generator, in index order, each over the
	 *         original generators <code>1..n0</code>
	 * @throws MalformedTranscriptException if the transcript breaks its grammar
	 */
	public List<Word> replay() {
		GeneratorTable table = new GeneratorTable(originalGeneratorCount);
		MoveTranscript moves = new MoveTranscript(transcript);
		int applied = 0;
		try {
			while (moves.hasNext()) {
				TietzeMove move = moves.nextMove(table.size());
				apply(table, move);
				applied++;
			}
		} catch (MalformedTranscriptException e) {
			LOGGER.error("Replay over {} original generators stopped after {} moves: {}", originalGeneratorCount, applied, e.getMessage());
			throw e;
		}
		LOGGER.debug("Replayed {} moves: {} original generators -> {} current generators", applied, originalGeneratorCount, table.size());
		return table.words();
	}

	/**
	 * Decodes the transcript into its moves without replaying them.
	 */
	public List<TietzeMove> moves() {
		return MoveTranscript.parse(originalGeneratorCount, transcript);
	}

	/**
	 * @return a copy of the transcript as given
	 */
	public int[] getTranscript() {
		return transcript.clone();
	}

	static void apply(GeneratorTable table, TietzeMove move) {
		LOGGER.trace("Applying {}", move);
		final int target = move.getTarget();
		switch (move.getType()) {
			case INTRODUCTION : {
				Word definition = Word.identity();
				for (int g : move.getDefiningWord()) {
					definition = definition.concat(table.resolve(g));
				}
				table.append(definition);
				break;
			}
			case DELETION :
				// index 'target' now names what used to be the last generator
				table.swapRemove(target);
				break;
			case INVERSION :
				table.set(target, table.get(target).inverse());
				break;
			case SLIDE : {
				final int a = move.getFirst();
				final int b = move.getSecond();
				Word slideBy = table.get(Math.abs(b));
				if (Integer.signum(a) != Integer.signum(b)) {
					slideBy = slideBy.inverse();
				}
				Word current = table.get(target);
				table.set(target, a > 0 ? current.concat(slideBy) : slideBy.concat(current));
				break;
			}
			default :
				throw new IllegalStateException("Unhandled move type: " + move.getType());
		}
	}
}
