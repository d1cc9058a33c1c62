package edu.uw.easymg.syntax.parser;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.easymg.lexicon.Lexicon;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.LexicalItem;

public abstract class AbstractParser implements Parser {

	private final static Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

	protected final Lexicon lexicon;
	protected final int maxLength;
	protected final Collection<String> goalCategories;
	protected final List<LexicalItem> covertHeads;
	protected final List<ParserListener> listeners;
	protected final PhaseChecker phaseChecker;
	protected final MergeEngine mergeEngine;
	protected final MoveEngine moveEngine;

	public AbstractParser(final ParserBuilder<?> builder) {
		this.lexicon = builder.getLexicon();
		this.maxLength = builder.getMaxSentenceLength();
		this.goalCategories = ImmutableSet.copyOf(builder.getGoalCategories());
		this.covertHeads = ImmutableList.copyOf(builder.getCovertHeads());
		this.listeners = ImmutableList.copyOf(builder.getListeners());
		this.phaseChecker = new PhaseChecker(builder.getPhaseConfig());
		this.mergeEngine = new MergeEngine(builder.getMergeStrategies(), phaseChecker);
		this.moveEngine = new MoveEngine(builder.getMovementStrategies(), phaseChecker,
				builder.getAllowRemnantMovement(), builder.getAllowVacuousMovement());
	}

	@Override
	public Optional<DerivationTree> parse(final String sentence) {
		return parseTokens(tokenize(sentence));
	}

	public static List<String> tokenize(final String sentence) {
		return WHITESPACE.splitToList(sentence);
	}

	@Override
	public Optional<DerivationTree> parseTokens(final List<String> words) {
		for (final ParserListener listener : listeners) {
			listener.handleNewSentence(words);
		}

		if (words.size() > maxLength) {
			System.err.println("Skipping sentence of length " + words.size());
			notifyCompletion(ParseOutcome.TOO_LONG, Optional.empty(), 0, 0);
			return Optional.empty();
		}

		for (final String word : words) {
			if (!lexicon.hasWord(word)) {
				System.err.println("Unknown word: " + word);
				notifyCompletion(ParseOutcome.UNKNOWN_WORD, Optional.empty(), 0, 0);
				return Optional.empty();
			}
		}

		return parse(words);
	}

	/**
	 * Searches for a derivation of words, which all have lexical entries.
	 *
	 * Returns Optional.empty() if the search fails.
	 */
	protected abstract Optional<DerivationTree> parse(List<String> words);

	protected void notifyCompletion(final ParseOutcome outcome, final Optional<DerivationTree> result,
			final int rounds, final int seenSize) {
		for (final ParserListener listener : listeners) {
			listener.handleSearchCompletion(outcome, result, rounds, seenSize);
		}
	}

	/**
	 * A tree is accepted if it is saturated at a goal category, nothing inside it is still waiting to move, and it
	 * pronounces exactly the input words.
	 */
	protected boolean isAccepted(final DerivationTree tree, final List<String> words) {
		final Optional<String> category = tree.getHead().getCategory();
		return category.isPresent() && goalCategories.contains(category.get()) && !tree.hasPendingLicensees()
				&& linearize(tree).equals(words);
	}

	@Override
	public List<String> linearize(final DerivationTree tree) {
		return Linearizer.linearize(tree);
	}

	@Override
	public int getMaxSentenceLength() {
		return maxLength;
	}

	public PhaseChecker getPhaseChecker() {
		return phaseChecker;
	}

	public MergeEngine getMergeEngine() {
		return mergeEngine;
	}

	public MoveEngine getMoveEngine() {
		return moveEngine;
	}
}
