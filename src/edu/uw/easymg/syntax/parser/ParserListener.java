package edu.uw.easymg.syntax.parser;

import java.util.List;
import java.util.Optional;

import edu.uw.easymg.syntax.grammar.DerivationTree;

public interface ParserListener {
	void handleNewSentence(final List<String> words);

	// Returns whether or not to keep parsing.
	boolean handleDequeue(final DerivationTree tree, final int round);

	void handleSearchCompletion(final ParseOutcome outcome, final Optional<DerivationTree> result, final int rounds,
			final int seenSize);
}
