package edu.uw.easymg.syntax.parser;

import java.util.List;
import java.util.Optional;

import edu.uw.easymg.syntax.grammar.DerivationTree;

public interface Parser {

	/**
	 * Splits the sentence on whitespace and parses the words.
	 */
	Optional<DerivationTree> parse(String sentence);

	/**
	 * Returns a derivation whose linearization is exactly the given words, or Optional.empty() if none was found.
	 */
	Optional<DerivationTree> parseTokens(List<String> words);

	List<String> linearize(DerivationTree tree);

	int getMaxSentenceLength();
}
