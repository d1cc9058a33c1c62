package edu.uw.easymg.syntax.parser;

/**
 * How a parse attempt ended.
 */
public enum ParseOutcome {
	ACCEPTED,
	// A word had no lexical entries, so the search never started.
	UNKNOWN_WORD,
	// No derivation was found within the search bounds.
	SEARCH_EXHAUSTED,
	// The sentence was longer than the parser accepts.
	TOO_LONG
}
