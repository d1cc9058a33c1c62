package edu.uw.easymg.syntax.parser;

/**
 * Ways of combining two trees, in the order they are tried.
 */
public enum MergeStrategy {
	/**
	 * Selector (or strong selector) checks a category.
	 */
	STANDARD,
	/**
	 * Adjunction: an adjunct selector checks a category, and the host projects unchanged.
	 */
	PAIR_MERGE,
	/**
	 * A delayed selector of the head checks a category after the head has been built.
	 */
	LATE_MERGE
}
