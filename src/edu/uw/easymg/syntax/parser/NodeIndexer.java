package edu.uw.easymg.syntax.parser;

/**
 * Hands out the structural indices of a single parse, in increasing order.
 */
public class NodeIndexer {
	private int next;

	public NodeIndexer(final int start) {
		this.next = start;
	}

	public NodeIndexer() {
		this(0);
	}

	public int next() {
		return next++;
	}

	public int peek() {
		return next;
	}
}
