package edu.uw.easymg.syntax.parser;

import java.util.Optional;

import edu.uw.easymg.syntax.grammar.DerivationTree;

/**
 * A slot holding at most one derivation tree.
 */
public class Workspace {
	private final int id;
	private DerivationTree tree;
	private boolean active = true;

	Workspace(final int id) {
		this.id = id;
	}

	public int getId() {
		return id;
	}

	public Optional<DerivationTree> getTree() {
		return Optional.ofNullable(tree);
	}

	void setTree(final DerivationTree tree) {
		this.tree = tree;
	}

	void clear() {
		this.tree = null;
	}

	public boolean isActive() {
		return active;
	}

	void setActive(final boolean active) {
		this.active = active;
	}

	public boolean isEmpty() {
		return tree == null;
	}

	@Override
	public String toString() {
		return "Workspace " + id + (active ? "" : " (inactive)") + (tree == null ? " empty" : "\n" + tree);
	}
}
