package edu.uw.easymg.syntax.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;

/**
 * Decides which nodes head phases, and what stays accessible once a phase is complete.
 */
public class PhaseChecker {

	private final PhaseConfig config;

	public PhaseChecker(final PhaseConfig config) {
		this.config = config;
	}

	public PhaseConfig getConfig() {
		return config;
	}

	/**
	 * True if the node carries an explicit phase marker, or its next feature is one of the phase-head categories.
	 */
	public boolean isPhaseHead(final DerivationTree node) {
		if (node.getChain().isPhaseHead()) {
			return true;
		}
		final Optional<Feature> first = node.getFirstFeature();
		return first.isPresent() && first.get().isCategorial()
				&& config.getPhaseHeads().contains(first.get().getName());
	}

	/**
	 * The elements at the edge of a phase: the constituent displaced to it (if any), followed by successive left
	 * children, up to the configured maximum.
	 */
	public List<DerivationTree> getPhaseEdge(final DerivationTree phase) {
		final List<DerivationTree> result = new ArrayList<>();
		if (!phase.isPhase() && !isPhaseHead(phase)) {
			return result;
		}

		if (phase.getChain().getDisplaced().isPresent()) {
			result.add(phase.getChain().getDisplaced().get());
		}
		DerivationTree node = phase;
		while (!node.isLeaf()) {
			node = node.getLeftChild();
			result.add(node);
		}

		return result.size() > config.getMaxEdgeElements() ? result.subList(0, config.getMaxEdgeElements())
				: result;
	}

	/**
	 * Whether the constituent at targetIndex can still be reached inside the given phase.
	 */
	public boolean checkExtraction(final DerivationTree phase, final int targetIndex) {
		if (!config.isEnforcePIC() || !phase.isPhaseCompleted()) {
			return true;
		}

		for (final DerivationTree edge : getPhaseEdge(phase)) {
			if (edge.getIndex() == targetIndex || edge.getChain().getTail().contains(targetIndex)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Marks every phase head in the tree as completed. Embedded phases are transferred independently.
	 */
	public DerivationTree transferPhase(final DerivationTree tree) {
		DerivationTree result = tree;
		if (!tree.isLeaf()) {
			result = tree.withChildren(transferPhase(tree.getLeftChild()), transferPhase(tree.getRightChild()));
		}
		if (isPhaseHead(result)) {
			result = result.completePhase();
		}
		return result;
	}

	/**
	 * The phase heads along the complement (right child) path from the root.
	 */
	public List<DerivationTree> phaseSpine(final DerivationTree tree) {
		final List<DerivationTree> result = new ArrayList<>();
		DerivationTree node = tree;
		while (true) {
			if (isPhaseHead(node)) {
				result.add(node);
			}
			if (node.isLeaf()) {
				break;
			}
			node = node.getRightChild();
		}
		return result;
	}
}
