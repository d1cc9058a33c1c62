package edu.uw.easymg.syntax.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * An immutable node in a derivation: either a leaf, or a binary node with exactly two children.
 *
 * Trees built by Merge have the specifier (or complement) on the left and the selecting head on the right. Trees
 * built by Move have the tree that hosted the movement on the left, and a trace on the right. The moved
 * constituent is held by the node's chain.
 */
public class DerivationTree implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Chain chain;
	private final DerivationTree leftChild;
	private final DerivationTree rightChild;
	private final int index;
	private final boolean isAdjunct;
	private final ImmutableList<Feature> delayedFeatures;
	private final boolean isPhase;
	private final boolean phaseCompleted;

	private DerivationTree(final Chain chain, final DerivationTree leftChild, final DerivationTree rightChild,
			final int index, final boolean isAdjunct, final List<Feature> delayedFeatures, final boolean isPhase,
			final boolean phaseCompleted) {
		Preconditions.checkArgument((leftChild == null) == (rightChild == null),
				"Derivation trees are strictly binary branching");
		Preconditions.checkArgument(!phaseCompleted || isPhase, "Only phases can be completed");
		this.chain = chain;
		this.leftChild = leftChild;
		this.rightChild = rightChild;
		this.index = index;
		this.isAdjunct = isAdjunct;
		this.delayedFeatures = ImmutableList.copyOf(delayedFeatures);
		this.isPhase = isPhase;
		this.phaseCompleted = phaseCompleted;
	}

	/**
	 * A leaf for a lexical item. Delayed features are taken off the item and kept for late merger.
	 */
	public static DerivationTree leaf(final LexicalItem item, final int index) {
		final List<Feature> features = new ArrayList<>();
		for (final Feature feature : item.getFeatures()) {
			if (!feature.isDelayed()) {
				features.add(feature);
			}
		}
		return new DerivationTree(new Chain(item.withFeatures(features)), null, null, index, false,
				item.getDelayedFeatures(), item.isPhaseHead(), false);
	}

	/**
	 * A leaf built from an existing chain, keeping its trace positions.
	 */
	public static DerivationTree leaf(final Chain chain, final int index) {
		return new DerivationTree(chain, null, null, index, false, Collections.emptyList(), chain.isPhaseHead(),
				false);
	}

	/**
	 * An unpronounced leaf marking the position a constituent moved out of.
	 */
	public static DerivationTree trace(final int index) {
		return new DerivationTree(Chain.withTail(new LexicalItem("", Collections.emptyList()), ImmutableSet.of(index)),
				null, null, index, false, Collections.emptyList(), false, false);
	}

	public static DerivationTree merge(final DerivationTree spec, final DerivationTree head, final Chain chain,
			final int index, final List<Feature> delayedFeatures) {
		return new DerivationTree(chain, spec, head, index, false, delayedFeatures, chain.isPhaseHead(), false);
	}

	/**
	 * Adjunction: the adjunct is marked as such and the head's chain projects.
	 */
	public static DerivationTree pairMerge(final DerivationTree adjunct, final DerivationTree head, final int index) {
		return new DerivationTree(head.chain, adjunct.withAdjunct(true), head, index, false, head.delayedFeatures,
				head.chain.isPhaseHead(), false);
	}

	/**
	 * Movement: the left child is the tree the constituent moved out of, and the right child is a trace at that
	 * tree's own index.
	 */
	public static DerivationTree move(final DerivationTree host, final Chain chain, final int index) {
		return new DerivationTree(chain, host, trace(host.index), index, false, host.delayedFeatures,
				chain.isPhaseHead(), false);
	}

	public Chain getChain() {
		return chain;
	}

	public LexicalItem getHead() {
		return chain.getHead();
	}

	public int getIndex() {
		return index;
	}

	public boolean isAdjunct() {
		return isAdjunct;
	}

	public ImmutableList<Feature> getDelayedFeatures() {
		return delayedFeatures;
	}

	public boolean isPhase() {
		return isPhase;
	}

	public boolean isPhaseCompleted() {
		return phaseCompleted;
	}

	public boolean isLeaf() {
		return leftChild == null;
	}

	/**
	 * Traces are leaves listed in their own trace tail.
	 */
	public boolean isTrace() {
		return isLeaf() && chain.getTail().contains(index);
	}

	/**
	 * True for nodes built by Move.
	 */
	public boolean isMovement() {
		return !isLeaf() && rightChild.isTrace() && rightChild.index == leftChild.index && chain.hasTraces();
	}

	public List<DerivationTree> getChildren() {
		return isLeaf() ? Collections.emptyList() : Arrays.asList(leftChild, rightChild);
	}

	public DerivationTree getLeftChild() {
		Preconditions.checkState(!isLeaf(), "Leaf node does not have children");
		return leftChild;
	}

	public DerivationTree getRightChild() {
		Preconditions.checkState(!isLeaf(), "Leaf node does not have children");
		return rightChild;
	}

	public Optional<Feature> getFirstFeature() {
		return chain.getHead().getFirstFeature();
	}

	public DerivationTree withoutFirstFeature() {
		return withChain(chain.withoutFirstFeature());
	}

	public DerivationTree withChain(final Chain newChain) {
		return new DerivationTree(newChain, leftChild, rightChild, index, isAdjunct, delayedFeatures, isPhase,
				phaseCompleted);
	}

	public DerivationTree withChildren(final DerivationTree newLeft, final DerivationTree newRight) {
		return new DerivationTree(chain, newLeft, newRight, index, isAdjunct, delayedFeatures, isPhase,
				phaseCompleted);
	}

	public DerivationTree withAdjunct(final boolean adjunct) {
		return new DerivationTree(chain, leftChild, rightChild, index, adjunct, delayedFeatures, isPhase,
				phaseCompleted);
	}

	public DerivationTree withDelayedFeatures(final List<Feature> newDelayedFeatures) {
		return new DerivationTree(chain, leftChild, rightChild, index, isAdjunct, newDelayedFeatures, isPhase,
				phaseCompleted);
	}

	/**
	 * Marks this node as a completed phase.
	 */
	public DerivationTree completePhase() {
		return new DerivationTree(chain, leftChild, rightChild, index, isAdjunct, delayedFeatures, true, true);
	}

	/**
	 * Replaces the first node (in pre-order) with the given index by a trace.
	 */
	public DerivationTree replaceWithTrace(final int target) {
		final Optional<DerivationTree> result = replaceWithTrace(this, target);
		return result.orElse(this);
	}

	private static Optional<DerivationTree> replaceWithTrace(final DerivationTree node, final int target) {
		if (node.index == target && !node.isTrace()) {
			return Optional.of(trace(target));
		}
		if (node.isLeaf()) {
			return Optional.empty();
		}
		final Optional<DerivationTree> left = replaceWithTrace(node.leftChild, target);
		if (left.isPresent()) {
			return Optional.of(node.withChildren(left.get(), node.rightChild));
		}
		final Optional<DerivationTree> right = replaceWithTrace(node.rightChild, target);
		if (right.isPresent()) {
			return Optional.of(node.withChildren(node.leftChild, right.get()));
		}
		return Optional.empty();
	}

	public boolean containsTrace() {
		if (isTrace()) {
			return true;
		}
		if (isLeaf()) {
			return false;
		}
		return leftChild.containsTrace() || rightChild.containsTrace();
	}

	/**
	 * True if some constituent still has to move, i.e. a selected constituent or a displaced one has an unchecked
	 * licensee. Head projections are skipped, as their leaves keep features that the projection above has checked.
	 */
	public boolean hasPendingLicensees() {
		if (chain.getDisplaced().isPresent()) {
			final DerivationTree displaced = chain.getDisplaced().get();
			if (hasLicensee(displaced) || displaced.hasPendingLicensees()) {
				return true;
			}
		}
		if (isLeaf()) {
			return false;
		}
		if (!isMovement() && hasLicensee(leftChild)) {
			return true;
		}
		return leftChild.hasPendingLicensees() || rightChild.hasPendingLicensees();
	}

	private static boolean hasLicensee(final DerivationTree node) {
		for (final Feature feature : node.getHead().getCheckableFeatures()) {
			if (feature.isLicensee()) {
				return true;
			}
		}
		return false;
	}

	public int depth() {
		return isLeaf() ? 0 : 1 + Math.max(leftChild.depth(), rightChild.depth());
	}

	public int size() {
		return isLeaf() ? 1 : 1 + leftChild.size() + rightChild.size();
	}

	/**
	 * The phonetic forms of the leaves, left to right. Unlike linearization, this ignores movement and copies.
	 */
	public List<String> getYield() {
		final List<String> result = new ArrayList<>();
		getYield(result);
		return result;
	}

	private void getYield(final List<String> result) {
		if (isLeaf()) {
			if (!chain.getHead().isEmpty()) {
				result.add(chain.getHead().getPhoneticForm());
			}
		} else {
			leftChild.getYield(result);
			rightChild.getYield(result);
		}
	}

	/**
	 * Identifies a tree for duplicate detection during search.
	 */
	public String getSignature() {
		return index + "|" + chain.getHead().getFeatures() + "|" + chain.getHead().getPhoneticForm();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof DerivationTree)) {
			return false;
		}
		final DerivationTree other = (DerivationTree) obj;
		return index == other.index && isAdjunct == other.isAdjunct && isPhase == other.isPhase
				&& phaseCompleted == other.phaseCompleted && chain.equals(other.chain)
				&& delayedFeatures.equals(other.delayedFeatures) && Objects.equals(leftChild, other.leftChild)
				&& Objects.equals(rightChild, other.rightChild);
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, chain.getHead());
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result, 0);
		return result.toString();
	}

	private void toString(final StringBuilder result, final int indent) {
		result.append(Strings.repeat("  ", indent));
		if (isTrace()) {
			result.append("t").append(index);
		} else {
			result.append(chain.getHead());
		}
		result.append(" #").append(index);
		if (chain.hasTraces() && !isTrace()) {
			result.append(" traces=").append(chain.getTail());
		}
		if (!delayedFeatures.isEmpty()) {
			result.append(" delayed=").append(delayedFeatures);
		}
		if (isAdjunct) {
			result.append(" (adjunct)");
		}
		if (isPhase) {
			result.append(phaseCompleted ? " (phase, completed)" : " (phase)");
		}
		result.append("\n");
		if (chain.getDisplaced().isPresent()) {
			chain.getDisplaced().get().toString(result, indent + 1);
		}
		if (!isLeaf()) {
			leftChild.toString(result, indent + 1);
			rightChild.toString(result, indent + 1);
		}
	}
}
