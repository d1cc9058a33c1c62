package edu.uw.easymg.syntax.parser;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import edu.uw.easymg.syntax.grammar.Chain;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;
import edu.uw.easymg.syntax.grammar.LexicalItem;

/**
 * Checks a licensor on the root of a tree by displacing the first matching licensee-bearing constituent, which
 * leaves a trace behind.
 */
public class MoveEngine {

	private final EnumSet<MovementStrategy> strategies;
	private final PhaseChecker phaseChecker;
	private final boolean allowRemnantMovement;
	private final boolean allowVacuousMovement;

	public MoveEngine(final Collection<MovementStrategy> strategies, final PhaseChecker phaseChecker,
			final boolean allowRemnantMovement, final boolean allowVacuousMovement) {
		this.strategies = strategies.isEmpty() ? EnumSet.noneOf(MovementStrategy.class) : EnumSet.copyOf(strategies);
		this.phaseChecker = phaseChecker;
		this.allowRemnantMovement = allowRemnantMovement;
		this.allowVacuousMovement = allowVacuousMovement;
	}

	/**
	 * The result of pulling a constituent out of a tree.
	 */
	public static class Extraction {
		private final DerivationTree moved;
		private final DerivationTree remainder;

		private Extraction(final DerivationTree moved, final DerivationTree remainder) {
			this.moved = moved;
			this.remainder = remainder;
		}

		/**
		 * The constituent, as it was before it moved.
		 */
		public DerivationTree getMoved() {
			return moved;
		}

		/**
		 * The tree it moved out of, with a trace in its place.
		 */
		public DerivationTree getRemainder() {
			return remainder;
		}

		/**
		 * The chain of the moved constituent, once its licensee is checked.
		 */
		public Chain getChain() {
			final DerivationTree checked = moved.withoutFirstFeature();
			final Set<Integer> tail = new TreeSet<>(moved.getChain().getTail());
			tail.add(moved.getIndex());
			return Chain.withTail(checked.getHead(), tail).withDisplaced(checked);
		}
	}

	public Optional<DerivationTree> applyMove(final DerivationTree tree, final NodeIndexer indexer) {
		if (!strategies.contains(MovementStrategy.STANDARD) && !strategies.contains(MovementStrategy.MULTI_SPECIFIER)) {
			return Optional.empty();
		}

		Optional<DerivationTree> result = moveOnce(tree, indexer);
		if (strategies.contains(MovementStrategy.MULTI_SPECIFIER)) {
			while (result.isPresent() && isLicensor(result.get().getFirstFeature())) {
				final Optional<DerivationTree> next = moveOnce(result.get(), indexer);
				if (!next.isPresent()) {
					break;
				}
				result = next;
			}
		}

		return result;
	}

	private Optional<DerivationTree> moveOnce(final DerivationTree tree, final NodeIndexer indexer) {
		final Optional<Feature> licensor = tree.getFirstFeature();
		if (!isLicensor(licensor)) {
			return Optional.empty();
		}

		final Optional<Extraction> extraction = extract(tree, licensor.get().getName());
		if (!extraction.isPresent()) {
			return Optional.empty();
		}

		final DerivationTree result = landing(extraction.get().getRemainder(), extraction.get().getChain(),
				indexer);
		if (!allowVacuousMovement && Linearizer.linearize(result).equals(Linearizer.linearize(tree))) {
			return Optional.empty();
		}

		return Optional.of(result);
	}

	/**
	 * Checks the licensor on the root of tree against another, independent, tree whose root bears the licensee.
	 */
	public Optional<DerivationTree> applyInterarborealMove(final DerivationTree tree, final DerivationTree other,
			final NodeIndexer indexer) {
		if (!strategies.contains(MovementStrategy.INTERARBOREAL)) {
			return Optional.empty();
		}

		final Optional<Feature> licensor = tree.getFirstFeature();
		final Optional<Feature> licensee = other.getFirstFeature();
		if (!licensor.isPresent() || !licensee.isPresent() || !licensor.get().matchesMove(licensee.get())) {
			return Optional.empty();
		}

		return Optional.of(landing(tree, new Extraction(other, other).getChain(), indexer));
	}

	/**
	 * Builds the landing site of a moved chain above the host, checking the host's licensor if it has one.
	 */
	public static DerivationTree landing(final DerivationTree host, final Chain moved, final NodeIndexer indexer) {
		final DerivationTree checkedHost = isLicensor(host.getFirstFeature()) ? host.withoutFirstFeature() : host;
		final LexicalItem hostItem = checkedHost.getHead();
		final LexicalItem item = new LexicalItem(moved.getHead().getPhoneticForm(), hostItem.getFeatures(),
				hostItem.getAgreement());
		final Chain chain = Chain.withTail(item, moved.getTail()).withDisplaced(
				moved.getDisplaced().orElseGet(() -> DerivationTree.leaf(moved.withoutDisplaced(), indexer.next())))
				.mergeAgreement(moved.getAgreement());
		return DerivationTree.move(checkedHost, chain, indexer.next());
	}

	/**
	 * Finds the first constituent in pre-order (displaced constituents before the rest of a node) whose next
	 * feature is the licensee, and replaces it by a trace.
	 */
	public Optional<Extraction> extract(final DerivationTree tree, final String licensee) {
		return extract(tree, licensee, new ArrayDeque<>(), true);
	}

	private Optional<Extraction> extract(final DerivationTree node, final String licensee,
			final Deque<DerivationTree> completedPhases, final boolean isRoot) {
		if (!isRoot && isCandidate(node, licensee) && isAccessible(node.getIndex(), completedPhases)) {
			return Optional.of(new Extraction(node, DerivationTree.trace(node.getIndex())));
		}

		final boolean opaque = !isRoot && node.isPhaseCompleted() && phaseChecker.getConfig().isEnforcePIC();
		if (opaque) {
			completedPhases.push(node);
		}
		try {
			final Optional<DerivationTree> displaced = node.getChain().getDisplaced();
			if (displaced.isPresent()) {
				final Optional<Extraction> result = extract(displaced.get(), licensee, completedPhases, false);
				if (result.isPresent()) {
					final DerivationTree remainder = result.get().getRemainder();
					final Chain chain = remainder.isTrace() ? node.getChain().withoutDisplaced()
							: node.getChain().withDisplaced(remainder);
					return Optional.of(new Extraction(result.get().getMoved(), node.withChain(chain)));
				}
			}

			if (node.isLeaf()) {
				return Optional.empty();
			}

			final Optional<Extraction> left = extract(node.getLeftChild(), licensee, completedPhases, false);
			if (left.isPresent()) {
				return Optional.of(new Extraction(left.get().getMoved(), node.withChildren(left.get().getRemainder(),
						node.getRightChild())));
			}

			final Optional<Extraction> right = extract(node.getRightChild(), licensee, completedPhases, false);
			if (right.isPresent()) {
				return Optional.of(new Extraction(right.get().getMoved(), node.withChildren(node.getLeftChild(),
						right.get().getRemainder())));
			}

			return Optional.empty();
		} finally {
			if (opaque) {
				completedPhases.pop();
			}
		}
	}

	private boolean isCandidate(final DerivationTree node, final String licensee) {
		final Optional<Feature> first = node.getFirstFeature();
		return !node.isTrace() && first.isPresent() && first.get().isLicensee()
				&& first.get().getName().equals(licensee) && (allowRemnantMovement || !node.containsTrace());
	}

	private boolean isAccessible(final int index, final Deque<DerivationTree> completedPhases) {
		for (final DerivationTree phase : completedPhases) {
			if (!phaseChecker.checkExtraction(phase, index)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isLicensor(final Optional<Feature> feature) {
		return feature.isPresent() && feature.get().isLicensor();
	}
}
