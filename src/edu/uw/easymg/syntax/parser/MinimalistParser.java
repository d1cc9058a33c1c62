package edu.uw.easymg.syntax.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;

import edu.uw.easymg.lexicon.Lexicon;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;
import edu.uw.easymg.syntax.grammar.LexicalItem;

/**
 * Breadth-first search over derivations. Each round takes the oldest tree off the agenda, and tries merging it
 * with every tree taken off before it (in both orders), and moving within it. The search stops when a tree
 * derives the input, or after a fixed number of rounds.
 */
public class MinimalistParser extends AbstractParser {

	protected final int maxDerivationDepth;
	protected final int maxSeenSize;
	protected final int maxAgendaSize;
	protected final int maxWorkspaces;
	protected final boolean sidewardMovement;
	protected final List<SidewardMovementType> sidewardMovementTypes;

	protected MinimalistParser(final Builder builder) {
		super(builder);
		this.maxDerivationDepth = builder.getMaxDerivationDepth();
		this.maxSeenSize = builder.getMaxSeenSize();
		this.maxAgendaSize = builder.getMaxAgendaSize();
		this.maxWorkspaces = builder.getMaxWorkspaces();
		this.sidewardMovement = builder.getEnableParallelWorkspaces()
				&& builder.getMovementStrategies().contains(MovementStrategy.SIDEWARD)
				&& !builder.getSidewardMovementTypes().isEmpty();
		this.sidewardMovementTypes = new ArrayList<>(builder.getSidewardMovementTypes());
	}

	public static class Builder extends ParserBuilder<Builder> {

		public Builder(final Lexicon lexicon) {
			super(lexicon);
		}

		@Override
		protected MinimalistParser build2() {
			return new MinimalistParser(this);
		}
	}

	/**
	 * The state of one search. Indices start from zero for every sentence.
	 */
	private class Search {
		private final NodeIndexer indexer = new NodeIndexer();
		private final Deque<DerivationTree> agenda = new ArrayDeque<>();
		private final List<DerivationTree> seen = new ArrayList<>();
		private final Set<String> signatures = new HashSet<>();

		private void seed(final List<String> words) {
			for (final String word : words) {
				for (final LexicalItem item : lexicon.getEntries(word)) {
					add(DerivationTree.leaf(item, indexer.next()));
				}
			}

			for (final LexicalItem item : covertHeads) {
				add(DerivationTree.leaf(item, indexer.next()));
			}
		}

		private void add(final DerivationTree tree) {
			if (agenda.size() >= maxAgendaSize) {
				return;
			}

			if (signatures.add(tree.getSignature())) {
				agenda.add(tree);
			}
		}

		private void addDerived(final Optional<DerivationTree> tree) {
			if (!tree.isPresent()) {
				return;
			}

			final DerivationTree result = tree.get();
			if (phaseChecker.getConfig().isImmediateTransfer() && isCompletePhase(result)) {
				add(phaseChecker.transferPhase(result));
			} else {
				add(result);
			}
		}

		private void explore(final DerivationTree tree) {
			for (final DerivationTree other : seen) {
				addDerived(mergeEngine.applyMerge(tree, other, indexer));
				addDerived(mergeEngine.applyMerge(other, tree, indexer));
				addDerived(moveEngine.applyInterarborealMove(tree, other, indexer));
				addDerived(moveEngine.applyInterarborealMove(other, tree, indexer));
				if (sidewardMovement) {
					exploreSideward(tree, other);
					exploreSideward(other, tree);
				}
			}

			addDerived(moveEngine.applyMove(tree, indexer));
		}

		/**
		 * Moves a constituent of source into target, each in its own workspace.
		 */
		private void exploreSideward(final DerivationTree source, final DerivationTree target) {
			final Optional<Feature> licensor = target.getFirstFeature();
			if (!licensor.isPresent() || !licensor.get().isLicensor() || maxWorkspaces < 2) {
				return;
			}

			final Optional<MoveEngine.Extraction> extraction = moveEngine.extract(source, licensor.get().getName());
			if (!extraction.isPresent()) {
				return;
			}

			for (final SidewardMovementType type : sidewardMovementTypes) {
				// Every alternative gets a fresh registry.
				final WorkspaceRegistry workspaces = new WorkspaceRegistry(maxWorkspaces);
				final int sourceWorkspace = workspaces.newWorkspace();
				workspaces.addTree(sourceWorkspace, extraction.get().getRemainder());
				final int targetWorkspace = workspaces.newWorkspace();
				workspaces.addTree(targetWorkspace, target);

				final Optional<DerivationTree> result = workspaces.sidewardMove(sourceWorkspace, targetWorkspace,
						extraction.get().getChain(), type, indexer);
				addDerived(result);

				if (type == SidewardMovementType.NUNES_STYLE && result.isPresent()) {
					// Try to reunite the two workspaces.
					final Optional<Integer> merged = workspaces.mergeWorkspaces(sourceWorkspace, targetWorkspace,
							this::mergeEitherWay);
					if (merged.isPresent()) {
						addDerived(workspaces.getTree(merged.get()));
					}
				}
			}
		}

		private Optional<DerivationTree> mergeEitherWay(final DerivationTree left, final DerivationTree right) {
			final Optional<DerivationTree> result = mergeEngine.applyMerge(left, right, indexer);
			return result.isPresent() ? result : mergeEngine.applyMerge(right, left, indexer);
		}
	}

	@Override
	protected Optional<DerivationTree> parse(final List<String> words) {
		final Search search = new Search();
		search.seed(words);

		int round = 0;
		while (round < maxDerivationDepth && !search.agenda.isEmpty()) {
			round++;
			final DerivationTree tree = search.agenda.poll();

			boolean keepParsing = true;
			for (final ParserListener listener : listeners) {
				keepParsing = keepParsing && listener.handleDequeue(tree, round);
			}
			if (!keepParsing) {
				break;
			}

			if (isAccepted(tree, words)) {
				final DerivationTree result = phaseChecker.getConfig().isImmediateTransfer() ? tree : phaseChecker
						.transferPhase(tree);
				notifyCompletion(ParseOutcome.ACCEPTED, Optional.of(result), round, search.seen.size());
				return Optional.of(result);
			}

			if (search.seen.size() < maxSeenSize) {
				search.explore(tree);
				search.seen.add(tree);
			}
		}

		System.err.println("No valid derivation found for: " + Joiner.on(" ").join(words));
		notifyCompletion(ParseOutcome.SEARCH_EXHAUSTED, Optional.empty(), round, search.seen.size());
		return Optional.empty();
	}

	/**
	 * A phase is complete once its head has nothing left to check, including delayed features.
	 */
	private boolean isCompletePhase(final DerivationTree tree) {
		return tree.getHead().isSaturated() && tree.getDelayedFeatures().isEmpty() && phaseChecker.isPhaseHead(tree);
	}

	public int getMaxDerivationDepth() {
		return maxDerivationDepth;
	}
}
