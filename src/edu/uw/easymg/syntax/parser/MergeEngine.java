package edu.uw.easymg.syntax.parser;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import edu.uw.easymg.syntax.grammar.Chain;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;
import edu.uw.easymg.syntax.grammar.LexicalItem;
import edu.uw.easymg.util.Agreement;

/**
 * Combines a specifier (or complement) with a head. An empty result just means the pair doesn't combine.
 */
public class MergeEngine {

	private final EnumSet<MergeStrategy> strategies;
	private final PhaseChecker phaseChecker;

	public MergeEngine(final Collection<MergeStrategy> strategies, final PhaseChecker phaseChecker) {
		this.strategies = strategies.isEmpty() ? EnumSet.noneOf(MergeStrategy.class) : EnumSet.copyOf(strategies);
		this.phaseChecker = phaseChecker;
	}

	public Optional<DerivationTree> applyMerge(final DerivationTree spec, final DerivationTree head,
			final NodeIndexer indexer) {
		if (phaseChecker.getConfig().isEnforcePIC() && head.isPhase() && head.isPhaseCompleted()) {
			// Completed phases are opaque.
			return Optional.empty();
		}

		// EnumSet iterates in declaration order, which is the priority order.
		for (final MergeStrategy strategy : strategies) {
			final Optional<DerivationTree> result;
			switch (strategy) {
			case STANDARD:
				result = standardMerge(spec, head, indexer);
				break;
			case PAIR_MERGE:
				result = pairMerge(spec, head, indexer);
				break;
			case LATE_MERGE:
				result = lateMerge(spec, head, indexer);
				break;
			default:
				throw new IllegalStateException("Unknown merge strategy: " + strategy);
			}

			if (result.isPresent()) {
				return result;
			}
		}

		return Optional.empty();
	}

	private Optional<DerivationTree> standardMerge(final DerivationTree spec, final DerivationTree head,
			final NodeIndexer indexer) {
		final Optional<Feature> headFeature = head.getFirstFeature();
		final Optional<Feature> specFeature = spec.getFirstFeature();
		if (!headFeature.isPresent() || !specFeature.isPresent() || !headFeature.get().matches(specFeature.get())) {
			return Optional.empty();
		}

		final Optional<ImmutableMap<String, String>> agreement = Agreement.unify(spec.getChain().getAgreement(),
				head.getChain().getAgreement());
		if (!agreement.isPresent()) {
			return Optional.empty();
		}

		final DerivationTree newSpec = spec.withoutFirstFeature();
		final DerivationTree newHead = head.withoutFirstFeature();
		final LexicalItem headItem = newHead.getHead();

		if (headFeature.get().triggersHeadMovement()) {
			if (!spec.isLeaf()) {
				// Only heads incorporate.
				return Optional.empty();
			}
			final LexicalItem fused = new LexicalItem(headItem.getPhoneticForm()
					+ spec.getHead().getPhoneticForm(), headItem.getFeatures(), agreement.get());
			return Optional.of(DerivationTree.leaf(new Chain(fused), indexer.next()).withDelayedFeatures(
					head.getDelayedFeatures()));
		}

		final String form = headItem.isEmpty() ? spec.getHead().getPhoneticForm() : headItem.getPhoneticForm();
		final LexicalItem item = new LexicalItem(form, headItem.getFeatures(), agreement.get());
		return Optional.of(DerivationTree.merge(newSpec, newHead, new Chain(item), indexer.next(),
				head.getDelayedFeatures()));
	}

	private Optional<DerivationTree> pairMerge(final DerivationTree spec, final DerivationTree head,
			final NodeIndexer indexer) {
		final Optional<Feature> headFeature = head.getFirstFeature();
		final Optional<Feature> specFeature = spec.getFirstFeature();
		if (!headFeature.isPresent() || !specFeature.isPresent()
				|| headFeature.get().getKind() != Feature.Kind.ADJUNCT_SELECTOR || !specFeature.get().isCategorial()
				|| !headFeature.get().getName().equals(specFeature.get().getName())) {
			return Optional.empty();
		}

		return Optional.of(DerivationTree.pairMerge(spec.withoutFirstFeature(), head.withoutFirstFeature(),
				indexer.next()));
	}

	private Optional<DerivationTree> lateMerge(final DerivationTree spec, final DerivationTree head,
			final NodeIndexer indexer) {
		final List<Feature> delayed = head.getDelayedFeatures();
		final Optional<Feature> specFeature = spec.getFirstFeature();
		if (delayed.isEmpty() || !specFeature.isPresent() || !delayed.get(0).matches(specFeature.get())) {
			return Optional.empty();
		}

		final List<Feature> remainingDelayed = delayed.subList(1, delayed.size());
		final DerivationTree newHead = head.withDelayedFeatures(remainingDelayed);
		final LexicalItem headItem = head.getHead();
		final String form = headItem.isEmpty() ? spec.getHead().getPhoneticForm() : headItem.getPhoneticForm();
		// Agreement is merged if it can be, but never blocks late merger.
		final Chain chain = new Chain(new LexicalItem(form, headItem.getFeatures(), headItem.getAgreement()))
				.mergeAgreement(spec.getChain().getAgreement());
		return Optional.of(DerivationTree.merge(spec, newHead, chain, indexer.next(), remainingDelayed));
	}
}
