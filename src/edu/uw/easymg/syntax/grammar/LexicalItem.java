package edu.uw.easymg.syntax.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.uw.easymg.syntax.grammar.Feature.Kind;

/**
 * A phonetic form with an ordered list of features. Operations consume the first feature.
 */
public class LexicalItem implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String phoneticForm;
	private final ImmutableList<Feature> features;
	private final ImmutableMap<String, String> agreement;

	public LexicalItem(final String phoneticForm, final List<Feature> features,
			final Map<String, String> agreement) {
		this.phoneticForm = phoneticForm;
		this.features = ImmutableList.copyOf(features);
		this.agreement = ImmutableMap.copyOf(agreement);
	}

	public LexicalItem(final String phoneticForm, final List<Feature> features) {
		this(phoneticForm, features, ImmutableMap.of());
	}

	/**
	 * Builds an item from a space or comma separated feature list. Lists written category-first, such as
	 * "D,=N" or "C +wh =T", are put into the order the features get checked: selectors, licensors, the category,
	 * licensees, then phase markers. Agreement features are moved into the agreement map.
	 */
	public static LexicalItem fromNotation(final String phoneticForm, final String notation) {
		final List<Feature> features = new ArrayList<>();
		final ImmutableMap.Builder<String, String> agreement = ImmutableMap.builder();
		String source = notation.trim();
		if (source.startsWith("[") && source.endsWith("]")) {
			source = source.substring(1, source.length() - 1);
		}

		for (final String token : source.split("[,\\s]+")) {
			if (token.isEmpty()) {
				continue;
			}
			final Feature feature = Feature.valueOf(token);
			if (feature.isAgreement()) {
				agreement.put(feature.getName(), feature.getAgreementValue());
			} else {
				features.add(feature);
			}
		}

		return new LexicalItem(phoneticForm, toDerivationOrder(features), agreement.build());
	}

	static List<Feature> toDerivationOrder(final List<Feature> features) {
		final Optional<Feature> first = firstCheckable(features);
		if (!first.isPresent() || !first.get().isCategorial()) {
			return features;
		}

		boolean needsReordering = false;
		for (final Feature feature : features) {
			if (feature.isSelector() || feature.isLicensor()) {
				needsReordering = true;
			}
		}
		if (!needsReordering) {
			return features;
		}

		final List<Feature> result = new ArrayList<>(features.size());
		addAll(features, result, Kind.SELECTOR, Kind.STRONG_SELECTOR, Kind.ADJUNCT_SELECTOR);
		addAll(features, result, Kind.LICENSOR);
		addAll(features, result, Kind.CATEGORIAL);
		addAll(features, result, Kind.LICENSEE);
		addAll(features, result, Kind.PHASE, Kind.DELAYED, Kind.AGREEMENT);
		return result;
	}

	private static void addAll(final List<Feature> from, final List<Feature> to, final Kind... kinds) {
		for (final Feature feature : from) {
			for (final Kind kind : kinds) {
				if (feature.getKind() == kind) {
					to.add(feature);
				}
			}
		}
	}

	public String getPhoneticForm() {
		return phoneticForm;
	}

	public ImmutableList<Feature> getFeatures() {
		return features;
	}

	public ImmutableMap<String, String> getAgreement() {
		return agreement;
	}

	public boolean hasFeatureType(final Kind kind) {
		for (final Feature feature : features) {
			if (feature.getKind() == kind) {
				return true;
			}
		}
		return false;
	}

	/**
	 * The next feature to be checked. Phase markers are skipped, as they are never checked.
	 */
	public Optional<Feature> getFirstFeature() {
		return firstCheckable(features);
	}

	private static Optional<Feature> firstCheckable(final List<Feature> features) {
		for (final Feature feature : features) {
			if (!feature.isPhaseHead()) {
				return Optional.of(feature);
			}
		}
		return Optional.empty();
	}

	public LexicalItem withoutFirstFeature() {
		final List<Feature> result = new ArrayList<>(features);
		for (int i = 0; i < result.size(); i++) {
			if (!result.get(i).isPhaseHead()) {
				result.remove(i);
				return new LexicalItem(phoneticForm, result, agreement);
			}
		}
		return this;
	}

	public LexicalItem withFeatures(final List<Feature> newFeatures) {
		return new LexicalItem(phoneticForm, newFeatures, agreement);
	}

	public LexicalItem withAgreement(final Map<String, String> newAgreement) {
		return new LexicalItem(phoneticForm, features, newAgreement);
	}

	public boolean isPhaseHead() {
		return hasFeatureType(Kind.PHASE);
	}

	public boolean isEmpty() {
		return phoneticForm.isEmpty();
	}

	public boolean hasDelayedFeatures() {
		return hasFeatureType(Kind.DELAYED);
	}

	/**
	 * The inner features of any Delayed features, in order.
	 */
	public ImmutableList<Feature> getDelayedFeatures() {
		final ImmutableList.Builder<Feature> result = ImmutableList.builder();
		for (final Feature feature : features) {
			if (feature.isDelayed()) {
				result.add(feature.getDelayedFeature());
			}
		}
		return result.build();
	}

	/**
	 * Features that Merge and Move can check, i.e. everything but phase and delayed markers.
	 */
	public ImmutableList<Feature> getCheckableFeatures() {
		final ImmutableList.Builder<Feature> result = ImmutableList.builder();
		for (final Feature feature : features) {
			if (!feature.isPhaseHead() && !feature.isDelayed()) {
				result.add(feature);
			}
		}
		return result.build();
	}

	/**
	 * True if nothing is left to check but (at most) a single category.
	 */
	public boolean isSaturated() {
		final List<Feature> checkable = getCheckableFeatures();
		return checkable.isEmpty() || (checkable.size() == 1 && checkable.get(0).isCategorial());
	}

	/**
	 * The category of a saturated item, if it has one.
	 */
	public Optional<String> getCategory() {
		final List<Feature> checkable = getCheckableFeatures();
		if (checkable.size() == 1 && checkable.get(0).isCategorial()) {
			return Optional.of(checkable.get(0).getName());
		}
		return Optional.empty();
	}

	/**
	 * An atomic item has exactly one feature, which is categorial.
	 */
	public boolean isAtomic() {
		return features.size() == 1 && features.get(0).isCategorial();
	}

	public Optional<String> getAtomicName() {
		return isAtomic() ? Optional.of(features.get(0).getName()) : Optional.empty();
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof LexicalItem)) {
			return false;
		}
		final LexicalItem other = (LexicalItem) obj;
		return phoneticForm.equals(other.phoneticForm) && features.equals(other.features)
				&& agreement.equals(other.agreement);
	}

	@Override
	public int hashCode() {
		return Objects.hash(phoneticForm, features, agreement);
	}

	@Override
	public String toString() {
		return phoneticForm + "[" + Joiner.on(" ").join(features) + (agreement.isEmpty() ? "" : " " + agreement)
				+ "]";
	}
}
