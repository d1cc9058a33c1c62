package edu.uw.easymg.lexicon;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import edu.uw.easymg.syntax.grammar.Feature;

/**
 * The category and movement feature names a grammar may use.
 */
public class FeatureTypeRegistry {

	public final static Collection<String> DEFAULT_CATEGORIES = ImmutableSet.of("C", "T", "v", "V", "D", "N", "P",
			"A");
	public final static Collection<String> DEFAULT_MOVEMENT_FEATURES = ImmutableSet.of("wh", "case", "top", "foc");

	private final Set<String> categories = Sets.newHashSet();
	private final Set<String> movementFeatures = Sets.newHashSet();

	public FeatureTypeRegistry() {
	}

	/**
	 * A registry with the standard clausal and nominal categories, and wh/case/topic/focus movement.
	 */
	public static FeatureTypeRegistry makeDefault() {
		final FeatureTypeRegistry result = new FeatureTypeRegistry();
		for (final String category : DEFAULT_CATEGORIES) {
			result.registerCategorial(category);
		}
		for (final String movement : DEFAULT_MOVEMENT_FEATURES) {
			result.registerMovement(movement);
		}
		return result;
	}

	public void registerCategorial(final String name) {
		categories.add(name);
	}

	/**
	 * Registers both the licensor and the licensee.
	 */
	public void registerMovement(final String name) {
		movementFeatures.add(name);
	}

	public boolean isCategorialRegistered(final String name) {
		return categories.contains(name);
	}

	public boolean isMovementRegistered(final String name) {
		return movementFeatures.contains(name);
	}

	public Set<String> getCategories() {
		return ImmutableSet.copyOf(categories);
	}

	public Set<String> getMovementFeatures() {
		return ImmutableSet.copyOf(movementFeatures);
	}

	public boolean isValid(final Feature feature) {
		switch (feature.getKind()) {
		case CATEGORIAL:
		case SELECTOR:
		case STRONG_SELECTOR:
		case ADJUNCT_SELECTOR:
		case PHASE:
			return categories.contains(feature.getName());
		case LICENSOR:
		case LICENSEE:
			return movementFeatures.contains(feature.getName());
		case AGREEMENT:
			return true;
		case DELAYED:
			return isValid(feature.getDelayedFeature());
		default:
			throw new IllegalStateException("Unknown feature kind: " + feature.getKind());
		}
	}

	/**
	 * Throws an IllegalArgumentException if the feature uses an unregistered name.
	 */
	public void validate(final Feature feature) {
		if (!isValid(feature)) {
			final boolean movement = feature.unwrapDelayed().isLicensor() || feature.unwrapDelayed().isLicensee();
			throw new IllegalArgumentException("Unregistered " + (movement ? "movement" : "categorial")
					+ " feature: " + feature);
		}
	}
}
