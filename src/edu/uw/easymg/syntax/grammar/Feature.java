package edu.uw.easymg.syntax.grammar;

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * A syntactic feature, consumed from the front of a lexical item's feature list by Merge and Move.
 *
 * Features are immutable values, compared by their textual form.
 */
public abstract class Feature implements Serializable {

	private static final long serialVersionUID = 1L;

	private final static String DELAY_SUFFIX = "[delay]";
	private final static String PHASE_PREFIX = "⚑";
	private final static String AGREEMENT_PREFIX = "φ:";

	public enum Kind {
		CATEGORIAL, SELECTOR, STRONG_SELECTOR, ADJUNCT_SELECTOR, LICENSOR, LICENSEE, AGREEMENT, PHASE, DELAYED
	}

	private final String asString;
	private final Kind kind;

	private Feature(final Kind kind, final String asString) {
		this.kind = kind;
		this.asString = asString;
	}

	public static Feature categorial(final String name) {
		return new NamedFeature(Kind.CATEGORIAL, name, name);
	}

	public static Feature selector(final String name) {
		return new NamedFeature(Kind.SELECTOR, name, "=" + name);
	}

	public static Feature strongSelector(final String name) {
		return new NamedFeature(Kind.STRONG_SELECTOR, name, "=" + name + "+");
	}

	public static Feature adjunctSelector(final String name) {
		return new NamedFeature(Kind.ADJUNCT_SELECTOR, name, "~" + name);
	}

	public static Feature licensor(final String name) {
		return new NamedFeature(Kind.LICENSOR, name, "+" + name);
	}

	public static Feature licensee(final String name) {
		return new NamedFeature(Kind.LICENSEE, name, "-" + name);
	}

	public static Feature phase(final String name) {
		return new NamedFeature(Kind.PHASE, name, PHASE_PREFIX + name);
	}

	public static Feature agreement(final String key, final String value) {
		return new AgreementFeature(key, value);
	}

	public static Feature delayed(final Feature inner) {
		return new DelayedFeature(inner);
	}

	/**
	 * Reads a feature from its textual form, the inverse of toString(). Accepts "agr:" and "phase:" as ASCII
	 * spellings of the agreement and phase prefixes.
	 */
	public static Feature valueOf(final String text) {
		final String source = text.trim();
		Preconditions.checkArgument(!source.isEmpty(), "Empty feature");
		if (source.endsWith(DELAY_SUFFIX)) {
			return delayed(valueOf(source.substring(0, source.length() - DELAY_SUFFIX.length())));
		} else if (source.startsWith(AGREEMENT_PREFIX)) {
			return parseAgreement(source, source.substring(AGREEMENT_PREFIX.length()));
		} else if (source.startsWith("agr:")) {
			return parseAgreement(source, source.substring("agr:".length()));
		} else if (source.startsWith(PHASE_PREFIX)) {
			return phase(checkName(source, source.substring(PHASE_PREFIX.length())));
		} else if (source.startsWith("phase:")) {
			return phase(checkName(source, source.substring("phase:".length())));
		} else if (source.startsWith("=") && source.endsWith("+")) {
			return strongSelector(checkName(source, source.substring(1, source.length() - 1)));
		} else if (source.startsWith("=")) {
			return selector(checkName(source, source.substring(1)));
		} else if (source.startsWith("~")) {
			return adjunctSelector(checkName(source, source.substring(1)));
		} else if (source.startsWith("+")) {
			return licensor(checkName(source, source.substring(1)));
		} else if (source.startsWith("-")) {
			return licensee(checkName(source, source.substring(1)));
		} else {
			return categorial(checkName(source, source));
		}
	}

	private static Feature parseAgreement(final String source, final String keyValue) {
		final int equals = keyValue.indexOf('=');
		if (equals <= 0 || equals == keyValue.length() - 1) {
			throw new IllegalArgumentException("Agreement features must look like φ:key=value, but got: " + source);
		}
		return agreement(keyValue.substring(0, equals), keyValue.substring(equals + 1));
	}

	private static String checkName(final String source, final String name) {
		if (!name.matches("[A-Za-z][A-Za-z0-9_]*")) {
			throw new IllegalArgumentException("Invalid feature name in: " + source);
		}
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * The category or movement name this feature refers to. Agreement features return their key.
	 */
	public abstract String getName();

	/**
	 * Merge licensing: a (strong) selector matches a categorial feature with the same name.
	 */
	public boolean matches(final Feature other) {
		return (kind == Kind.SELECTOR || kind == Kind.STRONG_SELECTOR) && other.kind == Kind.CATEGORIAL
				&& getName().equals(other.getName());
	}

	/**
	 * Move licensing: a licensor matches a licensee with the same name.
	 */
	public boolean matchesMove(final Feature other) {
		return kind == Kind.LICENSOR && other.kind == Kind.LICENSEE && getName().equals(other.getName());
	}

	public boolean triggersHeadMovement() {
		return kind == Kind.STRONG_SELECTOR;
	}

	public boolean isPhaseHead() {
		return kind == Kind.PHASE;
	}

	public boolean isDelayed() {
		return kind == Kind.DELAYED;
	}

	public boolean isCategorial() {
		return kind == Kind.CATEGORIAL;
	}

	public boolean isSelector() {
		return kind == Kind.SELECTOR || kind == Kind.STRONG_SELECTOR || kind == Kind.ADJUNCT_SELECTOR;
	}

	public boolean isLicensor() {
		return kind == Kind.LICENSOR;
	}

	public boolean isLicensee() {
		return kind == Kind.LICENSEE;
	}

	public boolean isAgreement() {
		return kind == Kind.AGREEMENT;
	}

	/**
	 * Returns the deferred feature of a Delayed feature.
	 */
	public Feature getDelayedFeature() {
		throw new UnsupportedOperationException("Not a delayed feature: " + this);
	}

	/**
	 * Strips any number of Delayed wrappers.
	 */
	public Feature unwrapDelayed() {
		Feature result = this;
		while (result.isDelayed()) {
			result = result.getDelayedFeature();
		}
		return result;
	}

	@Override
	public String toString() {
		return asString;
	}

	@Override
	public boolean equals(final Object other) {
		return other instanceof Feature && asString.equals(((Feature) other).asString);
	}

	@Override
	public int hashCode() {
		return asString.hashCode();
	}

	private static class NamedFeature extends Feature {
		private static final long serialVersionUID = 1L;
		private final String name;

		private NamedFeature(final Kind kind, final String name, final String asString) {
			super(kind, asString);
			this.name = name;
		}

		@Override
		public String getName() {
			return name;
		}
	}

	private static class AgreementFeature extends Feature {
		private static final long serialVersionUID = 1L;
		private final String key;
		private final String value;

		private AgreementFeature(final String key, final String value) {
			super(Kind.AGREEMENT, AGREEMENT_PREFIX + key + "=" + value);
			this.key = key;
			this.value = value;
		}

		@Override
		public String getName() {
			return key;
		}

		public String getValue() {
			return value;
		}
	}

	private static class DelayedFeature extends Feature {
		private static final long serialVersionUID = 1L;
		private final Feature inner;

		private DelayedFeature(final Feature inner) {
			super(Kind.DELAYED, inner + DELAY_SUFFIX);
			this.inner = inner;
		}

		@Override
		public String getName() {
			return inner.getName();
		}

		@Override
		public Feature getDelayedFeature() {
			return inner;
		}
	}

	/**
	 * The value of an agreement feature.
	 */
	public String getAgreementValue() {
		if (this instanceof AgreementFeature) {
			return ((AgreementFeature) this).getValue();
		}
		throw new UnsupportedOperationException("Not an agreement feature: " + this);
	}
}
