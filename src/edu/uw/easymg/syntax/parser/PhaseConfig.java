package edu.uw.easymg.syntax.parser;

import java.io.Serializable;
import java.util.Collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Settings for phase-based locality.
 */
public class PhaseConfig implements Serializable {

	private static final long serialVersionUID = 1L;

	public final static PhaseConfig DEFAULT = new PhaseConfig(true, ImmutableSet.of("C", "v", "D"), 1, true);

	private final boolean enforcePIC;
	private final ImmutableSet<String> phaseHeads;
	private final int maxEdgeElements;
	private final boolean immediateTransfer;

	public PhaseConfig(final boolean enforcePIC, final Collection<String> phaseHeads, final int maxEdgeElements,
			final boolean immediateTransfer) {
		Preconditions.checkArgument(maxEdgeElements >= 0, "maxEdgeElements must be non-negative");
		this.enforcePIC = enforcePIC;
		this.phaseHeads = ImmutableSet.copyOf(phaseHeads);
		this.maxEdgeElements = maxEdgeElements;
		this.immediateTransfer = immediateTransfer;
	}

	/**
	 * Whether the Phase Impenetrability Condition is enforced.
	 */
	public boolean isEnforcePIC() {
		return enforcePIC;
	}

	public ImmutableSet<String> getPhaseHeads() {
		return phaseHeads;
	}

	public int getMaxEdgeElements() {
		return maxEdgeElements;
	}

	public boolean isImmediateTransfer() {
		return immediateTransfer;
	}

	public PhaseConfig withEnforcePIC(final boolean newEnforcePIC) {
		return new PhaseConfig(newEnforcePIC, phaseHeads, maxEdgeElements, immediateTransfer);
	}

	public PhaseConfig withPhaseHeads(final Collection<String> newPhaseHeads) {
		return new PhaseConfig(enforcePIC, newPhaseHeads, maxEdgeElements, immediateTransfer);
	}

	public PhaseConfig withMaxEdgeElements(final int newMaxEdgeElements) {
		return new PhaseConfig(enforcePIC, phaseHeads, newMaxEdgeElements, immediateTransfer);
	}

	public PhaseConfig withImmediateTransfer(final boolean newImmediateTransfer) {
		return new PhaseConfig(enforcePIC, phaseHeads, maxEdgeElements, newImmediateTransfer);
	}

	@Override
	public String toString() {
		return "PhaseConfig [enforcePIC=" + enforcePIC + ", phaseHeads=" + phaseHeads + ", maxEdgeElements="
				+ maxEdgeElements + ", immediateTransfer=" + immediateTransfer + "]";
	}
}
