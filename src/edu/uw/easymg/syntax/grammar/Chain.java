package edu.uw.easymg.syntax.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import edu.uw.easymg.util.Agreement;

/**
 * The head of a (possibly moved) constituent, with the indices of the positions it has vacated.
 *
 * After movement, the chain also holds the displaced constituent itself, so that it can be pronounced in its
 * landing site and moved again.
 */
public class Chain implements Serializable {

	private static final long serialVersionUID = 1L;

	private final LexicalItem head;
	private final ImmutableSortedSet<Integer> tail;
	private final ImmutableMap<String, String> agreement;
	private final boolean isPhaseHead;
	private final DerivationTree displaced;

	private Chain(final LexicalItem head, final Collection<Integer> tail, final Map<String, String> agreement,
			final boolean isPhaseHead, final DerivationTree displaced) {
		this.head = head;
		this.tail = ImmutableSortedSet.copyOf(tail);
		this.agreement = ImmutableMap.copyOf(agreement);
		this.isPhaseHead = isPhaseHead;
		this.displaced = displaced;
	}

	public Chain(final LexicalItem head) {
		this(head, ImmutableSortedSet.of(), head.getAgreement(), head.isPhaseHead(), null);
	}

	public static Chain withTail(final LexicalItem head, final Collection<Integer> tail) {
		return new Chain(head, tail, head.getAgreement(), head.isPhaseHead(), null);
	}

	public LexicalItem getHead() {
		return head;
	}

	public ImmutableSortedSet<Integer> getTail() {
		return tail;
	}

	public ImmutableMap<String, String> getAgreement() {
		return agreement;
	}

	public boolean isPhaseHead() {
		return isPhaseHead;
	}

	public boolean hasTraces() {
		return !tail.isEmpty();
	}

	public Optional<DerivationTree> getDisplaced() {
		return Optional.ofNullable(displaced);
	}

	public Chain withHead(final LexicalItem newHead) {
		return new Chain(newHead, tail, agreement, isPhaseHead || newHead.isPhaseHead(), displaced);
	}

	public Chain withAgreement(final Map<String, String> newAgreement) {
		return new Chain(head.withAgreement(newAgreement), tail, newAgreement, isPhaseHead, displaced);
	}

	/**
	 * Unifies the agreement maps. If they conflict, the existing agreement is kept.
	 */
	public Chain mergeAgreement(final Map<String, String> other) {
		final Optional<ImmutableMap<String, String>> unified = Agreement.unify(agreement, other);
		return unified.isPresent() ? withAgreement(unified.get()) : this;
	}

	public Chain withDisplaced(final DerivationTree newDisplaced) {
		return new Chain(head, tail, agreement, isPhaseHead, newDisplaced);
	}

	/**
	 * The chain left behind when its displaced constituent moves on.
	 */
	public Chain withoutDisplaced() {
		return new Chain(head, tail, agreement, isPhaseHead, null);
	}

	public Chain withoutFirstFeature() {
		return new Chain(head.withoutFirstFeature(), tail, agreement, isPhaseHead, displaced);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Chain)) {
			return false;
		}
		final Chain other = (Chain) obj;
		return head.equals(other.head) && tail.equals(other.tail) && agreement.equals(other.agreement)
				&& isPhaseHead == other.isPhaseHead && Objects.equals(displaced, other.displaced);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, tail);
	}

	@Override
	public String toString() {
		return head + (tail.isEmpty() ? "" : " traces=" + tail);
	}
}
