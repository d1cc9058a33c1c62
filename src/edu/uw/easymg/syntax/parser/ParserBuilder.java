package edu.uw.easymg.syntax.parser;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.easymg.lexicon.Lexicon;
import edu.uw.easymg.syntax.grammar.LexicalItem;

public abstract class ParserBuilder<T extends ParserBuilder<T>> {

	ParserBuilder(final Lexicon lexicon) {
		this.lexicon = lexicon;
		this.covertHeads = lexicon.getCovertHeads();
	}

	private final Lexicon lexicon;
	private int maxSentenceLength = 70;
	private int maxDerivationDepth = 20;
	private boolean allowRemnantMovement = false;
	private boolean allowVacuousMovement = false;
	private Set<MovementStrategy> movementStrategies = EnumSet.of(MovementStrategy.STANDARD);
	private Set<MergeStrategy> mergeStrategies = EnumSet.of(MergeStrategy.STANDARD);
	private Set<SidewardMovementType> sidewardMovementTypes = EnumSet.noneOf(SidewardMovementType.class);
	private boolean enableParallelWorkspaces = false;
	private int maxWorkspaces = 3;
	private PhaseConfig phaseConfig = PhaseConfig.DEFAULT;
	private List<LexicalItem> covertHeads;
	private Set<String> goalCategories = ImmutableSet.of("C");
	private int maxSeenSize = 300000;
	private int maxAgendaSize = Integer.MAX_VALUE;
	private List<ParserListener> listeners = Collections.emptyList();

	public Lexicon getLexicon() {
		return lexicon;
	}

	public int getMaxSentenceLength() {
		return maxSentenceLength;
	}

	public int getMaxDerivationDepth() {
		return maxDerivationDepth;
	}

	public boolean getAllowRemnantMovement() {
		return allowRemnantMovement;
	}

	public boolean getAllowVacuousMovement() {
		return allowVacuousMovement;
	}

	public Set<MovementStrategy> getMovementStrategies() {
		return movementStrategies;
	}

	public Set<MergeStrategy> getMergeStrategies() {
		return mergeStrategies;
	}

	public Set<SidewardMovementType> getSidewardMovementTypes() {
		return sidewardMovementTypes;
	}

	public boolean getEnableParallelWorkspaces() {
		return enableParallelWorkspaces;
	}

	public int getMaxWorkspaces() {
		return maxWorkspaces;
	}

	public PhaseConfig getPhaseConfig() {
		return phaseConfig;
	}

	public List<LexicalItem> getCovertHeads() {
		return covertHeads;
	}

	public Set<String> getGoalCategories() {
		return goalCategories;
	}

	public int getMaxSeenSize() {
		return maxSeenSize;
	}

	public int getMaxAgendaSize() {
		return maxAgendaSize;
	}

	public List<ParserListener> getListeners() {
		return listeners;
	}

	public T maximumSentenceLength(final int maxSentenceLength) {
		this.maxSentenceLength = maxSentenceLength;
		return getThis();
	}

	/**
	 * Bounds the number of agenda items dequeued per sentence. Each item costs one round, including items that are
	 * never extended, so sentences needing movement usually need far more than the default of 20. A three-word
	 * wh-question with one covert complementizer takes around 50.
	 */
	public T maxDerivationDepth(final int maxDerivationDepth) {
		Preconditions.checkArgument(maxDerivationDepth >= 0, "maxDerivationDepth must be non-negative");
		this.maxDerivationDepth = maxDerivationDepth;
		return getThis();
	}

	public T allowRemnantMovement(final boolean allowRemnantMovement) {
		this.allowRemnantMovement = allowRemnantMovement;
		return getThis();
	}

	public T allowVacuousMovement(final boolean allowVacuousMovement) {
		this.allowVacuousMovement = allowVacuousMovement;
		return getThis();
	}

	public T movementStrategies(final Collection<MovementStrategy> movementStrategies) {
		this.movementStrategies = copy(movementStrategies, MovementStrategy.class);
		return getThis();
	}

	public T mergeStrategies(final Collection<MergeStrategy> mergeStrategies) {
		this.mergeStrategies = copy(mergeStrategies, MergeStrategy.class);
		return getThis();
	}

	public T sidewardMovementTypes(final Collection<SidewardMovementType> sidewardMovementTypes) {
		this.sidewardMovementTypes = copy(sidewardMovementTypes, SidewardMovementType.class);
		return getThis();
	}

	private static <E extends Enum<E>> Set<E> copy(final Collection<E> values, final Class<E> type) {
		return values.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(values);
	}

	public T enableParallelWorkspaces(final boolean enableParallelWorkspaces) {
		this.enableParallelWorkspaces = enableParallelWorkspaces;
		return getThis();
	}

	public T maxWorkspaces(final int maxWorkspaces) {
		Preconditions.checkArgument(maxWorkspaces > 0, "maxWorkspaces must be positive");
		this.maxWorkspaces = maxWorkspaces;
		return getThis();
	}

	public T phaseConfig(final PhaseConfig phaseConfig) {
		this.phaseConfig = phaseConfig;
		return getThis();
	}

	public T covertHeads(final List<LexicalItem> covertHeads) {
		this.covertHeads = ImmutableList.copyOf(covertHeads);
		return getThis();
	}

	public T goalCategories(final Collection<String> goalCategories) {
		this.goalCategories = ImmutableSet.copyOf(goalCategories);
		return getThis();
	}

	public T maxSeenSize(final int maxSeenSize) {
		this.maxSeenSize = maxSeenSize;
		return getThis();
	}

	public T maxAgendaSize(final int maxAgendaSize) {
		this.maxAgendaSize = maxAgendaSize;
		return getThis();
	}

	public T listeners(final List<ParserListener> listeners) {
		this.listeners = listeners;
		return getThis();
	}

	@SuppressWarnings("unchecked")
	T getThis() {
		return (T) this;
	}

	public AbstractParser build() {
		return build2();
	}

	protected abstract AbstractParser build2();
}
