package edu.uw.easymg.syntax.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.easymg.syntax.grammar.Chain;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;

/**
 * Holds the independent workspaces of a derivation, for movement between trees.
 *
 * A registry belongs to a single derivation branch, and is not thread-safe.
 */
public class WorkspaceRegistry {

	private final Map<Integer, Workspace> workspaces = new LinkedHashMap<>();
	private final int maxWorkspaces;
	private int nextId = 0;

	public WorkspaceRegistry(final int maxWorkspaces) {
		Preconditions.checkArgument(maxWorkspaces > 0, "maxWorkspaces must be positive");
		this.maxWorkspaces = maxWorkspaces;
	}

	public int newWorkspace() {
		Preconditions.checkState(canCreateWorkspace(), "Too many workspaces: " + maxWorkspaces);
		final int id = nextId++;
		workspaces.put(id, new Workspace(id));
		return id;
	}

	public boolean canCreateWorkspace() {
		return workspaces.size() < maxWorkspaces;
	}

	public int size() {
		return workspaces.size();
	}

	/**
	 * Puts a tree in an active workspace, replacing its current tree. Returns false if the workspace is missing or
	 * inactive.
	 */
	public boolean addTree(final int id, final DerivationTree tree) {
		final Workspace workspace = workspaces.get(id);
		if (workspace == null || !workspace.isActive()) {
			return false;
		}
		workspace.setTree(tree);
		return true;
	}

	public Optional<DerivationTree> getTree(final int id) {
		final Workspace workspace = workspaces.get(id);
		return workspace == null ? Optional.empty() : workspace.getTree();
	}

	/**
	 * Replaces the tree in a workspace with a modified version of it. Returns false if there was no tree.
	 */
	public boolean updateTree(final int id, final UnaryOperator<DerivationTree> update) {
		final Workspace workspace = workspaces.get(id);
		if (workspace == null || workspace.isEmpty()) {
			return false;
		}
		workspace.setTree(update.apply(workspace.getTree().get()));
		return true;
	}

	public boolean isActive(final int id) {
		final Workspace workspace = workspaces.get(id);
		return workspace != null && workspace.isActive();
	}

	public List<Integer> getActiveWorkspaces() {
		final List<Integer> result = new ArrayList<>();
		for (final Workspace workspace : workspaces.values()) {
			if (workspace.isActive()) {
				result.add(workspace.getId());
			}
		}
		return result;
	}

	public List<Integer> getActiveWorkspacesWithTrees() {
		final List<Integer> result = new ArrayList<>();
		for (final Workspace workspace : workspaces.values()) {
			if (workspace.isActive() && !workspace.isEmpty()) {
				result.add(workspace.getId());
			}
		}
		return result;
	}

	public void activate(final int id) {
		final Workspace workspace = workspaces.get(id);
		if (workspace != null) {
			workspace.setActive(true);
		}
	}

	public void deactivate(final int id) {
		final Workspace workspace = workspaces.get(id);
		if (workspace != null) {
			workspace.setActive(false);
		}
	}

	/**
	 * Moves the tree of one workspace into another. Returns false if the source is empty or the target can't take
	 * it, in which case nothing changes.
	 */
	public boolean transferTree(final int fromId, final int toId) {
		final Optional<DerivationTree> tree = getTree(fromId);
		if (fromId == toId) {
			// Already in place.
			return tree.isPresent() && isActive(toId);
		}
		if (!tree.isPresent() || !addTree(toId, tree.get())) {
			return false;
		}
		workspaces.get(fromId).clear();
		return true;
	}

	/**
	 * Copies the tree of a workspace into a new workspace, returning its id.
	 */
	public Optional<Integer> copyTree(final int fromId) {
		final Optional<DerivationTree> tree = getTree(fromId);
		if (!tree.isPresent() || !canCreateWorkspace()) {
			return Optional.empty();
		}
		final int id = newWorkspace();
		addTree(id, tree.get());
		return Optional.of(id);
	}

	/**
	 * Moves a chain out of the source workspace's tree and into the target's. Returns empty, changing nothing, if a
	 * workspace the movement type writes to is inactive, or a tree it reads is missing.
	 */
	public Optional<DerivationTree> sidewardMove(final int source, final int target, final Chain chain,
			final SidewardMovementType type, final NodeIndexer indexer) {
		final Optional<DerivationTree> sourceTree = getTree(source);
		final Optional<DerivationTree> targetTree = getTree(target);

		switch (type) {
		case NUNES_STYLE:
			if (!sourceTree.isPresent() || !targetTree.isPresent() || !isActive(source) || !isActive(target)) {
				return Optional.empty();
			}
			return nunesStyle(source, target, sourceTree.get(), targetTree.get(), chain, indexer);
		case PARALLEL_DERIVATION:
			return parallelDerivation(chain, indexer);
		case MULTIDOMINANCE:
			if (!sourceTree.isPresent() || !targetTree.isPresent() || !isActive(target)) {
				return Optional.empty();
			}
			return multidominance(target, sourceTree.get(), targetTree.get(), chain, indexer);
		case WHOLESALE_LATE_MERGER:
			if (!targetTree.isPresent() || !isActive(target)) {
				return Optional.empty();
			}
			return wholesaleLateMerger(target, targetTree.get(), chain);
		default:
			throw new IllegalStateException("Unknown sideward movement type: " + type);
		}
	}

	/**
	 * The source keeps a trace where the chain was, and the chain lands in the target's tree.
	 */
	private Optional<DerivationTree> nunesStyle(final int source, final int target, final DerivationTree sourceTree,
			final DerivationTree targetTree, final Chain chain, final NodeIndexer indexer) {
		DerivationTree withTraces = sourceTree;
		for (final int index : chain.getTail()) {
			withTraces = withTraces.replaceWithTrace(index);
		}
		addTree(source, withTraces);

		final DerivationTree result = MoveEngine.landing(targetTree, chain, indexer);
		addTree(target, result);
		return Optional.of(result);
	}

	/**
	 * The chain continues as a separate derivation in a workspace of its own.
	 */
	private Optional<DerivationTree> parallelDerivation(final Chain chain, final NodeIndexer indexer) {
		if (!canCreateWorkspace()) {
			return Optional.empty();
		}
		final DerivationTree tree = chain.getDisplaced().orElseGet(() -> DerivationTree.leaf(chain, indexer.next()));
		addTree(newWorkspace(), tree);
		return Optional.of(tree);
	}

	/**
	 * One node dominating both trees, as an approximation of a multiply-dominated constituent.
	 */
	private Optional<DerivationTree> multidominance(final int target, final DerivationTree sourceTree,
			final DerivationTree targetTree, final Chain chain, final NodeIndexer indexer) {
		final DerivationTree result = DerivationTree.merge(sourceTree, targetTree, chain.withoutDisplaced(),
				indexer.next(), ImmutableList.of());
		addTree(target, result);
		return Optional.of(result);
	}

	/**
	 * Defers the chain: the target gets a delayed requirement for its category, to be satisfied by LateMerge.
	 */
	private Optional<DerivationTree> wholesaleLateMerger(final int target, final DerivationTree targetTree,
			final Chain chain) {
		final Optional<Feature> first = chain.getHead().getFirstFeature();
		if (!first.isPresent()) {
			return Optional.empty();
		}

		final Feature requirement = first.get().isCategorial() ? Feature.selector(first.get().getName())
				: first.get();
		final DerivationTree result = targetTree.withDelayedFeatures(ImmutableList.<Feature>builder()
				.addAll(targetTree.getDelayedFeatures()).add(requirement).build());
		addTree(target, result);
		return Optional.of(result);
	}

	/**
	 * Combines the trees of two workspaces into a new workspace, using the supplied combinator, and deactivates the
	 * originals. If either workspace is empty, or the combinator fails, nothing changes.
	 */
	public Optional<Integer> mergeWorkspaces(final int ws1, final int ws2,
			final BiFunction<DerivationTree, DerivationTree, Optional<DerivationTree>> combinator) {
		final Optional<DerivationTree> tree1 = getTree(ws1);
		final Optional<DerivationTree> tree2 = getTree(ws2);
		if (!tree1.isPresent() || !tree2.isPresent() || !canCreateWorkspace()) {
			return Optional.empty();
		}

		final Optional<DerivationTree> combined = combinator.apply(tree1.get(), tree2.get());
		if (!combined.isPresent()) {
			return Optional.empty();
		}

		final int id = newWorkspace();
		addTree(id, combined.get());
		deactivate(ws1);
		deactivate(ws2);
		return Optional.of(id);
	}

	@Override
	public String toString() {
		return workspaces.values().toString();
	}
}
