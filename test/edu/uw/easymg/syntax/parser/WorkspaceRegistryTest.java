package edu.uw.easymg.syntax.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import edu.uw.easymg.syntax.grammar.Chain;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.Feature;
import edu.uw.easymg.syntax.grammar.LexicalItem;

public class WorkspaceRegistryTest {

	private final PhaseChecker phaseChecker = new PhaseChecker(PhaseConfig.DEFAULT);
	private final MergeEngine mergeEngine = new MergeEngine(EnumSet.of(MergeStrategy.STANDARD), phaseChecker);
	private final MoveEngine moveEngine = new MoveEngine(EnumSet.of(MovementStrategy.STANDARD), phaseChecker, false,
			false);

	private static DerivationTree leaf(final String form, final String notation, final int index) {
		return DerivationTree.leaf(LexicalItem.fromNotation(form, notation), index);
	}

	@Test
	public void testWorkspaceLimit() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(2);
		assertEquals(0, registry.newWorkspace());
		assertEquals(1, registry.newWorkspace());
		assertFalse(registry.canCreateWorkspace());
		assertThrows(IllegalStateException.class, () -> registry.newWorkspace());
		assertEquals(2, registry.size());
	}

	@Test
	public void testAddTree() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int id = registry.newWorkspace();
		final DerivationTree cat = leaf("cat", "[N]", 0);
		assertTrue(registry.addTree(id, cat));
		assertSame(cat, registry.getTree(id).get());
		assertFalse(registry.addTree(7, cat));

		registry.deactivate(id);
		assertFalse(registry.addTree(id, leaf("dog", "[N]", 1)));
		assertSame(cat, registry.getTree(id).get());
		registry.activate(id);
		assertTrue(registry.addTree(id, leaf("dog", "[N]", 1)));
	}

	@Test
	public void testActiveWorkspaces() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int first = registry.newWorkspace();
		final int second = registry.newWorkspace();
		final int third = registry.newWorkspace();
		registry.addTree(first, leaf("cat", "[N]", 0));
		registry.addTree(third, leaf("dog", "[N]", 1));
		registry.deactivate(third);

		assertEquals(Arrays.asList(first, second), registry.getActiveWorkspaces());
		assertEquals(Arrays.asList(first), registry.getActiveWorkspacesWithTrees());
	}

	@Test
	public void testTransferTree() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int from = registry.newWorkspace();
		final int to = registry.newWorkspace();
		final DerivationTree cat = leaf("cat", "[N]", 0);
		registry.addTree(from, cat);

		assertTrue(registry.transferTree(from, to));
		assertFalse(registry.getTree(from).isPresent());
		assertSame(cat, registry.getTree(to).get());
		assertFalse(registry.transferTree(from, to));
	}

	@Test
	public void testTransferToSameWorkspace() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(2);
		final int id = registry.newWorkspace();
		assertFalse(registry.transferTree(id, id));

		final DerivationTree cat = leaf("cat", "[N]", 0);
		registry.addTree(id, cat);
		assertTrue(registry.transferTree(id, id));
		assertSame(cat, registry.getTree(id).get());
	}

	@Test
	public void testFailedTransferChangesNothing() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int from = registry.newWorkspace();
		final int to = registry.newWorkspace();
		final DerivationTree cat = leaf("cat", "[N]", 0);
		final DerivationTree dog = leaf("dog", "[N]", 1);
		registry.addTree(from, cat);
		registry.addTree(to, dog);
		registry.deactivate(to);

		assertFalse(registry.transferTree(from, to));
		assertSame(cat, registry.getTree(from).get());
		assertSame(dog, registry.getTree(to).get());
	}

	@Test
	public void testCopyTree() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(2);
		final int id = registry.newWorkspace();
		final DerivationTree cat = leaf("cat", "[N]", 0);
		registry.addTree(id, cat);

		final Optional<Integer> copy = registry.copyTree(id);
		assertTrue(copy.isPresent());
		assertSame(cat, registry.getTree(copy.get()).get());
		assertSame(cat, registry.getTree(id).get());
		assertFalse(registry.copyTree(id).isPresent());
	}

	@Test
	public void testUpdateTree() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(2);
		final int id = registry.newWorkspace();
		assertFalse(registry.updateTree(id, tree -> tree.completePhase()));
		registry.addTree(id, leaf("that", "[C]", 0));
		assertTrue(registry.updateTree(id, tree -> tree.completePhase()));
		assertTrue(registry.getTree(id).get().isPhaseCompleted());
	}

	/**
	 * Sets up "saw what" (what 0, saw 1, VP 3) in workspace 0 and a C head (index 2) in workspace 1.
	 */
	private WorkspaceRegistry setUpSideward(final int maxWorkspaces) {
		final WorkspaceRegistry registry = new WorkspaceRegistry(maxWorkspaces);
		final DerivationTree vp = mergeEngine.applyMerge(leaf("what", "[D,-wh]", 0), leaf("saw", "[V,=D]", 1),
				new NodeIndexer(3)).get();
		registry.addTree(registry.newWorkspace(), vp);
		registry.addTree(registry.newWorkspace(), leaf("", "[C,+wh]", 2));
		return registry;
	}

	private Chain whChain(final WorkspaceRegistry registry) {
		return moveEngine.extract(registry.getTree(0).get(), "wh").get().getChain();
	}

	@Test
	public void testNunesStyle() {
		final WorkspaceRegistry registry = setUpSideward(2);
		final DerivationTree result = registry.sidewardMove(0, 1, whChain(registry),
				SidewardMovementType.NUNES_STYLE, new NodeIndexer(4)).get();

		assertEquals("what", result.getHead().getPhoneticForm());
		assertEquals(Optional.of("C"), result.getHead().getCategory());
		assertSame(result, registry.getTree(1).get());
		assertTrue(registry.getTree(0).get().containsTrace());
		assertEquals(Arrays.asList("saw"), Linearizer.linearize(registry.getTree(0).get()));
	}

	@Test
	public void testParallelDerivation() {
		final WorkspaceRegistry registry = setUpSideward(3);
		final DerivationTree result = registry.sidewardMove(0, 1, whChain(registry),
				SidewardMovementType.PARALLEL_DERIVATION, new NodeIndexer(4)).get();
		assertEquals(0, result.getIndex());
		assertEquals(3, registry.size());
		assertSame(result, registry.getTree(2).get());

		final WorkspaceRegistry full = setUpSideward(2);
		assertFalse(full.sidewardMove(0, 1, whChain(full), SidewardMovementType.PARALLEL_DERIVATION,
				new NodeIndexer(4)).isPresent());
	}

	@Test
	public void testMultidominance() {
		final WorkspaceRegistry registry = setUpSideward(2);
		final DerivationTree source = registry.getTree(0).get();
		final DerivationTree target = registry.getTree(1).get();
		final DerivationTree result = registry.sidewardMove(0, 1, whChain(registry),
				SidewardMovementType.MULTIDOMINANCE, new NodeIndexer(4)).get();

		assertSame(source, result.getLeftChild());
		assertSame(target, result.getRightChild());
		assertSame(result, registry.getTree(1).get());
	}

	@Test
	public void testWholesaleLateMerger() {
		final WorkspaceRegistry registry = setUpSideward(2);
		final Chain chain = new Chain(LexicalItem.fromNotation("what", "[D]"));
		final DerivationTree result = registry.sidewardMove(0, 1, chain, SidewardMovementType.WHOLESALE_LATE_MERGER,
				new NodeIndexer(4)).get();
		assertEquals(Arrays.asList(Feature.selector("D")), result.getDelayedFeatures());
		assertSame(result, registry.getTree(1).get());

		assertFalse(registry.sidewardMove(0, 1, whChain(registry), SidewardMovementType.WHOLESALE_LATE_MERGER,
				new NodeIndexer(4)).isPresent());
	}

	@Test
	public void testSidewardMoveToInactiveTarget() {
		for (final SidewardMovementType type : Arrays.asList(SidewardMovementType.NUNES_STYLE,
				SidewardMovementType.MULTIDOMINANCE, SidewardMovementType.WHOLESALE_LATE_MERGER)) {
			final WorkspaceRegistry registry = setUpSideward(2);
			final Chain chain = type == SidewardMovementType.WHOLESALE_LATE_MERGER
					? new Chain(LexicalItem.fromNotation("what", "[D]"))
					: whChain(registry);
			final DerivationTree source = registry.getTree(0).get();
			final DerivationTree target = registry.getTree(1).get();
			registry.deactivate(1);

			assertFalse(registry.sidewardMove(0, 1, chain, type, new NodeIndexer(4)).isPresent(), type.toString());
			assertSame(source, registry.getTree(0).get(), type.toString());
			assertSame(target, registry.getTree(1).get(), type.toString());
		}
	}

	@Test
	public void testNunesStyleFromInactiveSource() {
		final WorkspaceRegistry registry = setUpSideward(2);
		final Chain chain = whChain(registry);
		final DerivationTree target = registry.getTree(1).get();
		registry.deactivate(0);

		assertFalse(registry.sidewardMove(0, 1, chain, SidewardMovementType.NUNES_STYLE, new NodeIndexer(4))
				.isPresent());
		assertSame(target, registry.getTree(1).get());
	}

	@Test
	public void testParallelDerivationWithoutTrees() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int source = registry.newWorkspace();
		final int target = registry.newWorkspace();
		final DerivationTree result = registry.sidewardMove(source, target,
				new Chain(LexicalItem.fromNotation("what", "[D]")), SidewardMovementType.PARALLEL_DERIVATION,
				new NodeIndexer(0)).get();
		assertEquals("what", result.getHead().getPhoneticForm());
		assertSame(result, registry.getTree(2).get());
	}

	@Test
	public void testSidewardMoveNeedsTwoTrees() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(2);
		final int source = registry.newWorkspace();
		final int target = registry.newWorkspace();
		registry.addTree(source, leaf("what", "[-wh]", 0));
		assertFalse(registry.sidewardMove(source, target, new Chain(LexicalItem.fromNotation("what", "[D]")),
				SidewardMovementType.NUNES_STYLE, new NodeIndexer(1)).isPresent());
	}

	@Test
	public void testMergeWorkspaces() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int first = registry.newWorkspace();
		final int second = registry.newWorkspace();
		registry.addTree(first, leaf("cat", "[N]", 0));
		registry.addTree(second, leaf("the", "[D,=N]", 1));
		final NodeIndexer indexer = new NodeIndexer(2);

		final Optional<Integer> merged = registry.mergeWorkspaces(first, second, (a, b) -> mergeEngine.applyMerge(a,
				b, indexer));
		assertTrue(merged.isPresent());
		assertEquals(Arrays.asList(merged.get()), registry.getActiveWorkspaces());
		assertEquals(Arrays.asList("the", "cat"), Linearizer.linearize(registry.getTree(merged.get()).get()));
	}

	@Test
	public void testFailedMergeChangesNothing() {
		final WorkspaceRegistry registry = new WorkspaceRegistry(3);
		final int first = registry.newWorkspace();
		final int second = registry.newWorkspace();
		registry.addTree(first, leaf("cat", "[N]", 0));
		registry.addTree(second, leaf("dog", "[N]", 1));
		final NodeIndexer indexer = new NodeIndexer(2);

		assertFalse(registry.mergeWorkspaces(first, second, (a, b) -> mergeEngine.applyMerge(a, b, indexer))
				.isPresent());
		assertEquals(2, registry.size());
		assertEquals(Arrays.asList(first, second), registry.getActiveWorkspacesWithTrees());
	}
}
