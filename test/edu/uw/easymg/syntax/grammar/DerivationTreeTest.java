package edu.uw.easymg.syntax.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class DerivationTreeTest {

	private final DerivationTree the = DerivationTree.leaf(LexicalItem.fromNotation("the", "D =N"), 0);
	private final DerivationTree cat = DerivationTree.leaf(LexicalItem.fromNotation("cat", "N"), 1);

	private DerivationTree dp() {
		return DerivationTree.merge(cat.withoutFirstFeature(), the.withoutFirstFeature(),
				new Chain(LexicalItem.fromNotation("the", "D")), 2, Collections.emptyList());
	}

	@Test
	public void testLeaf() {
		assertTrue(the.isLeaf());
		assertTrue(the.getChildren().isEmpty());
		assertFalse(the.isTrace());
		assertFalse(the.isPhase());
		assertThrows(IllegalStateException.class, () -> the.getLeftChild());
	}

	@Test
	public void testMergedNodesHaveTwoChildren() {
		final DerivationTree dp = dp();
		assertFalse(dp.isLeaf());
		assertEquals(2, dp.getChildren().size());
		assertEquals(1, dp.depth());
		assertEquals(3, dp.size());
		assertEquals(Arrays.asList("cat", "the"), dp.getYield());
	}

	@Test
	public void testTrace() {
		final DerivationTree trace = DerivationTree.trace(7);
		assertTrue(trace.isTrace());
		assertEquals(7, trace.getIndex());
		assertTrue(trace.getHead().getPhoneticForm().isEmpty());
		assertTrue(trace.getHead().getFeatures().isEmpty());
		assertEquals(ImmutableSet.of(7), trace.getChain().getTail());
	}

	@Test
	public void testLeafTakesDelayedFeatures() {
		final DerivationTree leaf = DerivationTree.leaf(LexicalItem.fromNotation("the", "D =N[delay]"), 3);
		assertEquals(Arrays.asList(Feature.selector("N")), leaf.getDelayedFeatures());
		assertEquals(Arrays.asList(Feature.categorial("D")), leaf.getHead().getFeatures());
	}

	@Test
	public void testLeafWithPhaseMarkerIsPhase() {
		final DerivationTree c = DerivationTree.leaf(LexicalItem.fromNotation("", "C =T phase:C"), 4);
		assertTrue(c.isPhase());
		assertFalse(c.isPhaseCompleted());
		assertTrue(c.completePhase().isPhaseCompleted());
	}

	@Test
	public void testCompletePhaseMarksPhase() {
		final DerivationTree completed = cat.completePhase();
		assertTrue(completed.isPhase());
		assertTrue(completed.isPhaseCompleted());
	}

	@Test
	public void testReplaceWithTrace() {
		final DerivationTree dp = dp();
		final DerivationTree replaced = dp.replaceWithTrace(1);
		assertTrue(replaced.getLeftChild().isTrace());
		assertTrue(replaced.containsTrace());
		assertFalse(dp.containsTrace());
		assertEquals(Arrays.asList("the"), replaced.getYield());
	}

	@Test
	public void testPendingLicensees() {
		final DerivationTree what = DerivationTree.leaf(LexicalItem.fromNotation("what", "-wh"), 3);
		final DerivationTree saw = DerivationTree.leaf(LexicalItem.fromNotation("saw", "V"), 4);
		final Chain vChain = new Chain(LexicalItem.fromNotation("saw", "V"));
		assertTrue(DerivationTree.merge(what, saw, vChain, 5, Collections.emptyList()).hasPendingLicensees());
		assertFalse(dp().hasPendingLicensees());

		final DerivationTree which = DerivationTree.leaf(LexicalItem.fromNotation("which", "=N D -wh"), 6);
		final DerivationTree whichCat = DerivationTree.merge(cat.withoutFirstFeature(), which.withoutFirstFeature(),
				new Chain(LexicalItem.fromNotation("which", "D -wh")), 7, Collections.emptyList());
		assertFalse(whichCat.hasPendingLicensees());

		final DerivationTree host = DerivationTree.merge(DerivationTree.trace(3), saw, vChain, 5, Collections
				.emptyList());
		final Chain moved = Chain.withTail(LexicalItem.fromNotation("what", "C"), ImmutableSet.of(3));
		assertFalse(DerivationTree.move(host, moved.withDisplaced(what.withoutFirstFeature()), 8)
				.hasPendingLicensees());
		assertTrue(DerivationTree.move(host, moved.withDisplaced(what), 8).hasPendingLicensees());
	}

	@Test
	public void testStructuralEquality() {
		assertEquals(dp(), dp());
		assertEquals(dp().hashCode(), dp().hashCode());
		assertFalse(dp().equals(dp().withAdjunct(true)));
	}

	@Test
	public void testToStringMarksAdjunctsAndPhases() {
		final String printed = DerivationTree.pairMerge(cat, the, 5).completePhase().toString();
		assertTrue(printed.contains("(adjunct)"), printed);
		assertTrue(printed.contains("(phase, completed)"), printed);
	}
}
