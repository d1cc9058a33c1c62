package edu.uw.easymg.syntax.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.grammar.LexicalItem;

public class PhaseCheckerTest {

	private final PhaseChecker checker = new PhaseChecker(PhaseConfig.DEFAULT);
	private final MergeEngine mergeEngine = new MergeEngine(EnumSet.of(MergeStrategy.STANDARD), checker);
	private final MoveEngine moveEngine = new MoveEngine(EnumSet.of(MovementStrategy.STANDARD), checker, false,
			false);

	private static DerivationTree leaf(final String form, final String notation, final int index) {
		return DerivationTree.leaf(LexicalItem.fromNotation(form, notation), index);
	}

	private DerivationTree merge(final DerivationTree spec, final DerivationTree head, final NodeIndexer indexer) {
		return mergeEngine.applyMerge(spec, head, indexer).get();
	}

	/**
	 * [CP C [VP John [V' saw what]]], where VP and CP are phases. Indices: what 0, saw 1, John 2, C 3, V' 4, VP 5,
	 * CP 6.
	 */
	private DerivationTree clause() {
		final NodeIndexer indexer = new NodeIndexer(4);
		final DerivationTree vBar = merge(leaf("what", "[D]", 0), leaf("saw", "[V,=D,=D,phase:V]", 1), indexer);
		final DerivationTree vp = merge(leaf("John", "[D]", 2), vBar, indexer);
		return merge(vp, leaf("", "[C,=V,phase:C]", 3), indexer);
	}

	/**
	 * A wh-question after movement, at a phase: what 0, saw 1, C 2, VP 3, C' 4, CP 5.
	 */
	private DerivationTree whQuestion() {
		final NodeIndexer indexer = new NodeIndexer(3);
		final DerivationTree vp = merge(leaf("what", "[D,-wh]", 0), leaf("saw", "[V,=D]", 1), indexer);
		final DerivationTree cBar = merge(vp, leaf("", "[C,=V,+wh,phase:C]", 2), indexer);
		return moveEngine.applyMove(cBar, indexer).get();
	}

	private static List<Integer> indices(final List<DerivationTree> trees) {
		final List<Integer> result = new ArrayList<>();
		for (final DerivationTree tree : trees) {
			result.add(tree.getIndex());
		}
		return result;
	}

	@Test
	public void testIsPhaseHead() {
		assertTrue(checker.isPhaseHead(leaf("that", "[C]", 0)));
		assertTrue(checker.isPhaseHead(leaf("", "[T,=V,phase:T]", 0)));
		assertFalse(checker.isPhaseHead(leaf("will", "[T]", 0)));
		assertFalse(checker.isPhaseHead(leaf("that", "[C,=T]", 0)));

		final PhaseChecker custom = new PhaseChecker(PhaseConfig.DEFAULT.withPhaseHeads(Arrays.asList("T")));
		assertTrue(custom.isPhaseHead(leaf("will", "[T]", 0)));
		assertFalse(custom.isPhaseHead(leaf("that", "[C]", 0)));
	}

	@Test
	public void testPhaseEdge() {
		final DerivationTree question = whQuestion();
		assertTrue(question.isPhase());
		assertEquals(Arrays.asList(0), indices(checker.getPhaseEdge(question)));

		final PhaseChecker wideEdge = new PhaseChecker(PhaseConfig.DEFAULT.withMaxEdgeElements(3));
		assertEquals(Arrays.asList(0, 4, 3), indices(wideEdge.getPhaseEdge(question)));
	}

	@Test
	public void testNoEdgeOutsidePhases() {
		final NodeIndexer indexer = new NodeIndexer(2);
		final DerivationTree vp = merge(leaf("it", "[D]", 0), leaf("saw", "[V,=D]", 1), indexer);
		assertTrue(checker.getPhaseEdge(vp).isEmpty());
	}

	@Test
	public void testExtractionFromOpenPhase() {
		final DerivationTree cp = clause();
		for (int i = 0; i < 7; i++) {
			assertTrue(checker.checkExtraction(cp, i));
		}
	}

	@Test
	public void testExtractionFromCompletedPhase() {
		final DerivationTree question = whQuestion().completePhase();
		final List<Integer> edge = indices(checker.getPhaseEdge(question));
		for (int i = 0; i < 6; i++) {
			assertEquals(edge.contains(i) || question.getChain().getTail().contains(i), checker.checkExtraction(
					question, i), "index " + i);
		}
		assertTrue(checker.checkExtraction(question, 0));
		assertFalse(checker.checkExtraction(question, 1));

		final PhaseChecker withoutPIC = new PhaseChecker(PhaseConfig.DEFAULT.withEnforcePIC(false));
		assertTrue(withoutPIC.checkExtraction(question, 1));
	}

	@Test
	public void testTransferPhase() {
		final DerivationTree cp = clause();
		assertFalse(cp.isPhaseCompleted());

		final DerivationTree transferred = checker.transferPhase(cp);
		assertTrue(transferred.isPhaseCompleted());
		final DerivationTree vp = transferred.getLeftChild();
		assertTrue(vp.isPhaseCompleted());
		assertFalse(vp.getLeftChild().isPhaseCompleted());
		assertEquals(Linearizer.linearize(cp), Linearizer.linearize(transferred));
	}

	@Test
	public void testPhaseSpine() {
		final DerivationTree cp = clause();
		final List<DerivationTree> spine = checker.phaseSpine(cp);
		assertEquals(2, spine.size());
		assertSame(cp, spine.get(0));
		for (final DerivationTree node : spine) {
			assertTrue(checker.isPhaseHead(node));
		}
	}
}
