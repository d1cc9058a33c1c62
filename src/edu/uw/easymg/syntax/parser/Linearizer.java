package edu.uw.easymg.syntax.parser;

import java.util.ArrayList;
import java.util.List;

import com.carrotsearch.hppc.IntHashSet;

import edu.uw.easymg.syntax.grammar.DerivationTree;

/**
 * Projects a derivation onto its pronounced word order.
 *
 * Heads precede their complements, specifiers and adjuncts precede their heads, and moved constituents are
 * pronounced in their landing site. A constituent that has been merged more than once shares its indices with its
 * copies, and only the first copy is pronounced.
 */
public class Linearizer {

	private Linearizer() {
	}

	public static List<String> linearize(final DerivationTree tree) {
		final List<String> result = new ArrayList<>();
		linearize(tree, result, new IntHashSet());
		return result;
	}

	private static void linearize(final DerivationTree node, final List<String> result, final IntHashSet pronounced) {
		if (node.getChain().getDisplaced().isPresent()) {
			linearize(node.getChain().getDisplaced().get(), result, pronounced);
		}

		if (node.isLeaf()) {
			final String form = node.getHead().getPhoneticForm();
			if (!node.isTrace() && !form.isEmpty() && pronounced.add(node.getIndex())) {
				result.add(form);
			}
		} else if (node.isMovement()) {
			linearize(node.getLeftChild(), result, pronounced);
			linearize(node.getRightChild(), result, pronounced);
		} else if (node.getRightChild().isLeaf() && !node.getLeftChild().isAdjunct()) {
			// Lexical head, followed by its complement.
			linearize(node.getRightChild(), result, pronounced);
			linearize(node.getLeftChild(), result, pronounced);
		} else {
			linearize(node.getLeftChild(), result, pronounced);
			linearize(node.getRightChild(), result, pronounced);
		}
	}
}
