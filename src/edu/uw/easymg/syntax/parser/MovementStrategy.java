package edu.uw.easymg.syntax.parser;

public enum MovementStrategy {
	// Move within a single tree.
	STANDARD,
	// Keep moving while the root has licensors left, creating several specifiers in one step.
	MULTI_SPECIFIER,
	// Move from one tree into another, via the workspace registry.
	SIDEWARD,
	// Check a licensor against a separate tree whose root carries the licensee.
	INTERARBOREAL
}
