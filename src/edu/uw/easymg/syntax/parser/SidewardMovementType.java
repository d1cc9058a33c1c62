package edu.uw.easymg.syntax.parser;

public enum SidewardMovementType {
	NUNES_STYLE, PARALLEL_DERIVATION, MULTIDOMINANCE, WHOLESALE_LATE_MERGER
}
