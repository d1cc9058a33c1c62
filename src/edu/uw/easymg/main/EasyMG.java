package edu.uw.easymg.main;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.InputMismatchException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;

import edu.uw.easymg.lexicon.Lexicon;
import edu.uw.easymg.syntax.grammar.DerivationTree;
import edu.uw.easymg.syntax.parser.MergeStrategy;
import edu.uw.easymg.syntax.parser.MinimalistParser;
import edu.uw.easymg.syntax.parser.MovementStrategy;
import edu.uw.easymg.syntax.parser.Parser;
import edu.uw.easymg.syntax.parser.PhaseConfig;
import edu.uw.easymg.syntax.parser.SidewardMovementType;
import edu.uw.easymg.util.Util;

public class EasyMG {

	private final static Splitter COMMAS = Splitter.on(',').trimResults().omitEmptyStrings();

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "l", description = "Path to the lexicon file")
		String getLexicon();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to the input text file. Otherwise, the parser will read from stdin.")
		String getInputFile();

		@Option(shortName = "o", defaultValue = "tree", description = "(Optional) Output Format: one of \"tree\" or \"linearized\"")
		String getOutputFormat();

		@Option(shortName = "d", defaultValue = "20", description = "(Optional) Maximum number of search rounds per sentence. Defaults to 20, which is too few for most sentences with movement.")
		int getMaxDerivationDepth();

		@Option(shortName = "m", defaultValue = "70", description = "(Optional) Maximum length of sentences in words. Defaults to 70.")
		int getMaxLength();

		@Option(shortName = "g", defaultValue = { "C" }, description = "(Optional) Categories a complete derivation may have. Defaults to: C")
		List<String> getGoalCategories();

		@Option(defaultValue = { "STANDARD" }, description = "(Optional) Merge strategies: any of STANDARD, PAIR_MERGE, LATE_MERGE")
		List<String> getMergeStrategies();

		@Option(defaultValue = { "STANDARD" }, description = "(Optional) Movement strategies: any of STANDARD, MULTI_SPECIFIER, SIDEWARD, INTERARBOREAL")
		List<String> getMovementStrategies();

		@Option(defaultValue = "", description = "(Optional) Comma-separated sideward movement types: any of NUNES_STYLE, PARALLEL_DERIVATION, MULTIDOMINANCE, WHOLESALE_LATE_MERGER")
		String getSidewardMovementTypes();

		@Option(description = "(Optional) Allow sideward movement between parallel workspaces")
		boolean getParallelWorkspaces();

		@Option(defaultValue = "3", description = "(Optional) Maximum number of parallel workspaces. Defaults to 3.")
		int getMaxWorkspaces();

		@Option(description = "(Optional) Allow movement of constituents containing traces")
		boolean getRemnantMovement();

		@Option(description = "(Optional) Allow movement that doesn't change word order")
		boolean getVacuousMovement();

		@Option(description = "(Optional) Don't enforce the Phase Impenetrability Condition")
		boolean getNoPIC();

		@Option(defaultValue = { "C", "v", "D" }, description = "(Optional) Phase head categories. Defaults to: C v D")
		List<String> getPhaseHeads();

		@Option(defaultValue = "1", description = "(Optional) Number of phase edge positions that stay accessible. Defaults to 1.")
		int getMaxEdgeElements();

		@Option(defaultValue = "", description = "(Optional) Also write log messages to this file.")
		String getLogFile();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	// Set of supported OutputFormats
	public enum OutputFormat {
		TREE, LINEARIZED
	}

	public static void main(final String[] args) throws IOException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final Util.Logger logger = commandLineOptions.getLogFile().isEmpty() ? new Util.Logger()
					: new Util.Logger(Util.getFile(commandLineOptions.getLogFile()));
			final File lexiconFile = Util.getFile(commandLineOptions.getLexicon());
			if (!lexiconFile.exists()) {
				throw new InputMismatchException("Couldn't load lexicon from: " + lexiconFile);
			}

			logger.log("====Loading lexicon====");
			final Lexicon lexicon = Lexicon.load(lexiconFile);
			final OutputFormat outputFormat = OutputFormat.valueOf(commandLineOptions.getOutputFormat().toUpperCase());
			final Parser parser = getParserBuilder(commandLineOptions, lexicon).build();
			logger.log("===Lexicon loaded (" + lexicon.size() + " entries): parsing...===");

			final Iterator<String> inputLines;
			final boolean readingFromStdin = commandLineOptions.getInputFile().isEmpty();
			if (readingFromStdin) {
				inputLines = new Scanner(System.in, "UTF-8");
			} else {
				inputLines = Util.readFile(Util.getFile(commandLineOptions.getInputFile())).iterator();
			}

			final Stopwatch timer = Stopwatch.createStarted();
			int parsedSentences = 0;
			int derivations = 0;
			final BufferedWriter sysout = new BufferedWriter(new OutputStreamWriter(System.out,
					StandardCharsets.UTF_8));
			while (inputLines.hasNext()) {
				final String line = inputLines.next().trim();
				if (line.isEmpty() || line.startsWith("#")) {
					continue;
				}

				parsedSentences++;
				final Optional<DerivationTree> result = parser.parse(line);
				if (result.isPresent()) {
					derivations++;
				}
				sysout.write(print(parser, result, outputFormat, parsedSentences));
				sysout.newLine();
				if (readingFromStdin) {
					sysout.flush();
				}
			}
			sysout.close();

			logger.log("Sentences parsed: " + parsedSentences + ", derivations found: " + derivations);
			logger.log("Speed: "
					+ Util.twoDP(1000.0 * parsedSentences / Math.max(1, timer.elapsed(TimeUnit.MILLISECONDS)))
					+ " sentences per second");

		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	private static String print(final Parser parser, final Optional<DerivationTree> result,
			final OutputFormat outputFormat, final int id) {
		if (!result.isPresent()) {
			return "ID=" + id + " No derivation";
		}

		switch (outputFormat) {
		case TREE:
			return "ID=" + id + "\n" + result.get();
		case LINEARIZED:
			return "ID=" + id + " " + Joiner.on(" ").join(parser.linearize(result.get()));
		default:
			throw new IllegalStateException("Unknown output format: " + outputFormat);
		}
	}

	static MinimalistParser.Builder getParserBuilder(final CommandLineArguments o, final Lexicon lexicon) {
		final PhaseConfig phaseConfig = PhaseConfig.DEFAULT.withEnforcePIC(!o.getNoPIC())
				.withPhaseHeads(o.getPhaseHeads()).withMaxEdgeElements(o.getMaxEdgeElements());

		return new MinimalistParser.Builder(lexicon).maximumSentenceLength(o.getMaxLength())
				.maxDerivationDepth(o.getMaxDerivationDepth()).goalCategories(o.getGoalCategories())
				.mergeStrategies(toEnums(o.getMergeStrategies(), MergeStrategy.class))
				.movementStrategies(toEnums(o.getMovementStrategies(), MovementStrategy.class))
				.sidewardMovementTypes(
						toEnums(COMMAS.splitToList(o.getSidewardMovementTypes()), SidewardMovementType.class))
				.enableParallelWorkspaces(o.getParallelWorkspaces()).maxWorkspaces(o.getMaxWorkspaces())
				.allowRemnantMovement(o.getRemnantMovement()).allowVacuousMovement(o.getVacuousMovement())
				.phaseConfig(phaseConfig);
	}

	static <E extends Enum<E>> List<E> toEnums(final List<String> names, final Class<E> type) {
		final List<E> result = new ArrayList<>();
		for (final String name : names) {
			result.add(Enum.valueOf(type, name.toUpperCase()));
		}
		return result;
	}
}
