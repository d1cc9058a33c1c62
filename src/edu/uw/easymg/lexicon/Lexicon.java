package edu.uw.easymg.lexicon;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import edu.uw.easymg.syntax.grammar.Feature;
import edu.uw.easymg.syntax.grammar.LexicalItem;
import edu.uw.easymg.util.Agreement;
import edu.uw.easymg.util.Util;

/**
 * Maps words to their lexical items. Every entry is checked against a feature type registry before it's added.
 *
 * Covert heads (functional heads with no pronunciation) are kept separately, as they aren't tied to input words.
 */
public class Lexicon {

	/**
	 * The word used for covert heads in lexicon files.
	 */
	public static final String COVERT = "_";

	private final ListMultimap<String, LexicalItem> entries = ArrayListMultimap.create();
	private final List<LexicalItem> covertHeads = new ArrayList<>();
	private final FeatureTypeRegistry registry;

	public Lexicon(final FeatureTypeRegistry registry) {
		this.registry = registry;
	}

	public Lexicon() {
		this(FeatureTypeRegistry.makeDefault());
	}

	public FeatureTypeRegistry getRegistry() {
		return registry;
	}

	/**
	 * Adds an entry for a word. Throws an IllegalArgumentException, leaving the lexicon unchanged, if the item
	 * uses an unregistered feature.
	 */
	public void addEntry(final String word, final LexicalItem item) {
		validate(item);
		entries.put(word, item);
	}

	/**
	 * Adds an entry from its feature notation, e.g. addEntry("the", "D =N").
	 */
	public LexicalItem addEntry(final String word, final String features) {
		final LexicalItem item = LexicalItem.fromNotation(word, features);
		addEntry(word, item);
		return item;
	}

	public void addCovertHead(final LexicalItem item) {
		validate(item);
		covertHeads.add(item);
	}

	public LexicalItem addCovertHead(final String features) {
		final LexicalItem item = LexicalItem.fromNotation("", features);
		addCovertHead(item);
		return item;
	}

	private void validate(final LexicalItem item) {
		for (final Feature feature : item.getFeatures()) {
			registry.validate(feature);
		}
	}

	public List<LexicalItem> getEntries(final String word) {
		return Collections.unmodifiableList(entries.get(word));
	}

	public boolean hasWord(final String word) {
		return entries.containsKey(word);
	}

	public Set<String> getWords() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public List<LexicalItem> getCovertHeads() {
		return ImmutableList.copyOf(covertHeads);
	}

	public int size() {
		return entries.size() + covertHeads.size();
	}

	/**
	 * Loads a lexicon file. Each line has a word (or _ for a covert head), its features, and optionally its
	 * agreement, separated by tabs:
	 *
	 * <pre>
	 * the	D =N
	 * cat	N	num=sg
	 * _	C =T
	 * </pre>
	 *
	 * Lines starting with # are ignored.
	 */
	public static Lexicon load(final File file, final FeatureTypeRegistry registry) {
		final Lexicon result = new Lexicon(registry);
		int lineNumber = 0;
		for (final String line2 : Util.readFile(file)) {
			lineNumber++;
			final String line = line2.trim();
			if (line.isEmpty() || line.startsWith("#")) {
				continue;
			}

			final String[] fields = line.split("\t+");
			if (fields.length < 2 || fields.length > 3) {
				throw new IllegalArgumentException("Expected a word, features and optional agreement on line "
						+ lineNumber + ": \"" + line2 + "\" in file: " + file.getPath());
			}

			final String word = fields[0].trim();
			try {
				LexicalItem item = LexicalItem.fromNotation(word.equals(COVERT) ? "" : word, fields[1]);
				if (fields.length == 3) {
					final Map<String, String> extra = Agreement.fromString(fields[2]);
					final Optional<ImmutableMap<String, String>> agreement = Agreement.unify(item.getAgreement(), extra);
					if (!agreement.isPresent()) {
						throw new IllegalArgumentException("Conflicting agreement: " + item.getAgreement() + " and "
								+ extra);
					}
					item = item.withAgreement(agreement.get());
				}

				if (word.equals(COVERT)) {
					result.addCovertHead(item);
				} else {
					result.addEntry(word, item);
				}
			} catch (final IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid lexical entry on line " + lineNumber + ": \"" + line2
						+ "\" in file: " + file.getPath() + " (" + e.getMessage() + ")", e);
			}
		}

		return result;
	}

	public static Lexicon load(final File file) {
		return load(file, FeatureTypeRegistry.makeDefault());
	}
}
