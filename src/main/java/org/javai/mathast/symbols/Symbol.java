package org.javai.mathast.symbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A symbol with several accepted spellings: a preferred Unicode form, a preferred
 * ASCII form, a preferred LaTeX form, and any other spellings to recognise in input.
 *
 * @param unicode preferred Unicode representation
 * @param ascii preferred ASCII representation
 * @param latex preferred LaTeX representation
 * @param otherReprs additional representations accepted as input
 */
public record Symbol(String unicode, String ascii, String latex, List<String> otherReprs) {

	public Symbol {
		Objects.requireNonNull(unicode, "unicode must not be null");
		Objects.requireNonNull(ascii, "ascii must not be null");
		Objects.requireNonNull(latex, "latex must not be null");
		otherReprs = otherReprs != null ? List.copyOf(otherReprs) : List.of();
	}

	/**
	 * A symbol spelled the same way in every format, such as {@code x}.
	 */
	public static Symbol of(String text) {
		return new Symbol(text, text, text, List.of());
	}

	public static Symbol of(String unicode, String ascii, String latex, String... others) {
		return new Symbol(unicode, ascii, latex, List.of(others));
	}

	/**
	 * Every accepted representation: Unicode, ASCII, LaTeX, then the others.
	 */
	public List<String> reprs() {
		List<String> reprs = new ArrayList<>(3 + otherReprs.size());
		reprs.add(unicode);
		reprs.add(ascii);
		reprs.add(latex);
		reprs.addAll(otherReprs);
		return List.copyOf(reprs);
	}

	/**
	 * The longest representation of this symbol that the input starts with, if any.
	 */
	public Optional<String> matchFront(String input) {
		Objects.requireNonNull(input, "input must not be null");
		String best = null;
		for (String repr : reprs()) {
			if (!repr.isEmpty() && input.startsWith(repr) && (best == null || repr.length() > best.length())) {
				best = repr;
			}
		}
		return Optional.ofNullable(best);
	}
}
