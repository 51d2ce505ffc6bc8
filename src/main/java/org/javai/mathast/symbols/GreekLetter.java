package org.javai.mathast.symbols;

import java.util.List;
import java.util.Locale;

/**
 * The Greek alphabet, with Unicode code points for both cases.
 */
public enum GreekLetter {

	ALPHA("α", "Α"),
	BETA("β", "Β"),
	GAMMA("γ", "Γ"),
	DELTA("δ", "Δ"),
	EPSILON("ε", "Ε"),
	ZETA("ζ", "Ζ"),
	ETA("η", "Η"),
	THETA("θ", "Θ"),
	IOTA("ι", "Ι"),
	KAPPA("κ", "Κ"),
	LAMBDA("λ", "Λ"),
	MU("μ", "Μ"),
	NU("ν", "Ν"),
	XI("ξ", "Ξ"),
	OMICRON("ο", "Ο"),
	PI("π", "Π"),
	RHO("ρ", "Ρ"),
	SIGMA("σ", "Σ"),
	TAU("τ", "Τ"),
	UPSILON("υ", "Υ"),
	PHI("φ", "Φ"),
	CHI("χ", "Χ"),
	PSI("ψ", "Ψ"),
	OMEGA("ω", "Ω");

	private final String lower;
	private final String upper;

	GreekLetter(String lower, String upper) {
		this.lower = lower;
		this.upper = upper;
	}

	public String unicode(LetterCase letterCase) {
		return letterCase == LetterCase.UPPERCASE ? upper : lower;
	}

	/**
	 * The spelled-out name, capitalised for uppercase: {@code phi} or {@code Phi}.
	 */
	public String asciiName(LetterCase letterCase) {
		String name = name().toLowerCase(Locale.ROOT);
		if (letterCase == LetterCase.UPPERCASE) {
			return Character.toUpperCase(name.charAt(0)) + name.substring(1);
		}
		return name;
	}

	/**
	 * The symbol for this letter: {@code φ}, {@code phi}, {@code \phi} for lowercase phi.
	 */
	public Symbol symbol(LetterCase letterCase) {
		String ascii = asciiName(letterCase);
		return new Symbol(unicode(letterCase), ascii, "\\" + ascii, List.of());
	}
}
