package org.javai.mathast.ast;

import java.util.Locale;

/**
 * Tags for non-variable symbol leaves. New symbols are added here as they are needed.
 */
public enum SymbolTag {

	ELLIPSIS("ellipsis"),
	INFINITY("infinity"),
	DOES_NOT_EXIST("does-not-exist");

	private final String tag;

	SymbolTag(String tag) {
		this.tag = tag;
	}

	/**
	 * @throws UnknownOperatorException if the tag is null or not a known symbol
	 */
	public static SymbolTag fromTag(String tag) {
		if (tag == null) {
			throw new UnknownOperatorException("symbol", null);
		}
		String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		for (SymbolTag symbolTag : values()) {
			if (symbolTag.tag.equals(normalized)) {
				return symbolTag;
			}
		}
		throw new UnknownOperatorException("symbol", tag);
	}

	public String tag() {
		return tag;
	}
}
