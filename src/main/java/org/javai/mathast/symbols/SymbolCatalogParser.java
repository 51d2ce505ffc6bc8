package org.javai.mathast.symbols;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.javai.mathast.ast.BinaryOpKind;
import org.javai.mathast.ast.SymbolTag;
import org.javai.mathast.ast.UnaryOpKind;
import org.javai.mathast.ast.UnknownOperatorException;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for symbol catalog YAML files.
 * <p>
 * Expected layout:
 * <pre>
 * catalog_version: 1
 * special_functions: [sin, cos, ...]
 * symbols:
 *   le: { unicode: "≤", ascii: "&lt;=", latex: "\\le", other: [" le"] }
 * operators:
 *   binary:
 *     add: { unicode: "+", ascii: "+", latex: "+" }
 *   unary:
 *     negate: { unicode: "-", ascii: "-", latex: "-" }
 * opaque:
 *   infinity: { unicode: "∞", ascii: "inf", latex: "\\infty" }
 * </pre>
 * Every binary operator, unary operator and opaque symbol must have an entry.
 */
public class SymbolCatalogParser {

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a catalog from a path.
	 */
	public SymbolCatalog parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (SymbolCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolCatalogException("Failed to parse symbol catalog from path: " + path, e);
		}
	}

	/**
	 * Parse a catalog from an input stream.
	 */
	public SymbolCatalog parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildCatalog(data);
		} catch (SymbolCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolCatalogException("Failed to parse symbol catalog from input stream", e);
		}
	}

	/**
	 * Parse a catalog from a reader.
	 */
	public SymbolCatalog parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildCatalog(data);
		} catch (SymbolCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolCatalogException("Failed to parse symbol catalog from reader", e);
		}
	}

	/**
	 * Parse a catalog from a string.
	 */
	public SymbolCatalog parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildCatalog(data);
		} catch (SymbolCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolCatalogException("Failed to parse symbol catalog from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private SymbolCatalog buildCatalog(Map<String, Object> data) {
		if (data == null) {
			throw new SymbolCatalogException("Symbol catalog is empty");
		}
		String version = toString(data.get("catalog_version"));

		List<String> specialFunctions = buildNames((List<Object>) data.get("special_functions"));
		Map<String, Symbol> misc = buildSymbols((Map<String, Object>) data.get("symbols"), "symbols");

		Map<String, Object> operators = (Map<String, Object>) data.get("operators");
		if (operators == null) {
			throw new SymbolCatalogException("Missing required 'operators' section");
		}
		Map<BinaryOpKind, Symbol> binary = buildBinaryOperators((Map<String, Object>) operators.get("binary"));
		Map<UnaryOpKind, Symbol> unary = buildUnaryOperators((Map<String, Object>) operators.get("unary"));
		Map<SymbolTag, Symbol> opaque = buildOpaqueSymbols((Map<String, Object>) data.get("opaque"));

		return new SymbolCatalog(version, specialFunctions, misc, binary, unary, opaque);
	}

	private List<String> buildNames(List<Object> names) {
		if (names == null) {
			return List.of();
		}
		List<String> result = new ArrayList<>();
		for (Object name : names) {
			String text = toString(name);
			if (text.isBlank()) {
				throw new SymbolCatalogException("Special function names must not be blank");
			}
			result.add(text);
		}
		return result;
	}

	private Map<String, Symbol> buildSymbols(Map<String, Object> symbolsMap, String section) {
		if (symbolsMap == null) {
			return Map.of();
		}
		Map<String, Symbol> symbols = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : symbolsMap.entrySet()) {
			symbols.put(entry.getKey(), buildSymbol(entry.getValue(), section + "." + entry.getKey()));
		}
		return symbols;
	}

	private Map<BinaryOpKind, Symbol> buildBinaryOperators(Map<String, Object> section) {
		Map<BinaryOpKind, Symbol> result = new EnumMap<>(BinaryOpKind.class);
		for (Map.Entry<String, Symbol> entry : buildSymbols(section, "operators.binary").entrySet()) {
			result.put(resolve(() -> BinaryOpKind.fromTag(entry.getKey()), "operators.binary"), entry.getValue());
		}
		for (BinaryOpKind kind : BinaryOpKind.values()) {
			if (!result.containsKey(kind)) {
				throw new SymbolCatalogException("Missing display form for binary operator '" + kind.tag() + "'");
			}
		}
		return result;
	}

	private Map<UnaryOpKind, Symbol> buildUnaryOperators(Map<String, Object> section) {
		Map<UnaryOpKind, Symbol> result = new EnumMap<>(UnaryOpKind.class);
		for (Map.Entry<String, Symbol> entry : buildSymbols(section, "operators.unary").entrySet()) {
			result.put(resolve(() -> UnaryOpKind.fromTag(entry.getKey()), "operators.unary"), entry.getValue());
		}
		for (UnaryOpKind kind : UnaryOpKind.values()) {
			if (!result.containsKey(kind)) {
				throw new SymbolCatalogException("Missing display form for unary operator '" + kind.tag() + "'");
			}
		}
		return result;
	}

	private Map<SymbolTag, Symbol> buildOpaqueSymbols(Map<String, Object> section) {
		Map<SymbolTag, Symbol> result = new EnumMap<>(SymbolTag.class);
		for (Map.Entry<String, Symbol> entry : buildSymbols(section, "opaque").entrySet()) {
			result.put(resolve(() -> SymbolTag.fromTag(entry.getKey()), "opaque"), entry.getValue());
		}
		for (SymbolTag tag : SymbolTag.values()) {
			if (!result.containsKey(tag)) {
				throw new SymbolCatalogException("Missing display form for symbol '" + tag.tag() + "'");
			}
		}
		return result;
	}

	private <T> T resolve(Supplier<T> resolver, String section) {
		try {
			return resolver.get();
		} catch (UnknownOperatorException e) {
			throw new SymbolCatalogException("Invalid entry in '" + section + "': " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private Symbol buildSymbol(Object value, String path) {
		if (!(value instanceof Map)) {
			throw new SymbolCatalogException("Entry '" + path + "' must be a mapping");
		}
		Map<String, Object> symbolData = (Map<String, Object>) value;
		String unicode = required(symbolData, "unicode", path);
		String ascii = symbolData.containsKey("ascii") ? toString(symbolData.get("ascii")) : unicode;
		String latex = symbolData.containsKey("latex") ? toString(symbolData.get("latex")) : ascii;

		List<Object> othersList = (List<Object>) symbolData.get("other");
		List<String> others = new ArrayList<>();
		if (othersList != null) {
			for (Object other : othersList) {
				others.add(toString(other));
			}
		}
		return new Symbol(unicode, ascii, latex, others);
	}

	private String required(Map<String, Object> data, String key, String path) {
		Object value = data.get(key);
		if (value == null) {
			throw new SymbolCatalogException("Entry '" + path + "' is missing required field '" + key + "'");
		}
		return toString(value);
	}

	private String toString(Object obj) {
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}
}
