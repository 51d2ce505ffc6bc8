package org.javai.mathast.symbols;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.javai.mathast.ast.BinaryOpKind;
import org.javai.mathast.ast.SymbolTag;
import org.javai.mathast.ast.UnaryOpKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library of known mathematical symbols and the display forms of every operator and
 * opaque symbol tag.
 * <p>
 * Greek letters, Latin letters and the squared / inverse forms of special functions are
 * generated; everything else comes from the catalog YAML
 * ({@value #DEFAULT_CATALOG_RESOURCE} by default). Lookup by representation prefers
 * Greek, then Latin, then special functions, then the miscellaneous symbols; the first
 * symbol to claim a representation keeps it.
 */
public final class SymbolCatalog {

	private static final Logger logger = LoggerFactory.getLogger(SymbolCatalog.class);

	public static final String DEFAULT_CATALOG_RESOURCE = "META-INF/math-symbols.yml";

	private static final String LATIN_ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

	private final String version;
	private final Map<String, Symbol> greek;
	private final Map<String, Symbol> latin;
	private final SortedMap<String, Symbol> specialFunctions;
	private final Map<String, Symbol> misc;
	private final Map<BinaryOpKind, Symbol> binaryOperators;
	private final Map<UnaryOpKind, Symbol> unaryOperators;
	private final Map<SymbolTag, Symbol> opaqueSymbols;
	private final List<Symbol> allSymbols;
	private final Map<String, Symbol> byRepr;

	SymbolCatalog(String version, List<String> specialFunctionNames, Map<String, Symbol> misc,
			Map<BinaryOpKind, Symbol> binaryOperators, Map<UnaryOpKind, Symbol> unaryOperators,
			Map<SymbolTag, Symbol> opaqueSymbols) {
		this.version = version;
		this.greek = Collections.unmodifiableMap(buildGreek());
		this.latin = Collections.unmodifiableMap(buildLatin());
		this.specialFunctions = Collections.unmodifiableSortedMap(buildSpecialFunctions(specialFunctionNames));
		this.misc = Collections.unmodifiableMap(new LinkedHashMap<>(misc));
		this.binaryOperators = Collections.unmodifiableMap(new EnumMap<>(binaryOperators));
		this.unaryOperators = Collections.unmodifiableMap(new EnumMap<>(unaryOperators));
		this.opaqueSymbols = Collections.unmodifiableMap(new EnumMap<>(opaqueSymbols));

		List<Symbol> all = new ArrayList<>();
		all.addAll(greek.values());
		all.addAll(latin.values());
		all.addAll(specialFunctions.values());
		all.addAll(this.misc.values());
		this.allSymbols = List.copyOf(all);
		this.byRepr = Collections.unmodifiableMap(indexByRepr(allSymbols));

		logger.debug("Symbol catalog v{} loaded: {} greek, {} latin, {} special function, {} misc symbol(s)",
				version, greek.size(), latin.size(), specialFunctions.size(), this.misc.size());
	}

	/**
	 * Load the catalog bundled with this library.
	 *
	 * @throws SymbolCatalogException if the resource is missing or invalid
	 */
	public static SymbolCatalog loadDefault() {
		return loadResource(DEFAULT_CATALOG_RESOURCE, SymbolCatalog.class.getClassLoader());
	}

	/**
	 * Load a catalog from a classpath resource.
	 *
	 * @throws SymbolCatalogException if the resource is missing or invalid
	 */
	public static SymbolCatalog loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new SymbolCatalogException("Resource not found: " + resourcePath);
			}
			return new SymbolCatalogParser().parse(is);
		} catch (SymbolCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolCatalogException("Failed to load symbol catalog from resource: " + resourcePath, e);
		}
	}

	public String version() {
		return version;
	}

	/**
	 * Finds the symbol that claims the given representation in any format.
	 */
	public Optional<Symbol> lookup(String repr) {
		return Optional.ofNullable(byRepr.get(repr));
	}

	/**
	 * Greek letter by ASCII name; {@code pi} is π and {@code Pi} is Π.
	 */
	public Optional<Symbol> greek(String asciiName) {
		return Optional.ofNullable(greek.get(asciiName));
	}

	public Optional<Symbol> latin(String letter) {
		return Optional.ofNullable(latin.get(letter));
	}

	/**
	 * Special function by name, including the {@code ^2} and {@code ^-1} forms.
	 */
	public Optional<Symbol> specialFunction(String name) {
		return Optional.ofNullable(specialFunctions.get(name));
	}

	public boolean isSpecialFunction(String name) {
		return specialFunctions.containsKey(name);
	}

	/**
	 * Miscellaneous symbol by catalog key, such as {@code le} or {@code degree}.
	 */
	public Optional<Symbol> misc(String key) {
		return Optional.ofNullable(misc.get(key));
	}

	public Symbol operator(BinaryOpKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		return binaryOperators.get(kind);
	}

	public Symbol operator(UnaryOpKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		return unaryOperators.get(kind);
	}

	public Symbol symbolFor(SymbolTag tag) {
		Objects.requireNonNull(tag, "tag must not be null");
		return opaqueSymbols.get(tag);
	}

	public Map<String, Symbol> greekSymbols() {
		return greek;
	}

	public Map<String, Symbol> latinSymbols() {
		return latin;
	}

	public SortedMap<String, Symbol> specialFunctions() {
		return specialFunctions;
	}

	public Map<String, Symbol> miscSymbols() {
		return misc;
	}

	/**
	 * Greek, Latin, special function and miscellaneous symbols, in lookup preference order.
	 */
	public List<Symbol> allSymbols() {
		return allSymbols;
	}

	private static Map<String, Symbol> buildGreek() {
		Map<String, Symbol> symbols = new LinkedHashMap<>();
		for (GreekLetter letter : GreekLetter.values()) {
			for (LetterCase letterCase : LetterCase.values()) {
				Symbol symbol = letter.symbol(letterCase);
				symbols.put(symbol.ascii(), symbol);
			}
		}
		return symbols;
	}

	private static Map<String, Symbol> buildLatin() {
		Map<String, Symbol> symbols = new LinkedHashMap<>();
		for (char letter : LATIN_ALPHABET.toCharArray()) {
			String text = String.valueOf(letter);
			symbols.put(text, Symbol.of(text));
		}
		return symbols;
	}

	private static SortedMap<String, Symbol> buildSpecialFunctions(List<String> names) {
		SortedMap<String, Symbol> symbols = new TreeMap<>();
		for (String name : names) {
			symbols.put(name, new Symbol(name, name, "\\" + name, List.of()));
			symbols.put(name + "^2", new Symbol(name + "²", name + "^2", "\\" + name + "^2", List.of()));
			symbols.put(name + "^-1", new Symbol(name + "⁻¹", name + "^-1", "\\" + name + "^{-1}", List.of()));
		}
		return symbols;
	}

	private static Map<String, Symbol> indexByRepr(List<Symbol> symbols) {
		Map<String, Symbol> index = new LinkedHashMap<>();
		for (Symbol symbol : symbols) {
			for (String repr : symbol.reprs()) {
				Symbol existing = index.putIfAbsent(repr, symbol);
				if (existing != null && existing != symbol) {
					logger.debug("Representation '{}' already claimed by {}; skipping for {}",
							repr, existing.unicode(), symbol.unicode());
				}
			}
		}
		return index;
	}
}
