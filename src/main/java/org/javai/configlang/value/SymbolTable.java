package org.javai.configlang.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Insertion-ordered mapping from declared names to their values.
 * <p>
 * Values are immutable, so a lookup hands out the binding as it stands at lookup
 * time and a later redeclaration never reaches back into values already resolved.
 * Redeclaring a name replaces the binding but keeps its original position.
 */
public final class SymbolTable {

	private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final Map<String, Value> bindings = new LinkedHashMap<>();

	/**
	 * Binds {@code name} to {@code value}, replacing any previous binding.
	 *
	 * @return the value previously bound to the name, if any
	 */
	public Optional<Value> define(String name, Value value) {
		if (!isIdentifier(name)) {
			throw new IllegalArgumentException("Not a valid identifier: " + name);
		}
		Objects.requireNonNull(value, "value must not be null");
		Value previous = bindings.put(name, value);
		if (previous != null) {
			logger.debug("Redeclaration of '{}' shadows previous value {}", name, previous);
		}
		return Optional.ofNullable(previous);
	}

	public Optional<Value> lookup(String name) {
		return Optional.ofNullable(bindings.get(name));
	}

	public boolean contains(String name) {
		return bindings.containsKey(name);
	}

	public int size() {
		return bindings.size();
	}

	public boolean isEmpty() {
		return bindings.isEmpty();
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(bindings.keySet());
	}

	/**
	 * Returns an insertion-ordered copy of the current bindings.
	 */
	public Map<String, Value> snapshot() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
	}

	public static boolean isIdentifier(String text) {
		return text != null && IDENTIFIER.matcher(text).matches();
	}
}
