package com.themixednuts.typeschema.generator;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only mapping from type identity to definition name, consulted by the
 * walker to decide whether a composite is emitted as a {@code $ref}.
 *
 * <p>
 * Types are keyed by their canonical Jackson form
 * ({@link JavaType#toCanonical()}), so {@code Page<String>} and
 * {@code Page<Integer>} are distinct identities. When the same type is
 * registered under several names, the first name registered is the one
 * references point to and the only one generated.
 * </p>
 */
public final class DefinitionRegistry {

	private static final Logger LOGGER = LoggerFactory.getLogger(DefinitionRegistry.class);

	private final Map<String, String> namesByType;
	private final Map<String, JavaType> typesByName;

	private DefinitionRegistry(Map<String, String> namesByType, Map<String, JavaType> typesByName) {
		this.namesByType = Collections.unmodifiableMap(namesByType);
		this.typesByName = Collections.unmodifiableMap(typesByName);
	}

	/**
	 * Returns a registry with no definitions; every lookup misses.
	 */
	public static DefinitionRegistry empty() {
		return new DefinitionRegistry(new LinkedHashMap<>(), new LinkedHashMap<>());
	}

	public static Builder builder(TypeFactory typeFactory) {
		return new Builder(typeFactory);
	}

	/**
	 * Looks up the definition name registered for a type.
	 *
	 * @param type The resolved type.
	 * @return The definition name, or empty if the type is not registered.
	 */
	public Optional<String> lookup(JavaType type) {
		return Optional.ofNullable(namesByType.get(type.toCanonical()));
	}

	/**
	 * Returns one definition per registered type, in registration order, under
	 * the name references resolve to. Later names for the same type are left
	 * out.
	 */
	public Map<String, JavaType> definitions() {
		return typesByName;
	}

	public boolean isEmpty() {
		return typesByName.isEmpty();
	}

	/**
	 * Collects registrations; {@link #build()} freezes them.
	 */
	public static final class Builder {
		private final TypeFactory typeFactory;
		private final Map<String, String> namesByType = new LinkedHashMap<>();
		private final Map<String, JavaType> typesByName = new LinkedHashMap<>();

		private Builder(TypeFactory typeFactory) {
			this.typeFactory = Objects.requireNonNull(typeFactory, "TypeFactory cannot be null");
		}

		/**
		 * Registers a definition. An optional wrapper is unwrapped so the
		 * definition describes the wrapped type.
		 *
		 * @param name The definition name.
		 * @param type The Java type the definition describes.
		 * @return This builder for chaining.
		 */
		public Builder register(String name, Type type) {
			Objects.requireNonNull(name, "Definition name cannot be null");
			Objects.requireNonNull(type, "Definition type cannot be null");

			JavaType resolved = typeFactory.constructType(type);
			if (TypeKind.of(resolved).getCategory() == TypeKind.Category.OPTIONAL) {
				resolved = TypeKind.optionalContent(resolved, typeFactory);
			}
			JavaType previous = typesByName.put(name, resolved);
			if (previous != null && namesByType.remove(previous.toCanonical(), name)) {
				// hand the old type to the next name still registered for it
				String previousKey = previous.toCanonical();
				typesByName.forEach((other, otherType) -> {
					if (otherType.toCanonical().equals(previousKey)) {
						namesByType.putIfAbsent(previousKey, other);
					}
				});
			}

			String key = resolved.toCanonical();
			String existing = namesByType.putIfAbsent(key, name);
			if (existing != null && !existing.equals(name)) {
				LOGGER.warn("Type {} is registered as both '{}' and '{}'; only '{}' is generated", key, existing,
						name, existing);
			}
			return this;
		}

		public DefinitionRegistry build() {
			Map<String, JavaType> generated = new LinkedHashMap<>();
			typesByName.forEach((name, type) -> {
				if (name.equals(namesByType.get(type.toCanonical()))) {
					generated.put(name, type);
				}
			});
			return new DefinitionRegistry(new LinkedHashMap<>(namesByType), generated);
		}
	}
}
