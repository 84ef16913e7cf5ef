package io.jsonsift.core.modifier;

import io.jsonsift.core.error.UnknownModifierException;
import io.jsonsift.core.spi.Modifier;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of modifiers by name. Owned by the application and handed to a {@code JsonQuery};
 * lookups may run concurrently with queries. Registering a name that is already present replaces
 * the previous modifier.
 */
public final class ModifierRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModifierRegistry.class);

    private final Map<String, Modifier> modifiers = new ConcurrentHashMap<>();

    /** Creates a registry holding every built-in modifier. */
    public static ModifierRegistry withBuiltins() {
        var registry = new ModifierRegistry();
        BuiltinModifiers.registerAll(registry);
        return registry;
    }

    /**
     * Registers a modifier under {@code name}.
     *
     * @throws NullPointerException if name or modifier is null
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, Modifier modifier) {
        if (name == null) {
            throw new NullPointerException("modifier name must not be null");
        }
        if (modifier == null) {
            throw new NullPointerException("modifier must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("modifier name must not be empty");
        }
        Modifier previous = modifiers.put(name, modifier);
        LOG.debug("Registered modifier '{}'{}", name, previous != null ? " (replaced)" : "");
    }

    /** Looks up a modifier by name. */
    public Optional<Modifier> find(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    /**
     * Looks up a modifier by name, throwing if it is not registered.
     *
     * @throws UnknownModifierException if no modifier is registered under {@code name}
     */
    public Modifier requireModifier(String name) {
        return find(name).orElseThrow(() -> new UnknownModifierException(name));
    }

    public boolean hasModifier(String name) {
        return modifiers.containsKey(name);
    }

    public int size() {
        return modifiers.size();
    }

    /** Registered names in sorted order. */
    public Set<String> names() {
        return new TreeSet<>(modifiers.keySet());
    }
}
