package com.cadenza.json;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Predicate;

/**
 * A JSON backend for node graph export, registered under
 * {@code META-INF/services/com.cadenza.json.AstJsonProvider}.
 *
 * <pre>{@code
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short backend name, matched case-insensitively by {@link #findProvider(String)}.
     */
    String getName();

    /**
     * First registered provider, in class path order.
     *
     * @throws IllegalStateException if none is registered
     */
    static AstJsonProvider getProvider() {
        return find(provider -> true)
            .orElseThrow(() -> new IllegalStateException(
                "No JSON export backend registered; add cadenza-jackson to the class path"));
    }

    /**
     * @throws IllegalStateException if no registered provider has this name
     */
    static AstJsonProvider getProvider(String name) {
        return findProvider(name)
            .orElseThrow(() -> new IllegalStateException("No JSON export backend named '" + name + "' is registered"));
    }

    static Optional<AstJsonProvider> findProvider(String name) {
        return find(provider -> provider.getName().equalsIgnoreCase(name));
    }

    static boolean isProviderAvailable() {
        return find(provider -> true).isPresent();
    }

    private static Optional<AstJsonProvider> find(Predicate<AstJsonProvider> matches) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(matches)
            .findFirst();
    }
}
