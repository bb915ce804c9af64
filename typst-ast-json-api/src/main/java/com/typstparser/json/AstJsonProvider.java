package com.typstparser.json;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Predicate;

/**
 * Provider interface for JSON serialization of parse results.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., typst-ast-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(TypstParser.parseAst(text));
 * AstParseResult parsed = provider.getDeserializer().deserializeAst(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * Returns the serializer for converting parse results to JSON.
     *
     * @return the JSON serializer
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns the deserializer for reading parse results from JSON.
     *
     * @return the JSON deserializer
     */
    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the first provider registered under
     * {@code META-INF/services/com.typstparser.json.AstJsonProvider}.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        return find(provider -> true).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add typst-ast-jackson (or another provider) to your dependencies."));
    }

    /**
     * Gets a provider by its case-insensitive name.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        return find(provider -> provider.getName().equalsIgnoreCase(name))
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider found with name '" + name + "'. " +
                "Ensure the appropriate provider JAR is on the classpath."));
    }

    private static Optional<AstJsonProvider> find(Predicate<AstJsonProvider> filter) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (filter.test(provider)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
