package com.pyparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for syntax tree JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., pytree-jackson)
 * to your classpath.</p>
 *
 * <pre>{@code
 * TreeJsonProvider provider = TreeJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(module);
 * Module copy = provider.getDeserializer().deserializeModule(json);
 * }</pre>
 */
public interface TreeJsonProvider {

    TreeJsonSerializer getSerializer();

    TreeJsonDeserializer getDeserializer();

    /**
     * @return the provider name, e.g. "Jackson"
     */
    String getName();

    /**
     * Gets the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static TreeJsonProvider getProvider() {
        Iterator<TreeJsonProvider> iterator = ServiceLoader.load(TreeJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No TreeJsonProvider found on the classpath. " +
            "Add pytree-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets a provider by name, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static TreeJsonProvider getProvider(String name) {
        for (TreeJsonProvider provider : ServiceLoader.load(TreeJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No TreeJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(TreeJsonProvider.class).iterator().hasNext();
    }
}
