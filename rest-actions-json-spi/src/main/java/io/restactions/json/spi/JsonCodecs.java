package io.restactions.json.spi;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Resolves a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Finds the highest priority codec visible to the given class loader.
     */
    public static Optional<JsonCodec> find(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        ServiceLoader<JsonCodecProvider> loader = ServiceLoader.load(JsonCodecProvider.class, cl);
        return StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(JsonCodecProvider::priority))
                .map(JsonCodecProvider::codec);
    }

    /**
     * Finds a codec using the context class loader.
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = JsonCodecs.class.getClassLoader();
        return find(cl).orElseThrow(() -> new IllegalStateException(
                "No JsonCodecProvider found; add rest-actions-json-jackson to the classpath"));
    }
}
