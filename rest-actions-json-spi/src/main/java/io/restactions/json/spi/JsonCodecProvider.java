package io.restactions.json.spi;

/**
 * Service provider interface for {@link JsonCodec} implementations.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} using
 * {@code META-INF/services/io.restactions.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Creates a codec instance.
     */
    JsonCodec codec();

    /**
     * Higher wins when several providers are on the classpath.
     */
    default int priority() {
        return 0;
    }
}
