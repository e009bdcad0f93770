/**
 * JSON abstraction used by the REST action engine.
 *
 * <p>The engine only sees {@link io.restactions.json.spi.JsonNode} trees and the
 * {@link io.restactions.json.spi.JsonCodec} that produces them. Library bindings
 * live in other modules and are discovered with {@link java.util.ServiceLoader}.
 */
package io.restactions.json.spi;
