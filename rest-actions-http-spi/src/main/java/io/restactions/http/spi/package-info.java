/**
 * Transport boundary of the REST action engine.
 *
 * <p>{@link io.restactions.http.spi.HttpClientAdapter} is the blocking request executor,
 * {@link io.restactions.http.spi.AsyncHttpClientAdapter} the non-blocking one. Both deal
 * in fully buffered requests and responses; they know nothing about actions, unwrapping
 * or error classification. Status codes of 400 and above are ordinary responses here.
 */
package io.restactions.http.spi;
