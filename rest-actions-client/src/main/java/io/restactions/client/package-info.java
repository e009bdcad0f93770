/**
 * Client wiring: configuration, HTTP-backed request executors and resource handle creation.
 */
package io.restactions.client;
