/**
 * Action dispatch engine: registries of allowed actions, the shared dispatch skeleton,
 * response unwrapping and validation, and error classification.
 *
 * <p>Nothing in this package performs I/O or logs. Transport is supplied through
 * {@link io.restactions.core.RequestExecutor} or {@link io.restactions.core.AsyncRequestExecutor},
 * and every outcome is returned as an {@link io.restactions.core.ActionResult}.
 */
package io.restactions.core;
