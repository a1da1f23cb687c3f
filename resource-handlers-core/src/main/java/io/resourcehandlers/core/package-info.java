/**
 * Local resource handlers and handler assembly.
 *
 * <p>Provides handlers for {@code file:} and {@code data:} URLs, and
 * {@link io.resourcehandlers.core.ResourceHandlers} to compose them with handlers from other
 * modules. No network access happens here; remote handlers plug in through the SPI.
 */
package io.resourcehandlers.core;
