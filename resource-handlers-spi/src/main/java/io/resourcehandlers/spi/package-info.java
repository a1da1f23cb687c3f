/**
 * Resource resolution SPI.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>The {@link io.resourcehandlers.spi.ResourceUrlHandler} contract and its error type</li>
 *   <li>Small models ({@link io.resourcehandlers.spi.MimeData}, {@link io.resourcehandlers.spi.MimeType})</li>
 *   <li>The scheme guard, the no-op handler and the dispatching handler</li>
 * </ul>
 *
 * <p>Concrete handlers for files and {@code data:} URLs live in {@code resource-handlers-core}.
 */
package io.resourcehandlers.spi;
