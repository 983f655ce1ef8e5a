/**
 * PriceDock source tree root.
 *
 * <p>Where to start reading:
 *
 * <ul>
 *   <li>{@code io.pricedock.Main} starts the CLI process.</li>
 *   <li>{@code io.pricedock.cli.PriceDockCommand} maps commands onto the runtime.</li>
 *   <li>{@code io.pricedock.runtime.PriceDockRuntime} wires storage, the import pipeline and the supervisor.</li>
 *   <li>{@code io.pricedock.registry.ImportRunRegistry} is the source of truth for import attempts.</li>
 * </ul>
 */
package io.pricedock;
