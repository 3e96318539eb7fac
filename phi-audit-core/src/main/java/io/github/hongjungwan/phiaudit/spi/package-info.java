/**
 * Service Provider Interfaces (SPI) for the PHI Audit SDK.
 *
 * <p>Implement these interfaces to plug in a destination:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.phiaudit.spi.LogSink} - accepts one structured log record</li>
 *   <li>{@link io.github.hongjungwan.phiaudit.spi.AuditStore} - durably appends one audit entry
 *       and allows ordered iteration</li>
 * </ul>
 *
 * <h2>Built-in Implementations:</h2>
 * <p>Sinks live in {@code core.sink} (SLF4J, stream, Kafka, async and circuit-breaker decorators).
 * Stores live in {@code core.audit} (in-memory and JSON-lines file).</p>
 */
package io.github.hongjungwan.phiaudit.spi;
