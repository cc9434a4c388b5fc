/**
 * Clock adapters.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ai.drivewise.risk.infrastructure.time;
