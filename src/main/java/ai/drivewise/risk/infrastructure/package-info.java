/**
 * Infrastructure adapters implementing the application ports: upstream sources, sinks, cache, metrics, clock
 * and executors.
 * <p><strong>Concurrency:</strong> Adapters document their own guarantees; sources and sinks are shared by
 * poller worker threads.</p>
 */
package ai.drivewise.risk.infrastructure;
