/**
 * Upstream data sources. Adapters never throw from their port methods: failures become fallback records or
 * empty results, are logged and are counted.
 */
package ai.drivewise.risk.infrastructure.source;
