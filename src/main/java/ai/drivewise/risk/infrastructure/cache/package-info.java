/**
 * In-memory latest-signal cache feeding on-demand scoring.
 */
package ai.drivewise.risk.infrastructure.cache;
