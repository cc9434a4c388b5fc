/**
 * Model-refresh adapters without an external transport.
 */
package ai.drivewise.risk.infrastructure.refresh;
