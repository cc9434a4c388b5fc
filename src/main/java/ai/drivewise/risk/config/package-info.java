/**
 * Configuration loading, precedence rules and the composition root that wires the engine's use cases to adapters.
 */
package ai.drivewise.risk.config;
