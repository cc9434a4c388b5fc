/**
 * Logback helpers and log-safe formatting.
 */
package ai.drivewise.risk.logging;
