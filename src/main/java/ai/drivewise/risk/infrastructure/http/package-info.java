/**
 * Outbound HTTP and JSON parsing for the upstream source adapters.
 */
package ai.drivewise.risk.infrastructure.http;
