/**
 * File and no-op persistence sinks plus the shared JSON record encoding.
 */
package ai.drivewise.risk.infrastructure.persistence;
