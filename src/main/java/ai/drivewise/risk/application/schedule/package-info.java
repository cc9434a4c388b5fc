/**
 * Cadence scheduling for the periodic ingestion jobs.
 */
package ai.drivewise.risk.application.schedule;
