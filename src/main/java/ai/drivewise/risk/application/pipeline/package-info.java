/**
 * Use cases run by the scheduler and the CLI: traffic, incident and vehicle sweeps, the full pipeline
 * composite, model refresh and on-demand risk scoring.
 */
package ai.drivewise.risk.application.pipeline;
