/**
 * NHTSA safety-rating and VIN-decoding adapter.
 */
package ai.drivewise.risk.infrastructure.source.nhtsa;
