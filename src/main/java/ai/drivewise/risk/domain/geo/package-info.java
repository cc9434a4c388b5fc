/**
 * Geographic value types and the grid sampler that turns a region centre into sweep points.
 * <p><strong>Concurrency:</strong> Immutable values and stateless functions.</p>
 *
 * @since 0.1.0
 */
package ai.drivewise.risk.domain.geo;
