/**
 * <strong>Purpose:</strong> Immutable value types and pure services of the DriveWise risk engine.
 * <p><strong>Layout:</strong> {@code geo} (coordinates and grid sampling), {@code traffic} (flow samples and
 * incidents), {@code vehicle} (safety records and rating impact), {@code risk} (fusion).</p>
 * <p><strong>Concurrency:</strong> Records are immutable; services hold no mutable state.</p>
 * <p><strong>Dependencies:</strong> JDK only; no adapters or ports are referenced from here.</p>
 *
 * @since 0.1.0
 */
package ai.drivewise.risk.domain;
