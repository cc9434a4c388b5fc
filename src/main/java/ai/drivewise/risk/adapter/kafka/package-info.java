/**
 * Kafka adapters for the persistence and model-refresh ports.
 * <p><strong>Role:</strong> Outbound adapters selected with {@code sink=kafka}.</p>
 * <p><strong>Observability:</strong> Kafka client metrics; send failures are logged and surfaced to the job.</p>
 */
package ai.drivewise.risk.adapter.kafka;
