/**
 * TomTom traffic flow and incident adapters.
 * <p><strong>Security:</strong> The API key travels as a query parameter and is masked in every log line.</p>
 */
package ai.drivewise.risk.infrastructure.source.tomtom;
