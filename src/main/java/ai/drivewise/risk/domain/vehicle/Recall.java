package ai.drivewise.risk.domain.vehicle;

import java.util.Objects;

/**
 * Safety recall campaign affecting a vehicle. Text fields are empty, never {@code null}, when the upstream omits
 * them.
 *
 * @param campaignNumber NHTSA campaign number
 * @param reportReceivedDate date the manufacturer report was received, as reported upstream
 * @param component affected component
 * @param summary defect summary
 * @param consequence consequence of the defect
 * @param remedy announced remedy
 * @param manufacturer reporting manufacturer
 * @since 0.1.0
 */
public record Recall(
    String campaignNumber,
    String reportReceivedDate,
    String component,
    String summary,
    String consequence,
    String remedy,
    String manufacturer) {

  public Recall {
    campaignNumber = Objects.requireNonNullElse(campaignNumber, "");
    reportReceivedDate = Objects.requireNonNullElse(reportReceivedDate, "");
    component = Objects.requireNonNullElse(component, "");
    summary = Objects.requireNonNullElse(summary, "");
    consequence = Objects.requireNonNullElse(consequence, "");
    remedy = Objects.requireNonNullElse(remedy, "");
    manufacturer = Objects.requireNonNullElse(manufacturer, "");
  }
}
