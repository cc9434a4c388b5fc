package ai.drivewise.risk.infrastructure.source.nhtsa;

import ai.drivewise.risk.domain.vehicle.Recall;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.infrastructure.http.JsonHttpClient;
import ai.drivewise.risk.infrastructure.http.JsonSupport;
import ai.drivewise.risk.infrastructure.source.UrlParts;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the NHTSA {@code recallsByVehicle} endpoint.
 *
 * @since 0.1.0
 */
public final class NhtsaRecallClient {
  private final JsonHttpClient http;
  private final URI baseUrl;

  /**
   * Creates the client.
   *
   * @param http JSON client
   * @param baseUrl recalls API base, e.g. {@code https://api.nhtsa.gov/recalls}
   */
  public NhtsaRecallClient(JsonHttpClient http, URI baseUrl) {
    this.http = Objects.requireNonNull(http, "http");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
  }

  /**
   * Lists the recall campaigns for a make, model and model year.
   *
   * @param query resolved vehicle; the VIN is not used
   * @return campaigns in upstream order; empty when none are reported
   * @throws IOException on transport failure or non-2xx status
   * @throws InterruptedException if interrupted while waiting for the response
   */
  public List<Recall> byVehicle(VehicleQuery query) throws IOException, InterruptedException {
    Objects.requireNonNull(query, "query");
    Object body = http.getJson(recallsUri(query));
    List<Recall> recalls = new ArrayList<>();
    for (Object node : JsonSupport.array(JsonSupport.field(body, "results").orElse(null))) {
      if (node instanceof Map<?, ?>) {
        recalls.add(new Recall(
            text(node, "NHTSACampaignNumber"),
            text(node, "ReportReceivedDate"),
            text(node, "Component"),
            text(node, "Summary"),
            text(node, "Consequence"),
            text(node, "Remedy"),
            text(node, "Manufacturer")));
      }
    }
    return recalls;
  }

  URI recallsUri(VehicleQuery query) {
    Map<String, String> params = UrlParts.params();
    params.put("make", query.make());
    params.put("model", query.model());
    params.put("modelYear", Integer.toString(query.year()));
    return URI.create(baseUrl + "/recallsByVehicle" + UrlParts.query(params));
  }

  private static String text(Object node, String field) {
    return JsonSupport.field(node, field).flatMap(JsonSupport::text).orElse("");
  }
}
