package ai.drivewise.risk.infrastructure.source.nhtsa;

import static org.junit.jupiter.api.Assertions.*;

import ai.drivewise.risk.domain.vehicle.Recall;
import ai.drivewise.risk.domain.vehicle.VehicleQuery;
import ai.drivewise.risk.testutil.FakeJsonHttpClient;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;

class NhtsaRecallClientTest {
  private final FakeJsonHttpClient http = new FakeJsonHttpClient();
  private final NhtsaRecallClient client =
      new NhtsaRecallClient(http, URI.create("https://api.nhtsa.gov/recalls"));

  @Test
  void mapsEveryCampaignField() throws Exception {
    http.respond("/recallsByVehicle", """
        {"Count": 2, "results": [
          {"Manufacturer": "Honda (American Honda Motor Co.)", "NHTSACampaignNumber": "20V314000",
           "ReportReceivedDate": "29/05/2020", "Component": "FUEL SYSTEM, GASOLINE",
           "Summary": "Fuel pump may fail.", "Consequence": "Engine stall.", "Remedy": "Replace pump."},
          {"NHTSACampaignNumber": "21V215000", "Component": null}]}
        """);

    List<Recall> recalls = client.byVehicle(VehicleQuery.of(2020, "Honda", "Civic"));

    assertEquals(2, recalls.size());
    Recall first = recalls.get(0);
    assertEquals("20V314000", first.campaignNumber());
    assertEquals("29/05/2020", first.reportReceivedDate());
    assertEquals("FUEL SYSTEM, GASOLINE", first.component());
    assertEquals("Fuel pump may fail.", first.summary());
    assertEquals("Engine stall.", first.consequence());
    assertEquals("Replace pump.", first.remedy());
    assertEquals("Honda (American Honda Motor Co.)", first.manufacturer());
    assertEquals("", recalls.get(1).component());
  }

  @Test
  void requestCarriesMakeModelAndYear() {
    URI uri = client.recallsUri(VehicleQuery.of(2019, "Land Rover", "Range Rover"));

    assertEquals("/recalls/recallsByVehicle", uri.getPath());
    assertEquals("make=Land+Rover&model=Range+Rover&modelYear=2019", uri.getRawQuery());
  }

  @Test
  void missingResultsMeansNoRecalls() throws Exception {
    http.respond("/recallsByVehicle", "{\"Count\": 0, \"Message\": \"Results returned successfully\"}");

    assertTrue(client.byVehicle(VehicleQuery.of(2020, "Honda", "Civic")).isEmpty());
  }

  @Test
  void transportFailurePropagates() {
    http.fail("/recallsByVehicle", new IOException("HTTP 500"));

    assertThrows(IOException.class, () -> client.byVehicle(VehicleQuery.of(2020, "Honda", "Civic")));
  }
}
