package ai.drivewise.risk.infrastructure.persistence;

import ai.drivewise.risk.application.port.PersistencePort;
import ai.drivewise.risk.application.port.SinkException;
import ai.drivewise.risk.domain.risk.RiskScore;
import ai.drivewise.risk.domain.traffic.Incident;
import ai.drivewise.risk.domain.traffic.TrafficSample;
import ai.drivewise.risk.domain.vehicle.VehicleSafetyRecord;
import ai.drivewise.risk.validation.Paths;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PersistencePort} appending one JSON document per line to a file per record type.
 * <p><strong>Files:</strong> {@code traffic.ndjson}, {@code incidents.ndjson}, {@code vehicles.ndjson} and
 * {@code risk-scores.ndjson} under the configured directory. Files are opened lazily in append mode.</p>
 * <p><strong>Thread-safety:</strong> All methods are synchronized; sweeps and on-demand scoring may share one
 * instance.</p>
 * <p><strong>Durability:</strong> {@link #flush()} forces written data to the device.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonPersistenceAdapter implements PersistencePort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonPersistenceAdapter.class);

  enum Stream {
    TRAFFIC("traffic.ndjson"),
    INCIDENTS("incidents.ndjson"),
    VEHICLES("vehicles.ndjson"),
    RISK_SCORES("risk-scores.ndjson");

    private final String fileName;

    Stream(String fileName) {
      this.fileName = fileName;
    }

    String fileName() {
      return fileName;
    }
  }

  private final Path directory;
  private final RecordJsonWriter json = new RecordJsonWriter();
  private final Map<Stream, Output> outputs = new EnumMap<>(Stream.class);
  private boolean closed;

  /**
   * Creates the sink, creating {@code directory} if needed.
   *
   * @param directory output directory
   * @throws IllegalArgumentException if the directory cannot be created or written
   */
  public NdjsonPersistenceAdapter(Path directory) {
    this.directory = Paths.prepareWritableDir(Objects.requireNonNull(directory, "directory"));
    log.info("NDJSON sink writing to {}", this.directory);
  }

  /**
   * Directory receiving the files.
   *
   * @return absolute output directory
   */
  public Path directory() {
    return directory;
  }

  @Override
  public synchronized void persistTraffic(List<TrafficSample> samples) throws SinkException {
    append(Stream.TRAFFIC, samples, json::traffic);
  }

  @Override
  public synchronized void persistIncidents(List<Incident> incidents) throws SinkException {
    append(Stream.INCIDENTS, incidents, json::incident);
  }

  @Override
  public synchronized void persistVehicles(List<VehicleSafetyRecord> records) throws SinkException {
    append(Stream.VEHICLES, records, json::vehicle);
  }

  @Override
  public synchronized void persistRiskScores(List<RiskScore> scores) throws SinkException {
    append(Stream.RISK_SCORES, scores, json::riskScore);
  }

  @Override
  public synchronized void flush() throws SinkException {
    for (Map.Entry<Stream, Output> entry : outputs.entrySet()) {
      try {
        entry.getValue().flush();
      } catch (IOException ex) {
        throw new SinkException("failed to flush " + entry.getKey().fileName(), ex);
      }
    }
  }

  @Override
  public synchronized void close() throws SinkException {
    if (closed) {
      return;
    }
    closed = true;
    SinkException failure = null;
    for (Map.Entry<Stream, Output> entry : outputs.entrySet()) {
      try {
        entry.getValue().close();
      } catch (IOException ex) {
        SinkException wrapped = new SinkException("failed to close " + entry.getKey().fileName(), ex);
        if (failure == null) {
          failure = wrapped;
        } else {
          failure.addSuppressed(wrapped);
        }
      }
    }
    outputs.clear();
    if (failure != null) {
      throw failure;
    }
  }

  private <T> void append(Stream stream, List<T> records, Function<T, byte[]> encoder) throws SinkException {
    if (closed) {
      throw new SinkException("NDJSON sink is closed");
    }
    if (records == null || records.isEmpty()) {
      return;
    }
    try {
      Output output = outputs.get(stream);
      if (output == null) {
        output = new Output(directory.resolve(stream.fileName()));
        outputs.put(stream, output);
      }
      for (T record : records) {
        output.writeLine(encoder.apply(record));
      }
    } catch (IOException ex) {
      throw new SinkException("failed to append to " + stream.fileName(), ex);
    }
  }

  private static final class Output {
    private final FileChannel channel;
    private final OutputStream out;

    private Output(Path file) throws IOException {
      this.channel = FileChannel.open(
          file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
      this.out = new BufferedOutputStream(Channels.newOutputStream(channel), 64 * 1024);
    }

    void writeLine(byte[] document) throws IOException {
      out.write(document);
      out.write('\n');
    }

    void flush() throws IOException {
      out.flush();
      channel.force(false);
    }

    void close() throws IOException {
      try {
        out.flush();
      } finally {
        out.close();
      }
    }
  }
}
