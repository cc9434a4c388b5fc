package ai.drivewise.risk.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Output directory checks for file sinks.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Creates {@code dir} when missing and ensures it is a writable directory. Existing files in it are kept;
   * sinks append.
   *
   * @param dir directory to prepare
   * @return absolute, normalized directory
   * @throws IllegalArgumentException if the path is unusable
   */
  public static Path prepareWritableDir(Path dir) {
    if (dir == null) {
      throw new IllegalArgumentException("directory must not be null");
    }
    String raw = dir.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("directory must not contain control characters");
      }
    }
    Path normalized = dir.toAbsolutePath().normalize();
    try {
      Files.createDirectories(normalized);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }
}
