package rootwatch;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Per-root configuration, read once when the root is first watched from a
 * {@link #fileName} JSON file in the root directory.
 */
public class RootConfig {

  public static final String fileName = ".rootwatchconfig";
  private static final Logger log = LoggerFactory.getLogger(RootConfig.class);
  private static final Gson gson = new Gson();
  private final Duration idleReapAge;

  /** The file's shape; a missing key stays null so we can fall back to the daemon default. */
  private static class Json {
    @SerializedName("idle_reap_age_seconds")
    Long idleReapAgeSeconds;
  }

  public static RootConfig of(Duration idleReapAge) {
    return new RootConfig(idleReapAge);
  }

  /**
   * Reads {@code root/.rootwatchconfig}, using {@code daemon}'s values for anything
   * the file doesn't set. An unreadable or invalid file is logged and ignored, so a
   * typo in one root's config never prevents watching it.
   */
  public static RootConfig load(Path root, DaemonConfig daemon) {
    Duration age = daemon.getDefaultIdleReapAge();
    File file = root.resolve(fileName).toFile();
    if (!file.isFile()) {
      return new RootConfig(age);
    }
    try {
      Json json = gson.fromJson(FileUtils.readFileToString(file, UTF_8), Json.class);
      if (json != null && json.idleReapAgeSeconds != null) {
        if (json.idleReapAgeSeconds < 0) {
          log.warn("Ignoring negative idle_reap_age_seconds {} in {}", json.idleReapAgeSeconds, file);
        } else {
          age = Duration.ofSeconds(json.idleReapAgeSeconds);
        }
      }
    } catch (IOException | JsonParseException e) {
      log.warn("Could not read " + file + ", using daemon defaults", e);
    }
    return new RootConfig(age);
  }

  private RootConfig(Duration idleReapAge) {
    this.idleReapAge = idleReapAge;
  }

  public Duration getIdleReapAge() {
    return idleReapAge;
  }

  public boolean isReapEnabled() {
    return !idleReapAge.isZero();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("idleReapAge", idleReapAge).toString();
  }
}
