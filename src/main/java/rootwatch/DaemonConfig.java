package rootwatch;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import org.apache.commons.io.FileUtils;

import com.google.common.base.MoreObjects;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Process-wide configuration, fixed when the daemon starts.
 *
 * Loaded from a JSON file like:
 *
 * <pre>
 * { "idle_reap_age_seconds": 432000, "reap_sweep_interval_ms": 1000 }
 * </pre>
 */
public class DaemonConfig {

  public static final Duration defaultSweepInterval = Duration.ofSeconds(1);
  private static final Gson gson = new Gson();

  /** Used for roots whose own config doesn't set an age; 0 disables reaping. */
  @SerializedName("idle_reap_age_seconds")
  private long idleReapAgeSeconds = 0;

  @SerializedName("reap_sweep_interval_ms")
  private long reapSweepIntervalMs = defaultSweepInterval.toMillis();

  public static DaemonConfig defaults() {
    return new DaemonConfig();
  }

  public static DaemonConfig load(Path file) throws IOException {
    String json = FileUtils.readFileToString(file.toFile(), UTF_8);
    DaemonConfig config;
    try {
      config = gson.fromJson(json, DaemonConfig.class);
    } catch (JsonParseException e) {
      throw new IOException("Invalid daemon config " + file + ": " + e.getMessage(), e);
    }
    if (config == null) {
      // an empty file
      return defaults();
    }
    config.validate(file);
    return config;
  }

  private DaemonConfig() {
  }

  public DaemonConfig(long idleReapAgeSeconds, Duration reapSweepInterval) {
    this.idleReapAgeSeconds = idleReapAgeSeconds;
    this.reapSweepIntervalMs = reapSweepInterval.toMillis();
    validate(null);
  }

  public Duration getDefaultIdleReapAge() {
    return Duration.ofSeconds(idleReapAgeSeconds);
  }

  public Duration getReapSweepInterval() {
    return Duration.ofMillis(reapSweepIntervalMs);
  }

  private void validate(Path source) {
    if (idleReapAgeSeconds < 0) {
      throw new IllegalArgumentException("idle_reap_age_seconds must be non-negative" + (source == null ? "" : " in " + source));
    }
    if (reapSweepIntervalMs <= 0) {
      throw new IllegalArgumentException("reap_sweep_interval_ms must be positive" + (source == null ? "" : " in " + source));
    }
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("idleReapAgeSeconds", idleReapAgeSeconds)
      .add("reapSweepIntervalMs", reapSweepIntervalMs)
      .toString();
  }
}
