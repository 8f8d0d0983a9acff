package rootwatch;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import com.google.common.base.MoreObjects;

/** A point-in-time copy of a root's lifecycle state and holder counters. */
public class RootStatus {

  private final Path path;
  private final RootState state;
  private final Instant createdAt;
  private final Instant lastActivityAt;
  private final Duration idleReapAge;
  private final int triggerCount;
  private final int subscriptionCount;
  private final int inFlightCount;

  RootStatus(
    Path path,
    RootState state,
    Instant createdAt,
    Instant lastActivityAt,
    Duration idleReapAge,
    int triggerCount,
    int subscriptionCount,
    int inFlightCount) {
    this.path = path;
    this.state = state;
    this.createdAt = createdAt;
    this.lastActivityAt = lastActivityAt;
    this.idleReapAge = idleReapAge;
    this.triggerCount = triggerCount;
    this.subscriptionCount = subscriptionCount;
    this.inFlightCount = inFlightCount;
  }

  public Path getPath() {
    return path;
  }

  public RootState getState() {
    return state;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }

  public Duration getIdleReapAge() {
    return idleReapAge;
  }

  public int getTriggerCount() {
    return triggerCount;
  }

  public int getSubscriptionCount() {
    return subscriptionCount;
  }

  public int getInFlightCount() {
    return inFlightCount;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("path", path)
      .add("state", state)
      .add("lastActivityAt", lastActivityAt)
      .add("idleReapAge", idleReapAge)
      .add("triggers", triggerCount)
      .add("subscriptions", subscriptionCount)
      .add("inFlight", inFlightCount)
      .toString();
  }
}
