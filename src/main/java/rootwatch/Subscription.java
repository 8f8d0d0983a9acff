package rootwatch;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.MoreObjects;

/**
 * A client's live registration for change notifications on a root.
 *
 * Identity is the {@link #getId()}; the same client re-subscribing with the
 * same name gets a new id and replaces the old subscription.
 */
public class Subscription {

  private final long id;
  private final String name;
  private final String clientId;
  private final WatchRoot root;
  private final Map<String, Object> spec;

  Subscription(long id, String name, String clientId, WatchRoot root, Map<String, Object> spec) {
    this.id = id;
    this.name = name;
    this.clientId = clientId;
    this.root = root;
    // client specs are JSON, so values may be null
    this.spec = Collections.unmodifiableMap(new LinkedHashMap<>(spec));
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getClientId() {
    return clientId;
  }

  public Path getRootPath() {
    return root.getPath();
  }

  WatchRoot getRoot() {
    return root;
  }

  public Map<String, Object> getSpec() {
    return spec;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("id", id)
      .add("name", name)
      .add("clientId", clientId)
      .add("root", root.getPath())
      .toString();
  }
}
