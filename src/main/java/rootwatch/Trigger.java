package rootwatch;

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A named command registered on a root. We only track that it exists, running it
 * is up to the trigger executor.
 */
public class Trigger {

  private final String name;
  private final List<String> command;

  public Trigger(String name, List<String> command) {
    this.name = Objects.requireNonNull(name, "name");
    this.command = ImmutableList.copyOf(command);
  }

  public String getName() {
    return name;
  }

  public List<String> getCommand() {
    return command;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Trigger)) {
      return false;
    }
    Trigger other = (Trigger) o;
    return name.equals(other.name) && command.equals(other.command);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, command);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("command", command).toString();
  }
}
