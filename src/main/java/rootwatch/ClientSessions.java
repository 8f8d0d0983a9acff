package rootwatch;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;

/**
 * Tracks which subscriptions each connected client holds, so that a disconnect
 * (clean or not) can release all of them.
 *
 * The connection layer is expected to call {@link WatchService#onClientDisconnect(String)}
 * once the client's last request has returned, i.e. never concurrently with a
 * subscribe from that same client.
 */
class ClientSessions {

  private final ConcurrentHashMap<String, Set<Subscription>> byClient = new ConcurrentHashMap<>();

  void add(Subscription subscription) {
    byClient.compute(subscription.getClientId(), (clientId, subscriptions) -> {
      Set<Subscription> result = subscriptions == null ? ConcurrentHashMap.newKeySet() : subscriptions;
      result.add(subscription);
      return result;
    });
  }

  /** @return whether the client still had this subscription; a client's last removal drops its entry */
  boolean remove(Subscription subscription) {
    AtomicBoolean removed = new AtomicBoolean(false);
    byClient.computeIfPresent(subscription.getClientId(), (clientId, subscriptions) -> {
      removed.set(subscriptions.remove(subscription));
      return subscriptions.isEmpty() ? null : subscriptions;
    });
    return removed.get();
  }

  /** Forgets the client, returning whatever subscriptions it still held. */
  Set<Subscription> disconnect(String clientId) {
    Set<Subscription> subscriptions = byClient.remove(clientId);
    return subscriptions == null ? Collections.emptySet() : ImmutableSet.copyOf(subscriptions);
  }

  Set<Subscription> get(String clientId) {
    Set<Subscription> subscriptions = byClient.get(clientId);
    return subscriptions == null ? Collections.emptySet() : ImmutableSet.copyOf(subscriptions);
  }

  @VisibleForTesting
  int clientCount() {
    return byClient.size();
  }

}
