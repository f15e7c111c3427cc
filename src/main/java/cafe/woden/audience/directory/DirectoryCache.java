package cafe.woden.audience.directory;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Read-through user cache keyed by login and by id.
 *
 * <p>Both maps always reference the same {@link UserRecord}; a record is written to both under one
 * lock. Entries never expire and are only replaced by a newer lookup.
 */
@Component
public class DirectoryCache {

  private final ConcurrentHashMap<String, UserRecord> byLogin = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, UserRecord> byId = new ConcurrentHashMap<>();
  private final Object writeLock = new Object();

  public void put(UserRecord record) {
    if (record == null) return;
    synchronized (writeLock) {
      UserRecord previous = byId.put(record.id(), record);
      // A renamed user must not stay reachable under the old login.
      if (previous != null && !previous.login().equals(record.login())) {
        byLogin.remove(previous.login(), previous);
      }
      byLogin.put(record.login(), record);
    }
  }

  public void putAll(Collection<UserRecord> records) {
    if (records == null) return;
    for (UserRecord r : records) put(r);
  }

  public Optional<UserRecord> byLogin(String login) {
    String key = LookupKind.LOGIN.normalize(login);
    if (key.isEmpty()) return Optional.empty();
    return Optional.ofNullable(byLogin.get(key));
  }

  public Optional<UserRecord> byId(String id) {
    String key = LookupKind.ID.normalize(id);
    if (key.isEmpty()) return Optional.empty();
    return Optional.ofNullable(byId.get(key));
  }

  public boolean contains(LookupKind kind, String key) {
    return kind == LookupKind.LOGIN ? byLogin(key).isPresent() : byId(key).isPresent();
  }

  public int size() {
    return byId.size();
  }
}
