package cafe.woden.audience.channel;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.Entity;
import org.jmolecules.ddd.annotation.Identity;

/**
 * Per-channel membership, follower and news state.
 *
 * <p>Audience and followers are insertion-ordered sets; the first insertion fixes an entry's
 * position. The news queue holds at most {@link #newsCapacity()} entries and evicts the oldest
 * first. Every method locks this instance, so readers always see a consistent view.
 */
@Entity
public final class Channel {

  @Identity private final String name;
  private final int newsCapacity;

  private ChannelStatus status = ChannelStatus.CONNECTING;
  private final LinkedHashSet<String> audience = new LinkedHashSet<>();
  private final LinkedHashSet<String> followers = new LinkedHashSet<>();
  private final LinkedHashSet<String> joinWindow = new LinkedHashSet<>();
  private final Deque<String> news = new ArrayDeque<>();

  public Channel(String name, int newsCapacity) {
    String n = ChannelNames.normalize(name);
    if (n.isEmpty()) throw new IllegalArgumentException("channel name is blank");
    if (newsCapacity <= 0) throw new IllegalArgumentException("newsCapacity must be > 0");
    this.name = n;
    this.newsCapacity = newsCapacity;
  }

  public String name() {
    return name;
  }

  public int newsCapacity() {
    return newsCapacity;
  }

  public synchronized ChannelStatus status() {
    return status;
  }

  public synchronized void markConnected() {
    status = ChannelStatus.CONNECTED;
  }

  /** Own join observed: back to {@code CONNECTING} with an empty audience. Followers survive. */
  public synchronized void resetForJoin() {
    status = ChannelStatus.CONNECTING;
    audience.clear();
  }

  /** @return true when the login was not already present */
  public synchronized boolean addAudience(String login) {
    String l = key(login);
    return !l.isEmpty() && audience.add(l);
  }

  public synchronized int addAudience(Collection<String> logins) {
    if (logins == null) return 0;
    int added = 0;
    for (String login : logins) {
      String l = key(login);
      if (!l.isEmpty() && audience.add(l)) added++;
    }
    return added;
  }

  public synchronized boolean removeAudience(String login) {
    return audience.remove(key(login));
  }

  public synchronized List<String> audienceSnapshot() {
    return List.copyOf(audience);
  }

  public synchronized int addFollowers(Collection<String> ids) {
    if (ids == null) return 0;
    int added = 0;
    for (String id : ids) {
      String i = Objects.toString(id, "").trim();
      if (!i.isEmpty() && followers.add(i)) added++;
    }
    return added;
  }

  public synchronized boolean isFollower(String id) {
    return id != null && followers.contains(id.trim());
  }

  public synchronized int followerCount() {
    return followers.size();
  }

  public synchronized List<String> followersSnapshot() {
    return List.copyOf(followers);
  }

  /**
   * Queues a login for the next batched lookup.
   *
   * @return true when the window went from empty to non-empty, i.e. the caller should schedule
   *     the debounced lookup
   */
  public synchronized boolean offerJoinWindow(String login) {
    String l = key(login);
    if (l.isEmpty()) return false;
    boolean wasEmpty = joinWindow.isEmpty();
    return joinWindow.add(l) && wasEmpty;
  }

  /** Takes the whole window as one batch and leaves it empty. */
  public synchronized List<String> drainJoinWindow() {
    List<String> batch = List.copyOf(joinWindow);
    joinWindow.clear();
    return batch;
  }

  public synchronized void pushNews(String entry) {
    if (entry == null) return;
    news.addLast(entry);
    while (news.size() > newsCapacity) {
      news.pollFirst();
    }
  }

  public synchronized List<String> newsSnapshot() {
    return List.copyOf(news);
  }

  /** Returns the queued news oldest-first and empties the queue. */
  public synchronized List<String> drainNews() {
    List<String> out = List.copyOf(news);
    news.clear();
    return out;
  }

  private static String key(String login) {
    return Objects.toString(login, "").trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "Channel[" + name + "]";
  }
}
