package cafe.woden.audience.channel;

import cafe.woden.audience.config.AudienceProperties;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Tracked channels keyed by normalized name. */
@Component
public class ChannelRegistry {
  private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

  private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
  private final int newsCapacity;

  @Autowired
  public ChannelRegistry(AudienceProperties props) {
    this(Objects.requireNonNull(props, "props").chat().maxNewsEntryCount());
  }

  public ChannelRegistry(int newsCapacity) {
    this.newsCapacity = newsCapacity;
  }

  public Optional<Channel> find(String name) {
    String key = ChannelNames.normalize(name);
    if (key.isEmpty()) return Optional.empty();
    return Optional.ofNullable(channels.get(key));
  }

  /**
   * Own join: creates the channel if it is new, then resets it to {@code CONNECTING} with an empty
   * audience either way.
   */
  public Channel onSelfJoin(String name) {
    String key = ChannelNames.normalize(name);
    if (key.isEmpty()) throw new IllegalArgumentException("channel name is blank");
    Channel channel =
        channels.computeIfAbsent(
            key,
            k -> {
              log.info("Tracking channel {}", k);
              return new Channel(k, newsCapacity);
            });
    channel.resetForJoin();
    return channel;
  }

  /** Own part: the channel is forgotten entirely. */
  public Optional<Channel> onSelfPart(String name) {
    String key = ChannelNames.normalize(name);
    if (key.isEmpty()) return Optional.empty();
    Channel removed = channels.remove(key);
    if (removed != null) log.info("Stopped tracking channel {}", key);
    return Optional.ofNullable(removed);
  }

  public List<String> names() {
    return List.copyOf(channels.keySet());
  }

  public int size() {
    return channels.size();
  }
}
