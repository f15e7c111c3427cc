package cafe.woden.audience.app;

import cafe.woden.audience.app.api.AudienceCommandPort;
import cafe.woden.audience.app.api.AudienceEntry;
import cafe.woden.audience.app.api.AudienceQueryPort;
import cafe.woden.audience.channel.Channel;
import cafe.woden.audience.channel.ChannelNames;
import cafe.woden.audience.channel.ChannelRegistry;
import cafe.woden.audience.channel.ChannelStatus;
import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.directory.DirectoryCache;
import cafe.woden.audience.directory.UserRecord;
import cafe.woden.audience.irc.ChatConnection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Facade over the connection, the channel registry and the directory cache. */
@Service
public class AudienceService implements AudienceQueryPort, AudienceCommandPort {
  private static final Logger log = LoggerFactory.getLogger(AudienceService.class);

  private final ChatConnection connection;
  private final ChannelRegistry registry;
  private final DirectoryCache directory;
  private final AudienceProperties.Snapshot snapshotSettings;

  public AudienceService(
      ChatConnection connection,
      ChannelRegistry registry,
      DirectoryCache directory,
      AudienceProperties props) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.snapshotSettings = Objects.requireNonNull(props, "props").snapshot();
  }

  @Override
  public void joinChannel(String channel) {
    connection.join(requireName(channel));
  }

  @Override
  public void leaveChannel(String channel) {
    connection.part(requireName(channel));
  }

  @Override
  public List<String> drainMessages(String channel) {
    return registry.find(channel).map(Channel::drainNews).orElse(List.of());
  }

  @Override
  public List<AudienceEntry> getAudienceSnapshot(String channel) {
    long deadline = System.currentTimeMillis() + snapshotSettings.waitTimeoutMs();
    List<AudienceEntry> view = currentAudience(channel);
    while (view.isEmpty() && registry.find(channel).isPresent()) {
      long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0) {
        log.debug(
            "Audience of {} still empty after {}ms", channel, snapshotSettings.waitTimeoutMs());
        break;
      }
      try {
        Thread.sleep(Math.min(remaining, snapshotSettings.pollIntervalMs()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      view = currentAudience(channel);
    }
    return view;
  }

  @Override
  public List<AudienceEntry> currentAudience(String channel) {
    Optional<Channel> tracked = registry.find(channel);
    if (tracked.isEmpty()) return List.of();
    Channel ch = tracked.get();
    List<String> audience = ch.audienceSnapshot();
    List<String> followerIds = ch.followersSnapshot();
    Set<String> followers = new HashSet<>(followerIds);

    Map<String, AudienceEntry> byLogin = new LinkedHashMap<>();
    for (String login : audience) {
      Optional<UserRecord> record = directory.byLogin(login);
      if (record.isEmpty()) continue;
      UserRecord r = record.get();
      byLogin.put(
          r.login(),
          new AudienceEntry(r.login(), r.displayName(), true, followers.contains(r.id())));
    }
    for (String id : followerIds) {
      Optional<UserRecord> record = directory.byId(id);
      if (record.isEmpty()) continue;
      UserRecord r = record.get();
      byLogin.putIfAbsent(r.login(), new AudienceEntry(r.login(), r.displayName(), false, true));
    }
    return List.copyOf(byLogin.values());
  }

  @Override
  public Optional<ChannelStatus> channelStatus(String channel) {
    return registry.find(channel).map(Channel::status);
  }

  @Override
  public List<String> trackedChannels() {
    return registry.names();
  }

  private static String requireName(String channel) {
    String name = ChannelNames.normalize(channel);
    if (name.isEmpty()) throw new IllegalArgumentException("channel name is blank");
    return name;
  }
}
