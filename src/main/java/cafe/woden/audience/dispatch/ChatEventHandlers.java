package cafe.woden.audience.dispatch;

import cafe.woden.audience.channel.Channel;
import cafe.woden.audience.channel.ChannelNames;
import cafe.woden.audience.channel.ChannelRegistry;
import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.config.ExecutorConfig;
import cafe.woden.audience.directory.DirectoryLookupService;
import cafe.woden.audience.directory.FollowerPipeline;
import cafe.woden.audience.directory.LookupKind;
import cafe.woden.audience.irc.ChatConnection;
import cafe.woden.audience.irc.IrcCommands;
import cafe.woden.audience.irc.IrcLine;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** The command handlers wired into {@link ChatEventDispatcher}. */
@Component
public class ChatEventHandlers {
  private static final Logger log = LoggerFactory.getLogger(ChatEventHandlers.class);

  private static final String NAME_PREFIXES = "@+%&~";

  private final ChatConnection connection;
  private final ChannelRegistry registry;
  private final DirectoryLookupService lookups;
  private final FollowerPipeline followers;
  private final AudienceProperties.Chat settings;
  private final Scheduler joinWindowScheduler;

  public ChatEventHandlers(
      ChatConnection connection,
      ChannelRegistry registry,
      DirectoryLookupService lookups,
      FollowerPipeline followers,
      AudienceProperties props,
      @Qualifier(ExecutorConfig.JOIN_WINDOW_RX_SCHEDULER) Scheduler joinWindowScheduler) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.lookups = Objects.requireNonNull(lookups, "lookups");
    this.followers = Objects.requireNonNull(followers, "followers");
    this.settings = Objects.requireNonNull(props, "props").chat();
    this.joinWindowScheduler = Objects.requireNonNull(joinWindowScheduler, "joinWindowScheduler");
  }

  /** 001: {@code <assigned-name> :Welcome...}. */
  void onWelcome(String origin, List<String> params) {
    String assigned = first(params);
    if (assigned == null) {
      log.warn("Welcome without an assigned name");
      return;
    }
    connection.onWelcome(assigned);
  }

  void onPing(String origin, List<String> params) {
    String token = first(params);
    connection.sendImmediate(token == null ? IrcCommands.PONG : IrcCommands.PONG + " :" + token);
  }

  /** Authenticated: flush whatever was sent while offline, then re-join everything tracked. */
  void onGlobalUserState(String origin, List<String> params) {
    connection.onAuthenticated();
    List<String> tracked = registry.names();
    for (String name : tracked) connection.join(name);
    if (!tracked.isEmpty()) log.info("Re-joined {} tracked channel(s)", tracked.size());
  }

  void onJoin(String origin, List<String> params) {
    String channel = ChannelNames.normalize(first(params));
    String login = IrcLine.loginOf(origin);
    if (channel.isEmpty() || login == null) return;

    if (connection.isSelf(login)) {
      registry.onSelfJoin(channel);
      log.info("[{}] joined", channel);
      return;
    }

    Optional<Channel> tracked = registry.find(channel);
    if (tracked.isEmpty()) return;
    Channel ch = tracked.get();
    ch.addAudience(login);
    if (ch.offerJoinWindow(login)) {
      Completable.timer(settings.joinDebounceMs(), TimeUnit.MILLISECONDS, joinWindowScheduler)
          .subscribe(
              () -> flushJoinWindow(ch),
              err -> log.warn("[{}] join window flush failed", ch.name(), err));
    }
  }

  private void flushJoinWindow(Channel ch) {
    List<String> batch = ch.drainJoinWindow();
    if (batch.isEmpty()) return;
    log.debug("[{}] looking up {} recent joiner(s)", ch.name(), batch.size());
    lookups.lookup(batch, LookupKind.LOGIN);
  }

  void onPart(String origin, List<String> params) {
    String channel = ChannelNames.normalize(first(params));
    String login = IrcLine.loginOf(origin);
    if (channel.isEmpty() || login == null) return;

    if (connection.isSelf(login)) {
      registry.onSelfPart(channel);
      log.info("[{}] left", channel);
      return;
    }
    registry.find(channel).ifPresent(ch -> ch.removeAudience(login));
  }

  /** {@code PRIVMSG <channel> :<text>}; only the news command is acted on. */
  void onPrivmsg(String origin, List<String> params) {
    if (params == null || params.size() < 2) return;
    String sender = IrcLine.loginOf(origin);
    if (sender == null || connection.isSelf(sender)) return;

    String text = newsText(params.get(1), settings.commandPrefix());
    if (text == null) return;

    Optional<Channel> tracked = registry.find(params.get(0));
    if (tracked.isEmpty()) return;
    Channel ch = tracked.get();
    ch.pushNews(settings.commandPrefix() + " " + sender + ": " + text);
    connection.say(ch.name(), String.format(Locale.ROOT, settings.acknowledgement(), sender));
    log.info("[{}] news from {}", ch.name(), sender);
  }

  /** 353: {@code <me> <symbol> <channel> :<name> <name> ...}. */
  void onNamesReply(String origin, List<String> params) {
    if (params == null || params.size() < 2) return;
    String channel = null;
    for (int i = 0; i < params.size() - 1; i++) {
      if (params.get(i).startsWith("#")) {
        channel = params.get(i);
        break;
      }
    }
    if (channel == null) return;

    List<String> logins = new ArrayList<>();
    for (String name : params.get(params.size() - 1).trim().split("\\s+")) {
      String login = stripNamePrefixes(name);
      if (!login.isEmpty()) logins.add(login);
    }
    registry.find(channel).ifPresent(ch -> ch.addAudience(logins));
  }

  /** 366: {@code <me> <channel> :End of /NAMES list}. */
  void onEndOfNames(String origin, List<String> params) {
    if (params == null || params.size() < 2) return;
    Optional<Channel> tracked = registry.find(params.get(1));
    if (tracked.isEmpty()) return;
    Channel ch = tracked.get();
    ch.markConnected();

    List<String> audience = ch.audienceSnapshot();
    log.info("[{}] connected with {} in chat", ch.name(), audience.size());
    lookups.lookup(audience, LookupKind.LOGIN);

    String owner = ChannelNames.ownerLogin(ch.name());
    lookups
        .resolveLogin(owner)
        .thenAccept(
            record -> {
              if (record.isPresent()) {
                followers.start(ch, record.get());
              } else {
                log.warn("[{}] owner {} not found in directory; no followers", ch.name(), owner);
              }
            });
  }

  static String newsText(String message, String prefix) {
    if (message == null || prefix == null || prefix.isEmpty()) return null;
    String m = message.strip();
    if (!m.regionMatches(true, 0, prefix, 0, prefix.length())) return null;
    String rest = m.substring(prefix.length());
    if (rest.isEmpty() || !Character.isWhitespace(rest.charAt(0))) return null;
    rest = rest.strip();
    return rest.isEmpty() ? null : rest;
  }

  private static String stripNamePrefixes(String name) {
    int i = 0;
    while (i < name.length() && NAME_PREFIXES.indexOf(name.charAt(i)) >= 0) i++;
    return name.substring(i).toLowerCase(Locale.ROOT);
  }

  private static String first(List<String> params) {
    if (params == null || params.isEmpty()) return null;
    String p = params.get(0);
    return (p == null || p.isBlank()) ? null : p.trim();
  }
}
