package cafe.woden.audience.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Audience tracker configuration.
 *
 * <p>Example YAML:
 * <pre>
 * audience:
 *   chat:
 *     username: newsbot
 *     oauth-token: oauth:abc123
 *     auto-join: [somechannel]
 *   directory:
 *     client-id: abc123
 * </pre>
 */
@ConfigurationProperties(prefix = "audience")
public record AudienceProperties(Chat chat, Directory directory, Snapshot snapshot) {

  public static final int MAX_KEYS_PER_REQUEST = 100;

  /** Chat endpoint identity and behavior. */
  public record Chat(
      String uri,
      String username,
      String oauthToken,
      String capabilities,
      List<String> autoJoin,
      String commandPrefix,
      String acknowledgement,
      int maxNewsEntryCount,
      long joinDebounceMs,
      int maxBackoffSeconds,
      long connectTimeoutMs,
      long sendTimeoutMs,
      long idleTimeoutMs,
      long heartbeatCheckMs) {
    public Chat {
      if (uri == null || uri.isBlank()) uri = "wss://irc-ws.chat.twitch.tv:443";
      if (username == null) username = "";
      if (oauthToken == null) oauthToken = "";
      if (capabilities == null || capabilities.isBlank()) {
        capabilities = "twitch.tv/membership twitch.tv/commands";
      }
      if (autoJoin == null) autoJoin = List.of();
      if (commandPrefix == null || commandPrefix.isBlank()) commandPrefix = "!news";
      if (acknowledgement == null || acknowledgement.isBlank()) {
        acknowledgement = "@%s thanks, your news was queued";
      }
      if (maxNewsEntryCount <= 0) maxNewsEntryCount = 20;
      if (joinDebounceMs <= 0) joinDebounceMs = 1_000;
      if (maxBackoffSeconds <= 0) maxBackoffSeconds = 30;
      if (connectTimeoutMs <= 0) connectTimeoutMs = 15_000;
      if (sendTimeoutMs <= 0) sendTimeoutMs = 10_000;
      if (idleTimeoutMs <= 0) idleTimeoutMs = 360_000;
      if (heartbeatCheckMs <= 0) heartbeatCheckMs = 15_000;
    }
  }

  /** Companion REST API used for directory lookups and follower pagination. */
  public record Directory(
      String baseUrl,
      String clientId,
      String bearerToken,
      int chunkSize,
      long chunkDelayMs,
      long rateLimitRetryMs,
      long requestTimeoutMs,
      int followerPageSize,
      long followerPageDelayMs,
      long followerLookupDelayMs,
      int followerCap) {
    public Directory {
      if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.twitch.tv/helix";
      while (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
      if (clientId == null) clientId = "";
      if (bearerToken == null) bearerToken = "";
      if (chunkSize <= 0 || chunkSize > MAX_KEYS_PER_REQUEST) chunkSize = MAX_KEYS_PER_REQUEST;
      if (chunkDelayMs <= 0) chunkDelayMs = 1_000;
      if (rateLimitRetryMs <= 0) rateLimitRetryMs = 10_000;
      if (requestTimeoutMs <= 0) requestTimeoutMs = 15_000;
      if (followerPageSize <= 0 || followerPageSize > MAX_KEYS_PER_REQUEST) {
        followerPageSize = MAX_KEYS_PER_REQUEST;
      }
      if (followerPageDelayMs <= 0) followerPageDelayMs = 1_000;
      if (followerLookupDelayMs <= 0) followerLookupDelayMs = 1_000;
      if (followerCap <= 0) followerCap = 1_000;
    }
  }

  /** Blocking facade read behavior. */
  public record Snapshot(long waitTimeoutMs, long pollIntervalMs) {
    public Snapshot {
      if (waitTimeoutMs <= 0) waitTimeoutMs = 10_000;
      if (pollIntervalMs <= 0) pollIntervalMs = 250;
    }
  }

  public AudienceProperties {
    if (chat == null) {
      chat = new Chat(null, null, null, null, null, null, null, 0, 0, 0, 0, 0, 0, 0);
    }
    if (directory == null) {
      directory = new Directory(null, null, null, 0, 0, 0, 0, 0, 0, 0, 0);
    }
    if (snapshot == null) {
      snapshot = new Snapshot(0, 0);
    }
  }
}
