package cafe.woden.audience.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import cafe.woden.audience.app.api.AudienceEntry;
import cafe.woden.audience.channel.Channel;
import cafe.woden.audience.channel.ChannelRegistry;
import cafe.woden.audience.channel.ChannelStatus;
import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.directory.DirectoryCache;
import cafe.woden.audience.directory.UserRecord;
import cafe.woden.audience.irc.ChatConnection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AudienceServiceTest {

  private final ChatConnection connection = mock(ChatConnection.class);
  private final ChannelRegistry registry = new ChannelRegistry(20);
  private final DirectoryCache cache = new DirectoryCache();
  private final AudienceService service =
      new AudienceService(
          connection,
          registry,
          cache,
          new AudienceProperties(null, null, new AudienceProperties.Snapshot(300, 10)));

  @Test
  void joinAndLeaveGoThroughTheConnectionWithNormalizedNames() {
    service.joinChannel("Foo");
    service.leaveChannel("#BAR");

    verify(connection).join("#foo");
    verify(connection).part("#bar");
    assertThrows(IllegalArgumentException.class, () -> service.joinChannel(" "));
  }

  @Test
  void snapshotListsChattersThenFollowersResolvedThroughTheCache() {
    Channel foo = registry.onSelfJoin("#foo");
    foo.addAudience(List.of("alice", "bob", "ghost"));
    foo.addFollowers(List.of("2", "3", "4"));
    cache.put(new UserRecord("1", "alice", "Alice"));
    cache.put(new UserRecord("2", "bob", "Bob"));
    cache.put(new UserRecord("3", "carol", "Carol"));

    List<AudienceEntry> view = service.getAudienceSnapshot("#foo");

    assertThat(view)
        .containsExactly(
            new AudienceEntry("alice", "Alice", true, false),
            new AudienceEntry("bob", "Bob", true, true),
            new AudienceEntry("carol", "Carol", false, true));
  }

  @Test
  void untrackedChannelReturnsEmptyWithoutWaiting() {
    long start = System.nanoTime();

    assertTrue(service.getAudienceSnapshot("#nowhere").isEmpty());

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(250);
  }

  @Test
  void emptySnapshotWaitsIsBoundedByTheTimeout() {
    registry.onSelfJoin("#foo");
    long start = System.nanoTime();

    assertTrue(service.getAudienceSnapshot("#foo").isEmpty());

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
        .isGreaterThanOrEqualTo(250);
  }

  @Test
  void snapshotReturnsOnceDataArrives() throws Exception {
    Channel foo = registry.onSelfJoin("#foo");
    CompletableFuture<List<AudienceEntry>> pending =
        CompletableFuture.supplyAsync(() -> service.getAudienceSnapshot("#foo"));

    foo.addAudience("alice");
    cache.put(new UserRecord("1", "alice", "Alice"));

    assertThat(pending.get(5, TimeUnit.SECONDS)).hasSize(1);
  }

  @Test
  void drainMessagesEmptiesTheQueue() {
    Channel foo = registry.onSelfJoin("#foo");
    foo.pushNews("!news bob: one");
    foo.pushNews("!news bob: two");

    assertThat(service.drainMessages("FOO")).containsExactly("!news bob: one", "!news bob: two");
    assertThat(service.drainMessages("#foo")).isEmpty();
    assertThat(service.drainMessages("#nowhere")).isEmpty();
  }

  @Test
  void statusAndTrackedChannelsReflectTheRegistry() {
    registry.onSelfJoin("#foo").markConnected();

    assertEquals(ChannelStatus.CONNECTED, service.channelStatus("foo").orElseThrow());
    assertTrue(service.channelStatus("#bar").isEmpty());
    assertThat(service.trackedChannels()).containsExactly("#foo");
  }
}
