package cafe.woden.audience.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChannelRegistryTest {

  @Test
  void selfJoinCreatesOnceAndResetsOnRejoin() {
    ChannelRegistry registry = new ChannelRegistry(20);

    Channel first = registry.onSelfJoin("#Foo");
    first.addAudience("alice");
    first.addFollowers(List.of("1"));
    first.markConnected();

    Channel again = registry.onSelfJoin("foo");

    assertSame(first, again);
    assertEquals(ChannelStatus.CONNECTING, again.status());
    assertThat(again.audienceSnapshot()).isEmpty();
    assertThat(again.followersSnapshot()).containsExactly("1");
    assertEquals(1, registry.size());
  }

  @Test
  void lookupsNormalizeTheName() {
    ChannelRegistry registry = new ChannelRegistry(20);
    registry.onSelfJoin("#foo");

    assertTrue(registry.find("FOO").isPresent());
    assertTrue(registry.find(" #foo ").isPresent());
    assertTrue(registry.find("#bar").isEmpty());
    assertTrue(registry.find(null).isEmpty());
  }

  @Test
  void selfPartForgetsTheChannel() {
    ChannelRegistry registry = new ChannelRegistry(20);
    registry.onSelfJoin("#foo");
    registry.onSelfJoin("#bar");

    assertTrue(registry.onSelfPart("#FOO").isPresent());
    assertTrue(registry.onSelfPart("#foo").isEmpty());

    assertThat(registry.names()).containsExactly("#bar");
  }

  @Test
  void newChannelsUseTheConfiguredNewsCapacity() {
    ChannelRegistry registry = new ChannelRegistry(5);

    assertEquals(5, registry.onSelfJoin("#foo").newsCapacity());
  }

  @Test
  void channelNamesNormalizeAndYieldOwner() {
    assertEquals("#foo", ChannelNames.normalize("Foo"));
    assertEquals("#foo", ChannelNames.normalize(" #FOO "));
    assertEquals("", ChannelNames.normalize("#"));
    assertEquals("", ChannelNames.normalize(null));
    assertEquals("foo", ChannelNames.ownerLogin("#Foo"));
  }
}
