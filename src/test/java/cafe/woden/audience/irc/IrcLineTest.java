package cafe.woden.audience.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class IrcLineTest {

  @Test
  void trailingParameterKeepsEmbeddedWhitespace() {
    IrcLine line = IrcLine.parse(":origin cmd a b :c d e");

    assertEquals("origin", line.origin());
    assertEquals("cmd", line.command());
    assertEquals(List.of("a", "b", "c d e"), line.parameters());
  }

  @Test
  void lineWithoutTrailingMarkerSplitsOnWhitespaceOnly() {
    IrcLine line = IrcLine.parse(":tmi.twitch.tv CAP * ACK   twitch.tv/membership");

    assertEquals(List.of("*", "ACK", "twitch.tv/membership"), line.parameters());
  }

  @Test
  void tabEndsTheOriginLikeASpace() {
    IrcLine line = IrcLine.parse(":bob\tJOIN #foo");

    assertEquals("bob", line.origin());
    assertEquals("JOIN", line.command());
    assertEquals(List.of("#foo"), line.parameters());
  }

  @Test
  void lineWithoutOriginHasNullOrigin() {
    IrcLine line = IrcLine.parse("PING :tmi.twitch.tv");

    assertNull(line.origin());
    assertEquals("PING", line.command());
    assertEquals(List.of("tmi.twitch.tv"), line.parameters());
  }

  @Test
  void bareCommandHasNoParametersWhileEmptyTrailingHasOne() {
    IrcLine bare = IrcLine.parse(":tmi.twitch.tv GLOBALUSERSTATE");
    assertFalse(bare.hasParameters());
    assertNull(bare.parameters());
    assertNull(bare.param(0));

    IrcLine emptyTrailing = IrcLine.parse("PRIVMSG #foo :");
    assertTrue(emptyTrailing.hasParameters());
    assertEquals(List.of("#foo", ""), emptyTrailing.parameters());
  }

  @Test
  void markerInsideATokenIsOrdinary() {
    IrcLine line = IrcLine.parse("PRIVMSG #foo a:b ::)");

    assertEquals(List.of("#foo", "a:b", ":)"), line.parameters());
  }

  @Test
  void namesReplyKeepsNameListAsOneParameter() {
    IrcLine line =
        IrcLine.parse(":newsbot.tmi.twitch.tv 353 newsbot = #foo :alice bob carol");

    assertEquals(IrcCommands.NAMES_REPLY, line.command());
    assertEquals("#foo", line.param(2));
    assertEquals("alice bob carol", line.param(3));
  }

  @Test
  void originLoginIsTheLowercasedNick() {
    IrcLine line = IrcLine.parse(":Bob!bob@bob.tmi.twitch.tv JOIN #foo");

    assertEquals("bob", line.originLogin());
    assertEquals("carol", IrcLine.loginOf("carol@carol.tmi.twitch.tv"));
    assertEquals("tmi.twitch.tv", IrcLine.loginOf("tmi.twitch.tv"));
    assertNull(IrcLine.loginOf(null));
  }

  @Test
  void blankOrCommandlessLinesAreMalformed() {
    assertThrows(MalformedLineException.class, () -> IrcLine.parse(""));
    assertThrows(MalformedLineException.class, () -> IrcLine.parse("   "));
    MalformedLineException e =
        assertThrows(MalformedLineException.class, () -> IrcLine.parse(":lonely.origin"));
    assertEquals(":lonely.origin", e.rawLine());
  }

  @Test
  void splitFrameDropsBlankSegments() {
    List<String> lines = IrcLine.splitFrame("PING :a\r\n\r\n:x 001 me :hi\r\n");

    assertEquals(List.of("PING :a", ":x 001 me :hi"), lines);
    assertTrue(IrcLine.splitFrame("").isEmpty());
    assertTrue(IrcLine.splitFrame(null).isEmpty());
  }
}
