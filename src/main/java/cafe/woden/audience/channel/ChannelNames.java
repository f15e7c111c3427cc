package cafe.woden.audience.channel;

import java.util.Locale;
import java.util.Objects;

/** Channel name normalization: lowercase with a leading {@code #}. */
public final class ChannelNames {

  public static final char CHANNEL_MARKER = '#';

  private ChannelNames() {}

  /** {@code "Foo"}, {@code "#Foo"} and {@code " #foo "} all normalize to {@code "#foo"}. */
  public static String normalize(String name) {
    String n = Objects.toString(name, "").trim().toLowerCase(Locale.ROOT);
    if (n.isEmpty()) return "";
    if (n.charAt(0) == CHANNEL_MARKER) {
      return n.length() == 1 ? "" : n;
    }
    return CHANNEL_MARKER + n;
  }

  /** Owner login of a channel: the normalized name without its marker. */
  public static String ownerLogin(String name) {
    String n = normalize(name);
    return n.isEmpty() ? "" : n.substring(1);
  }
}
