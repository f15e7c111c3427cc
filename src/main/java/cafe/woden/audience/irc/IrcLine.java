package cafe.woden.audience.irc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One inbound protocol line, split into origin, command and parameters.
 *
 * <p>Examples (no leading spaces):
 *
 * <pre>
 *   :tmi.twitch.tv 001 newsbot :Welcome, GLHF!
 *   PING :tmi.twitch.tv
 *   :bob!bob@bob.tmi.twitch.tv PRIVMSG #foo :!news hello there
 * </pre>
 *
 * @param origin sender prefix without its leading marker, or null when the line has none
 * @param command command token or numeric, never null
 * @param parameters parameter tokens in order, or null when the line carried no parameters at all
 */
@ValueObject
public record IrcLine(String origin, String command, List<String> parameters) {

  static final char ORIGIN_MARKER = ':';
  static final char TRAILING_MARKER = ':';

  private static final Pattern LINE_TERMINATOR = Pattern.compile("\r\n");

  public IrcLine {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command is required");
    }
    if (parameters != null) parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  /** Parses a single line (without its terminator). */
  public static IrcLine parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedLineException("Empty line", raw);
    }
    String s = raw.stripLeading();

    String origin = null;
    String rest = s;
    if (s.charAt(0) == ORIGIN_MARKER) {
      int sp = indexOfSeparator(s);
      if (sp < 0) {
        throw new MalformedLineException("Origin without command", raw);
      }
      origin = s.substring(1, sp);
      rest = s.substring(sp);
    }

    List<String> tokens = tokenize(rest);
    if (tokens.isEmpty()) {
      throw new MalformedLineException("Missing command", raw);
    }
    String command = tokens.get(0);
    List<String> params = tokens.size() > 1 ? tokens.subList(1, tokens.size()) : null;
    return new IrcLine(origin, command, params);
  }

  /**
   * Splits a transport frame into individual lines, dropping blank segments.
   *
   * <p>A single frame may carry several CRLF-terminated lines.
   */
  public static List<String> splitFrame(String frame) {
    if (frame == null || frame.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String segment : LINE_TERMINATOR.split(frame)) {
      if (!segment.isBlank()) out.add(segment);
    }
    return out;
  }

  /**
   * Character scan: whitespace runs flush the buffer and arm the boundary flag; a trailing marker
   * seen right after a boundary (once the command token exists) turns the rest of the input into
   * one final token, whitespace included.
   */
  private static boolean isSeparator(char c) {
    return c == ' ' || c == '\t';
  }

  private static int indexOfSeparator(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (isSeparator(s.charAt(i))) return i;
    }
    return -1;
  }

  static List<String> tokenize(String s) {
    List<String> out = new ArrayList<>();
    StringBuilder buf = new StringBuilder();
    boolean boundary = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (isSeparator(c)) {
        if (buf.length() > 0) {
          out.add(buf.toString());
          buf.setLength(0);
        }
        boundary = true;
        continue;
      }
      if (boundary && c == TRAILING_MARKER && !out.isEmpty()) {
        out.add(s.substring(i + 1));
        return out;
      }
      buf.append(c);
      boundary = false;
    }
    if (buf.length() > 0) out.add(buf.toString());
    return out;
  }

  public boolean hasParameters() {
    return parameters != null;
  }

  /** Returns the parameter at {@code index}, or null when absent. */
  public String param(int index) {
    if (parameters == null || index < 0 || index >= parameters.size()) return null;
    return parameters.get(index);
  }

  /** Login part of the origin ({@code nick!user@host} yields {@code nick}), lowercased. */
  public String originLogin() {
    return loginOf(origin);
  }

  public static String loginOf(String origin) {
    if (origin == null || origin.isBlank()) return null;
    String o = origin.trim();
    int bang = o.indexOf('!');
    if (bang > 0) o = o.substring(0, bang);
    int at = o.indexOf('@');
    if (at > 0) o = o.substring(0, at);
    return o.toLowerCase(Locale.ROOT);
  }
}
