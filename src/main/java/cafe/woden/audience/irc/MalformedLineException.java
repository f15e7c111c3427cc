package cafe.woden.audience.irc;

/** Thrown when a raw protocol line has no command token. */
public class MalformedLineException extends RuntimeException {

  private final String rawLine;

  public MalformedLineException(String message, String rawLine) {
    super(message);
    this.rawLine = rawLine;
  }

  public String rawLine() {
    return rawLine;
  }
}
