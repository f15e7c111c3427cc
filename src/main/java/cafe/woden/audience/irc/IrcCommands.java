package cafe.woden.audience.irc;

/** Command tokens and numerics exchanged with the chat endpoint. */
public final class IrcCommands {

  public static final String WELCOME = "001";
  public static final String NAMES_REPLY = "353";
  public static final String END_OF_NAMES = "366";

  public static final String PING = "PING";
  public static final String PONG = "PONG";
  public static final String GLOBAL_USER_STATE = "GLOBALUSERSTATE";
  public static final String JOIN = "JOIN";
  public static final String PART = "PART";
  public static final String PRIVMSG = "PRIVMSG";

  public static final String CAP = "CAP";
  public static final String PASS = "PASS";
  public static final String NICK = "NICK";
  public static final String USER = "USER";

  private IrcCommands() {}
}
