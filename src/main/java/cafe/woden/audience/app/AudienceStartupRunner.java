package cafe.woden.audience.app;

import cafe.woden.audience.app.api.AudienceCommandPort;
import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.irc.ChatConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Checks credentials, queues the configured auto-joins and starts the connection loop. */
@Component
public class AudienceStartupRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(AudienceStartupRunner.class);

  private final AudienceProperties props;
  private final AudienceCommandPort commands;
  private final ChatConnection connection;

  public AudienceStartupRunner(
      AudienceProperties props, AudienceCommandPort commands, ChatConnection connection) {
    this.props = Objects.requireNonNull(props, "props");
    this.commands = Objects.requireNonNull(commands, "commands");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> missing = missingCredentials(props);
    if (!missing.isEmpty()) {
      throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
    }
    for (String channel : props.chat().autoJoin()) {
      if (channel == null || channel.isBlank()) continue;
      commands.joinChannel(channel);
    }
    log.info(
        "Starting chat connection as {} ({} auto-join channel(s))",
        props.chat().username(),
        props.chat().autoJoin().size());
    connection.start();
  }

  static List<String> missingCredentials(AudienceProperties props) {
    List<String> missing = new ArrayList<>();
    if (props.chat().username().isBlank()) missing.add("audience.chat.username");
    if (props.chat().oauthToken().isBlank()) missing.add("audience.chat.oauth-token");
    if (props.directory().clientId().isBlank()) missing.add("audience.directory.client-id");
    return missing;
  }
}
