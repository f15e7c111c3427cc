package cafe.woden.audience.directory;

import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A directory user profile, cached by both id and login. */
@ValueObject
public record UserRecord(String id, String login, String displayName) {
  public UserRecord {
    id = Objects.requireNonNull(id, "id").trim();
    login = Objects.requireNonNull(login, "login").trim().toLowerCase(Locale.ROOT);
    if (id.isEmpty()) throw new IllegalArgumentException("id is blank");
    if (login.isEmpty()) throw new IllegalArgumentException("login is blank");
    if (displayName == null || displayName.isBlank()) displayName = login;
  }
}
