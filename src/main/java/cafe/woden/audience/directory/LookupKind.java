package cafe.woden.audience.directory;

import java.util.Locale;
import java.util.Objects;

/** Which key a directory lookup is keyed by; also the REST query parameter name. */
public enum LookupKind {
  LOGIN("login"),
  ID("id");

  private final String queryParam;

  LookupKind(String queryParam) {
    this.queryParam = queryParam;
  }

  public String queryParam() {
    return queryParam;
  }

  /** Canonical form of a key of this kind; logins are case-insensitive. */
  public String normalize(String key) {
    String k = Objects.toString(key, "").trim();
    return this == LOGIN ? k.toLowerCase(Locale.ROOT) : k;
  }
}
