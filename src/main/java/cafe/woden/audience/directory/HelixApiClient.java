package cafe.woden.audience.directory;

import cafe.woden.audience.config.AudienceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link DirectoryApi} over the JDK {@link HttpClient}.
 *
 * <p>Every request carries the {@code Client-ID} header, plus {@code Authorization: Bearer} when a
 * bearer token is configured. Responses are JSON objects with a {@code data} array and, for paged
 * endpoints, a {@code pagination.cursor}.
 */
@Component
public class HelixApiClient implements DirectoryApi {
  private static final Logger log = LoggerFactory.getLogger(HelixApiClient.class);

  static final int TOO_MANY_REQUESTS = 429;
  private static final int MAX_DETAIL_CHARS = 200;

  private final AudienceProperties.Directory settings;
  private final ObjectMapper json;
  private final Duration timeout;
  private final HttpClient client;

  public HelixApiClient(AudienceProperties props, ObjectMapper json) {
    this.settings = Objects.requireNonNull(props, "props").directory();
    this.json = Objects.requireNonNull(json, "json");
    this.timeout = Duration.ofMillis(settings.requestTimeoutMs());
    this.client =
        HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public ApiOutcome<List<UserRecord>> fetchUsers(LookupKind kind, List<String> keys) {
    Objects.requireNonNull(kind, "kind");
    if (keys == null || keys.isEmpty()) return ApiOutcome.success(List.of());
    if (keys.size() > AudienceProperties.MAX_KEYS_PER_REQUEST) {
      throw new IllegalArgumentException(
          "At most " + AudienceProperties.MAX_KEYS_PER_REQUEST + " keys per request");
    }
    StringBuilder query = new StringBuilder();
    for (String key : keys) appendParam(query, kind.queryParam(), key);
    ApiOutcome<String> body = get("/users", query.toString());
    if (!(body instanceof ApiOutcome.Success<String> ok)) return recast(body);
    try {
      return ApiOutcome.success(parseUsers(ok.value()));
    } catch (IOException e) {
      log.warn("Unreadable /users response: {}", e.toString());
      return ApiOutcome.failed(-1, "unreadable response");
    }
  }

  @Override
  public ApiOutcome<FollowerPage> fetchFollowers(String toId, String cursor, int pageSize) {
    StringBuilder query = new StringBuilder();
    appendParam(query, "to_id", Objects.requireNonNull(toId, "toId"));
    if (cursor != null && !cursor.isBlank()) appendParam(query, "after", cursor);
    appendParam(query, "first", Integer.toString(pageSize));
    ApiOutcome<String> body = get("/users/follows", query.toString());
    if (!(body instanceof ApiOutcome.Success<String> ok)) return recast(body);
    try {
      return ApiOutcome.success(parseFollowerPage(ok.value()));
    } catch (IOException e) {
      log.warn("Unreadable /users/follows response: {}", e.toString());
      return ApiOutcome.failed(-1, "unreadable response");
    }
  }

  private ApiOutcome<String> get(String path, String query) {
    URI uri = URI.create(settings.baseUrl() + path + "?" + query);
    HttpRequest.Builder b =
        HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .header("Client-ID", settings.clientId());
    if (!settings.bearerToken().isBlank()) {
      b.header("Authorization", "Bearer " + settings.bearerToken());
    }
    HttpRequest req = b.GET().build();

    HttpResponse<String> resp;
    try {
      resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      log.warn("GET {} failed: {}", path, e.toString());
      return ApiOutcome.failed(-1, e.toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ApiOutcome.failed(-1, "interrupted");
    }

    int status = resp.statusCode();
    if (status == TOO_MANY_REQUESTS) {
      long reset =
          resp.headers().firstValue("Ratelimit-Reset").map(HelixApiClient::parseLong).orElse(0L);
      log.debug("GET {} rate limited (reset {})", path, reset);
      return ApiOutcome.rateLimited(reset);
    }
    if (status < 200 || status >= 300) {
      return ApiOutcome.failed(status, abbreviate(resp.body()));
    }
    return ApiOutcome.success(resp.body());
  }

  List<UserRecord> parseUsers(String body) throws IOException {
    JsonNode data = json.readTree(body).path("data");
    if (!data.isArray()) return List.of();
    List<UserRecord> out = new ArrayList<>(data.size());
    for (JsonNode n : data) {
      String id = n.path("id").asText("");
      String login = n.path("login").asText("");
      if (id.isBlank() || login.isBlank()) continue;
      out.add(new UserRecord(id, login, n.path("display_name").asText(null)));
    }
    return out;
  }

  FollowerPage parseFollowerPage(String body) throws IOException {
    JsonNode root = json.readTree(body);
    List<String> ids = new ArrayList<>();
    JsonNode data = root.path("data");
    if (data.isArray()) {
      for (JsonNode n : data) {
        String id = n.path("from_id").asText("");
        if (!id.isBlank()) ids.add(id);
      }
    }
    JsonNode cursor = root.path("pagination").path("cursor");
    return new FollowerPage(ids, cursor.isTextual() ? cursor.asText() : null);
  }

  @SuppressWarnings("unchecked")
  private static <T> ApiOutcome<T> recast(ApiOutcome<String> outcome) {
    // Only the non-success variants reach here; neither carries a value.
    return (ApiOutcome<T>) (ApiOutcome<?>) outcome;
  }

  private static void appendParam(StringBuilder query, String name, String value) {
    if (query.length() > 0) query.append('&');
    query
        .append(URLEncoder.encode(name, StandardCharsets.UTF_8))
        .append('=')
        .append(URLEncoder.encode(Objects.toString(value, ""), StandardCharsets.UTF_8));
  }

  private static long parseLong(String s) {
    try {
      return Long.parseLong(s.trim());
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  private static String abbreviate(String s) {
    if (s == null) return "";
    return s.length() <= MAX_DETAIL_CHARS ? s : s.substring(0, MAX_DETAIL_CHARS) + "...";
  }
}
