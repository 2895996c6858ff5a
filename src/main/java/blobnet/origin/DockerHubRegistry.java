package blobnet.origin;

import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.messaging.JsonMessageCodec;
import blobnet.storage.ArtifactHash;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pulls blobs from a Docker registry v2 endpoint using anonymous pull tokens.
 * <p>
 * A token is requested per repository name and cached until its {@code expires_in}
 * elapses. Redirects to blob storage are followed.
 */
public class DockerHubRegistry implements OriginRegistry {

    private static final Logger log = LoggerFactory.getLogger(DockerHubRegistry.class);

    public static final String DEFAULT_AUTH_URL = "https://auth.docker.io/token";
    public static final String DEFAULT_REGISTRY_URL = "https://registry-1.docker.io";
    public static final String DEFAULT_SERVICE = "registry.docker.io";
    private static final String CLIENT_ID = "blobnet";
    private static final long DEFAULT_TOKEN_LIFETIME_SECONDS = 60;

    private final HttpClient http;
    private final ObjectMapper objectMapper = JsonMessageCodec.createConfiguredObjectMapper();
    private final String authUrl;
    private final String registryUrl;
    private final String service;
    private final Duration requestTimeout;
    private final Clock clock;
    private final Map<String, AccessToken> tokens = new ConcurrentHashMap<>();

    public DockerHubRegistry() {
        this(DEFAULT_AUTH_URL, DEFAULT_REGISTRY_URL, DEFAULT_SERVICE, Duration.ofSeconds(60), Clock.systemUTC());
    }

    public DockerHubRegistry(String authUrl, String registryUrl, String service, Duration requestTimeout, Clock clock) {
        this.authUrl = authUrl;
        this.registryUrl = registryUrl.endsWith("/") ? registryUrl.substring(0, registryUrl.length() - 1) : registryUrl;
        this.service = service;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] fetchBlob(String name, ArtifactHash hash) {
        AccessToken token = tokenFor(name);
        URI uri = URI.create(registryUrl + "/v2/library/" + name + "/blobs/" + hash.id());
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token.token())
                .GET()
                .build();
        log.info("Fetching {} of {} from origin", hash, name);
        HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
        checkStatus(response.statusCode(), "blob " + hash + " of " + name);
        return response.body();
    }

    AccessToken tokenFor(String name) {
        Instant now = clock.instant();
        AccessToken cached = tokens.get(name);
        if (cached != null && !cached.isExpired(now)) {
            return cached;
        }
        AccessToken fresh = requestToken(name, now);
        tokens.put(name, fresh);
        return fresh;
    }

    private AccessToken requestToken(String name, Instant now) {
        String scope = "repository:library/" + name + ":pull";
        URI uri = URI.create(authUrl
                + "?client_id=" + CLIENT_ID
                + "&service=" + URLEncoder.encode(service, StandardCharsets.UTF_8)
                + "&scope=" + URLEncoder.encode(scope, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET().build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        checkStatus(response.statusCode(), "token for " + name);
        TokenResponse body;
        try {
            body = objectMapper.readValue(response.body(), TokenResponse.class);
        } catch (IOException e) {
            throw ArtifactException.ioError("Malformed token response for " + name, e);
        }
        if (body.effectiveToken() == null) {
            throw new ArtifactException(ErrorKind.ORIGIN_UNAUTHORIZED, "Token response for " + name + " carries no token");
        }
        long lifetime = body.expiresIn() != null ? body.expiresIn() : DEFAULT_TOKEN_LIFETIME_SECONDS;
        log.debug("Obtained origin token for {} valid {}s", name, lifetime);
        return new AccessToken(body.effectiveToken(), now.plusSeconds(lifetime));
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw ArtifactException.ioError("Origin request " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ArtifactException.ioError("Interrupted during origin request " + request.uri(), e);
        }
    }

    private static void checkStatus(int status, String what) {
        if (status / 100 == 2) {
            return;
        }
        if (status == 401 || status == 403) {
            throw new ArtifactException(ErrorKind.ORIGIN_UNAUTHORIZED, "Origin refused " + what + " (status " + status + ")");
        }
        if (status == 404) {
            throw new ArtifactException(ErrorKind.ORIGIN_NOT_FOUND, "Origin has no " + what);
        }
        throw new ArtifactException(ErrorKind.IO_ERROR, "Origin failed for " + what + " (status " + status + ")");
    }
}
