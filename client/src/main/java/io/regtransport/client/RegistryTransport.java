package io.regtransport.client;

import static io.regtransport.spec.BadStateException.checkState;
import static io.regtransport.util.Assert.checkNotNullParam;
import static java.net.HttpURLConnection.HTTP_OK;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.regtransport.client.auth.Bearer;
import io.regtransport.client.auth.Credential;
import io.regtransport.client.http.HttpClient;
import io.regtransport.client.http.HttpResponse;
import io.regtransport.spec.Action;
import io.regtransport.spec.BadStateException;
import io.regtransport.spec.MediaTypes;
import io.regtransport.spec.RegistryClientException;
import io.regtransport.spec.ResourceName;
import io.regtransport.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport that handles Registry v2 Bearer authentication.
 * <p>
 * Every Registry v2 endpoint expects Bearer authentication. Bearer tokens are obtained by
 * presenting a Basic (or anonymous) credential to the token endpoint ("realm") that the
 * registry names in the {@code www-authenticate} challenge of its {@code /v2/} ping. Tokens are
 * scoped to one resource and carry the capabilities of the requested {@link Action}.
 * <p>
 * Registries may reject a token at any time once it expires, answering with a 401. The
 * transport then exchanges the Basic credential for a new token and reissues the request,
 * once.
 * <p>
 * Construction pings the registry and performs the first exchange; a transport that was
 * constructed successfully is ready to issue requests. The realm and service are never
 * rediscovered. Instances are safe for use by concurrent threads.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RegistryTransport transport = new RegistryTransport(
 *     Tag.parse("gcr.io/my-project/my-image:latest"),
 *     new Basic("_token", accessToken),
 *     HttpClient.createHttpClient(),
 *     Action.PULL);
 *
 * HttpResponse manifest = transport.request(
 *     RegistryRequest.builder("https://gcr.io/v2/my-project/my-image/manifests/latest")
 *         .acceptedCodes(200)
 *         .acceptedMimeTypes(MediaTypes.SUPPORTED_MANIFEST_TYPES)
 *         .build());
 * }</pre>
 */
public class RegistryTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryTransport.class);

    static final String CHALLENGE = "Bearer ";
    static final String REALM_PREFIX = "realm=";
    static final String SERVICE_PREFIX = "service=";

    private static final String AUTHORIZATION = "Authorization";
    private static final String USER_AGENT = "user-agent";
    private static final String CONTENT_TYPE = "content-type";
    private static final String CONTENT_LENGTH = "content-length";
    private static final String ACCEPT = "Accept";

    private final ResourceName name;
    private final Credential basicCredential;
    private final HttpClient httpClient;
    private final Action action;
    private final String userAgent;
    private final String realm;
    private final String service;

    private final Object credentialLock = new Object();
    // guarded by credentialLock
    private @Nullable Bearer bearerCredential;

    /**
     * Creates a transport with the default configuration.
     *
     * @param name the resource the transport is bound to
     * @param basicCredential the credential exchanged for Bearer tokens
     * @param httpClient the client performing HTTP requests
     * @param action the capability tokens are requested for
     * @throws BadStateException if the ping or the initial token exchange fails, or the action is missing
     * @throws RegistryClientException if the registry or the token endpoint cannot be reached
     */
    public RegistryTransport(ResourceName name, Credential basicCredential, HttpClient httpClient,
                             @Nullable Action action) throws RegistryClientException {
        this(name, basicCredential, httpClient, action, RegistryTransportConfig.DEFAULT);
    }

    /**
     * Creates a transport.
     *
     * @param name the resource the transport is bound to
     * @param basicCredential the credential exchanged for Bearer tokens
     * @param httpClient the client performing HTTP requests, or {@code null} to create one from
     *                   {@link RegistryTransportConfig#getHttpClientBuilder()}
     * @param action the capability tokens are requested for
     * @param config transport settings
     * @throws BadStateException if the ping or the initial token exchange fails, or the action is missing
     * @throws RegistryClientException if the registry or the token endpoint cannot be reached
     */
    public RegistryTransport(ResourceName name, Credential basicCredential, @Nullable HttpClient httpClient,
                             @Nullable Action action, RegistryTransportConfig config) throws RegistryClientException {
        this.name = checkNotNullParam("name", name);
        this.basicCredential = checkNotNullParam("basicCredential", basicCredential);
        checkNotNullParam("config", config);
        checkState(action != null, "Invalid action supplied to RegistryTransport: " + action);
        this.action = action;
        this.httpClient = httpClient == null ? config.getHttpClientBuilder().create() : httpClient;
        this.userAgent = config.getUserAgent();

        // Ping once to establish the realm, then get a credential for use with this transport.
        Challenge challenge = ping();
        this.realm = challenge.realm();
        this.service = challenge.service();
        refresh();
    }

    /**
     * Pings the registry to discover the realm and service used for token exchanges.
     */
    private Challenge ping() throws RegistryClientException {
        String url = HttpUtils.scheme(name.registry()) + "://" + name.registry() + "/v2/";
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, MediaTypes.APPLICATION_JSON);
        headers.put(USER_AGENT, userAgent);

        LOGGER.debug("Pinging {} for {}", url, name);
        HttpResponse response = send("GET", url, headers, null);

        // We expect a www-authenticate challenge.
        checkState(response.statusCode() == HTTP_UNAUTHORIZED, "Unexpected status: " + response.statusCode());

        String challenge = response.firstHeader("www-authenticate").orElse(null);
        checkState(challenge != null && challenge.startsWith(CHALLENGE),
                "Unexpected \"www-authenticate\" header: " + challenge);

        String realm = null;
        String service = name.registry();
        for (String token : challenge.substring(CHALLENGE.length()).split(",")) {
            String t = token.trim();
            if (t.startsWith(REALM_PREFIX)) {
                realm = unquote(t.substring(REALM_PREFIX.length()));
            } else if (t.startsWith(SERVICE_PREFIX)) {
                service = unquote(t.substring(SERVICE_PREFIX.length()));
            }
        }
        checkState(realm != null && !realm.isEmpty(),
                "Expected a \"" + REALM_PREFIX + "\" in \"www-authenticate\" header: " + challenge);

        LOGGER.debug("Registry {} issues tokens from realm {} for service {}", name.registry(), realm, service);
        return new Challenge(realm, service);
    }

    /**
     * Exchanges the Basic credential for a new Bearer token and installs it.
     * <p>
     * Called eagerly during construction and whenever a request is rejected with a 401.
     *
     * @throws BadStateException if the token endpoint does not answer 200 with a {@code token}
     * @throws RegistryClientException if the token endpoint cannot be reached
     */
    void refresh() throws RegistryClientException {
        String url = realm + "?scope=" + encode(scope()) + "&service=" + encode(service);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, MediaTypes.APPLICATION_JSON);
        headers.put(USER_AGENT, userAgent);
        // The caller's credential may rotate, so read it on every exchange.
        String authorization = basicCredential.get();
        if (!authorization.isEmpty()) {
            headers.put(AUTHORIZATION, authorization);
        }

        LOGGER.debug("Requesting token for scope {} from {}", scope(), realm);
        HttpResponse response = send("GET", url, headers, null);
        String content = response.bodyAsString();

        checkState(response.statusCode() == HTTP_OK,
                "Bad status during token exchange: " + response.statusCode() + "\n" + content);

        JsonNode wrapper;
        try {
            wrapper = Utils.readTree(content);
        } catch (JsonProcessingException e) {
            throw new BadStateException("Malformed JSON response: " + content, e);
        }
        checkState(wrapper != null && wrapper.isObject() && wrapper.hasNonNull("token"),
                "Malformed JSON response: " + content);

        Bearer bearer = new Bearer(wrapper.get("token").asText());
        synchronized (credentialLock) {
            // We have successfully reauthenticated.
            bearerCredential = bearer;
        }
    }

    /**
     * Issues an authenticated request.
     * <p>
     * If the registry answers 401, the Bearer token is refreshed and the request is issued a
     * second and final time.
     *
     * @param request the request
     * @return the response, whose status is one of {@link RegistryRequest#acceptedCodes()}
     * @throws RegistryDiagnosticException if the final status is not accepted
     * @throws BadStateException if a token refresh fails
     * @throws RegistryClientException if the registry cannot be reached
     */
    public HttpResponse request(RegistryRequest request) throws RegistryClientException {
        checkNotNullParam("request", request);

        HttpResponse response = attempt(request);
        if (response.statusCode() == HTTP_UNAUTHORIZED) {
            // On Unauthorized, refresh the credential and retry once.
            LOGGER.debug("{} was rejected with 401, refreshing the token", request);
            refresh();
            response = attempt(request);
        }

        if (!request.acceptedCodes().contains(response.statusCode())) {
            throw new RegistryDiagnosticException(response);
        }
        return response;
    }

    public HttpResponse request(String url, Set<Integer> acceptedCodes) throws RegistryClientException {
        return request(RegistryRequest.builder(url).acceptedCodes(acceptedCodes).build());
    }

    public HttpResponse request(String url, Set<Integer> acceptedCodes, @Nullable String method,
                                byte @Nullable [] body, @Nullable String contentType,
                                @Nullable List<String> acceptedMimeTypes) throws RegistryClientException {
        return request(RegistryRequest.builder(url)
                .acceptedCodes(acceptedCodes)
                .method(method)
                .body(body)
                .contentType(contentType)
                .acceptedMimeTypes(acceptedMimeTypes)
                .build());
    }

    /**
     * Issues a request and follows {@code link: <...>; rel="next"} headers.
     * <p>
     * Pages are fetched lazily, one request per {@link PaginatedResponses#next()}. The returned
     * sequence cannot be restarted and must not be shared between threads.
     *
     * @param request the request for the first page
     * @return the pages
     */
    public PaginatedResponses paginatedRequest(RegistryRequest request) {
        checkNotNullParam("request", request);
        return new PaginatedResponses(this, request);
    }

    public PaginatedResponses paginatedRequest(String url, Set<Integer> acceptedCodes) {
        return paginatedRequest(RegistryRequest.builder(url).acceptedCodes(acceptedCodes).build());
    }

    public ResourceName getName() {
        return name;
    }

    public Action getAction() {
        return action;
    }

    public String getRealm() {
        return realm;
    }

    public String getService() {
        return service;
    }

    /**
     * Returns the Bearer credential currently attached to requests.
     *
     * @return the current credential
     */
    public Bearer getBearerCredential() {
        synchronized (credentialLock) {
            // Set by the constructor before any caller can observe this instance.
            return Objects.requireNonNull(bearerCredential, "bearerCredential");
        }
    }

    String scope() {
        return name.scope(action);
    }

    private HttpResponse attempt(RegistryRequest request) throws RegistryClientException {
        // Read the credential per attempt, a refresh may have replaced it.
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUTHORIZATION, getBearerCredential().get());
        headers.put(USER_AGENT, userAgent);

        if (request.hasBody()) {
            headers.put(CONTENT_TYPE, request.contentType());
        }
        List<String> acceptedMimeTypes = request.acceptedMimeTypes();
        if (acceptedMimeTypes != null) {
            headers.put(ACCEPT, String.join(",", acceptedMimeTypes));
        }
        String method = request.method();
        // POST and PUT require a content-length when no body is supplied.
        if ((method.equals("POST") || method.equals("PUT")) && !request.hasBody()) {
            headers.put(CONTENT_LENGTH, "0");
        }

        return send(method, request.url(), headers, request.body());
    }

    private HttpResponse send(String method, String url, Map<String, String> headers,
                              byte @Nullable [] body) throws RegistryClientException {
        try {
            return httpClient.request(method, url)
                    .addHeaders(headers)
                    .body(body)
                    .send();
        } catch (IOException e) {
            throw new RegistryClientException("Failed to " + method + " " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryClientException("Interrupted during " + method + " " + url, e);
        }
    }

    private static String unquote(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private record Challenge(String realm, String service) {
    }
}
