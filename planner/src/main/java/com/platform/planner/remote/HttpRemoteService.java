package com.platform.planner.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.planner.config.PlannerProperties;
import com.platform.planner.error.PlanInterruptedException;
import com.platform.planner.error.RemoteServiceException;
import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.mapping.WireDto;
import com.platform.planner.remote.RemoteModels.EntityInfo;
import com.platform.planner.remote.RemoteModels.MarketInfo;
import com.platform.planner.remote.RemoteModels.ScenarioInfo;
import com.platform.planner.remote.RemoteModels.UserInfo;
import com.platform.planner.remote.RemoteModels.VersionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client for the remote analysis service REST API.
 */
@Slf4j
@Component
public class HttpRemoteService implements RemoteService {

    private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+\\.\\d+(?:\\.\\d+)*)");

    private final PlannerProperties.Remote config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpRemoteService(PlannerProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getRemote();
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.getConnectionTimeoutMs()))
            .build();
    }

    // ==================== Service Info ====================

    @Override
    public ProtocolVersion reportedProtocolVersion() {
        if (config.getVersion() != null && !config.getVersion().isBlank()) {
            return ProtocolVersion.parse(config.getVersion());
        }

        VersionInfo info = read("get version", send("get version", get("admin/versions")), VersionInfo.class);
        String reported = info.getVersion() != null ? info.getVersion() : info.getVersionInfo();
        Matcher matcher = VERSION_PATTERN.matcher(reported != null ? reported : "");
        if (!matcher.find()) {
            throw RemoteServiceException.invalidResponse("get version",
                new IllegalStateException("No version number in: " + reported));
        }

        ProtocolVersion version = ProtocolVersion.parse(matcher.group(1));
        log.info("Remote service reports version {}", version);
        return version;
    }

    @Override
    public String currentUsername() {
        UserInfo user = read("get user", send("get user", get("users/me")), UserInfo.class);
        return user.getUsername();
    }

    // ==================== Scenarios & Markets ====================

    @Override
    public ScenarioInfo createScenario(WireDto dto) {
        return read("create scenario", send("create scenario", post("scenarios", dto.toJson())), ScenarioInfo.class);
    }

    @Override
    public ScenarioInfo createNamedScenario(String name, WireDto dto) {
        return read("create scenario",
            send("create scenario", post("scenarios/" + encode(name), dto.toJson())), ScenarioInfo.class);
    }

    @Override
    public MarketInfo createMarket(String baseMarket, String scenarioId, Map<String, Object> params) {
        String path = String.format("markets/%s/scenarios/%s%s", encode(baseMarket), encode(scenarioId), query(params));
        MarketInfo market = read("create market", send("create market", post(path, null)), MarketInfo.class);
        log.info("Created plan market {} ({}) from scenario {}", market.getDisplayName(), market.getUuid(), scenarioId);
        return market;
    }

    @Override
    public MarketInfo getMarket(String marketId) {
        return read("get market", send("get market", get("markets/" + encode(marketId))), MarketInfo.class);
    }

    @Override
    public void stopMarket(String marketId) {
        HttpRequest request = builder("markets/" + encode(marketId) + "?operation=stop")
            .PUT(HttpRequest.BodyPublishers.noBody())
            .build();
        send("stop market", request);
        log.info("Requested stop of market {}", marketId);
    }

    @Override
    public boolean deleteMarket(String marketId) {
        return delete("delete market", "markets/" + encode(marketId));
    }

    @Override
    public boolean deleteScenario(String scenarioId) {
        return delete("delete scenario", "scenarios/" + encode(scenarioId));
    }

    // ==================== Search & Stats ====================

    @Override
    public Optional<EntityInfo> findEntity(String uuid) {
        JsonNode node = readTree("search", send("search", get("search/" + encode(uuid))));
        JsonNode entity = node.isArray() ? node.path(0) : node;
        if (entity.isMissingNode() || entity.isNull() || !entity.has("uuid")) {
            return Optional.empty();
        }
        return Optional.of(convert("search", entity, EntityInfo.class));
    }

    @Override
    public List<String> findClusterIds(String market) {
        JsonNode node = readTree("search clusters",
            send("search clusters", get("search?types=Cluster&scopes=" + encode(market))));
        List<String> ids = new ArrayList<>();
        for (JsonNode entity : node) {
            if (entity.hasNonNull("uuid")) {
                ids.add(entity.get("uuid").asText());
            }
        }
        log.debug("Found {} clusters in market {}", ids.size(), market);
        return ids;
    }

    @Override
    public JsonNode getMarketStats(String marketId) {
        return readTree("get market stats", send("get market stats", get("markets/" + encode(marketId) + "/stats")));
    }

    // ==================== HTTP ====================

    private boolean delete(String operation, String path) {
        HttpResponse<String> response = send(operation, builder(path).DELETE().build());
        return response.statusCode() == 200 || response.statusCode() == 204;
    }

    private HttpRequest get(String path) {
        return builder(path).GET().build();
    }

    private HttpRequest post(String path, String json) {
        HttpRequest.BodyPublisher body = json != null
            ? HttpRequest.BodyPublishers.ofString(json)
            : HttpRequest.BodyPublishers.noBody();
        return builder(path)
            .header("Content-Type", "application/json")
            .POST(body)
            .build();
    }

    private HttpRequest.Builder builder(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(stripSlash(config.getBaseUrl()) + "/" + path))
            .header("Accept", "application/json")
            .timeout(Duration.ofMillis(config.getReadTimeoutMs()));

        if (StringUtils.hasText(config.getUsername())) {
            String credentials = config.getUsername() + ":" + (config.getPassword() != null ? config.getPassword() : "");
            builder.header("Authorization",
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return builder;
    }

    private HttpResponse<String> send(String operation, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("{} failed, remote service not reachable at {}: {}", operation, config.getBaseUrl(), e.getMessage());
            throw RemoteServiceException.unreachable(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanInterruptedException("Interrupted during " + operation, e);
        }

        if (response.statusCode() >= 400) {
            log.error("{} failed: {} (status {})", operation, response.body(), response.statusCode());
            throw RemoteServiceException.forStatus(response.statusCode(), operation, response.body());
        }
        return response;
    }

    private <T> T read(String operation, HttpResponse<String> response, Class<T> type) {
        JsonNode node = readTree(operation, response);
        // list endpoints wrap single resources
        return convert(operation, node.isArray() ? node.path(0) : node, type);
    }

    private JsonNode readTree(String operation, HttpResponse<String> response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw RemoteServiceException.invalidResponse(operation, e);
        }
    }

    private <T> T convert(String operation, JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw RemoteServiceException.invalidResponse(operation, e);
        }
    }

    static String query(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        new LinkedHashMap<>(params).forEach((key, value) ->
            joiner.add(encode(key) + "=" + encode(String.valueOf(value))));
        return joiner.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
