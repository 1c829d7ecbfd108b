package com.example.strmmirror.infrastructure.alist;

import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.RemoteEntry;
import com.example.strmmirror.infrastructure.remote.RemoteListingClient;
import com.example.strmmirror.infrastructure.remote.RemoteListingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Walks an Alist server through its JSON API ({@code /api/fs/list}, {@code /api/fs/get}).
 */
public class AlistApiClient implements RemoteListingClient {

    private static final Logger log = LoggerFactory.getLogger(AlistApiClient.class);

    static final int PAGE_SIZE = 200;

    private final MirrorConfiguration config;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private volatile String token;

    public AlistApiClient(MirrorConfiguration config, CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = trimTrailingSlash(config.getUrl());
        this.token = StringUtils.hasText(config.getToken()) ? config.getToken() : null;
    }

    @Override
    public Iterable<RemoteEntry> listTree(String rootPath, Duration waitTime, boolean detail) {
        String root = normalizeDirectory(rootPath);
        return () -> new TreeIterator(root, waitTime == null ? Duration.ZERO : waitTime, detail);
    }

    @Override
    public void close() {
        // the HTTP client is shared between sources and closed by its owner
    }

    /**
     * Send one API call and return the {@code data} node of a successful response.
     */
    JsonNode post(String apiPath, Map<String, Object> body) {
        HttpPost request = new HttpPost(baseUrl + apiPath);
        String authToken = resolveToken(apiPath);
        if (authToken != null) {
            request.setHeader(HttpHeaders.AUTHORIZATION, authToken);
        }
        try {
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int status = response.getStatusLine().getStatusCode();
                String payload = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (status < 200 || status >= 300) {
                    throw new RemoteListingException("Alist request failed, status=" + status + ", api=" + apiPath);
                }
                return unwrap(apiPath, objectMapper.readTree(payload));
            }
        } catch (IOException e) {
            throw new RemoteListingException("Alist request failed, api=" + apiPath + ": " + e.getMessage(), e);
        }
    }

    JsonNode unwrap(String apiPath, JsonNode response) {
        int code = response.path("code").asInt(-1);
        if (code != 200) {
            throw new RemoteListingException("Alist API error, api=" + apiPath + ", code=" + code
                    + ", message=" + response.path("message").asText(""));
        }
        return response.path("data");
    }

    RemoteEntry toEntry(String parentPath, JsonNode item, String rawUrl) {
        String name = item.path("name").asText();
        String path = "/".equals(parentPath) ? "/" + name : parentPath + "/" + name;
        boolean directory = item.path("is_dir").asBoolean(false);
        return RemoteEntry.builder()
                .path(path)
                .name(name)
                .directory(directory)
                .size(item.path("size").asLong(0L))
                .modifiedTimestamp(parseTimestamp(item.path("modified").asText(null)))
                .primaryUrl(directory ? null : buildProxyUrl(path, item.path("sign").asText("")))
                .rawUrl(directory ? null : rawUrl)
                .build();
    }

    String buildProxyUrl(String path, String sign) {
        StringBuilder url = new StringBuilder(baseUrl).append("/d");
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            try {
                url.append('/').append(URLEncoder.encode(segment, StandardCharsets.UTF_8.name()).replace("+", "%20"));
            } catch (UnsupportedEncodingException e) {
                throw new IllegalStateException("UTF-8 not supported", e);
            }
        }
        if (StringUtils.hasText(sign)) {
            url.append("?sign=").append(sign);
        }
        return url.toString();
    }

    static double parseTimestamp(String value) {
        if (!StringUtils.hasText(value)) {
            return 0D;
        }
        try {
            OffsetDateTime time = OffsetDateTime.parse(value);
            return time.toEpochSecond() + time.getNano() / 1_000_000_000D;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Alist timestamp: {}", value);
            return 0D;
        }
    }

    private String resolveToken(String apiPath) {
        if (token != null || "/api/auth/login".equals(apiPath) || !StringUtils.hasText(config.getUsername())) {
            return token;
        }
        synchronized (this) {
            if (token == null) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("username", config.getUsername());
                body.put("password", config.getPassword());
                JsonNode data = post("/api/auth/login", body);
                String issued = data.path("token").asText("");
                if (issued.isEmpty()) {
                    throw new RemoteListingException("Alist login returned no token, user=" + config.getUsername());
                }
                token = issued;
                log.info("ALIST_LOGIN_OK sourceId={} user={}", config.getId(), config.getUsername());
            }
            return token;
        }
    }

    private List<JsonNode> listDirectory(String dirPath, Duration waitTime) {
        List<JsonNode> items = new ArrayList<>();
        int page = 1;
        while (true) {
            pause(waitTime);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("path", dirPath);
            body.put("password", "");
            body.put("page", page);
            body.put("per_page", PAGE_SIZE);
            body.put("refresh", false);
            JsonNode data = post("/api/fs/list", body);
            JsonNode content = data.path("content");
            int total = data.path("total").asInt(0);
            if (!content.isArray() || content.size() == 0) {
                break;
            }
            content.forEach(items::add);
            if (items.size() >= total) {
                break;
            }
            page++;
        }
        return items;
    }

    private String fetchRawUrl(String path, Duration waitTime) {
        pause(waitTime);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("password", "");
        return post("/api/fs/get", body).path("raw_url").asText(null);
    }

    private void pause(Duration waitTime) {
        if (waitTime.isZero()) {
            return;
        }
        try {
            Thread.sleep(waitTime.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteListingException("Alist listing interrupted");
        }
    }

    private static String normalizeDirectory(String path) {
        if (!StringUtils.hasText(path) || "/".equals(path.trim())) {
            return "/";
        }
        String normalized = path.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        return trimTrailingSlash(normalized);
    }

    private static String trimTrailingSlash(String value) {
        String normalized = value == null ? "" : value.trim();
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private class TreeIterator implements Iterator<RemoteEntry> {

        private final Deque<String> pendingDirs = new ArrayDeque<>();
        private final Deque<RemoteEntry> buffer = new ArrayDeque<>();
        private final Duration waitTime;
        private final boolean detail;

        private TreeIterator(String root, Duration waitTime, boolean detail) {
            this.waitTime = waitTime;
            this.detail = detail;
            pendingDirs.push(root);
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !pendingDirs.isEmpty()) {
                String dir = pendingDirs.pop();
                List<String> subdirs = new ArrayList<>();
                for (JsonNode item : listDirectory(dir, waitTime)) {
                    boolean isDir = item.path("is_dir").asBoolean(false);
                    String rawUrl = null;
                    if (!isDir && detail) {
                        String name = item.path("name").asText();
                        rawUrl = fetchRawUrl("/".equals(dir) ? "/" + name : dir + "/" + name, waitTime);
                    }
                    RemoteEntry entry = toEntry(dir, item, rawUrl);
                    buffer.add(entry);
                    if (isDir) {
                        subdirs.add(entry.getPath());
                    }
                }
                for (int i = subdirs.size() - 1; i >= 0; i--) {
                    pendingDirs.push(subdirs.get(i));
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public RemoteEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }
    }
}
