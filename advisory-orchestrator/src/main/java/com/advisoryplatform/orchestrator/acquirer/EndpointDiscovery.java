package com.advisoryplatform.orchestrator.acquirer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves the list of peer endpoints to query. The first source that yields a non-empty
 * list wins:
 *
 * <ol>
 *   <li>inline JSON array (typically {@code CORE4_VERDICT_ENDPOINTS})</li>
 *   <li>JSON file at a configured path (typically {@code CORE4_VERDICT_ENDPOINTS_FILE})</li>
 *   <li>{@value #CONVENTIONAL_FILE_NAME} in each search directory, in order</li>
 *   <li>the built-in default endpoint</li>
 * </ol>
 *
 * <p>Malformed JSON and unreadable files are logged and skipped; invalid descriptors inside
 * an otherwise valid array are dropped individually. Discovery never throws.
 */
public class EndpointDiscovery {

    private static final Logger log = LoggerFactory.getLogger(EndpointDiscovery.class);

    public static final String CONVENTIONAL_FILE_NAME = "softmax_core4_endpoints.json";

    private final String       inlineJson;
    private final String       endpointsFile;
    private final List<Path>   searchDirs;
    private final PeerEndpoint defaultEndpoint;
    private final ObjectMapper objectMapper;

    public EndpointDiscovery(String inlineJson,
                             String endpointsFile,
                             List<Path> searchDirs,
                             PeerEndpoint defaultEndpoint,
                             ObjectMapper objectMapper) {
        this.inlineJson      = inlineJson;
        this.endpointsFile   = endpointsFile;
        this.searchDirs      = searchDirs == null ? List.of() : List.copyOf(searchDirs);
        this.defaultEndpoint = Objects.requireNonNull(defaultEndpoint, "defaultEndpoint");
        this.objectMapper    = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @return endpoints in declaration order; never empty
     */
    public List<PeerEndpoint> discover() {
        if (hasText(inlineJson)) {
            List<PeerEndpoint> inline = parseInline();
            if (!inline.isEmpty()) {
                log.debug("[Discovery] source=inline endpoints={}", inline.size());
                return inline;
            }
        }

        if (hasText(endpointsFile)) {
            List<PeerEndpoint> fromFile = readFile(Path.of(endpointsFile.strip()));
            if (!fromFile.isEmpty()) {
                log.debug("[Discovery] source=file path={} endpoints={}", endpointsFile, fromFile.size());
                return fromFile;
            }
        }

        for (Path dir : searchDirs) {
            Path candidate = dir.resolve(CONVENTIONAL_FILE_NAME);
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            List<PeerEndpoint> found = readFile(candidate);
            if (!found.isEmpty()) {
                log.debug("[Discovery] source=search path={} endpoints={}", candidate, found.size());
                return found;
            }
        }

        log.debug("[Discovery] source=default core={} url={}", defaultEndpoint.coreName(), defaultEndpoint.url());
        return List.of(defaultEndpoint);
    }

    private List<PeerEndpoint> parseInline() {
        try {
            return parseList(objectMapper.readTree(inlineJson));
        } catch (JsonProcessingException e) {
            log.warn("[Discovery] Invalid inline endpoint JSON. reason={}", e.getOriginalMessage());
            return List.of();
        }
    }

    private List<PeerEndpoint> readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("[Discovery] Endpoint file not found. path={}", path);
            return List.of();
        }
        try {
            return parseList(objectMapper.readTree(path.toFile()));
        } catch (IOException e) {
            log.warn("[Discovery] Failed to read endpoint file. path={} reason={}", path, e.getMessage());
            return List.of();
        }
    }

    private List<PeerEndpoint> parseList(JsonNode root) {
        if (root == null || !root.isArray()) {
            log.warn("[Discovery] Endpoint config must be a JSON array. got={}",
                root == null ? "nothing" : root.getNodeType());
            return List.of();
        }
        List<PeerEndpoint> endpoints = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            try {
                endpoints.add(new PeerEndpoint(
                    textOrNull(item, "core_name"),
                    textOrNull(item, "url"),
                    textOrNull(item, "method"),
                    textOrNull(item, "payload_key")));
            } catch (IllegalArgumentException e) {
                log.warn("[Discovery] Skipping invalid endpoint descriptor. item={} reason={}", item, e.getMessage());
            }
        }
        return endpoints;
    }

    private static String textOrNull(JsonNode item, String field) {
        JsonNode value = item.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
