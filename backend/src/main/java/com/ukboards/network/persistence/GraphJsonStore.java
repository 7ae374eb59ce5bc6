package com.ukboards.network.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ukboards.config.BoardsProperties;
import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.graph.GraphEdge;
import com.ukboards.network.graph.GraphNode;
import com.ukboards.network.graph.NodeKind;
import com.ukboards.network.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Reads and writes networks as node-link JSON. The run record that produced a network is stored
 * alongside it under {@link #METADATA_KEY}.
 */
@Component
public class GraphJsonStore {
    public static final String METADATA_KEY = "ukboards-metadata";
    public static final DateTimeFormatter METADATA_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    public static final DateTimeFormatter FILE_NAME_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH:mm:ss");
    private static final String EMPTY_SET = "set()";

    private static final Logger log = LoggerFactory.getLogger(GraphJsonStore.class);

    private final ObjectMapper objectMapper;
    private final Path dataDirectory;

    public GraphJsonStore(ObjectMapper objectMapper, BoardsProperties properties) {
        this.objectMapper = objectMapper;
        this.dataDirectory = Paths.get(properties.getData().getJsonPath());
    }

    public Path dataDirectory() {
        return dataDirectory;
    }

    public static String networkFileName(String prefix, LocalDateTime time) {
        return prefix + "-" + FILE_NAME_TIME_FORMAT.format(time) + ".json";
    }

    /**
     * The most recently modified {@code .json} file in {@code directory} whose name contains
     * {@code prefix}.
     */
    public Path latestNetworkFile(Path directory, String prefix) {
        String pattern = "*" + (prefix == null ? "" : prefix) + "*.json";
        Path latest = null;
        FileTime latestTime = null;
        if (Files.isDirectory(directory)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, pattern)) {
                for (Path file : files) {
                    FileTime modified = Files.getLastModifiedTime(file);
                    if (latestTime == null || modified.compareTo(latestTime) > 0) {
                        latest = file;
                        latestTime = modified;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + directory, e);
            }
        }
        if (latest == null) {
            throw new NoMatchingDataPathException(directory, prefix);
        }
        return latest;
    }

    public void write(BoardGraph graph, RunRecord run, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), toNodeLink(graph, run));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write network to " + path, e);
        }
        log.info("Wrote {} nodes and {} edges to {}", graph.nodeCount(), graph.edgeCount(), path);
    }

    public StoredNetwork read(Path path) {
        try {
            return fromNodeLink(objectMapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read network from " + path, e);
        }
    }

    public ObjectNode toNodeLink(BoardGraph graph, RunRecord run) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("directed", false);
        root.put("multigraph", false);
        root.set("graph", objectMapper.createObjectNode());
        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : graph.nodes()) {
            ObjectNode json = nodes.addObject();
            json.put("id", node.id());
            json.put("name", node.name());
            json.put("kind", node.kind().label());
            json.put("bipartite", node.bipartite());
            json.put("is_person", node.isPerson());
            json.put("category", node.category());
            json.set("data", node.data());
        }
        ArrayNode links = root.putArray("links");
        for (GraphEdge edge : graph.edges()) {
            ObjectNode json = links.addObject();
            json.put("source", edge.organisationId());
            json.put("target", edge.memberId());
            json.set("data", edge.data());
        }
        if (run != null) {
            root.set(METADATA_KEY, runToJson(run));
        }
        return root;
    }

    public StoredNetwork fromNodeLink(JsonNode root) {
        BoardGraph graph = new BoardGraph();
        for (JsonNode json : root.path("nodes")) {
            graph.addNode(new GraphNode(
                json.path("id").asText(),
                json.path("name").asText(""),
                NodeKind.fromLabel(json.path("kind").asText()),
                json.path("bipartite").asInt(),
                json.path("is_person").asBoolean(false),
                json.hasNonNull("category") ? json.get("category").asText() : null,
                dataOf(json)
            ));
        }
        for (JsonNode json : root.path("links")) {
            graph.addEdge(json.path("source").asText(), json.path("target").asText(), dataOf(json));
        }
        JsonNode metadata = root.get(METADATA_KEY);
        RunRecord run = metadata == null || metadata.isNull() ? null : runFromJson(metadata);
        return new StoredNetwork(graph, run);
    }

    private JsonNode dataOf(JsonNode json) {
        JsonNode data = json.get("data");
        return data == null || data.isNull() ? null : data;
    }

    ObjectNode runToJson(RunRecord run) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("kind", run.kind());
        ArrayNode rootIds = json.putArray("root_ids");
        run.rootIds().forEach(rootIds::add);
        json.set("parameter_state", objectMapper.valueToTree(run.parameterState()));
        json.put("start_time", formatTime(run.startTime()));
        json.put("end_time", formatTime(run.endTime()));
        if (run.connectedComponentsCount() == null) {
            json.putNull("connected_components_count");
        } else {
            json.put("connected_components_count", run.connectedComponentsCount());
        }
        ObjectNode kinds = json.putObject("kinds_ids_dict");
        for (Map.Entry<String, Set<String>> entry : run.kindsIds().entrySet()) {
            kinds.put(entry.getKey(), formatSet(entry.getValue()));
        }
        if (run.success() == null) {
            json.putNull("success");
        } else {
            json.put("success", run.success());
        }
        ArrayNode composed = json.putArray("composed_runs");
        for (RunRecord child : run.composedRuns()) {
            composed.add(runToJson(child));
        }
        return json;
    }

    RunRecord runFromJson(JsonNode json) {
        List<String> rootIds = new ArrayList<>();
        for (JsonNode rootId : json.path("root_ids")) {
            rootIds.add(rootId.asText());
        }
        Map<String, Object> parameterState = json.hasNonNull("parameter_state")
            ? objectMapper.convertValue(json.get("parameter_state"), new TypeReference<LinkedHashMap<String, Object>>() {})
            : Map.of();
        Map<String, Set<String>> kindsIds = new LinkedHashMap<>();
        json.path("kinds_ids_dict").fields().forEachRemaining(entry -> kindsIds.put(entry.getKey(), parseSet(entry.getValue())));
        List<RunRecord> composed = new ArrayList<>();
        for (JsonNode child : json.path("composed_runs")) {
            composed.add(runFromJson(child));
        }
        return new RunRecord(
            json.path("kind").asText(null),
            rootIds,
            parameterState,
            parseTime(json.get("start_time")),
            parseTime(json.get("end_time")),
            json.hasNonNull("connected_components_count") ? json.get("connected_components_count").asInt() : null,
            kindsIds,
            json.hasNonNull("success") ? json.get("success").asBoolean() : null,
            composed
        );
    }

    static String formatSet(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY_SET;
        }
        StringJoiner joined = new StringJoiner(", ", "{", "}");
        for (String value : new TreeSet<>(values)) {
            joined.add("'" + value + "'");
        }
        return joined.toString();
    }

    static Set<String> parseSet(JsonNode value) {
        Set<String> result = new TreeSet<>();
        if (value == null || value.isNull()) {
            return result;
        }
        if (value.isArray()) {
            value.forEach(item -> result.add(item.asText()));
            return result;
        }
        String text = value.asText().trim();
        if (text.equals(EMPTY_SET) || text.length() < 2 || !text.startsWith("{") || !text.endsWith("}")) {
            return result;
        }
        String inner = text.substring(1, text.length() - 1).trim();
        if (inner.isEmpty()) {
            return result;
        }
        for (String item : inner.split(", ")) {
            String trimmed = item.trim();
            if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
            result.add(trimmed);
        }
        return result;
    }

    private static String formatTime(LocalDateTime time) {
        return time == null ? null : METADATA_TIME_FORMAT.format(time);
    }

    private static LocalDateTime parseTime(JsonNode value) {
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.asText(), METADATA_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Unreadable run time {}: {}", value.asText(), e.getMessage());
            return null;
        }
    }
}
