package com.tanmi.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.LogEntry;
import com.tanmi.core.model.Memo;
import com.tanmi.core.model.NodeDetail;
import com.tanmi.core.model.NodeGraph;
import com.tanmi.core.model.Problem;
import com.tanmi.core.model.WorkspaceConfig;
import com.tanmi.core.model.WorkspaceDetail;
import com.tanmi.core.model.WorkspaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link WorkspaceStore} that keeps every object as a JSON file.
 *
 * <p>Layout:
 * <pre>
 * {home}/index.json                                   registry of all workspaces
 * {projectRoot}/{workspaceDir}/{key}/workspace.json   config
 *                                   /detail.json      goal, rules, docs
 *                                   /graph.json       node graph
 *                                   /log.jsonl        workspace log, one entry per line
 *                                   /problem.json
 *                                   /nodes/{key}/     detail.json, log.jsonl, problem.json
 *                                   /memos/{id}.json
 * </pre>
 *
 * <p>Whole-object writes go to a temp file first and are moved into place atomically.
 */
public class JsonFileWorkspaceStore implements WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileWorkspaceStore.class);

    private static final String INDEX_FILE = "index.json";
    private static final String CONFIG_FILE = "workspace.json";
    private static final String DETAIL_FILE = "detail.json";
    private static final String GRAPH_FILE = "graph.json";
    private static final String LOG_FILE = "log.jsonl";
    private static final String PROBLEM_FILE = "problem.json";
    private static final String NODES_DIR = "nodes";
    private static final String MEMOS_DIR = "memos";

    private static final TypeReference<List<IndexEntry>> INDEX_TYPE = new TypeReference<>() {};

    private final Path home;
    private final String workspaceDirName;
    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;
    private final Object indexLock = new Object();

    public JsonFileWorkspaceStore(Path home, String workspaceDirName, ObjectMapper objectMapper) {
        this.home = Objects.requireNonNull(home, "home must not be null");
        this.workspaceDirName = Objects.requireNonNull(workspaceDirName, "workspaceDirName must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Mapper settings the on-disk format relies on: ISO-8601 instants, tolerant of unknown fields.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    // --- workspace registry ---

    @Override
    public void registerWorkspace(WorkspaceConfig config, WorkspaceDetail detail, NodeGraph graph) {
        var key = StorageKey.forWorkspace(config.getName(), config.getId());
        var entry = new IndexEntry(config.getId(), config.getName(), config.getProjectRoot(), key.value(),
                config.getStatus(), config.getCreatedAt(), config.getUpdatedAt());

        synchronized (indexLock) {
            var entries = readIndex();
            if (entries.stream().anyMatch(e -> e.id().equals(config.getId()))) {
                throw new TanmiException(ErrorCode.WORKSPACE_EXISTS,
                        "Workspace '%s' is already registered".formatted(config.getId()));
            }
            var dir = workspaceDir(entry);
            createDirectories(dir.resolve(NODES_DIR));
            createDirectories(dir.resolve(MEMOS_DIR));
            writeJson(dir.resolve(CONFIG_FILE), config);
            writeJson(dir.resolve(DETAIL_FILE), detail);
            writeJson(dir.resolve(GRAPH_FILE), graph);

            entries.add(entry);
            writeIndex(entries);
        }
        log.info("Registered workspace {} ({}) at {}", config.getId(), config.getName(), config.getProjectRoot());
    }

    @Override
    public Optional<WorkspaceConfig> findWorkspace(String workspaceId) {
        return findEntry(workspaceId).map(this::loadConfig);
    }

    @Override
    public List<WorkspaceConfig> listWorkspaces() {
        List<IndexEntry> entries;
        synchronized (indexLock) {
            entries = readIndex();
        }
        return entries.stream().map(this::loadConfig).toList();
    }

    @Override
    public void deleteWorkspace(String workspaceId) {
        synchronized (indexLock) {
            var entries = readIndex();
            var entry = entries.stream()
                    .filter(e -> e.id().equals(workspaceId))
                    .findFirst()
                    .orElseThrow(() -> notFound(workspaceId));
            deleteRecursively(workspaceDir(entry));
            entries.remove(entry);
            writeIndex(entries);
        }
        log.info("Deleted workspace storage for {}", workspaceId);
    }

    // --- workspace objects ---

    @Override
    public WorkspaceConfig readConfig(String workspaceId) {
        return findWorkspace(workspaceId).orElseThrow(() -> notFound(workspaceId));
    }

    @Override
    public void writeConfig(WorkspaceConfig config) {
        synchronized (indexLock) {
            var entries = readIndex();
            int index = -1;
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).id().equals(config.getId())) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                throw notFound(config.getId());
            }
            var existing = entries.get(index);
            writeJson(workspaceDir(existing).resolve(CONFIG_FILE), config);
            entries.set(index, new IndexEntry(existing.id(), config.getName(), existing.projectRoot(),
                    existing.dirName(), config.getStatus(), existing.createdAt(), config.getUpdatedAt()));
            writeIndex(entries);
        }
    }

    @Override
    public NodeGraph readGraph(String workspaceId) {
        return readJson(workspaceDir(workspaceId).resolve(GRAPH_FILE), NodeGraph.class)
                .orElseThrow(() -> new UncheckedIOException(
                        new IOException("Graph missing for workspace " + workspaceId)));
    }

    @Override
    public void writeGraph(String workspaceId, NodeGraph graph) {
        writeJson(workspaceDir(workspaceId).resolve(GRAPH_FILE), graph);
    }

    @Override
    public WorkspaceDetail readWorkspaceDetail(String workspaceId) {
        return readJson(workspaceDir(workspaceId).resolve(DETAIL_FILE), WorkspaceDetail.class)
                .orElseGet(() -> new WorkspaceDetail("", List.of(), List.of()));
    }

    @Override
    public void writeWorkspaceDetail(String workspaceId, WorkspaceDetail detail) {
        writeJson(workspaceDir(workspaceId).resolve(DETAIL_FILE), detail);
    }

    // --- nodes ---

    @Override
    public NodeDetail readDetail(String workspaceId, String nodeId) {
        return readJson(nodeDir(workspaceId, nodeId).resolve(DETAIL_FILE), NodeDetail.class)
                .orElseGet(NodeDetail::empty);
    }

    @Override
    public void writeDetail(String workspaceId, String nodeId, NodeDetail detail) {
        writeJson(nodeDir(workspaceId, nodeId).resolve(DETAIL_FILE), detail);
    }

    @Override
    public void deleteNode(String workspaceId, String nodeId) {
        deleteRecursively(nodeDir(workspaceId, nodeId));
    }

    @Override
    public void appendLog(String workspaceId, String nodeId, LogEntry entry) {
        var file = scopeDir(workspaceId, nodeId).resolve(LOG_FILE);
        try {
            createDirectories(file.getParent());
            var line = lineWriter.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append log entry to " + file, e);
        }
    }

    @Override
    public List<LogEntry> readLog(String workspaceId, String nodeId) {
        var file = scopeDir(workspaceId, nodeId).resolve(LOG_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<LogEntry> entries = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(objectMapper.readValue(line, LogEntry.class));
                }
            }
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read log " + file, e);
        }
    }

    @Override
    public Problem readProblem(String workspaceId, String nodeId) {
        return readJson(scopeDir(workspaceId, nodeId).resolve(PROBLEM_FILE), Problem.class)
                .orElse(Problem.NONE);
    }

    @Override
    public void writeProblem(String workspaceId, String nodeId, Problem problem) {
        writeJson(scopeDir(workspaceId, nodeId).resolve(PROBLEM_FILE), problem);
    }

    // --- memos ---

    @Override
    public Optional<Memo> findMemo(String workspaceId, String memoId) {
        return readJson(memoFile(workspaceId, memoId), Memo.class);
    }

    @Override
    public List<Memo> listMemos(String workspaceId) {
        var dir = workspaceDir(workspaceId).resolve(MEMOS_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .map(p -> readJson(p, Memo.class))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(Memo::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list memos in " + dir, e);
        }
    }

    @Override
    public void writeMemo(String workspaceId, Memo memo) {
        writeJson(memoFile(workspaceId, memo.id()), memo);
    }

    @Override
    public void deleteMemo(String workspaceId, String memoId) {
        try {
            Files.deleteIfExists(memoFile(workspaceId, memoId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete memo " + memoId, e);
        }
    }

    // --- paths ---

    private Path workspaceDir(IndexEntry entry) {
        return Path.of(entry.projectRoot()).resolve(workspaceDirName).resolve(entry.dirName());
    }

    private Path workspaceDir(String workspaceId) {
        return findEntry(workspaceId).map(this::workspaceDir).orElseThrow(() -> notFound(workspaceId));
    }

    private Path nodeDir(String workspaceId, String nodeId) {
        return workspaceDir(workspaceId).resolve(NODES_DIR).resolve(StorageKey.forNode(nodeId).value());
    }

    private Path scopeDir(String workspaceId, String nodeId) {
        return nodeId == null ? workspaceDir(workspaceId) : nodeDir(workspaceId, nodeId);
    }

    private Path memoFile(String workspaceId, String memoId) {
        if (memoId == null || memoId.isBlank() || memoId.contains("/") || memoId.contains("\\")
                || memoId.contains("..")) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Invalid memo id '%s'".formatted(memoId));
        }
        return workspaceDir(workspaceId).resolve(MEMOS_DIR).resolve(memoId + ".json");
    }

    // --- index ---

    private Optional<IndexEntry> findEntry(String workspaceId) {
        synchronized (indexLock) {
            return readIndex().stream().filter(e -> e.id().equals(workspaceId)).findFirst();
        }
    }

    private List<IndexEntry> readIndex() {
        var file = home.resolve(INDEX_FILE);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(file.toFile(), INDEX_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workspace index " + file, e);
        }
    }

    private void writeIndex(List<IndexEntry> entries) {
        createDirectories(home);
        writeJson(home.resolve(INDEX_FILE), entries);
    }

    /**
     * Config for an index entry. A workspace whose project directory has disappeared is
     * reported from the index alone with status {@link WorkspaceStatus#ERROR}.
     */
    private WorkspaceConfig loadConfig(IndexEntry entry) {
        return readJson(workspaceDir(entry).resolve(CONFIG_FILE), WorkspaceConfig.class)
                .orElseGet(() -> {
                    log.warn("Workspace {} has no readable config under {}", entry.id(), entry.projectRoot());
                    var config = new WorkspaceConfig();
                    config.setId(entry.id());
                    config.setName(entry.name());
                    config.setProjectRoot(entry.projectRoot());
                    config.setStatus(WorkspaceStatus.ERROR);
                    config.setCreatedAt(entry.createdAt());
                    config.setUpdatedAt(entry.updatedAt());
                    return config;
                });
    }

    // --- file helpers ---

    private <T> Optional<T> readJson(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private void writeJson(Path file, Object value) {
        createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + root, e);
        }
    }

    private static TanmiException notFound(String workspaceId) {
        return new TanmiException(ErrorCode.WORKSPACE_NOT_FOUND,
                "Workspace '%s' not found".formatted(workspaceId),
                "List workspaces to find a valid id");
    }

    /** Registry row; {@code dirName} is the workspace's storage key. */
    record IndexEntry(String id, String name, String projectRoot, String dirName,
                      WorkspaceStatus status, Instant createdAt, Instant updatedAt) {
    }
}
