package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.PublishException;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * On-disk home of every published run.
 *
 * Layout under the base directory:
 *   {source}_{yyyyMMdd_HHmmss}[_n]/   one directory per run, never modified after publish
 *   .staging/{jobId}/                  job-private scratch space, moved into place on publish
 *   .latest/{source}                   text file holding the latest runId for the source
 *
 * A run directory only appears through an atomic rename of a fully written staging directory,
 * and the latest pointer is only swapped after that rename succeeded. The pointer never moves
 * to a run older than the one it currently names.
 *
 * Full snapshots are cached for the few most recently read runs only; history rows are
 * built from each run's metadata block without loading its posts.
 */
@Service
@Slf4j
public class RunVersionStore {

    public static final String SNAPSHOT_FILE = "dashboard_data.json";

    private static final String STAGING_DIR = ".staging";
    private static final String POINTER_DIR = ".latest";
    private static final DateTimeFormatter RUN_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern RUN_DIR = Pattern.compile("^(.+)_(\\d{8}_\\d{6})(?:_(\\d+))?$");

    private final ObjectMapper objectMapper;
    private final Path baseDir;

    /** Run ids handed out but not yet on disk. Guarded by {@code this}. */
    private final Set<String> reservedRunIds = new HashSet<>();
    /** Least recently read snapshots are evicted first. Guarded by itself. */
    private final Map<String, RunSnapshot> snapshotCache;
    private final Map<String, RunMetadata> metadataCache = new ConcurrentHashMap<>();

    public RunVersionStore(InsightPipelineProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.baseDir = Paths.get(properties.getOutput().getBaseDir()).toAbsolutePath();
        int cacheSize = Math.max(1, properties.getOutput().getSnapshotCacheSize());
        this.snapshotCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RunSnapshot> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /** Writes the content of a run into the directory it is given. */
    @FunctionalInterface
    public interface RunContentWriter {
        void write(Path directory, RunSnapshot snapshot) throws IOException;
    }

    // ── Write side ───────────────────────────────────────────────────────────

    /**
     * Creates a fresh job-private staging directory.
     */
    public Path stage(String jobId) {
        Path dir = baseDir.resolve(STAGING_DIR).resolve(jobId + "-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new PublishException("Cannot create staging directory " + dir, e);
        }
    }

    /**
     * Assigns a run id, writes the run into {@code stagingDir} and links it into the shared
     * namespace. Returns the snapshot as published (with its run id filled in).
     */
    public RunSnapshot publish(RunSnapshot snapshot, Path stagingDir, RunContentWriter writer) {
        RunMetadata meta = snapshot.getMetadata();
        String source = meta.getSource();
        String runId = reserveRunId(source, meta.getGeneratedAt());
        RunSnapshot published = snapshot.toBuilder()
                .metadata(meta.toBuilder().runId(runId).build())
                .build();
        Path target = baseDir.resolve(runId);

        try {
            writer.write(stagingDir, published);
            moveAtomically(stagingDir, target);
        } catch (IOException | RuntimeException e) {
            release(runId);
            deleteQuietly(stagingDir);
            throw new PublishException("Failed to publish run " + runId + ": " + e.getMessage(), e);
        }
        release(runId);

        try {
            updateLatestPointer(source, runId);
        } catch (IOException e) {
            // The run must not stay visible when the job is about to be reported as failed.
            deleteQuietly(target);
            throw new PublishException("Failed to update latest pointer for " + source + ": " + e.getMessage(), e);
        }

        cache(runId, published);
        log.info("Published run {} ({} posts, {} categories)", runId, meta.getNumPosts(), meta.getNumCategories());
        return published;
    }

    /** Removes a staging directory left by a job that did not publish. */
    public void discard(Path stagingDir) {
        if (stagingDir != null) {
            deleteQuietly(stagingDir);
        }
    }

    // ── Read side ────────────────────────────────────────────────────────────

    public Optional<RunSnapshot> latest(String source) {
        return latestRunId(source).map(this::loadSnapshot);
    }

    public Optional<String> latestRunId(String source) {
        Optional<String> pointed = readPointer(source).filter(id -> Files.isDirectory(baseDir.resolve(id)));
        if (pointed.isPresent()) {
            return pointed;
        }
        List<String> runIds = runIds(source);
        return runIds.isEmpty() ? Optional.empty() : Optional.of(runIds.get(runIds.size() - 1));
    }

    /** Published runs for the source, oldest first. */
    public List<RunSummary> history(String source) {
        List<String> runIds = runIds(source);
        String current = runIds.isEmpty() ? null : latestRunId(source).orElse(null);
        List<RunSummary> summaries = new ArrayList<>(runIds.size());
        for (String runId : runIds) {
            summaries.add(RunSummary.of(loadMetadata(runId), runId.equals(current)));
        }
        return summaries;
    }

    public Optional<RunSnapshot> load(String source, String runId) {
        RunId parsed = RunId.parse(runId);
        if (parsed == null || !parsed.source().equals(source) || !Files.isDirectory(baseDir.resolve(runId))) {
            return Optional.empty();
        }
        return Optional.of(loadSnapshot(runId));
    }

    /** Every source with at least one published run, sorted by name. */
    public List<String> list() {
        Set<String> sources = new TreeSet<>();
        for (RunId id : scanRunDirectories()) {
            sources.add(id.source());
        }
        return new ArrayList<>(sources);
    }

    // ── Startup recovery ─────────────────────────────────────────────────────

    /**
     * Drops staging directories left behind by a crash and points every source at its
     * newest complete run.
     */
    public void recover() {
        Path staging = baseDir.resolve(STAGING_DIR);
        if (Files.isDirectory(staging)) {
            try (Stream<Path> leftovers = Files.list(staging)) {
                leftovers.forEach(dir -> {
                    log.warn("Removing abandoned staging directory {}", dir.getFileName());
                    deleteQuietly(dir);
                });
            } catch (IOException e) {
                log.warn("Could not clean staging area {}: {}", staging, e.getMessage());
            }
        }

        for (String source : list()) {
            List<String> runIds = runIds(source);
            String newest = runIds.get(runIds.size() - 1);
            Optional<String> pointed = readPointer(source);
            if (pointed.isEmpty() || !pointed.get().equals(newest)) {
                try {
                    writePointer(source, newest);
                    log.info("Repaired latest pointer for {} → {}", source, newest);
                } catch (IOException e) {
                    log.warn("Could not repair latest pointer for {}: {}", source, e.getMessage());
                }
            }
        }
        log.info("Run store ready at {} ({} sources)", baseDir, list().size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized String reserveRunId(String source, Instant generatedAt) {
        String base = source + "_" + RUN_TIMESTAMP.format(generatedAt);
        String candidate = base;
        int n = 2;
        while (reservedRunIds.contains(candidate) || Files.exists(baseDir.resolve(candidate))) {
            candidate = base + "_" + n++;
        }
        reservedRunIds.add(candidate);
        return candidate;
    }

    private synchronized void release(String runId) {
        reservedRunIds.remove(runId);
    }

    private synchronized void updateLatestPointer(String source, String runId) throws IOException {
        RunId current = readPointer(source)
                .filter(id -> Files.isDirectory(baseDir.resolve(id)))
                .map(RunId::parse)
                .orElse(null);
        if (current != null && RunId.ORDER.compare(current, RunId.parse(runId)) > 0) {
            log.warn("Not moving latest pointer for {} back from {} to {}", source, current.value(), runId);
            return;
        }
        writePointer(source, runId);
    }

    private void writePointer(String source, String runId) throws IOException {
        Path pointerDir = baseDir.resolve(POINTER_DIR);
        Files.createDirectories(pointerDir);
        Path tmp = pointerDir.resolve(source + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, runId, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, pointerDir.resolve(source), StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private Optional<String> readPointer(String source) {
        Path pointer = baseDir.resolve(POINTER_DIR).resolve(source);
        try {
            String value = Files.readString(pointer, StandardCharsets.UTF_8).strip();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable latest pointer for {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> runIds(String source) {
        return scanRunDirectories().stream()
                .filter(id -> id.source().equals(source))
                .sorted(RunId.ORDER)
                .map(RunId::value)
                .toList();
    }

    private List<RunId> scanRunDirectories() {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(baseDir)) {
            return entries
                    .filter(Files::isDirectory)
                    .map(p -> RunId.parse(p.getFileName().toString()))
                    .filter(id -> id != null && Files.exists(baseDir.resolve(id.value()).resolve(SNAPSHOT_FILE)))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list run directory " + baseDir, e);
        }
    }

    private RunSnapshot loadSnapshot(String runId) {
        RunSnapshot cached;
        synchronized (snapshotCache) {
            cached = snapshotCache.get(runId);
        }
        if (cached != null) {
            return cached;
        }
        Path file = baseDir.resolve(runId).resolve(SNAPSHOT_FILE);
        try {
            RunSnapshot snapshot = objectMapper.readValue(file.toFile(), RunSnapshot.class);
            cache(runId, snapshot);
            return snapshot;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read snapshot " + file, e);
        }
    }

    private void cache(String runId, RunSnapshot snapshot) {
        synchronized (snapshotCache) {
            snapshotCache.put(runId, snapshot);
        }
        metadataCache.put(runId, snapshot.getMetadata());
    }

    int cachedSnapshotCount() {
        synchronized (snapshotCache) {
            return snapshotCache.size();
        }
    }

    /** Streams the snapshot file up to its metadata block; posts and insights are skipped unparsed. */
    private RunMetadata loadMetadata(String runId) {
        RunMetadata cached = metadataCache.get(runId);
        if (cached != null) {
            return cached;
        }
        Path file = baseDir.resolve(runId).resolve(SNAPSHOT_FILE);
        try (JsonParser parser = objectMapper.getFactory().createParser(file.toFile())) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Snapshot is not a JSON object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                parser.nextToken();
                if ("metadata".equals(field)) {
                    RunMetadata meta = objectMapper.readValue(parser, RunMetadata.class);
                    metadataCache.put(runId, meta);
                    return meta;
                }
                parser.skipChildren();
            }
            throw new IOException("Snapshot has no metadata block");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read run metadata " + file, e);
        }
    }

    private void moveAtomically(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("Filesystem does not support atomic rename for " + to, e);
        }
    }

    private void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }

    /** Parsed form of a run directory name. */
    record RunId(String value, String source, String timestamp, int sequence) {

        static final Comparator<RunId> ORDER = Comparator
                .comparing(RunId::timestamp)
                .thenComparingInt(RunId::sequence);

        static RunId parse(String name) {
            if (name == null) return null;
            Matcher m = RUN_DIR.matcher(name);
            if (!m.matches()) return null;
            int seq = m.group(3) != null ? Integer.parseInt(m.group(3)) : 1;
            return new RunId(name, m.group(1), m.group(2), seq);
        }
    }
}
