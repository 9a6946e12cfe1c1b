package io.crontab4j.internal.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crontab4j.core.RunLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Append-only NDJSON history per job at {@code <storeDir>/runs/<jobId>.jsonl}.
 *
 * <p>Files are pruned by size: once a file grows past {@code maxBytes} it is rewritten with only
 * the newest {@code keepLines} lines. Writes to the same file are serialised through a fixed set of
 * lock stripes keyed by path. Files are decoded leniently: bytes that are not valid UTF-8, such as a
 * torn append, only spoil their own line.
 */
public class FileRunLog {
    private static final Logger log = LoggerFactory.getLogger(FileRunLog.class);

    public static final int MAX_LIMIT = 5000;

    private static final int STRIPES = 64;

    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final ObjectMapper objectMapper;
    private final long maxBytes;
    private final int keepLines;
    private final Object[] stripes = new Object[STRIPES];

    public FileRunLog(ObjectMapper objectMapper, long maxBytes, int keepLines) {
        this.objectMapper = FileJobStore.configure(
                Objects.requireNonNull(objectMapper, "objectMapper must not be null").copy());
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (keepLines <= 0) {
            throw new IllegalArgumentException("keepLines must be positive");
        }
        this.maxBytes = maxBytes;
        this.keepLines = keepLines;
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    /**
     * @throws IllegalArgumentException if the job id could escape the runs directory
     */
    public static Path pathFor(Path storeDir, String jobId) {
        if (jobId == null || !JOB_ID.matcher(jobId).matches() || jobId.equals(".") || jobId.equals("..")) {
            throw new IllegalArgumentException("invalid cron job id for run log: " + jobId);
        }
        return storeDir.resolve("runs").resolve(jobId + ".jsonl");
    }

    public void append(Path path, RunLogEntry entry) {
        synchronized (monitorFor(path)) {
            try {
                Files.createDirectories(path.getParent());
                String line = objectMapper.writeValueAsString(entry) + "\n";
                Files.writeString(path, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                if (Files.size(path) > maxBytes) {
                    prune(path);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("failed to append run log " + path, e);
            }
        }
    }

    /**
     * Newest finished entries, returned oldest first.
     *
     * @param limit  clamped to [1, 5000]; callers without a preference pass
     *               {@link io.crontab4j.CronService#DEFAULT_RUNS_LIMIT}
     * @param jobId  when non-null, only entries of this job are returned
     */
    public List<RunLogEntry> read(Path path, int limit, String jobId) {
        int max = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<String> lines;
        try {
            lines = readLines(path);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read run log " + path, e);
        }

        List<RunLogEntry> result = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && result.size() < max; i--) {
            RunLogEntry entry = parse(lines.get(i));
            if (entry == null) {
                continue;
            }
            if (jobId != null && !jobId.equals(entry.jobId())) {
                continue;
            }
            result.add(entry);
        }
        Collections.reverse(result);
        return result;
    }

    public void clear(Path path) {
        synchronized (monitorFor(path)) {
            try {
                if (Files.exists(path)) {
                    Files.writeString(path, "", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("failed to clear run log " + path, e);
            }
        }
    }

    /**
     * Remove entries whose {@code ts} is in {@code timestamps}. Lines that cannot be parsed are kept.
     *
     * @return number of entries removed
     */
    public int deleteEntries(Path path, Collection<Long> timestamps) {
        if (timestamps == null || timestamps.isEmpty()) {
            return 0;
        }
        Set<Long> targets = Set.copyOf(timestamps);
        synchronized (monitorFor(path)) {
            try {
                List<String> lines;
                try {
                    lines = readLines(path);
                } catch (NoSuchFileException e) {
                    return 0;
                }
                List<String> kept = new ArrayList<>(lines.size());
                int removed = 0;
                for (String line : lines) {
                    if (line.isBlank()) {
                        continue;
                    }
                    Long ts = timestampOf(line);
                    if (ts != null && targets.contains(ts)) {
                        removed++;
                    } else {
                        kept.add(line);
                    }
                }
                if (removed > 0) {
                    rewrite(path, kept);
                }
                return removed;
            } catch (IOException e) {
                throw new UncheckedIOException("failed to rewrite run log " + path, e);
            }
        }
    }

    private void prune(Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : readLines(path)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        List<String> kept = lines.subList(Math.max(0, lines.size() - keepLines), lines.size());
        rewrite(path, kept);
        log.debug("cron run log pruned path={} kept={} dropped={}", path, kept.size(), lines.size() - kept.size());
    }

    // Malformed bytes decode to U+FFFD instead of failing the whole file.
    private static List<String> readLines(Path path) throws IOException {
        String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    private static void rewrite(Path path, List<String> lines) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + "." + ProcessHandle.current().pid() + "."
                + Long.toHexString(ThreadLocalRandom.current().nextLong()) + ".tmp");
        try {
            StringBuilder sb = new StringBuilder();
            for (String line : lines) {
                sb.append(line).append('\n');
            }
            Files.writeString(tmp, sb.toString(), StandardCharsets.UTF_8);
            FileJobStore.moveOver(tmp, path);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private RunLogEntry parse(String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node == null || !node.isObject()
                    || !RunLogEntry.FINISHED.equals(node.path("action").asText(null))
                    || node.path("jobId").asText("").isBlank()
                    || !node.path("ts").isNumber()) {
                return null;
            }
            return objectMapper.treeToValue(node, RunLogEntry.class);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("cron run log skipping malformed line msg={}", e.getMessage());
            return null;
        }
    }

    private Long timestampOf(String line) {
        try {
            JsonNode ts = objectMapper.readTree(line).path("ts");
            return ts.isNumber() ? ts.asLong() : null;
        } catch (IOException e) {
            return null;
        }
    }

    private Object monitorFor(Path path) {
        int h = path.toAbsolutePath().normalize().hashCode();
        return stripes[Math.floorMod(h ^ (h >>> 16), STRIPES)];
    }
}
