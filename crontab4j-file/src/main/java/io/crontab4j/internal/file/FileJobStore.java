package io.crontab4j.internal.file;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronStoreFile;
import io.crontab4j.core.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Persists the job list as a single JSON document at {@code <storeDir>/jobs.json}.
 *
 * <p>Writes go to a temp file first and are renamed over the target, so a failed save leaves the
 * previous file intact. Not thread-safe: callers hold the critical section.
 */
public class FileJobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    static final String STORE_FILE = "jobs.json";

    private final Path storeDir;
    private final Path storeFile;
    private final ObjectMapper objectMapper;

    private CronStoreFile cached;

    public FileJobStore(Path storeDir, ObjectMapper objectMapper) {
        this.storeDir = Objects.requireNonNull(storeDir, "storeDir must not be null");
        this.storeFile = storeDir.resolve(STORE_FILE);
        this.objectMapper = configure(Objects.requireNonNull(objectMapper, "objectMapper must not be null").copy());
    }

    static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Path storeDir() {
        return storeDir;
    }

    public Path storeFile() {
        return storeFile;
    }

    /**
     * Current in-memory store, loading it on first use.
     */
    public CronStoreFile current() {
        return cached != null ? cached : load(false);
    }

    /**
     * Return the cached store, or read it from disk when nothing is cached or a reload is forced.
     *
     * @throws UncheckedIOException when the file exists but cannot be read or parsed
     */
    public CronStoreFile load(boolean forceReload) {
        if (cached != null && !forceReload) {
            return cached;
        }
        CronStoreFile loaded;
        try {
            loaded = objectMapper.readValue(Files.readAllBytes(storeFile), CronStoreFile.class);
        } catch (NoSuchFileException e) {
            loaded = new CronStoreFile();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read cron store " + storeFile, e);
        }
        if (loaded == null) {
            loaded = new CronStoreFile();
        }
        List<CronJob> jobs = new ArrayList<>();
        for (CronJob job : loaded.getJobs()) {
            if (job == null) {
                continue;
            }
            if (job.getState() == null) {
                job.setState(new JobState());
            }
            jobs.add(job);
        }
        loaded.setJobs(jobs);
        cached = loaded;
        return cached;
    }

    /**
     * Atomically write the cached store to disk.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public void save() {
        CronStoreFile store = current();
        try {
            Files.createDirectories(storeDir);
            Path tmp = storeDir.resolve(STORE_FILE + "." + ProcessHandle.current().pid() + "."
                    + Long.toHexString(ThreadLocalRandom.current().nextLong()) + ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), store);
                moveOver(tmp, storeFile);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write cron store " + storeFile, e);
        }
        try {
            Files.copy(storeFile, storeDir.resolve(STORE_FILE + ".bak"), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.debug("cron store backup failed path={} msg={}", storeFile, e.getMessage());
        }
    }

    static void moveOver(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
