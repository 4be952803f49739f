package com.appraisalplatform.common.replay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * File-backed {@link ReplayStore}: one JSON document per line.
 *
 * <p>Eviction and sampling are delegated to an {@link InMemoryReplayStore}; the file is
 * the durable copy. Existing records are reloaded on construction and the file is
 * compacted to the surviving set. Appends are line appends; {@link #purgeExpired()} and
 * {@link #clear()} rewrite the file. Write failures are logged and never surface to
 * the appending agent.
 */
public class JsonLinesReplayStore implements ReplayStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesReplayStore.class);

    private final InMemoryReplayStore delegate;
    private final ObjectMapper objectMapper;
    private final Path file;
    private int appendsSinceCompaction;

    public JsonLinesReplayStore(InMemoryReplayStore delegate, ObjectMapper objectMapper, Path file) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.file = Objects.requireNonNull(file, "file");
        load();
    }

    @Override
    public synchronized void append(ReplayRecord record) {
        delegate.append(record);
        try {
            if (delegate.settings().deduplicateSimilar()
                    && delegate.getAll().stream().noneMatch(r -> r.id().equals(record.id()))) {
                // merged into a stored record, whose line on disk is now stale
                rewrite();
                return;
            }
            writeLine(record);
            appendsSinceCompaction++;
            // evicted records linger in the file until the next rewrite
            if (appendsSinceCompaction >= delegate.settings().maxSize()) {
                rewrite();
            }
        } catch (IOException e) {
            log.error("Replay record not persisted. recordId={} file={}", record.id(), file, e);
        }
    }

    @Override
    public List<ReplayRecord> sample(int n, boolean prioritized) {
        return delegate.sample(n, prioritized);
    }

    @Override
    public List<ReplayRecord> sampleByAgent(String agentId, int n) {
        return delegate.sampleByAgent(agentId, n);
    }

    @Override
    public List<ReplayRecord> sampleByType(String type, int n) {
        return delegate.sampleByType(type, n);
    }

    @Override
    public List<ReplayRecord> highPriority() {
        return delegate.highPriority();
    }

    @Override
    public List<ReplayRecord> getAll() {
        return delegate.getAll();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public synchronized int purgeExpired() {
        int removed = delegate.purgeExpired();
        if (removed > 0) {
            rewriteQuietly();
        }
        return removed;
    }

    @Override
    public ReplayStatistics statistics() {
        return delegate.statistics();
    }

    @Override
    public synchronized void clear() {
        delegate.clear();
        rewriteQuietly();
    }

    public Path file() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        int loaded = 0;
        int skipped = 0;
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    delegate.append(objectMapper.readValue(line, ReplayRecord.class));
                    loaded++;
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping unreadable replay line. file={} reason={}", file, e.getMessage());
                }
            }
            rewrite();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load replay file " + file, e);
        }
        log.info("Replay store loaded. file={} loaded={} skipped={} retained={}",
                 file, loaded, skipped, delegate.size());
    }

    private void writeLine(ReplayRecord record) throws IOException {
        ensureParent();
        Files.writeString(file, objectMapper.writeValueAsString(record) + System.lineSeparator(),
                          StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private void rewrite() throws IOException {
        ensureParent();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (ReplayRecord record : delegate.getAll()) {
                writer.write(objectMapper.writeValueAsString(record));
                writer.newLine();
            }
        }
        appendsSinceCompaction = 0;
    }

    private void rewriteQuietly() {
        try {
            rewrite();
        } catch (IOException e) {
            log.error("Replay file rewrite failed. file={}", file, e);
        }
    }

    private void ensureParent() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
