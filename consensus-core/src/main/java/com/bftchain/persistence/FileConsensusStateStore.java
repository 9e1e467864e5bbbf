package com.bftchain.persistence;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.bftchain.validator.ValidatorSet;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores the commit record as a small text file:
 *
 * <pre>
 * baseDir/nodeId/state/commit_record
 *   height=12
 *   block=4f1c...
 *   validators=val1:10,val2:10,val3:5
 * </pre>
 *
 * Writes go to a temp file first and are moved over the old record.
 */
@Slf4j
public class FileConsensusStateStore implements ConsensusStateStore {
    private static final String HEIGHT = "height";
    private static final String BLOCK = "block";
    private static final String VALIDATORS = "validators";

    private final Path stateDir;
    private final Path recordFile;
    private final Path tempFile;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileConsensusStateStore(String baseDir, String nodeId) {
        this.stateDir = Paths.get(baseDir, nodeId, "state");
        this.recordFile = stateDir.resolve("commit_record");
        this.tempFile = stateDir.resolve("commit_record.tmp");
    }

    @Override
    public void initialize() throws IOException {
        Files.createDirectories(stateDir);
        // leftover from a crash mid-write; the previous record is still intact
        Files.deleteIfExists(tempFile);
    }

    @Override
    public void save(CommitRecord record) throws IOException {
        lock.writeLock().lock();
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                writer.write(HEIGHT + "=" + record.getHeight());
                writer.newLine();
                writer.write(BLOCK + "=" + (record.getBlockId() == null ? "" : record.getBlockId()));
                writer.newLine();
                writer.write(VALIDATORS + "=" + serializeValidators(record.getNextValidatorSet()));
                writer.newLine();
            }
            try {
                Files.move(tempFile, recordFile, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to replace", stateDir);
                Files.move(tempFile, recordFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<CommitRecord> load() throws IOException {
        lock.readLock().lock();
        try {
            File file = recordFile.toFile();
            if (!file.exists()) {
                return Optional.empty();
            }
            Map<String, String> fields = new HashMap<>();
            try (BufferedReader reader = Files.newBufferedReader(recordFile, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.trim().isEmpty()) {
                        continue;
                    }
                    int eq = line.indexOf('=');
                    if (eq <= 0) {
                        throw new CorruptedStateException("Malformed line in " + recordFile + ": " + line);
                    }
                    fields.put(line.substring(0, eq), line.substring(eq + 1));
                }
            }
            return Optional.of(parse(fields));
        } finally {
            lock.readLock().unlock();
        }
    }

    private CommitRecord parse(Map<String, String> fields) {
        String height = fields.get(HEIGHT);
        String block = fields.get(BLOCK);
        String validators = fields.get(VALIDATORS);
        if (height == null || block == null || validators == null) {
            throw new CorruptedStateException("Incomplete commit record in " + recordFile + ": " + fields.keySet());
        }
        try {
            long h = Long.parseLong(height);
            if (h < 0) {
                throw new CorruptedStateException("Negative committed height " + h + " in " + recordFile);
            }
            return new CommitRecord(h, block.isEmpty() ? null : block, deserializeValidators(validators));
        } catch (IllegalArgumentException e) {
            throw new CorruptedStateException("Unreadable commit record in " + recordFile, e);
        }
    }

    private static String serializeValidators(ValidatorSet validatorSet) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> entry : validatorSet.asMap().entrySet()) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(entry.getKey()).append(':').append(entry.getValue());
        }
        return sb.toString();
    }

    private static ValidatorSet deserializeValidators(String serialized) {
        Map<String, Long> validators = new LinkedHashMap<>();
        for (String part : serialized.split(",")) {
            int colon = part.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Bad validator entry: " + part);
            }
            validators.put(part.substring(0, colon), Long.parseLong(part.substring(colon + 1)));
        }
        return new ValidatorSet(validators);
    }

    @Override
    public void close() {
        // Nothing to do
    }

    Path getRecordFile() {
        return recordFile;
    }
}
