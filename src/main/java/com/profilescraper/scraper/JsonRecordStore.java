package com.profilescraper.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured store: one pretty-printed UTF-8 JSON array holding every persisted {@link ScrapedRecord}.
 * <p>
 * {@link #append} reads the array, adds the record and rewrites the whole file through a temp file that is
 * fsynced and then atomically moved over the original, so readers only ever see a complete array.
 * Reads and writes go through streams rather than interruptible channels, so a pending thread interrupt
 * does not abort them.
 * A store that exists but cannot be parsed is never overwritten; the append fails instead.
 *
 * @since 1.0
 */
public class JsonRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonRecordStore.class);
    private static final TypeReference<List<ScrapedRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public JsonRecordStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Appends one record and atomically replaces the store.
     * @throws PersistenceException if the existing store is unreadable or the write fails
     */
    public void append(ScrapedRecord record) throws PersistenceException {
        List<ScrapedRecord> records = new ArrayList<>(readAll());
        records.add(record);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            byte[] bytes = mapper.writeValueAsBytes(records);
            try (FileOutputStream out = new FileOutputStream(tmp.toFile())) {
                out.write(bytes);
                out.getFD().sync();
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}; falling back to a plain replace.", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new PersistenceException("Failed to write JSON store " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Saved profile data to {} ({} record(s)).", file, records.size());
    }

    /**
     * Every stored record in append order; empty if the store does not exist yet.
     * @throws PersistenceException if the store exists but cannot be parsed
     */
    public List<ScrapedRecord> readAll() throws PersistenceException {
        if (!Files.exists(file)) return List.of();
        try (FileInputStream in = new FileInputStream(file.toFile())) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) return List.of();
            List<ScrapedRecord> records = mapper.readValue(bytes, RECORD_LIST);
            return records == null ? List.of() : records;
        } catch (FileNotFoundException e) {
            return List.of();
        } catch (IOException e) {
            throw new PersistenceException("JSON store " + file + " is unreadable: " + e.getMessage(), e);
        }
    }

    /**
     * Read-side dedup for the at-least-once retry path: one record per {@code profile_url}, the one with the
     * latest {@code scraped_at} (later position wins ties), in first-seen order of the URL.
     */
    public List<ScrapedRecord> readLatestPerProfile() throws PersistenceException {
        return latestPerProfile(readAll());
    }

    static List<ScrapedRecord> latestPerProfile(Collection<ScrapedRecord> records) {
        Map<String, ScrapedRecord> latest = new LinkedHashMap<>();
        for (ScrapedRecord r : records) {
            ScrapedRecord current = latest.get(r.profileUrl());
            // fixed-width timestamp format sorts lexicographically
            if (current == null || r.scrapedAt().compareTo(current.scrapedAt()) >= 0) {
                latest.put(r.profileUrl(), r);
            }
        }
        return new ArrayList<>(latest.values());
    }

    public Path file() {
        return file;
    }
}
