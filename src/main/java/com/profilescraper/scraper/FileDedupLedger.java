package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link DedupLedger} backed by a newline-delimited text file.
 * <p>
 * Each append is a single {@code O_APPEND} write of one line followed by an fsync, so independent processes
 * appending to the same file never interleave within a line and never race on a read-modify-write.
 * Duplicate or blank lines on disk are tolerated and collapsed on {@link #load()}.
 *
 * @since 1.0
 */
public class FileDedupLedger implements DedupLedger {
    private static final Logger logger = LoggerFactory.getLogger(FileDedupLedger.class);

    private final Path file;
    private final Set<RecordIdentifier> known = new LinkedHashSet<>();

    public FileDedupLedger(Path file) {
        this.file = file;
    }

    @Override
    public Set<RecordIdentifier> load() {
        known.clear();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            logger.info("No ledger at {}; starting with an empty set.", file);
            return Collections.emptySet();
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Ledger {} is unreadable ({}); continuing with an empty set. Already-processed records may be revisited.", file, e.getMessage());
            return Collections.emptySet();
        }
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) continue;
            Optional<RecordIdentifier> id = RecordIdentifier.parse(line.trim(), null);
            if (id.isPresent()) {
                known.add(id.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.warn("Ignored {} malformed line(s) in ledger {}.", skipped, file);
        }
        logger.info("Loaded {} processed identifier(s) from {}.", known.size(), file);
        return Collections.unmodifiableSet(new LinkedHashSet<>(known));
    }

    @Override
    public boolean contains(RecordIdentifier id) {
        return id != null && known.contains(id);
    }

    @Override
    public void append(RecordIdentifier id) throws PersistenceException {
        if (id == null) throw new IllegalArgumentException("id must not be null");
        if (known.contains(id)) {
            logger.debug("Ledger already contains {}; append skipped.", id);
            return;
        }
        byte[] line = (id.value() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (FileOutputStream out = new FileOutputStream(file.toFile(), true)) {
                out.write(line);
                out.getFD().sync();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to append " + id + " to ledger " + file, e);
        }
        known.add(id);
    }

    @Override
    public int size() {
        return known.size();
    }
}
