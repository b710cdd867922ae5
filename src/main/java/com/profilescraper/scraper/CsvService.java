package com.profilescraper.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Appends flattened records to a CSV file using OpenCSV.
 * <p>
 * Flattening is lossy: scalar fields are written verbatim, repeated sections are
 * reduced to their size. The JSON store remains the source of truth. Each append is flushed and fsynced
 * before returning.
 *
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    private static final List<String> COLUMNS = List.of(
        "profile_url",
        "scraped_at",
        "name",
        "headline",
        "location",
        "about",
        "num_experiences",
        "num_education",
        "num_skills",
        "num_certifications",
        "num_languages"
    );

    private final Path file;

    public CsvService(Path file) {
        this.file = file;
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    @Override
    public String[] toRow(ScrapedRecord record) {
        return new String[]{
            record.profileUrl(),
            record.scrapedAt(),
            record.name(),
            record.headline(),
            record.location(),
            record.about(),
            Integer.toString(record.experience().size()),
            Integer.toString(record.education().size()),
            Integer.toString(record.skills().size()),
            Integer.toString(record.certifications().size()),
            Integer.toString(record.languages().size())
        };
    }

    @Override
    public void appendRecord(ScrapedRecord record) throws PersistenceException {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            boolean writeHeader = !Files.exists(file) || Files.size(file) == 0;
            try (FileOutputStream out = new FileOutputStream(file.toFile(), true);
                 CSVWriter writer = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
                if (writeHeader) {
                    writer.writeNext(COLUMNS.toArray(String[]::new));
                }
                writer.writeNext(toRow(record));
                writer.flush();
                out.getFD().sync();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to append to CSV store " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Saved profile row to {}", file);
    }

    public Path file() {
        return file;
    }
}
