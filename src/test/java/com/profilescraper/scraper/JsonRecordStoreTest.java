package com.profilescraper.scraper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordStoreTest {

    @TempDir
    Path dir;

    @Test
    void testMissingStoreReadsEmpty() throws Exception {
        assertTrue(new JsonRecordStore(dir.resolve("profiles.json")).readAll().isEmpty());
    }

    @Test
    void testEmptyFileReadsEmpty() throws Exception {
        Path file = Files.createFile(dir.resolve("profiles.json"));
        assertTrue(new JsonRecordStore(file).readAll().isEmpty());
    }

    @Test
    void testAppendKeepsOrderAndFullStructure() throws Exception {
        JsonRecordStore store = new JsonRecordStore(dir.resolve("out").resolve("profiles.json"));
        ScrapedRecord first = Fixtures.record("a", "2024-03-05 10:00:00");
        ScrapedRecord second = new ScrapedRecord(Fixtures.profile("b").value(), "2024-03-05 10:05:00",
            "B", "", "", "About \"b\"\nsecond line",
            List.of(new ExperienceEntry("Dev", "Initech", "2019", "Austin", "TPS reports")),
            List.of(new EducationEntry("Tech", "MSc", "2018")),
            List.of("Go"), List.of(new CertificationEntry("CKA", "CNCF", "2022")), List.of("French"));

        store.append(first);
        store.append(second);

        assertEquals(List.of(first, second), store.readAll());
        assertFalse(Files.exists(dir.resolve("out").resolve("profiles.json.tmp")));
    }

    @Test
    void testOnDiskFieldNames() throws Exception {
        Path file = dir.resolve("profiles.json");
        new JsonRecordStore(file).append(Fixtures.record("a", "2024-03-05 10:00:00"));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.trim().startsWith("["));
        assertTrue(json.contains("\"profile_url\" : \"https://www.linkedin.com/in/a\""));
        assertTrue(json.contains("\"scraped_at\" : \"2024-03-05 10:00:00\""));
        assertFalse(json.contains("identifier"));
    }

    @Test
    void testCorruptStoreIsNeverOverwritten() throws Exception {
        Path file = dir.resolve("profiles.json");
        Files.writeString(file, "[{\"profile_url\": ", StandardCharsets.UTF_8);
        JsonRecordStore store = new JsonRecordStore(file);

        assertThrows(PersistenceException.class, store::readAll);
        assertThrows(PersistenceException.class, () -> store.append(Fixtures.record("a", "2024-03-05 10:00:00")));
        assertEquals("[{\"profile_url\": ", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testUnknownPropertiesAreIgnored() throws Exception {
        Path file = dir.resolve("profiles.json");
        Files.writeString(file, "[{\"profile_url\":\"https://www.linkedin.com/in/x\",\"scraped_at\":\"2024-01-01 09:00:00\",\"extra\":1}]",
            StandardCharsets.UTF_8);

        List<ScrapedRecord> records = new JsonRecordStore(file).readAll();

        assertEquals(1, records.size());
        assertEquals("", records.get(0).name());
        assertTrue(records.get(0).skills().isEmpty());
    }

    @Test
    void testLatestPerProfileCollapsesRetries() throws Exception {
        JsonRecordStore store = new JsonRecordStore(dir.resolve("profiles.json"));
        ScrapedRecord aOld = Fixtures.record("a", "2024-03-05 10:00:00");
        ScrapedRecord b = Fixtures.record("b", "2024-03-05 10:02:00");
        ScrapedRecord aNew = Fixtures.record("a", "2024-03-06 09:30:00");
        store.append(aOld);
        store.append(b);
        store.append(aNew);

        assertEquals(3, store.readAll().size());
        assertEquals(List.of(aNew, b), store.readLatestPerProfile());
    }

    @Test
    void testAppendCompletesWhileInterruptIsPending() throws Exception {
        JsonRecordStore store = new JsonRecordStore(dir.resolve("profiles.json"));
        store.append(Fixtures.record("a", "2024-03-05 10:00:00"));
        Thread.currentThread().interrupt();
        try {
            store.append(Fixtures.record("b", "2024-03-05 10:05:00"));
            assertEquals(2, store.readAll().size());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertFalse(Files.exists(dir.resolve("profiles.json.tmp")));
    }
}
