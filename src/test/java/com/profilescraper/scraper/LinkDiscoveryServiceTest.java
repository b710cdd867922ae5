package com.profilescraper.scraper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkDiscoveryServiceTest {
    private static final String LISTING = "https://www.linkedin.com/search/results/people/?keywords=java";

    @TempDir
    Path dir;

    private FileDedupLedger ledger;
    private RecordingSleeper sleeper;
    private LinkDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        ledger = new FileDedupLedger(dir.resolve("scraped_urls.txt"));
        ledger.load();
        sleeper = new RecordingSleeper();
        discovery = new LinkDiscoveryService(ledger, Fixtures.pacing(), sleeper, Fixtures.BASE_URL);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testFiltersLedgerAndDeduplicatesInFirstSeenOrder() throws Exception {
        ledger.append(Fixtures.profile("a"));
        FakePageSession session = new FakePageSession()
            .withLinkBatch("/in/a", "/in/b")
            .withLinkBatch("https://www.linkedin.com/in/a/", "/in/c?trk=x");

        DiscoveryResult result = discovery.discover(session, LISTING, 3);

        assertFalse(result.isFailed());
        assertEquals(List.of(Fixtures.profile("b"), Fixtures.profile("c")), result.candidates());
        assertEquals(3, result.rawCount());
        assertEquals(List.of(LISTING), session.navigations);
    }

    @Test
    void testOnlyProfilePathsAreCandidates() {
        FakePageSession session = new FakePageSession().withLinkBatch(
            "/in/jane",
            "/in/jane/details/skills/",
            "/company/acme",
            "/in/",
            "https://www.linkedin.com/in/john#about");

        DiscoveryResult result = discovery.discover(session, LISTING, 1);

        assertEquals(List.of(Fixtures.profile("jane"), Fixtures.profile("john")), result.candidates());
    }

    @Test
    void testStopsAfterTwoIdleRevealAttempts() {
        FakePageSession session = new FakePageSession().withLinkBatch("/in/a");

        DiscoveryResult result = discovery.discover(session, LISTING, 10);

        assertEquals(LinkDiscoveryService.IDLE_ATTEMPTS_BEFORE_STOP, result.attempts());
        assertEquals(2, session.revealCalls);
        assertEquals(List.of(Fixtures.profile("a")), result.candidates());
    }

    @Test
    void testRevealBudgetIsRespected() {
        FakePageSession session = new FakePageSession()
            .withLinkBatch("/in/a").withLinkBatch("/in/b").withLinkBatch("/in/c").withLinkBatch("/in/d");

        DiscoveryResult result = discovery.discover(session, LISTING, 2);

        assertEquals(2, result.attempts());
        assertEquals(List.of(Fixtures.profile("a"), Fixtures.profile("b"), Fixtures.profile("c")), result.candidates());
    }

    @Test
    void testNavigationFailureIsReportedNotThrown() {
        FakePageSession session = new FakePageSession().withLinkBatch("/in/a");
        session.failingUrls.add(LISTING);

        DiscoveryResult result = discovery.discover(session, LISTING, 3);

        assertTrue(result.isFailed());
        assertTrue(result.candidates().isEmpty());
        assertNotNull(result.failure().getCause());
    }

    @Test
    void testEmptyListing() {
        DiscoveryResult result = discovery.discover(new FakePageSession(), LISTING, 3);
        assertFalse(result.isFailed());
        assertTrue(result.candidates().isEmpty());
    }

    @Test
    void testInterruptKeepsLinksFoundSoFar() {
        RecordingSleeper interrupting = new RecordingSleeper().interruptOnCall(2);
        LinkDiscoveryService interrupted = new LinkDiscoveryService(ledger, Fixtures.pacing(), interrupting, Fixtures.BASE_URL);
        FakePageSession session = new FakePageSession().withLinkBatch("/in/a").withLinkBatch("/in/b");

        DiscoveryResult result = interrupted.discover(session, LISTING, 5);

        assertEquals(List.of(Fixtures.profile("a")), result.candidates());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testRevealFailureKeepsLinksFoundSoFar() {
        FakePageSession session = new FakePageSession() {
            @Override
            public boolean revealMore() {
                revealCalls++;
                throw new IllegalStateException("Execution context was destroyed");
            }
        }.withLinkBatch("/in/a", "/in/b");

        DiscoveryResult result = discovery.discover(session, LISTING, 5);

        assertFalse(result.isFailed());
        assertEquals(List.of(Fixtures.profile("a"), Fixtures.profile("b")), result.candidates());
        assertEquals(1, result.attempts());
        assertEquals(1, session.revealCalls);
    }
}
