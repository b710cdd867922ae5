package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one scraping run over an exclusively owned browser session.
 * <p>
 * State machine: {@code IDLE -> AUTHENTICATING -> DISCOVERING -> PROCESSING -> DRAINING -> CLOSED}, with
 * {@code FAILED} reachable from any non-terminal state. Per candidate, in order:
 * <ol>
 *   <li>Honour a pending stop request (budget, {@link #requestStop()}, thread interrupt).</li>
 *   <li>Consult the {@link WindowOracle}; outside the window the run drains with {@link StopReason#WINDOW_CLOSED}.</li>
 *   <li>Skip identifiers the {@link DedupLedger} already holds, without consuming budget or delay.</li>
 *   <li>Extract and persist. Extraction, persistence and unexpected driver failures are logged and the loop continues.</li>
 *   <li>Stop once {@code maxRecords} records are persisted; otherwise wait a {@link PacingGenerator#longDelay()}.</li>
 * </ol>
 * Stop signals are only observed between candidates; an in-flight extraction or persist always runs to
 * completion or local failure. A stop requested during the inter-record delay wakes the run thread.
 * The session is closed on every exit path.
 * <p>
 * Instances are single-use.
 *
 * @since 1.0
 */
public class ScraperService implements ScraperServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScraperService.class);

    private final CredentialsProvider credentialsProvider;
    private final SessionProvider sessionProvider;
    private final AuthServiceInterface authService;
    private final LinkDiscoveryInterface linkDiscovery;
    private final RecordExtractor extractor;
    private final PersistenceSink sink;
    private final DedupLedger ledger;
    private final WindowOracle windowOracle;
    private final PacingGenerator pacing;
    private final Sleeper sleeper;
    private final int discoveryBudget;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile RunState state = RunState.IDLE;
    private volatile Thread runThread;
    private volatile boolean waiting;

    public ScraperService(CredentialsProvider credentialsProvider,
                          SessionProvider sessionProvider,
                          AuthServiceInterface authService,
                          LinkDiscoveryInterface linkDiscovery,
                          RecordExtractor extractor,
                          PersistenceSink sink,
                          DedupLedger ledger,
                          WindowOracle windowOracle,
                          PacingGenerator pacing,
                          Sleeper sleeper,
                          int discoveryBudget) {
        this.credentialsProvider = credentialsProvider;
        this.sessionProvider = sessionProvider;
        this.authService = authService;
        this.linkDiscovery = linkDiscovery;
        this.extractor = extractor;
        this.sink = sink;
        this.ledger = ledger;
        this.windowOracle = windowOracle;
        this.pacing = pacing;
        this.sleeper = sleeper;
        this.discoveryBudget = discoveryBudget;
    }

    @Override
    public RunSummary run(String location, int maxRecords) throws ConfigurationException, SessionException {
        if (location == null || location.isBlank()) throw new IllegalArgumentException("location is required");
        if (maxRecords <= 0) throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        synchronized (this) {
            if (state != RunState.IDLE) {
                throw new IllegalStateException("ScraperService is single-use; current state " + state);
            }
            state = RunState.AUTHENTICATING;
            runThread = Thread.currentThread();
        }
        logger.info("Starting profile scraping session. Listing: {}, max profiles: {}", location, maxRecords);

        Credentials credentials;
        try {
            credentials = credentialsProvider.resolve();
        } catch (ConfigurationException e) {
            state = RunState.FAILED;
            logger.error("Cannot start run: {}", e.getMessage());
            throw e;
        }
        ledger.load();

        PageSession session;
        try {
            session = sessionProvider.open();
        } catch (SessionException e) {
            state = RunState.FAILED;
            logger.error("Could not open browser session: {}", e.getMessage());
            throw e;
        }

        try {
            authService.authenticate(session, credentials);

            state = RunState.DISCOVERING;
            DiscoveryResult discovery = linkDiscovery.discover(session, location, discoveryBudget);
            RunSummary summary;
            if (discovery.isFailed()) {
                logger.warn("Discovery failed: {}", discovery.failure().getMessage());
                summary = new RunSummary(0, 0, 0, 0, StopReason.DISCOVERY_FAILED, discovery.failure().getMessage());
            } else if (discovery.candidates().isEmpty()) {
                logger.warn("No profile links found");
                summary = new RunSummary(0, 0, 0, 0, StopReason.NO_CANDIDATES, "");
            } else {
                state = RunState.PROCESSING;
                logger.info("Found {} profile links to scrape", discovery.candidates().size());
                summary = process(session, discovery.candidates(), maxRecords);
            }
            state = RunState.DRAINING;
            logger.info("Scraping session finished: {}", summary.describe());
            return summary;
        } catch (SessionException | RuntimeException e) {
            state = RunState.FAILED;
            logger.error("Run failed: {}", e.getMessage());
            throw e;
        } finally {
            release(session);
        }
    }

    private RunSummary process(PageSession session, List<RecordIdentifier> candidates, int maxRecords) {
        int processed = 0;
        int failed = 0;
        int skipped = 0;
        for (int i = 0; i < candidates.size(); i++) {
            RecordIdentifier id = candidates.get(i);
            if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                logger.warn("Stop requested; ending run before {}", id);
                return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.INTERRUPTED, "");
            }
            WindowDecision window = windowOracle.evaluateNow();
            if (!window.permitted()) {
                logger.warn("Scraper stopped due to time constraints. {}", window.reason());
                return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.WINDOW_CLOSED, window.reason());
            }
            if (ledger.contains(id)) {
                logger.info("Profile already scraped: {}", id);
                skipped++;
                continue;
            }

            try {
                ScrapedRecord record = extractor.extract(session, id);
                persist(record);
                processed++;
                logger.info("Progress: {}/{} profiles scraped", processed, maxRecords);
            } catch (ExtractionException e) {
                failed++;
                logger.error("Error scraping profile {}: {}", id, e.getMessage());
            } catch (PersistenceException e) {
                failed++;
                logger.error("Failed to persist {}; it will be retried on a later run: {}", id, e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                logger.error("Unexpected failure on {}: {}", id, e.toString());
            }

            if (processed >= maxRecords) {
                logger.info("Reached maximum profiles limit: {}", maxRecords);
                return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.BUDGET_REACHED, "");
            }
            if (i < candidates.size() - 1) {
                Duration delay = pacing.longDelay();
                logger.info("Waiting {} seconds before next profile...", delay.toSeconds());
                waiting = true;
                try {
                    if (stopRequested.get()) {
                        logger.warn("Stop requested; skipping inter-record delay.");
                        return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.INTERRUPTED, "");
                    }
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted during inter-record delay.");
                    return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.INTERRUPTED, "");
                } finally {
                    waiting = false;
                }
            }
        }
        return new RunSummary(processed, failed, skipped, candidates.size(), StopReason.COMPLETED, "");
    }

    /**
     * Persists with the interrupt flag cleared so the write completes; a pending interrupt is re-asserted after.
     */
    private void persist(ScrapedRecord record) throws PersistenceException {
        boolean interrupted = Thread.interrupted();
        try {
            sink.persist(record);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private void release(PageSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to release browser session cleanly: {}", e.getMessage());
        }
        if (state != RunState.FAILED) {
            state = RunState.CLOSED;
        }
    }

    @Override
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("Graceful stop requested; the current record will finish first.");
        }
        Thread thread = runThread;
        if (waiting && thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    @Override
    public RunState getState() {
        return state;
    }
}
