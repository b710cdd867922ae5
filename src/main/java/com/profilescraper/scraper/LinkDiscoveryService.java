package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Discovers profile links on a listing page by repeatedly revealing more content.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Navigate to the listing; on failure return {@link DiscoveryResult#failed} rather than throwing.</li>
 *   <li>Collect every visible profile link, canonicalized to a {@link RecordIdentifier}.</li>
 *   <li>Scroll to reveal more and collect again, up to {@code budget} times. Stop early after two consecutive
 *       attempts that add nothing new.</li>
 *   <li>Drop identifiers already present in the {@link DedupLedger}, keeping first-seen order.</li>
 * </ol>
 *
 * @since 1.0
 */
public class LinkDiscoveryService implements LinkDiscoveryInterface {
    private static final Logger logger = LoggerFactory.getLogger(LinkDiscoveryService.class);
    private static final Pattern PROFILE_PATH = Pattern.compile("^/in/[^/]+$");
    static final int IDLE_ATTEMPTS_BEFORE_STOP = 2;

    private final DedupLedger ledger;
    private final PacingGenerator pacing;
    private final Sleeper sleeper;
    private final String baseUrl;

    public LinkDiscoveryService(DedupLedger ledger, PacingGenerator pacing, Sleeper sleeper, String baseUrl) {
        this.ledger = ledger;
        this.pacing = pacing;
        this.sleeper = sleeper;
        this.baseUrl = baseUrl;
    }

    @Override
    public DiscoveryResult discover(PageSession session, String location, int budget) {
        logger.info("Navigating to listing: {}", location);
        try {
            session.navigate(location);
        } catch (SessionException e) {
            logger.warn("Discovery navigation to {} failed: {}", location, e.getMessage());
            return DiscoveryResult.failed(new DiscoveryException("Could not open listing " + location, e));
        }

        Set<RecordIdentifier> seen = new LinkedHashSet<>();
        int attempts = 0;
        try {
            sleeper.sleep(pacing.shortDelay());
            collect(session, seen);
            int idle = 0;
            while (attempts < budget) {
                attempts++;
                session.revealMore();
                sleeper.sleep(pacing.scrollDelay());
                int added = collect(session, seen);
                logger.debug("Reveal attempt {}/{} added {} identifier(s).", attempts, budget, added);
                if (added == 0) {
                    idle++;
                    if (idle >= IDLE_ATTEMPTS_BEFORE_STOP) {
                        logger.info("No new links after {} consecutive attempts; listing exhausted.", idle);
                        break;
                    }
                } else {
                    idle = 0;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Discovery interrupted after {} attempt(s); keeping {} identifier(s) found so far.", attempts, seen.size());
        } catch (RuntimeException e) {
            logger.warn("Revealing more links failed after {} attempt(s); keeping {} identifier(s): {}",
                attempts, seen.size(), e.getMessage());
        }

        List<RecordIdentifier> fresh = new ArrayList<>();
        for (RecordIdentifier id : seen) {
            if (!ledger.contains(id)) fresh.add(id);
        }
        logger.info("Found {} profile link(s), {} not yet processed.", seen.size(), fresh.size());
        return new DiscoveryResult(fresh, seen.size(), attempts, null);
    }

    private int collect(PageSession session, Set<RecordIdentifier> seen) {
        int added = 0;
        for (String href : session.attributes(ProfileFieldRegistry.joined(ProfileFieldRegistry.PROFILE_LINK), "href")) {
            Optional<RecordIdentifier> id = toCandidate(href);
            if (id.isPresent() && seen.add(id.get())) added++;
        }
        return added;
    }

    Optional<RecordIdentifier> toCandidate(String href) {
        return RecordIdentifier.parse(href, baseUrl)
            .filter(id -> PROFILE_PATH.matcher(id.path()).matches());
    }
}
