package com.tabletop.service;

import com.tabletop.config.MatchRetentionProperties;
import com.tabletop.config.RulePreset;
import com.tabletop.config.RulePresetLoader;
import com.tabletop.dto.MatchSnapshot;
import com.tabletop.event.MatchEvent;
import com.tabletop.exception.IntentRejectedException;
import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.PlayerIntent;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for match creation and intent submission.
 * <p>
 * Intents for the same match are serialised through a fair lock per match id; different matches
 * never contend. Events are published under the lock once an intent resolved successfully.
 * A lock exists only while its match is registered; ended matches are dropped by {@link #closeMatch}
 * or by the periodic eviction sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchService {

    private final MatchComposer matchComposer;
    private final TurnResolver turnResolver;
    private final MatchQueryService matchQueryService;
    private final MatchRepository matchRepository;
    private final RulePresetLoader presetLoader;
    private final ApplicationEventPublisher eventPublisher;
    private final MatchRetentionProperties retention;

    private final ConcurrentHashMap<String, ReentrantLock> matchLocks = new ConcurrentHashMap<>();

    /**
     * Compose and register a new match.
     */
    public MatchState createMatch(RuleConfiguration rules, int playerCount) {
        MatchState match = matchComposer.build(rules, playerCount);
        matchRepository.save(match);
        log.info("Created {} match {} with {} players", match.getArchetype(), match.getId(), match.getRoster().size());
        eventPublisher.publishEvent(MatchEvent.matchStarted(match.getId(), match.getRoster().size()));
        return match;
    }

    /**
     * Create a match from a loaded preset.
     *
     * @throws IllegalArgumentException if the preset id is unknown
     */
    public MatchState createMatchFromPreset(String presetId, int playerCount) {
        RulePreset preset = presetLoader.getPreset(presetId);
        log.debug("Creating match from preset '{}'", preset.id());
        return createMatch(preset.rules(), playerCount);
    }

    public MatchState getMatch(String matchId) {
        return matchQueryService.getMatch(matchId);
    }

    /**
     * Take a consistent snapshot of a match.
     */
    public MatchSnapshot getSnapshot(String matchId) {
        return getSnapshot(matchId, null);
    }

    /**
     * Take a consistent snapshot of a match as one player sees it.
     *
     * @param observerId player the view is for, or null for the full view
     * @throws IllegalArgumentException if the match or the observer does not exist
     */
    public MatchSnapshot getSnapshot(String matchId, Integer observerId) {
        ReentrantLock lock = acquire(matchId);
        try {
            return matchQueryService.snapshot(matchQueryService.getMatch(matchId), observerId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve an intent and publish its events.
     *
     * @throws IntentRejectedException  if the intent is not legal; the match is unchanged
     * @throws IllegalArgumentException if the match does not exist
     */
    public IntentResult submitIntent(String matchId, PlayerIntent intent) {
        ReentrantLock lock = acquire(matchId);
        try {
            MatchState match = matchQueryService.getMatch(matchId);
            IntentResult result;
            try {
                result = turnResolver.resolveIntent(match, intent);
            } catch (IntentRejectedException e) {
                log.warn("Rejected {} in match {}: {} ({})", intent, matchId, e.getMessage(), e.getReason());
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected failure resolving {} in match {}; aborting match", intent, matchId, e);
                abort(match, lock);
                throw e;
            }

            result.events().forEach(eventPublisher::publishEvent);
            if (result.matchOver()) {
                log.info("Match {} is over after turn {}", matchId, match.getTurnNumber());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Abort a match. Waits for any intent in flight on the same match to finish first.
     *
     * @throws IllegalArgumentException if the match does not exist
     */
    public void abortMatch(String matchId) {
        ReentrantLock lock = acquire(matchId);
        try {
            abort(matchQueryService.getMatch(matchId), lock);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop an ended match and its lock.
     *
     * @throws IllegalArgumentException if the match does not exist
     * @throws IllegalStateException    if the match is still in progress
     */
    public void closeMatch(String matchId) {
        ReentrantLock lock = acquire(matchId);
        try {
            MatchState match = matchQueryService.getMatch(matchId);
            if (match.getStatus() == MatchStatus.IN_PROGRESS) {
                throw new IllegalStateException("Match " + matchId + " is still in progress");
            }
            remove(match, lock);
            log.info("Closed {} match {}", match.getStatus(), matchId);
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${engine.matches.eviction-interval:60000}")
    public void evictEndedMatches() {
        int evicted = evictEndedBefore(LocalDateTime.now().minus(retention.finishedRetention()));
        if (evicted > 0) {
            log.info("Evicted {} ended matches", evicted);
        }
    }

    /**
     * Close every ended match whose end time is before {@code cutoff}.
     *
     * @return the number of matches dropped
     */
    int evictEndedBefore(LocalDateTime cutoff) {
        int evicted = 0;
        for (MatchState match : matchRepository.findAll()) {
            if (match.getStatus() == MatchStatus.IN_PROGRESS
                    || match.getEndedAt() == null
                    || !match.getEndedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                closeMatch(match.getId());
                evicted++;
            } catch (IllegalArgumentException e) {
                log.debug("Match {} was already removed: {}", match.getId(), e.getMessage());
            }
        }
        return evicted;
    }

    int trackedLockCount() {
        return matchLocks.size();
    }

    public List<MatchState> getActiveMatches() {
        return matchQueryService.getMatchesInProgress();
    }

    private void abort(MatchState match, ReentrantLock lock) {
        match.setStatus(MatchStatus.ABORTED);
        match.setEndedAt(LocalDateTime.now());
        match.tearDown();
        remove(match, lock);
        log.info("Match {} aborted", match.getId());
        eventPublisher.publishEvent(MatchEvent.matchAborted(match.getId()));
    }

    private void remove(MatchState match, ReentrantLock lock) {
        matchRepository.deleteById(match.getId());
        matchLocks.remove(match.getId(), lock);
    }

    /**
     * Lock a registered match. A lock is only created while the match is in the repository, and a
     * lock whose match was removed while this thread waited is released and reported as missing.
     */
    private ReentrantLock acquire(String matchId) {
        ReentrantLock lock = matchLocks.compute(matchId, (id, existing) ->
                existing != null ? existing
                        : matchRepository.existsById(id) ? new ReentrantLock(true) : null);
        if (lock == null) {
            throw new IllegalArgumentException("Match not found: " + matchId);
        }
        lock.lock();
        if (matchLocks.get(matchId) != lock) {
            lock.unlock();
            throw new IllegalArgumentException("Match not found: " + matchId);
        }
        return lock;
    }
}
