package com.tabletop.repository;

import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of live matches, keyed by match id.
 */
@Repository
public class MatchRepository {

    private final Map<String, MatchState> matches = new ConcurrentHashMap<>();

    public MatchState save(MatchState match) {
        matches.put(match.getId(), match);
        return match;
    }

    public Optional<MatchState> findById(String matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    public List<MatchState> findByStatus(MatchStatus status) {
        return matches.values().stream()
                .filter(m -> m.getStatus() == status)
                .toList();
    }

    public List<MatchState> findAll() {
        return List.copyOf(matches.values());
    }

    public boolean existsById(String matchId) {
        return matches.containsKey(matchId);
    }

    public void deleteById(String matchId) {
        matches.remove(matchId);
    }

    public long count() {
        return matches.size();
    }
}
