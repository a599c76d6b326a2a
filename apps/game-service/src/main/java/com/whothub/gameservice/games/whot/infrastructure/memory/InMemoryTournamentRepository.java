package com.whothub.gameservice.games.whot.infrastructure.memory;

import com.whothub.gameservice.games.whot.domain.model.Tournament;
import com.whothub.gameservice.games.whot.domain.repository.TournamentRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 赛事列表需要保持创建顺序，所以用 LinkedHashMap（只在主循环线程访问）。
 */
@Repository
public class InMemoryTournamentRepository implements TournamentRepository {

    private final Map<String, Tournament> tournaments = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public Optional<Tournament> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(tournaments.get(id));
    }

    @Override
    public boolean exists(String id) {
        return id != null && tournaments.containsKey(id);
    }

    @Override
    public void save(Tournament tournament) {
        tournaments.put(tournament.getId(), tournament);
    }

    @Override
    public boolean removeIfSame(Tournament tournament) {
        return tournaments.remove(tournament.getId(), tournament);
    }

    @Override
    public Collection<Tournament> findAll() {
        synchronized (tournaments) {
            return List.copyOf(tournaments.values());
        }
    }
}
