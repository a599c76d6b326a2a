package com.whothub.gameservice.games.whot.infrastructure.memory;

import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.domain.repository.SessionRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<GameSession> find(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(sessions.get(code));
    }

    @Override
    public boolean exists(String code) {
        return code != null && sessions.containsKey(code);
    }

    @Override
    public void save(GameSession session) {
        sessions.put(session.getCode(), session);
    }

    @Override
    public boolean removeIfSame(GameSession session) {
        return sessions.remove(session.getCode(), session);
    }

    @Override
    public Collection<GameSession> findAll() {
        return List.copyOf(sessions.values());
    }
}
