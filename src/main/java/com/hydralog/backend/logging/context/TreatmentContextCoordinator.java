package com.hydralog.backend.logging.context;

import com.hydralog.backend.logging.cache.SummaryCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user readiness state machine. Events for one user are applied one at a time; the local cache is
 * loaded exactly once after both auth and profile are ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TreatmentContextCoordinator {

    private final SummaryCacheService cache;

    private final Map<Long, ContextState> states = new ConcurrentHashMap<>();

    public ContextState onEvent(ContextEvent event) {
        Objects.requireNonNull(event.userId(), "userId");
        return states.compute(event.userId(),
                (uid, current) -> apply(current == null ? ContextState.initial(uid) : current, event));
    }

    public ContextState state(Long userId) {
        return states.getOrDefault(userId, ContextState.initial(userId));
    }

    private ContextState apply(ContextState state, ContextEvent event) {
        if (event instanceof ContextEvent.AuthReady) {
            return loadIfReady(state.withAuth());
        }
        if (event instanceof ContextEvent.ProfileReady p) {
            boolean samePet = p.petId().equals(state.petId());
            if (state.petId() != null && !samePet) {
                log.info("pet switched user={} {} -> {}", state.userId(), state.petId(), p.petId());
                cache.clear(state.userId(), state.petId());
            }
            return loadIfReady(state.withPet(p.petId(), p.zone(), samePet));
        }
        if (state.petId() != null) {
            cache.clear(state.userId(), state.petId());
        }
        log.info("context reset user={}", state.userId());
        return ContextState.initial(state.userId());
    }

    private ContextState loadIfReady(ContextState state) {
        if (!state.ready() || state.cacheLoaded()) return state;

        cache.invalidateExpired(state.zone());
        ContextState loaded = state.loaded(cache.get(state.userId(), state.petId(), state.zone()).orElse(null));
        log.info("summary cache loaded user={} pet={} hit={}",
                state.userId(), state.petId(), loaded.todaySummary() != null);
        return loaded;
    }
}
