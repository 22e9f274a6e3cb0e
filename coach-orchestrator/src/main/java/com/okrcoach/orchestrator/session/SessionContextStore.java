package com.okrcoach.orchestrator.session;

import java.util.Optional;

/**
 * Owner of per-session state. Implementations replace the whole snapshot on {@link #save}.
 */
public interface SessionContextStore {

    Optional<SessionContext> load(String sessionId);

    void save(SessionContext context);
}
