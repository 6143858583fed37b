package com.bidmarket.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionStore sessionStore;

    public SessionMaintenanceScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${bidmarket.auth.session.purge-interval:PT1H}")
    public void purgeExpiredSessions() {
        int purged = sessionStore.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired sessions", purged);
        }
    }
}
