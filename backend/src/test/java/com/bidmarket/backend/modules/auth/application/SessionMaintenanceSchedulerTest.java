package com.bidmarket.backend.modules.auth.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionMaintenanceSchedulerTest {

    @Mock
    private SessionStore sessionStore;

    @InjectMocks
    private SessionMaintenanceScheduler scheduler;

    @Test
    void purgesExpiredSessions() {
        when(sessionStore.purgeExpired()).thenReturn(3);

        scheduler.purgeExpiredSessions();

        verify(sessionStore).purgeExpired();
    }
}
