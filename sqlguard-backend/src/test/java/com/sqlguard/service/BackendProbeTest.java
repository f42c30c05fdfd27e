package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.model.BackendMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BackendProbeTest {

    @Mock
    ReadOnlyDataSourceFactory dataSourceFactory;

    @Test
    void blankUrlSelectsDemoWithoutTouchingThePool() {
        BackendProbe probe = new BackendProbe(dataSourceFactory, new ResultNormalizer());

        BackendContext context = probe.probe(new DatabaseSettings("  ", 5000, 30000, 5, 50, false));

        assertEquals(BackendMode.DEMO, context.getMode());
        assertTrue(context.getExecutor().isEmpty());
        verifyNoInteractions(dataSourceFactory);
    }

    @Test
    void unreachableBackendSelectsDemo() {
        when(dataSourceFactory.create(any())).thenThrow(new IllegalStateException("Failed to initialize pool: Connection refused"));
        BackendProbe probe = new BackendProbe(dataSourceFactory, new ResultNormalizer());

        BackendContext context = probe.probe(new DatabaseSettings("postgres://u:pw@127.0.0.1:1/db", 1000, 30000, 5, 50, false));

        assertEquals(BackendMode.DEMO, context.getMode());
        assertTrue(context.getExecutor().isEmpty());
    }
}
