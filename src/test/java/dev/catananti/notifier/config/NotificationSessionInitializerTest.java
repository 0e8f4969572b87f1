package dev.catananti.notifier.config;

import dev.catananti.notifier.service.DeliveryManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationSessionInitializer")
class NotificationSessionInitializerTest {

    @Mock
    private DeliveryManager deliveryManager;

    @InjectMocks
    private NotificationSessionInitializer initializer;

    @Test
    @DisplayName("should start the session for the configured tenant")
    void shouldStartConfiguredTenant() {
        ReflectionTestUtils.setField(initializer, "tenantId", "rest-42");
        when(deliveryManager.start("rest-42")).thenReturn(true);

        initializer.startSession();

        verify(deliveryManager).start("rest-42");
    }

    @Test
    @DisplayName("should skip auto-start without a tenant")
    void shouldSkipWithoutTenant() {
        ReflectionTestUtils.setField(initializer, "tenantId", "");

        initializer.startSession();

        verify(deliveryManager, never()).start(anyString());
    }

    @Test
    @DisplayName("should stop the session on shutdown")
    void shouldStopOnShutdown() {
        initializer.stopSession();

        verify(deliveryManager).stop();
    }
}
