package me.golemcore.engram.infrastructure.event;

import me.golemcore.engram.domain.model.EngramsCleanedUpEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringEventBusTest {

    private ApplicationEventPublisher publisher;
    private SpringEventBus eventBus;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        eventBus = new SpringEventBus(publisher);
    }

    @Test
    void shouldForwardEventToPublisher() {
        EngramsCleanedUpEvent event = new EngramsCleanedUpEvent(2, 30, 0.1);

        eventBus.publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void shouldIgnoreNullEvent() {
        eventBus.publish(null);

        verifyNoInteractions(publisher);
    }

    @Test
    void shouldNotPropagateListenerFailure() {
        doThrow(new IllegalStateException("listener broke")).when(publisher).publishEvent(any(Object.class));

        assertDoesNotThrow(() -> eventBus.publish(new Object()));
    }
}
