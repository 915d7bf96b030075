package me.golemcore.engram.adapter.outbound.llm;

import me.golemcore.engram.domain.model.LlmRequest;
import me.golemcore.engram.domain.model.LlmResponse;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private EngramProperties properties;

    @BeforeEach
    void setUp() {
        properties = new EngramProperties();
    }

    // ===== init() =====

    @Test
    void shouldSelectAndInitializeConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertTrue(factory.isAvailable());
        verify(langchain4j).initialize();
        verify(noop, never()).initialize();
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldFailChatWhenNoAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertEquals("none", factory.getCurrentModel());
        assertFalse(factory.isAvailable());
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> factory.chat(LlmRequest.builder().build()).join());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    // ===== delegation =====

    @Test
    void shouldDelegateChatToActiveAdapter() {
        properties.getLlm().setProvider("custom");
        LlmProviderAdapter custom = createMockAdapter("custom", true);
        LlmResponse response = LlmResponse.builder().content("summary").build();
        LlmRequest request = LlmRequest.builder().build();
        when(custom.chat(request)).thenReturn(CompletableFuture.completedFuture(response));
        when(custom.getCurrentModel()).thenReturn("gpt-4o-mini");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertSame(response, factory.chat(request).join());
        assertEquals("gpt-4o-mini", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
    }

    private LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        return adapter;
    }
}
