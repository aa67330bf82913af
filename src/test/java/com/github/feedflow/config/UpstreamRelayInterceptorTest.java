package com.github.feedflow.config;

import com.github.feedflow.model.MediaKind;
import com.github.feedflow.service.UpstreamRelay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.mockito.Mockito.*;

@DisplayName("UpstreamRelayInterceptor")
class UpstreamRelayInterceptorTest {

    private final UpstreamRelayInterceptor interceptor = new UpstreamRelayInterceptor();

    @Test
    @DisplayName("should close a relay whose body never ran")
    void shouldCloseUnwrittenRelay() {
        UpstreamRelay relay = mock(UpstreamRelay.class);
        when(relay.isClosed()).thenReturn(false);
        when(relay.getVideoId()).thenReturn("rejected001");
        when(relay.getKind()).thenReturn(MediaKind.VIDEO);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/youtube/proxy/rejected001");
        UpstreamRelayInterceptor.register(request, relay);

        interceptor.afterCompletion(request, new MockHttpServletResponse(), null,
                new TaskRejectedException("Executor did not accept task"));

        verify(relay).close();
    }

    @Test
    @DisplayName("should leave an already relayed body alone")
    void shouldSkipClosedRelay() {
        UpstreamRelay relay = mock(UpstreamRelay.class);
        when(relay.isClosed()).thenReturn(true);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/youtube/proxy/relayed0001");
        UpstreamRelayInterceptor.register(request, relay);

        interceptor.afterCompletion(request, new MockHttpServletResponse(), null, null);

        verify(relay, never()).close();
    }

    @Test
    @DisplayName("should ignore requests without a relay")
    void shouldIgnoreRequestsWithoutRelay() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/youtube/proxy/tokenless01");

        interceptor.afterCompletion(request, new MockHttpServletResponse(), null, null);
    }
}
