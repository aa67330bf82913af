package com.github.feedflow.config;

import com.github.feedflow.service.UpstreamRelay;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

/**
 * Closes the upstream relay of a proxy request once the request completes.
 * A relay whose body never ran (async submit rejected, handler failure) would otherwise keep
 * its upstream connection open.
 */
@Slf4j
@Component
public class UpstreamRelayInterceptor implements AsyncHandlerInterceptor {

    public static final String RELAY_ATTR = UpstreamRelay.class.getName();

    public static void register(HttpServletRequest request, UpstreamRelay relay) {
        request.setAttribute(RELAY_ATTR, relay);
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        Object attribute = request.getAttribute(RELAY_ATTR);
        if (!(attribute instanceof UpstreamRelay)) {
            return;
        }

        UpstreamRelay relay = (UpstreamRelay) attribute;
        if (!relay.isClosed()) {
            log.warn("Releasing unwritten upstream relay for {} {}", relay.getVideoId(), relay.getKind().getWireName());
            relay.close();
        }
    }
}
