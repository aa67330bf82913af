package com.github.feedflow.controller;

import com.github.feedflow.config.UpstreamRelayInterceptor;
import com.github.feedflow.exception.InvalidRequestException;
import com.github.feedflow.model.MediaKind;
import com.github.feedflow.service.MediaProxyService;
import com.github.feedflow.service.UpstreamRelay;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping("/api/youtube")
@RequiredArgsConstructor
public class ProxyController {

    private final MediaProxyService mediaProxyService;

    /**
     * Relay media bytes for a signed proxy URL, honoring Range for seeking.
     */
    @GetMapping("/proxy/{videoId}")
    public ResponseEntity<StreamingResponseBody> proxy(@PathVariable String videoId,
                                                       @RequestParam(defaultValue = "video") String type,
                                                       @RequestParam(required = false) String exp,
                                                       @RequestParam(required = false) String sig,
                                                       @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
                                                       HttpServletRequest request) {
        MediaKind kind = MediaKind.fromWireName(type)
                .orElseThrow(() -> new InvalidRequestException("Invalid stream type", "type"));

        mediaProxyService.verifyToken(videoId, kind, exp, sig);
        UpstreamRelay relay = mediaProxyService.open(videoId, kind, range);
        UpstreamRelayInterceptor.register(request, relay);

        return ResponseEntity.status(relay.getStatus())
                .headers(relay.getHeaders())
                .body(relay);
    }
}
