package com.github.feedflow.controller;

import com.github.feedflow.exception.InvalidRequestException;
import com.github.feedflow.model.StreamResponse;
import com.github.feedflow.model.StreamType;
import com.github.feedflow.service.StreamAccessPolicy;
import com.github.feedflow.service.StreamLinkService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/youtube")
@RequiredArgsConstructor
public class StreamController {

    private final StreamAccessPolicy accessPolicy;
    private final StreamLinkService streamLinkService;

    /**
     * Resolve a video and hand out signed, same-origin proxy URLs for it.
     * Clients whose token expired come back here; /proxy never refreshes tokens.
     */
    @GetMapping("/stream/{videoId}")
    public ResponseEntity<StreamResponse> stream(@PathVariable String videoId,
                                                 @RequestParam(defaultValue = "both") String type,
                                                 HttpServletRequest request) {
        accessPolicy.authorize(request);

        StreamType streamType = StreamType.fromWireName(type)
                .orElseThrow(() -> new InvalidRequestException("Invalid stream type", "type"));

        log.info("Stream request: {} ({})", videoId, type);
        StreamResponse response = streamLinkService.describe(videoId, streamType,
                ServletUriComponentsBuilder.fromCurrentContextPath());
        return ResponseEntity.ok(response);
    }
}
