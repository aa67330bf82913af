package com.github.feedflow.service;

import com.github.feedflow.exception.VideoNotFoundException;
import com.github.feedflow.model.ExtractionResult;
import com.github.feedflow.model.ResolvedStream;
import com.github.feedflow.model.SelectedStreams;
import com.github.feedflow.service.extraction.ExtractionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Resolves a video id to playable upstream URLs, going through the stream cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamResolutionService {

    private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final StreamCache streamCache;
    private final ExtractionRunner extractionRunner;
    private final FormatSelector formatSelector;
    private final Clock clock;

    public ResolvedStream resolve(String videoId) {
        if (videoId == null || !VIDEO_ID.matcher(videoId).matches()) {
            throw new VideoNotFoundException("Invalid video id", videoId);
        }
        return streamCache.getOrResolve(videoId, () -> resolveUncached(videoId));
    }

    private ResolvedStream resolveUncached(String videoId) {
        ExtractionResult extraction = extractionRunner.resolve(videoId);
        SelectedStreams selected = formatSelector.select(extraction.getFormats());

        if (selected.getVideoUrl() == null && selected.getAudioUrl() == null) {
            log.warn("No usable format among {} candidates for {}", extraction.getFormats().size(), videoId);
        }

        return ResolvedStream.builder()
                .videoId(videoId)
                .videoUrl(selected.getVideoUrl())
                .audioUrl(selected.getAudioUrl())
                .title(extraction.getTitle())
                .thumbnailUrl(extraction.getThumbnailUrl())
                .durationSeconds(extraction.getDurationSeconds())
                .resolvedAt(clock.instant())
                .build();
    }
}
