package com.github.feedflow.service;

import com.github.feedflow.model.CandidateFormat;
import com.github.feedflow.model.SelectedStreams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks the video and audio URL a client will actually play.
 * Pure; returns nulls for kinds with no usable format and never throws.
 */
@Slf4j
@Component
public class FormatSelector {

    static final String VIDEO_CONTAINER = "mp4";
    static final String PREFERRED_AUDIO_CONTAINER = "m4a";
    static final Set<String> AUDIO_CONTAINERS = Set.of("m4a", "mp4", "webm");
    static final int MAX_PREFERRED_HEIGHT = 720;

    private static final Comparator<CandidateFormat> BY_HEIGHT_DESC =
            Comparator.comparingInt((CandidateFormat f) -> f.getHeight() != null ? f.getHeight() : 0).reversed();

    private static final Comparator<CandidateFormat> BY_ABR_DESC =
            Comparator.comparingDouble((CandidateFormat f) -> f.getAbr() != null ? f.getAbr() : 0.0).reversed();

    public SelectedStreams select(List<CandidateFormat> formats) {
        if (formats == null || formats.isEmpty()) {
            return SelectedStreams.none();
        }

        String videoUrl = pickByHeight(formats, f -> f.hasVideo() && f.hasAudio())
                .or(() -> pickByHeight(formats, f -> f.hasVideo() && !f.hasAudio()))
                .map(CandidateFormat::getUrl)
                .orElse(null);

        String audioUrl = pickAudio(formats)
                .map(CandidateFormat::getUrl)
                .orElse(null);

        // Serves full video bytes for audio-only playback. Kept because clients
        // expect a non-null audio URL whenever a video URL exists.
        if (audioUrl == null && videoUrl != null) {
            log.debug("No audio-only format, reusing the video stream for audio");
            audioUrl = videoUrl;
        }

        return new SelectedStreams(videoUrl, audioUrl);
    }

    private Optional<CandidateFormat> pickByHeight(List<CandidateFormat> formats, Predicate<CandidateFormat> kind) {
        List<CandidateFormat> sorted = formats.stream()
                .filter(CandidateFormat::hasUrl)
                .filter(f -> VIDEO_CONTAINER.equals(f.getExt()))
                .filter(kind)
                .sorted(BY_HEIGHT_DESC)
                .toList();

        if (sorted.isEmpty()) {
            return Optional.empty();
        }

        return sorted.stream()
                .filter(f -> f.getHeight() != null && f.getHeight() <= MAX_PREFERRED_HEIGHT)
                .findFirst()
                .or(() -> Optional.of(sorted.get(0)));
    }

    private Optional<CandidateFormat> pickAudio(List<CandidateFormat> formats) {
        List<CandidateFormat> sorted = formats.stream()
                .filter(CandidateFormat::hasUrl)
                .filter(f -> !f.hasVideo() && f.hasAudio())
                .filter(f -> AUDIO_CONTAINERS.contains(f.getExt()))
                .sorted(BY_ABR_DESC)
                .toList();

        if (sorted.isEmpty()) {
            return Optional.empty();
        }

        return sorted.stream()
                .filter(f -> PREFERRED_AUDIO_CONTAINER.equals(f.getExt()))
                .findFirst()
                .or(() -> Optional.of(sorted.get(0)));
    }
}
