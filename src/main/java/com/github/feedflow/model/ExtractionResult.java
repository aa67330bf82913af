package com.github.feedflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractionResult {

    String videoId;
    String title;
    String thumbnailUrl;
    long durationSeconds;

    @Singular
    List<CandidateFormat> formats;
}
