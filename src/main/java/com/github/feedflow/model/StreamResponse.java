package com.github.feedflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Body of /stream. A URL is present only for kinds that were requested and exist.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamResponse {

    private String title;
    private long duration;
    private String thumbnailUrl;
    private String videoUrl;
    private String audioUrl;
}
