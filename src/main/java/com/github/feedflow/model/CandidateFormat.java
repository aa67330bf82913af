package com.github.feedflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * One downloadable format reported by the extraction tool.
 * Codec fields hold the literal "none" when the stream lacks that track.
 */
@Value
@Builder
public class CandidateFormat {

    public static final String NO_CODEC = "none";

    String formatId;
    String ext;
    String vcodec;
    String acodec;
    Integer width;
    Integer height;
    Double fps;
    Double abr;
    String url;
    Long filesize;
    String formatNote;

    public boolean hasVideo() {
        return !NO_CODEC.equals(vcodec);
    }

    public boolean hasAudio() {
        return !NO_CODEC.equals(acodec);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    @Override
    public String toString() {
        // url is a bearer credential for the upstream CDN; keep it out of logs
        return "CandidateFormat(" + formatId + ", " + ext + ", " + vcodec + "/" + acodec
                + ", " + width + "x" + height + ", abr=" + abr + ")";
    }
}
