package com.github.feedflow.service.extraction;

import com.github.feedflow.exception.ExtractionException.Reason;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristics that map extraction tool output (or a spawn failure message) to a failure reason.
 * Kept apart from the retry and fallback logic because the tool's wording changes between releases.
 */
@Component
public class ExtractionErrorClassifier {

    static final int MAX_MESSAGE_LENGTH = 2000;

    private static final Pattern ERROR_PREFIX =
            Pattern.compile("^ERROR:\\s*(?:\\[[^\\]]+\\]\\s*)?(?:[A-Za-z0-9_-]{11}:)?\\s*", Pattern.CASE_INSENSITIVE);

    public Reason classify(String output) {
        if (output == null || output.isBlank()) {
            return Reason.TOOL_ERROR;
        }
        String text = normalize(output);

        if (isEnvironmentFailure(text)) {
            return Reason.ENVIRONMENT;
        }
        if (text.contains("cookies are no longer valid") || text.contains("likely been rotated in the browser")) {
            return Reason.COOKIES_INVALID;
        }
        if (text.contains("confirm you're not a bot")
                || text.contains("please sign in to continue")
                || text.contains("cookies-from-browser")
                || text.contains("use --cookies")) {
            return Reason.BOT_CHECK;
        }
        if (text.contains("this live event will begin in")) {
            return Reason.LIVE_NOT_STARTED;
        }
        if (text.contains("video unavailable")
                || text.contains("does not exist")
                || text.contains("this video has been removed")
                || text.contains("private video")
                || text.contains("http error 404")
                || text.contains("incomplete youtube id")) {
            return Reason.NOT_FOUND;
        }
        return Reason.TOOL_ERROR;
    }

    /**
     * True when the tool could not run at all on this host, as opposed to failing on a video.
     */
    public boolean isEnvironmentFailure(String output) {
        if (output == null) {
            return false;
        }
        String text = normalize(output);

        if (text.contains("python3") && text.contains("no such file or directory")) {
            return true;
        }
        if (text.contains("/usr/bin/env") && text.contains("python") && text.contains("not found")) {
            return true;
        }
        if (text.contains("spawn") && text.contains("enoent")) {
            return true;
        }
        if (text.contains("eacces")) {
            return true;
        }
        // java.io.IOException from ProcessBuilder.start: "Cannot run program ... error=2, No such file or directory"
        if (text.contains("cannot run program")) {
            return true;
        }
        return text.contains("error=13") || text.contains("permission denied");
    }

    /**
     * One line suitable for logs and client error bodies: the first "ERROR:" line with its
     * extractor and video-id prefix removed, capped in length.
     */
    public String summarize(String output) {
        if (output == null || output.isBlank()) {
            return "Extraction failed";
        }

        String line = output.lines()
                .map(String::trim)
                .filter(l -> l.startsWith("ERROR:"))
                .findFirst()
                .orElseGet(() -> output.lines()
                        .map(String::trim)
                        .filter(l -> !l.isEmpty())
                        .findFirst()
                        .orElse(""));

        String cleaned = ERROR_PREFIX.matcher(line).replaceFirst("");
        if (cleaned.isBlank()) {
            cleaned = line.isBlank() ? "Extraction failed" : line;
        }
        return cleaned.length() > MAX_MESSAGE_LENGTH ? cleaned.substring(0, MAX_MESSAGE_LENGTH) : cleaned;
    }

    private String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replace('’', '\'');
    }
}
