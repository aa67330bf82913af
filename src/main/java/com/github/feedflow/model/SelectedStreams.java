package com.github.feedflow.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of format selection. Either URL may be null.
 */
@Value
@AllArgsConstructor
public class SelectedStreams {

    String videoUrl;
    String audioUrl;

    public static SelectedStreams none() {
        return new SelectedStreams(null, null);
    }
}
