package com.github.feedflow.service.extraction;

import lombok.Value;

@Value
public class ProcessResult {

    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Both streams joined, for error classification.
     */
    public String combinedOutput() {
        return (stderr != null ? stderr : "") + "\n" + (stdout != null ? stdout : "");
    }
}
