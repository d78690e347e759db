package com.delta.screener.screening.api;

public record ResumeTextRequest(
    Long resumeId,
    String text
) {
}
