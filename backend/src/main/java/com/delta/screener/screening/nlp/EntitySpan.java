package com.delta.screener.screening.nlp;

public record EntitySpan(
    int start,
    int end,
    String text,
    EntityLabel label
) {
}
