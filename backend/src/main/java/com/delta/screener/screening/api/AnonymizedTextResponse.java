package com.delta.screener.screening.api;

import com.delta.screener.screening.model.ParsedFields;

public record AnonymizedTextResponse(
    String anonymizedText,
    ParsedFields anonymizedFields
) {
}
