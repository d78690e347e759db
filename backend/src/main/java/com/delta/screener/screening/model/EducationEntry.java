package com.delta.screener.screening.model;

public record EducationEntry(
    String institution,
    String degree,
    String year
) {
}
