package com.delta.screener.screening.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ExperienceEntry(
    String dates,
    String company
) {
    @JsonIgnore
    public boolean isEmpty() {
        return dates == null && company == null;
    }
}
