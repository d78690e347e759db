package com.delta.screener.screening.nlp;

import java.util.List;
import java.util.Optional;

public record AnalyzedText(
    List<EntitySpan> entities,
    TextSegments segments
) {
    public AnalyzedText {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public Optional<EntitySpan> firstEntity(EntityLabel label) {
        return entities.stream().filter(e -> e.label() == label).findFirst();
    }

    public Optional<EntitySpan> firstEntityWithin(EntityLabel label, String line) {
        return entities.stream()
            .filter(e -> e.label() == label && line.contains(e.text()))
            .findFirst();
    }
}
