package com.delta.screener.screening.nlp;

import java.util.List;

/**
 * Linguistic analysis used by resume extraction. Implementations are built once and shared
 * read-only across concurrent screening calls.
 */
public interface TextAnalyzer {

    /**
     * Named entities in document order.
     */
    List<EntitySpan> recognizeEntities(String text);

    TextSegments segment(String text);

    default AnalyzedText analyze(String text) {
        return new AnalyzedText(recognizeEntities(text), segment(text));
    }
}
