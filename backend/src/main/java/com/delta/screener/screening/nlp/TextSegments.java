package com.delta.screener.screening.nlp;

import java.util.List;

public record TextSegments(
    List<String> sentences,
    List<String> nounPhrases
) {
    public TextSegments {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        nounPhrases = nounPhrases == null ? List.of() : List.copyOf(nounPhrases);
    }
}
