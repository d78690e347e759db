package com.delta.screener.screening.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cosine similarity of two documents under TF-IDF weighting over word unigrams and bigrams.
 * Tokens are runs of two or more word characters, idf is smoothed ({@code ln((1+n)/(1+df)) + 1})
 * and each row is L2-normalized. Stateless; one instance serves concurrent callers.
 */
public class TfidfSimilarity {
    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    public static final int DEFAULT_MAX_FEATURES = 1000;

    private final int maxFeatures;

    public TfidfSimilarity() {
        this(DEFAULT_MAX_FEATURES);
    }

    public TfidfSimilarity(int maxFeatures) {
        this.maxFeatures = Math.max(1, maxFeatures);
    }

    /**
     * @return the similarity in [0, 1], or empty when neither document yields a single term
     */
    public OptionalDouble similarity(String left, String right) {
        Map<String, Integer> leftCounts = termCounts(left);
        Map<String, Integer> rightCounts = termCounts(right);

        List<String> vocabulary = vocabulary(leftCounts, rightCounts);
        if (vocabulary.isEmpty()) {
            return OptionalDouble.empty();
        }

        double[] leftVector = new double[vocabulary.size()];
        double[] rightVector = new double[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            String term = vocabulary.get(i);
            int leftTf = leftCounts.getOrDefault(term, 0);
            int rightTf = rightCounts.getOrDefault(term, 0);
            int df = (leftTf > 0 ? 1 : 0) + (rightTf > 0 ? 1 : 0);
            double idf = Math.log((1.0 + 2) / (1.0 + df)) + 1.0;
            leftVector[i] = leftTf * idf;
            rightVector[i] = rightTf * idf;
        }
        normalize(leftVector);
        normalize(rightVector);

        double dot = 0.0;
        for (int i = 0; i < leftVector.length; i++) {
            dot += leftVector[i] * rightVector[i];
        }
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, dot)));
    }

    private List<String> vocabulary(Map<String, Integer> leftCounts, Map<String, Integer> rightCounts) {
        Map<String, Integer> corpus = new HashMap<>(leftCounts);
        rightCounts.forEach((term, count) -> corpus.merge(term, count, Integer::sum));
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(corpus.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));
        List<String> terms = new ArrayList<>();
        for (int i = 0; i < entries.size() && i < maxFeatures; i++) {
            terms.add(entries.get(i).getKey());
        }
        terms.sort(Comparator.naturalOrder());
        return terms;
    }

    static Map<String, Integer> termCounts(String document) {
        Map<String, Integer> counts = new HashMap<>();
        if (document == null || document.isEmpty()) {
            return counts;
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        for (int i = 0; i < tokens.size(); i++) {
            counts.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                counts.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static void normalize(double[] vector) {
        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        if (norm == 0.0) {
            return;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = vector[i] / norm;
        }
    }
}
