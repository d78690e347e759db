package com.delta.screener.screening.nlp;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based analyzer for resume text: capitalization runs for entities, per-line sentence
 * segmentation and stop-word delimited noun phrases. Holds no per-call state.
 */
public class HeuristicTextAnalyzer implements TextAnalyzer {
    private static final Pattern LINE = Pattern.compile("[^\\r\\n]+");
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9+#]+(?:[./'&-][A-Za-z0-9+#]+)*");
    private static final Pattern RUN_GAP = Pattern.compile("[ \\t]+(?:&[ \\t]+)?");
    private static final Pattern PHRASE_GAP = Pattern.compile("[ \\t]+");
    private static final Pattern NAME_WORD = Pattern.compile("[A-Z][A-Za-z'-]*");
    private static final Pattern NUMERIC = Pattern.compile("\\d+(?:[./-]\\d+)*");
    private static final int MIN_PERSON_TOKENS = 2;
    private static final int MAX_PERSON_TOKENS = 3;

    private static final Set<String> CONNECTORS = Set.of("of", "and", "for", "the", "de");

    private static final Set<String> ORG_MARKERS = Set.of(
        "university", "college", "institute", "school", "academy", "polytechnic",
        "inc", "corp", "corporation", "llc", "ltd", "limited", "gmbh", "plc",
        "company", "co", "technologies", "labs", "bank", "group", "holdings", "partners"
    );

    private static final Set<String> NON_NAME_WORDS = Set.of(
        "resume", "curriculum", "vitae", "cv", "profile", "summary", "objective", "contact",
        "experience", "work", "employment", "career", "history", "education", "skills", "projects",
        "certifications", "references", "languages", "interests", "achievements", "professional",
        "technical", "personal", "details", "information", "email", "phone", "address",
        "senior", "junior", "lead", "principal", "staff", "chief", "head", "software", "data",
        "engineer", "engineering", "developer", "development", "manager", "management", "analyst",
        "scientist", "architect", "consultant", "designer", "intern", "director", "specialist",
        "administrator", "full", "stack", "backend", "frontend", "cloud", "platform", "web",
        "bachelor", "master", "doctor", "science", "arts", "computer", "degree", "diploma",
        "january", "february", "march", "april", "may", "june", "july", "august", "september",
        "october", "november", "december", "present", "current", "new", "remote"
    );

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "but", "nor", "of", "in", "on", "at", "to", "for", "with",
        "by", "from", "as", "into", "over", "under", "via", "per", "about", "across", "within",
        "is", "are", "was", "were", "be", "been", "being", "am", "has", "have", "had",
        "do", "does", "did", "will", "would", "can", "could", "should",
        "i", "me", "my", "we", "our", "you", "your", "he", "she", "him", "his", "her", "they",
        "their", "it", "its", "this", "that", "these", "those", "which", "who", "whom",
        "also", "not", "no", "than", "then", "very", "more", "most",
        "using", "used", "use", "built", "build", "building", "developed", "develop", "developing",
        "designed", "implemented", "worked", "working", "created", "maintained", "managed",
        "reduced", "improved", "including", "led", "mentored", "conducted", "collaborated"
    );

    private final Set<String> nonNameWords;

    public HeuristicTextAnalyzer() {
        this(List.of());
    }

    /**
     * @param vocabulary extra lowercase words that must never be read as part of a person name,
     *                   typically the skill vocabulary
     */
    public HeuristicTextAnalyzer(Collection<String> vocabulary) {
        Set<String> words = new HashSet<>(NON_NAME_WORDS);
        for (String entry : vocabulary) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.toLowerCase(Locale.ROOT).split("\\s+")) {
                if (!part.isBlank()) {
                    words.add(part);
                }
            }
        }
        this.nonNameWords = Set.copyOf(words);
    }

    @Override
    public List<EntitySpan> recognizeEntities(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<EntitySpan> entities = new ArrayList<>();
        Matcher lines = LINE.matcher(text);
        while (lines.find()) {
            String line = lines.group();
            int offset = lines.start();
            List<Token> tokens = tokenize(line);
            for (Run run : capitalizedRuns(line, tokens)) {
                EntityLabel label = classify(run);
                if (label == null) {
                    continue;
                }
                int start = run.first().start();
                int end = run.last().end();
                entities.add(new EntitySpan(offset + start, offset + end, line.substring(start, end), label));
            }
        }
        return entities;
    }

    @Override
    public TextSegments segment(String text) {
        if (text == null || text.isEmpty()) {
            return new TextSegments(List.of(), List.of());
        }
        List<String> sentences = new ArrayList<>();
        List<String> phrases = new ArrayList<>();
        Matcher lines = LINE.matcher(text);
        while (lines.find()) {
            String line = lines.group();
            if (line.isBlank()) {
                continue;
            }
            collectSentences(line, sentences);
            collectNounPhrases(line, phrases);
        }
        return new TextSegments(sentences, phrases);
    }

    private void collectSentences(String line, List<String> out) {
        BreakIterator iterator = BreakIterator.getSentenceInstance(Locale.US);
        iterator.setText(line);
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            String sentence = line.substring(start, end).trim();
            if (!sentence.isEmpty()) {
                out.add(sentence);
            }
        }
    }

    private void collectNounPhrases(String line, List<String> out) {
        List<Token> current = new ArrayList<>();
        Token previous = null;
        for (Token token : tokenize(line)) {
            boolean breaks = isPhraseBreaker(token.text())
                || (previous != null && !PHRASE_GAP.matcher(line.substring(previous.end(), token.start())).matches());
            if (breaks) {
                flushPhrase(line, current, out);
            }
            if (!isPhraseBreaker(token.text())) {
                current.add(token);
            }
            previous = token;
        }
        flushPhrase(line, current, out);
    }

    private void flushPhrase(String line, List<Token> current, List<String> out) {
        if (!current.isEmpty()) {
            out.add(line.substring(current.get(0).start(), current.get(current.size() - 1).end()));
            current.clear();
        }
    }

    private boolean isPhraseBreaker(String token) {
        return STOP_WORDS.contains(token.toLowerCase(Locale.ROOT)) || NUMERIC.matcher(token).matches();
    }

    private List<Run> capitalizedRuns(String line, List<Token> tokens) {
        List<Run> runs = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int runStartIndex = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean capitalized = Character.isUpperCase(token.text().charAt(0));
            boolean connector = CONNECTORS.contains(token.text().toLowerCase(Locale.ROOT));
            boolean contiguous = current.isEmpty()
                || RUN_GAP.matcher(line.substring(current.get(current.size() - 1).end(), token.start())).matches();

            if (!contiguous) {
                addRun(line, tokens, runStartIndex, current, runs);
                current = new ArrayList<>();
            }
            if (capitalized || (connector && !current.isEmpty())) {
                if (current.isEmpty()) {
                    runStartIndex = i;
                }
                current.add(token);
            } else {
                addRun(line, tokens, runStartIndex, current, runs);
                current = new ArrayList<>();
            }
        }
        addRun(line, tokens, runStartIndex, current, runs);
        return runs;
    }

    private void addRun(String line, List<Token> tokens, int startIndex, List<Token> current, List<Run> runs) {
        List<Token> trimmed = new ArrayList<>(current);
        while (!trimmed.isEmpty() && isConnector(trimmed.get(trimmed.size() - 1))) {
            trimmed.remove(trimmed.size() - 1);
        }
        if (trimmed.isEmpty()) {
            return;
        }
        boolean afterAt = false;
        if (startIndex > 0) {
            Token before = tokens.get(startIndex - 1);
            afterAt = "at".equalsIgnoreCase(before.text());
        }
        if (!afterAt) {
            String prefix = line.substring(0, trimmed.get(0).start()).stripTrailing();
            afterAt = prefix.endsWith("@");
        }
        runs.add(new Run(List.copyOf(trimmed), afterAt));
    }

    private EntityLabel classify(Run run) {
        for (Token token : run.tokens()) {
            String word = token.text().toLowerCase(Locale.ROOT);
            if (word.endsWith(".")) {
                word = word.substring(0, word.length() - 1);
            }
            if (ORG_MARKERS.contains(word)) {
                return EntityLabel.ORG;
            }
        }
        if (run.afterAt()) {
            return EntityLabel.ORG;
        }
        return looksLikePersonName(run) ? EntityLabel.PERSON : null;
    }

    private boolean looksLikePersonName(Run run) {
        int size = run.tokens().size();
        if (size < MIN_PERSON_TOKENS || size > MAX_PERSON_TOKENS) {
            return false;
        }
        for (Token token : run.tokens()) {
            if (isConnector(token) || !NAME_WORD.matcher(token.text()).matches()) {
                return false;
            }
            if (nonNameWords.contains(token.text().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isConnector(Token token) {
        return CONNECTORS.contains(token.text().toLowerCase(Locale.ROOT));
    }

    private static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(line);
        while (matcher.find()) {
            tokens.add(new Token(matcher.start(), matcher.end(), matcher.group()));
        }
        return tokens;
    }

    private record Token(int start, int end, String text) {
    }

    private record Run(List<Token> tokens, boolean afterAt) {
        Token first() {
            return tokens.get(0);
        }

        Token last() {
            return tokens.get(tokens.size() - 1);
        }
    }
}
