package com.payment.threatintel.features;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TF-IDF keyword salience over the documents of one cluster, used to name it.
 */
public final class KeywordSalienceExtractor {

    public static final int MAX_FEATURES = 12;
    public static final int TOP_TERMS = 3;
    public static final String FALLBACK_NAME_PREFIX = "Emerging Scam Cluster #";

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "across", "after", "afterwards", "again", "against", "all", "almost",
            "alone", "along", "already", "also", "although", "always", "am", "among", "amongst", "an", "and",
            "another", "any", "anyhow", "anyone", "anything", "anyway", "anywhere", "are", "around", "as", "at",
            "back", "be", "became", "because", "become", "becomes", "been", "before", "beforehand", "behind",
            "being", "below", "beside", "besides", "between", "beyond", "both", "but", "by", "can", "cannot",
            "could", "did", "do", "does", "done", "down", "due", "during", "each", "either", "else",
            "elsewhere", "enough", "etc", "even", "ever", "every", "everyone", "everything", "everywhere",
            "except", "few", "for", "former", "from", "further", "had", "has", "have", "he", "hence", "her",
            "here", "hers", "herself", "him", "himself", "his", "how", "however", "if", "in", "indeed", "into",
            "is", "it", "its", "itself", "just", "last", "latter", "least", "less", "made", "many", "may", "me",
            "meanwhile", "might", "mine", "more", "moreover", "most", "mostly", "much", "must", "my", "myself",
            "neither", "never", "nevertheless", "next", "no", "nobody", "none", "nor", "not", "nothing", "now",
            "nowhere", "of", "off", "often", "on", "once", "one", "only", "onto", "or", "other", "others",
            "otherwise", "our", "ours", "ourselves", "out", "over", "own", "per", "perhaps", "please", "rather",
            "re", "same", "see", "seem", "seemed", "seems", "several", "she", "should", "since", "so", "some",
            "somehow", "someone", "something", "sometime", "sometimes", "somewhere", "still", "such", "than",
            "that", "the", "their", "them", "themselves", "then", "thence", "there", "thereafter", "thereby",
            "therefore", "these", "they", "this", "those", "though", "through", "throughout", "thus", "to",
            "together", "too", "toward", "towards", "under", "until", "up", "upon", "us", "very", "via", "was",
            "we", "well", "were", "what", "whatever", "when", "whence", "whenever", "where", "whereas",
            "wherever", "whether", "which", "while", "who", "whoever", "whole", "whom", "whose", "why", "will",
            "with", "within", "without", "would", "yet", "you", "your", "yours", "yourself", "yourselves");

    private KeywordSalienceExtractor() {
    }

    /** Salient terms with a positive aggregate score, most salient first, at most {@value #TOP_TERMS}. */
    public static List<String> topTerms(List<String> documents) {
        if (documents == null || documents.isEmpty()) return List.of();

        List<List<String>> tokenized = new ArrayList<>(documents.size());
        Map<String, Integer> corpusFrequency = new HashMap<>();
        for (String doc : documents) {
            List<String> tokens = tokenize(doc);
            tokenized.add(tokens);
            for (String t : tokens) corpusFrequency.merge(t, 1, Integer::sum);
        }
        if (corpusFrequency.isEmpty()) return List.of();

        List<String> vocabulary = corpusFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_FEATURES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        int n = documents.size();
        Map<String, Double> idf = new HashMap<>();
        for (String term : vocabulary) {
            long df = tokenized.stream().filter(tokens -> tokens.contains(term)).count();
            idf.put(term, Math.log((1.0 + n) / (1.0 + df)) + 1.0);
        }

        Map<String, Double> columnSums = new LinkedHashMap<>();
        for (String term : vocabulary) columnSums.put(term, 0.0);
        for (List<String> tokens : tokenized) {
            Map<String, Double> row = new HashMap<>();
            for (String t : tokens) {
                if (idf.containsKey(t)) row.merge(t, idf.get(t), Double::sum);
            }
            double norm = Math.sqrt(row.values().stream().mapToDouble(v -> v * v).sum());
            if (norm == 0.0) continue;
            row.forEach((term, value) -> columnSums.merge(term, value / norm, Double::sum));
        }

        return columnSums.entrySet().stream()
                .filter(e -> e.getValue() > 0.0)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TERMS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /** "Loan / Otp / Urgent" style name, or the numbered fallback when there are no terms. */
    public static String clusterName(List<String> terms, int fallbackIndex) {
        if (terms == null || terms.isEmpty()) return FALLBACK_NAME_PREFIX + fallbackIndex;
        return terms.stream().map(KeywordSalienceExtractor::titleCase).collect(Collectors.joining(" / "));
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group();
            if (!STOP_WORDS.contains(token)) out.add(token);
        }
        return out;
    }

    private static String titleCase(String term) {
        if (term.isEmpty()) return term;
        return Character.toUpperCase(term.charAt(0)) + term.substring(1);
    }
}
