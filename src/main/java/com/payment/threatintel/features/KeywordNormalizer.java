package com.payment.threatintel.features;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword canonicalisation shared by cluster merging and real-time matching. Payment-channel names are
 * interchangeable in scam narratives ("send via UPI" vs "pay the EMI"), so they collapse to one token.
 */
public final class KeywordNormalizer {

    public static final String PAYMENT = "payment";

    public static final Set<String> PAYMENT_SYNONYMS = Set.of("upi", "emi", "paytm", "pay", "payment");

    /** High-signal scam vocabulary that can override a weak text-embedding similarity. */
    public static final Set<String> CORE_SCAM_KEYWORDS = Set.of(
            "loan", "otp", "job", "invest", "investment", "crypto", "urgent", "verify", "kyc", "work", "hiring");

    private KeywordNormalizer() {
    }

    /** Lowercased, trimmed keywords; blanks dropped. */
    public static Set<String> lower(Collection<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords == null) return out;
        for (String kw : keywords) {
            if (kw == null) continue;
            String k = kw.trim().toLowerCase(Locale.ROOT);
            if (!k.isEmpty()) out.add(k);
        }
        return out;
    }

    /** Lowercased keywords with every payment-channel synonym replaced by {@link #PAYMENT}. */
    public static Set<String> normalize(Collection<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        for (String k : lower(keywords)) {
            out.add(PAYMENT_SYNONYMS.contains(k) ? PAYMENT : k);
        }
        return out;
    }

    public static boolean hasPaymentTerm(Set<String> lowered) {
        for (String k : lowered) {
            if (PAYMENT_SYNONYMS.contains(k)) return true;
        }
        return false;
    }

    public static Set<String> intersection(Set<String> a, Set<String> b) {
        Set<String> out = new LinkedHashSet<>(a);
        out.retainAll(b);
        return out;
    }

    public static Set<String> coreTerms(Set<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        for (String k : keywords) {
            if (CORE_SCAM_KEYWORDS.contains(k)) out.add(k);
        }
        return out;
    }

    /** |a ∩ b| / |a ∪ b|, 0 when both are empty. */
    public static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) return 0.0;
        return (double) intersection(a, b).size() / union.size();
    }
}
