package com.payment.threatintel.intel;

/**
 * Text embedded for an event or candidate transaction: the sender's reason followed by the payee.
 */
final class SampleText {

    private SampleText() {
    }

    static String of(String reason, String receiver) {
        String r = reason != null ? reason.trim() : "";
        String p = receiver != null ? receiver.trim() : "";
        if (r.isEmpty()) return p;
        if (p.isEmpty()) return r;
        return r + " " + p;
    }
}
