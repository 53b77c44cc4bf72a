package com.premiumlens.core.encoding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of decoding a byte buffer: the text, the winning charset name and
 * the score every candidate achieved on the sample.
 *
 * @since 1.0.0
 */
public final class DecodedText {

    private final String text;
    private final String encoding;
    private final Map<String, Double> candidateScores;

    public DecodedText(String text, String encoding, Map<String, Double> candidateScores) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
        this.candidateScores = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(candidateScores, "candidateScores must not be null")));
    }

    public String getText() {
        return text;
    }

    /**
     * @return lower-case charset name as listed among the candidates, e.g.
     *         {@code "gb18030"}
     */
    public String getEncoding() {
        return encoding;
    }

    /**
     * @return candidate name to sample score, in candidate order; a candidate
     *         that could not decode at all scores negative infinity
     */
    public Map<String, Double> getCandidateScores() {
        return candidateScores;
    }

    @Override
    public String toString() {
        return "DecodedText{encoding='" + encoding + "', length=" + text.length()
                + ", scores=" + candidateScores + '}';
    }
}
