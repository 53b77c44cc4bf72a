package com.premiumlens.core.encoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the most plausible charset for a CSV extract exported by
 * Chinese-locale tooling.
 *
 * <h3>Scoring</h3>
 * <p>
 * A prefix sample of the buffer is decoded with each candidate using a
 * replacing decoder and scored: {@value #CJK_WEIGHT} per CJK ideograph,
 * {@value #REPLACEMENT_PENALTY} per U+FFFD. Characters in the Latin-extended
 * range carry no weight; their count only breaks ties between equal scores
 * (fewer wins, since GBK bytes misread as single-byte text land there).
 * Remaining ties go to the earlier candidate.
 * </p>
 * <p>
 * A sample that is well-formed UTF-8 and contains multi-byte sequences is
 * taken as UTF-8 outright when {@code utf-8} is a candidate: GBK-family
 * decoders read such bytes as plausible ideographs and would otherwise
 * outscore it. Only the UTF-8 score is recorded in that case.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * A candidate that is unknown to the runtime or fails to decode is scored
 * negative infinity and skipped. If no candidate produces a score the whole
 * buffer is decoded as UTF-8 with replacement. Detection never throws.
 * </p>
 *
 * @since 1.0.0
 */
public class EncodingDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EncodingDetector.class);

    static final int CJK_WEIGHT = 5;
    static final int REPLACEMENT_PENALTY = -20;

    private static final char REPLACEMENT = '\uFFFD';
    private static final char BOM = '\uFEFF';

    private final List<String> candidates;
    private final int sampleBytes;

    /**
     * @param candidates  charset names in tie-break order; must not be empty
     * @param sampleBytes maximum prefix length scored per candidate
     * @throws IllegalArgumentException if the candidate list is empty or the
     *                                  sample size is not positive
     */
    public EncodingDetector(List<String> candidates, int sampleBytes) {
        Objects.requireNonNull(candidates, "Candidate list must not be null");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate encoding is required");
        }
        if (sampleBytes < 1) {
            throw new IllegalArgumentException("sampleBytes must be >= 1, got: " + sampleBytes);
        }
        this.candidates = List.copyOf(candidates);
        this.sampleBytes = sampleBytes;
    }

    /**
     * Detect the charset of {@code bytes} and decode the whole buffer with it.
     *
     * @param bytes full file content; must not be {@code null}
     * @return decoded text with a leading byte-order mark removed
     */
    public DecodedText decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "Byte buffer must not be null");
        int sampleLength = Math.min(bytes.length, sampleBytes);
        boolean truncated = sampleLength < bytes.length;

        Map<String, Double> scores = new LinkedHashMap<>();
        String utf8 = utf8Candidate();
        if (utf8 != null) {
            String strict = strictUtf8Sample(bytes, sampleLength, truncated);
            if (strict != null && hasNonAscii(bytes, sampleLength)) {
                scores.put(utf8, score(strict));
                LOG.debug("Sample is well-formed UTF-8 (score={})", scores.get(utf8));
                return new DecodedText(stripBom(decodeFully(StandardCharsets.UTF_8, bytes)), utf8, scores);
            }
        }

        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        long bestLatin = Long.MAX_VALUE;

        for (String name : candidates) {
            double score;
            long latin;
            try {
                String sample = decodeSample(Charset.forName(name), bytes, sampleLength, truncated);
                score = score(sample);
                latin = countLatinExtended(sample);
            } catch (IllegalArgumentException | CharacterCodingException e) {
                // IllegalArgumentException covers unsupported and illegal charset names
                LOG.debug("Candidate encoding {} failed: {}", name, e.toString());
                scores.put(name, Double.NEGATIVE_INFINITY);
                continue;
            }
            scores.put(name, score);
            LOG.trace("Candidate {} scored {} (latin-extended={})", name, score, latin);
            if (score > bestScore || (score == bestScore && latin < bestLatin)) {
                best = name;
                bestScore = score;
                bestLatin = latin;
            }
        }

        if (best == null) {
            LOG.warn("No candidate encoding could decode the input, falling back to permissive UTF-8");
            return new DecodedText(stripBom(new String(bytes, StandardCharsets.UTF_8)), "utf-8", scores);
        }

        String text = decodeFully(Charset.forName(best), bytes);
        LOG.debug("Detected encoding {} (scores={})", best, scores);
        return new DecodedText(stripBom(text), best, scores);
    }

    /**
     * Score a decoded text sample.
     *
     * @param text decoded text
     * @return CJK reward minus replacement penalty
     */
    static double score(CharSequence text) {
        long cjk = 0;
        long replacements = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == REPLACEMENT) {
                replacements++;
            } else if (isCjk(c)) {
                cjk++;
            }
        }
        return (double) cjk * CJK_WEIGHT + (double) replacements * REPLACEMENT_PENALTY;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String decodeSample(Charset charset, byte[] bytes, int length, boolean truncated)
            throws CharacterCodingException {
        CharsetDecoder decoder = replacingDecoder(charset);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(length * (double) decoder.maxCharsPerByte()) + 16);
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, length);
        // a multi-byte sequence cut by the sample boundary stays unread rather than
        // turning into a replacement character
        CoderResult result = decoder.decode(in, out, !truncated);
        if (result.isError()) {
            result.throwException();
        }
        if (!truncated) {
            decoder.flush(out);
        }
        out.flip();
        return out.toString();
    }

    private String utf8Candidate() {
        for (String name : candidates) {
            try {
                if (StandardCharsets.UTF_8.equals(Charset.forName(name))) {
                    return name;
                }
            } catch (IllegalArgumentException e) {
                LOG.debug("Ignoring unknown candidate encoding {}", name);
            }
        }
        return null;
    }

    /**
     * @return the sample decoded as strict UTF-8, or {@code null} when it
     *         contains a malformed sequence
     */
    private static String strictUtf8Sample(byte[] bytes, int length, boolean truncated) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(length + 16);
        CoderResult result = decoder.decode(ByteBuffer.wrap(bytes, 0, length), out, !truncated);
        if (result.isError()) {
            return null;
        }
        if (!truncated && decoder.flush(out).isError()) {
            return null;
        }
        out.flip();
        return out.toString();
    }

    private static boolean hasNonAscii(byte[] bytes, int length) {
        for (int i = 0; i < length; i++) {
            if (bytes[i] < 0) {
                return true;
            }
        }
        return false;
    }

    private static String decodeFully(Charset charset, byte[] bytes) {
        try {
            return replacingDecoder(charset).decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // cannot happen with REPLACE actions; keep the contract of never throwing
            LOG.warn("Full decode with {} failed, using UTF-8: {}", charset, e.toString());
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static CharsetDecoder replacingDecoder(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    private static boolean isCjk(char c) {
        return (c >= '\u4E00' && c <= '\u9FFF') || (c >= '\u3400' && c <= '\u4DBF');
    }

    private static long countLatinExtended(CharSequence text) {
        long count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '\u00C0' && c <= '\u024F') {
                count++;
            }
        }
        return count;
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }
}
