package com.premiumlens.core.normalize;

import com.premiumlens.core.model.InsuranceRecord;

import java.text.Normalizer;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonicalizes the free-text dimension fields of a record so that strings
 * with the same meaning compare equal as map keys.
 *
 * <h3>Rules</h3>
 * <ol>
 * <li>Unicode NFKC, which folds full-width letters, digits, punctuation and
 * the ideographic space to their half-width forms.</li>
 * <li>Repair of known mojibake left by lossy GBK round trips:
 * {@code 客?} becomes {@code 客车}, {@code 货?} becomes {@code 货车},
 * {@code 旧车?过户} becomes {@code 旧车过户} (where {@code ?} is one or more
 * U+FFFD).</li>
 * <li>Removal of any remaining U+FFFD.</li>
 * <li>Every whitespace run collapsed to a single space, then trimmed.</li>
 * <li>If the input was damaged and now ends in a bare {@code 客} or
 * {@code 货}, {@code 车} is appended.</li>
 * </ol>
 *
 * <p>
 * {@code normalizeText(normalizeText(s)).equals(normalizeText(s))} holds for
 * every input.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordNormalizer {

    private static final char REPLACEMENT = '\uFFFD';

    private static final Pattern PASSENGER = Pattern.compile("客\uFFFD+");
    private static final Pattern FREIGHT = Pattern.compile("货\uFFFD+");
    private static final Pattern USED_CAR_TRANSFER = Pattern.compile("旧车\uFFFD+过户");
    private static final Pattern REPLACEMENTS = Pattern.compile("\uFFFD+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private RecordNormalizer() {
        // utility class
    }

    /**
     * Normalize one text value.
     *
     * @param text raw value, may be {@code null}
     * @return canonical form; {@code null} stays {@code null}
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return null;
        }
        boolean damaged = text.indexOf(REPLACEMENT) >= 0;

        String s = Normalizer.normalize(text, Normalizer.Form.NFKC);
        if (damaged) {
            s = PASSENGER.matcher(s).replaceAll("客车");
            s = FREIGHT.matcher(s).replaceAll("货车");
            s = USED_CAR_TRANSFER.matcher(s).replaceAll("旧车过户");
            s = REPLACEMENTS.matcher(s).replaceAll("");
        }
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();

        if (damaged && (s.endsWith("客") || s.endsWith("货"))) {
            s = s + "车";
        }
        return s;
    }

    /**
     * Normalize the organization, customer category, business type and
     * terminal source of a record.
     *
     * @param record source record; must not be {@code null}
     * @return the same instance when nothing changed, otherwise a new record
     */
    public static InsuranceRecord normalize(InsuranceRecord record) {
        Objects.requireNonNull(record, "Record must not be null");
        String organization = normalizeText(record.getThirdLevelOrganization());
        String customer = normalizeText(record.getCustomerCategory());
        String business = normalizeText(record.getBusinessTypeCategory());
        String terminal = normalizeText(record.getTerminalSource());

        if (organization.equals(record.getThirdLevelOrganization())
                && customer.equals(record.getCustomerCategory())
                && business.equals(record.getBusinessTypeCategory())
                && terminal.equals(record.getTerminalSource())) {
            return record;
        }
        return record.toBuilder()
                .thirdLevelOrganization(organization)
                .customerCategory(customer)
                .businessTypeCategory(business)
                .terminalSource(terminal)
                .build();
    }
}
