package com.premiumlens.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A categorical value whose canonical form in the source CSV is a fixed label
 * (for most insurance dimensions a Chinese business term).
 *
 * @since 1.0.0
 */
public interface LabeledValue {

    /**
     * @return the canonical label as it appears in source data
     */
    String label();

    /**
     * Look up the constant of {@code type} whose label equals {@code label}
     * exactly.
     *
     * @param type  enum class; must not be {@code null}
     * @param label candidate label, may be {@code null}
     * @param <E>   enum type
     * @return the matching constant, or empty when nothing matches
     */
    static <E extends Enum<E> & LabeledValue> Optional<E> fromLabel(Class<E> type, String label) {
        Objects.requireNonNull(type, "Enum type must not be null");
        if (label == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.label().equals(label)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
