package com.questrail.ocmf.obis;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strongly typed OBIS register identifier as carried in a reading's {@code RI}.
 *
 * <p>Two notations are accepted:</p>
 * <ul>
 *   <li>strict OCMF: six zero-padded upper-case hex pairs, e.g. {@code 01-00:B2.08.00*FF}</li>
 *   <li>IEC 62056-6-1: one or two hex digits per group, optional suffix of up to
 *       three digits, e.g. {@code 1-b:1.8.0} or {@code 1-0:1.8.0*198}</li>
 * </ul>
 *
 * <p>{@link #toString()} reproduces the wire text exactly.</p>
 */
public final class ObisCode
{
    private static final Pattern OCMF_FORMAT = Pattern.compile(
            "[0-9A-F]{2}-[0-9A-F]{2}:[0-9A-F]{2}\\.[0-9A-F]{2}\\.[0-9A-F]{2}\\*[0-9A-F]{2}");

    private static final Pattern IEC_FORMAT = Pattern.compile(
            "[0-9A-Fa-f]{1,2}-[0-9A-Fa-f]{1,2}:[0-9A-Fa-f]{1,2}\\.[0-9A-Fa-f]{1,2}\\.[0-9A-Fa-f]{1,2}(\\*[0-9A-Fa-f]{1,3})?");

    private final String code;
    private final String suffix;

    private ObisCode(String code, String suffix) {
        this.code = code;
        this.suffix = suffix;
    }

    /**
     * @throws IllegalArgumentException if the text matches neither notation
     */
    public static ObisCode parse(String text) {
        Objects.requireNonNull(text, "text");
        if (!OCMF_FORMAT.matcher(text).matches() && !IEC_FORMAT.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid OBIS code '" + text + "'");
        }
        int star = text.indexOf('*');
        if (star < 0) {
            return new ObisCode(text, null);
        }
        return new ObisCode(text.substring(0, star), text.substring(star + 1));
    }

    /**
     * Normalized code without suffix.
     */
    public String code() {
        return code;
    }

    public Optional<String> suffix() {
        return Optional.ofNullable(suffix);
    }

    public Optional<ObisInfo> info() {
        return ObisRegistry.info(code);
    }

    public boolean isBillingRelevant() {
        return ObisRegistry.isBillingRelevant(code);
    }

    public boolean isAccumulationRegister() {
        return ObisRegistry.isAccumulationRegister(code);
    }

    public boolean isTransactionRegister() {
        return ObisRegistry.isTransactionRegister(code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObisCode that)) return false;
        return code.equals(that.code) && Objects.equals(suffix, that.suffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, suffix);
    }

    @Override
    public String toString() {
        return suffix == null ? code : code + "*" + suffix;
    }
}
