package com.questrail.ocmf.obis;

import java.util.LinkedHashMap;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ObisRegistry
 * -----------------------------------------------------------------------------
 * Static classification of meter register codes (IEC 62056-6-1, OCMF Table 25).
 *
 * <p>OCMF reserves manufacturer-specific codes in the C field for billing data:</p>
 * <ul>
 *   <li>{@code 01-00:B0.08.00} .. {@code B3}: import energy (total mains,
 *       total device, transaction mains, transaction device)</li>
 *   <li>{@code 01-00:C0.08.00} .. {@code C3}: the export counterparts</li>
 * </ul>
 *
 * <p>{@code B0,B1,C0,C1} are life-of-device totals; {@code B2,B3,C2,C3} are
 * session-scoped. All eight are accumulation registers, the only registers a
 * cumulated loss ({@code CL}) value may accompany.</p>
 *
 * <p>The table is built once at class initialization and never mutated, so
 * every method is safe to call from any thread.</p>
 */
public final class ObisRegistry
{
    static final Pattern ACCUMULATION = Pattern.compile("01-00:[BC][0-3]\\.08\\.00");
    static final Pattern TRANSACTION = Pattern.compile("01-00:[BC][23]\\.08\\.00");
    private static final Pattern IEC_ENERGY = Pattern.compile("01-00:0[12]\\.08\\.00");

    private static final Map<String, ObisInfo> KNOWN;

    static {
        Map<String, ObisInfo> table = new LinkedHashMap<>();
        register(table, "01-00:B0.08.00", "Total Import Mains Energy (energy at meter)", true, ObisCategory.IMPORT);
        register(table, "01-00:B1.08.00", "Total Import Device Energy (energy at device/car)", true, ObisCategory.IMPORT);
        register(table, "01-00:B2.08.00", "Transaction Import Mains Energy (session energy at meter)", true, ObisCategory.IMPORT);
        register(table, "01-00:B3.08.00", "Transaction Import Device Energy (session energy at device)", true, ObisCategory.IMPORT);
        register(table, "01-00:C0.08.00", "Total Export Mains Energy", true, ObisCategory.EXPORT);
        register(table, "01-00:C1.08.00", "Total Export Device Energy", true, ObisCategory.EXPORT);
        register(table, "01-00:C2.08.00", "Transaction Export Mains Energy", true, ObisCategory.EXPORT);
        register(table, "01-00:C3.08.00", "Transaction Export Device Energy", true, ObisCategory.EXPORT);

        register(table, "01-00:00.08.06", "Charging duration (time-based)", false, ObisCategory.OTHER);
        register(table, "01-00:01.08.00", "Active energy import (+A) total", true, ObisCategory.IMPORT);
        register(table, "01-00:02.08.00", "Active energy export (-A) total", true, ObisCategory.EXPORT);
        register(table, "01-00:16.07.00", "Sum active power (total)", false, ObisCategory.POWER);

        // Pre-1.4 OCMF records use the short IEC notation.
        register(table, "1-b:1.8.0", "Active energy import (+A) - legacy format", true, ObisCategory.IMPORT);
        register(table, "1-b:2.8.0", "Active energy export (-A) - legacy format", true, ObisCategory.EXPORT);

        KNOWN = Collections.unmodifiableMap(table);
    }

    private ObisRegistry() {}

    private static void register(Map<String, ObisInfo> table,
                                 String code,
                                 String description,
                                 boolean billingRelevant,
                                 ObisCategory category) {
        table.put(code, new ObisInfo(code, description, billingRelevant, category));
    }

    /**
     * Strips the optional {@code *suffix}: {@code 01-00:B0.08.00*FF} becomes
     * {@code 01-00:B0.08.00}.
     */
    public static String normalize(String code) {
        int star = code.indexOf('*');
        return star < 0 ? code : code.substring(0, star);
    }

    public static Optional<ObisInfo> info(String code) {
        return Optional.ofNullable(KNOWN.get(normalize(code)));
    }

    /**
     * Returns every registered entry in registration order.
     */
    public static Map<String, ObisInfo> knownCodes() {
        return KNOWN;
    }

    public static boolean isAccumulationRegister(String code) {
        return ACCUMULATION.matcher(normalize(code)).matches();
    }

    public static boolean isTransactionRegister(String code) {
        return TRANSACTION.matcher(normalize(code)).matches();
    }

    /**
     * Table lookup first; unknown codes fall back to the accumulation pattern
     * and the IEC {@code 01-00:01.08.00 / 02.08.00} energy registers.
     */
    public static boolean isBillingRelevant(String code) {
        String normalized = normalize(code);
        ObisInfo info = KNOWN.get(normalized);
        if (info != null) {
            return info.billingRelevant();
        }
        return ACCUMULATION.matcher(normalized).matches()
                || IEC_ENERGY.matcher(normalized).matches();
    }

    /**
     * Checks that a reading identification is usable for billing.
     *
     * @param code OBIS code or {@code null}
     * @return empty if suitable, otherwise the reason it is not
     */
    public static Optional<String> validateForBilling(String code) {
        if (code == null) {
            return Optional.of("OBIS code (RI) is required for billing-relevant readings");
        }
        if (!isBillingRelevant(code)) {
            return Optional.of("OBIS code '" + normalize(code) + "' is not billing-relevant");
        }
        return Optional.empty();
    }
}
