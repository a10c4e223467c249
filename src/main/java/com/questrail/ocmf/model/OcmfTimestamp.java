package com.questrail.ocmf.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Timestamp with synchronization status ({@code TM}).
 *
 * <h2>Wire form</h2>
 * <pre>
 *   2019-08-13T10:03:15,000+0000 I
 * </pre>
 * <p>Milliseconds are separated by a <strong>comma</strong>, the offset has no
 * colon, and a single space precedes the {@link TimeStatus} flag.
 * {@link #toString()} always reproduces this form.</p>
 *
 * <p>Ordering between timestamps compares instants; the status flag does not
 * take part.</p>
 */
public record OcmfTimestamp(OffsetDateTime dateTime, TimeStatus status)
{
    private static final Pattern WIRE_FORMAT = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2},\\d{3}[+-]\\d{4} [UISR]");

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss,SSSxx")
            .withResolverStyle(ResolverStyle.STRICT);

    public OcmfTimestamp {
        Objects.requireNonNull(dateTime, "dateTime");
        Objects.requireNonNull(status, "status");
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid OCMF timestamp
     */
    public static OcmfTimestamp parse(String text) {
        Objects.requireNonNull(text, "text");
        if (!WIRE_FORMAT.matcher(text).matches()) {
            throw new IllegalArgumentException(
                    "Timestamp '" + text + "' does not match 'YYYY-MM-DDThh:mm:ss,fff+zzzz S'");
        }
        int space = text.lastIndexOf(' ');
        TimeStatus status = TimeStatus.fromCode(text.charAt(space + 1)).orElseThrow();
        try {
            return new OcmfTimestamp(OffsetDateTime.parse(text.substring(0, space), FORMATTER), status);
        }
        catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Timestamp '" + text + "' is not a valid date/time", e);
        }
    }

    public Instant instant() {
        return dateTime.toInstant();
    }

    public boolean isSynchronized() {
        return status == TimeStatus.SYNCHRONIZED;
    }

    public boolean isBefore(OcmfTimestamp other) {
        return instant().isBefore(other.instant());
    }

    @Override
    public String toString() {
        return FORMATTER.format(dateTime) + " " + status.code();
    }
}
