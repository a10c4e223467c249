package com.questrail.ocmf.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Pagination token ({@code PG}) linking related records.
 *
 * <h2>Protocol constraints</h2>
 * <ul>
 *   <li>{@code T<n>}: transaction context, {@code F<n>}: fiscal context</li>
 *   <li>{@code n} is at least 1 and has no leading zero ({@code T0}, {@code T01}
 *       and {@code F00} are rejected)</li>
 * </ul>
 */
public final class Pagination
{
    private static final Pattern FORMAT = Pattern.compile("[TF][1-9][0-9]*");

    /**
     * Scope of the running counter.
     */
    public enum Context
    {
        TRANSACTION('T'),
        FISCAL('F');

        private final char prefix;

        Context(char prefix) {
            this.prefix = prefix;
        }

        public char prefix() {
            return prefix;
        }
    }

    private final Context context;
    private final long number;

    private Pagination(Context context, long number) {
        this.context = context;
        this.number = number;
    }

    /**
     * @throws IllegalArgumentException if the token is malformed
     */
    public static Pagination parse(String text) {
        Objects.requireNonNull(text, "text");
        if (!FORMAT.matcher(text).matches()) {
            throw new IllegalArgumentException(
                    "Pagination '" + text + "' must be T<n> or F<n> with n >= 1 and no leading zero");
        }
        final long number;
        try {
            number = Long.parseLong(text.substring(1));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Pagination '" + text + "' counter out of range", e);
        }
        Context context = text.charAt(0) == 'T' ? Context.TRANSACTION : Context.FISCAL;
        return new Pagination(context, number);
    }

    public static Pagination of(Context context, long number) {
        Objects.requireNonNull(context, "context");
        if (number < 1) {
            throw new IllegalArgumentException("Pagination counter must be >= 1 (was " + number + ")");
        }
        return new Pagination(context, number);
    }

    public Context context() {
        return context;
    }

    public long number() {
        return number;
    }

    /**
     * {@code true} if {@code next} carries the immediately following counter value.
     */
    public boolean isFollowedBy(Pagination next) {
        return next.number == number + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pagination that)) return false;
        return context == that.context && number == that.number;
    }

    @Override
    public int hashCode() {
        return Objects.hash(context, number);
    }

    @Override
    public String toString() {
        return context.prefix() + Long.toString(number);
    }
}
