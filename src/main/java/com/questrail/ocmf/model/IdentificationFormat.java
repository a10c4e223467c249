package com.questrail.ocmf.model;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Format contract an identification type ({@code IT}) imposes on its
 * identification data ({@code ID}).
 */
public sealed interface IdentificationFormat
{
    /**
     * @param data identification data, never {@code null}
     */
    boolean accepts(String data);

    String description();

    /**
     * No assignment happened; {@code ID} must be empty or absent.
     */
    record NoData() implements IdentificationFormat
    {
        @Override
        public boolean accepts(String data) {
            return data.isEmpty();
        }

        @Override
        public String description() {
            return "empty";
        }
    }

    /**
     * No format defined; any string is accepted.
     */
    record Unrestricted() implements IdentificationFormat
    {
        @Override
        public boolean accepts(String data) {
            return true;
        }

        @Override
        public String description() {
            return "any string";
        }
    }

    record Matching(Pattern pattern, String description) implements IdentificationFormat
    {
        public Matching {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(description, "description");
        }

        @Override
        public boolean accepts(String data) {
            return pattern.matcher(data).matches();
        }
    }

    record MaxLength(int maxLength) implements IdentificationFormat
    {
        @Override
        public boolean accepts(String data) {
            return data.length() <= maxLength;
        }

        @Override
        public String description() {
            return "at most " + maxLength + " characters";
        }
    }

    /**
     * International number with a leading {@code +}, parsed and checked
     * against the numbering plan of its country code.
     */
    record PhoneNumber() implements IdentificationFormat
    {
        @Override
        public boolean accepts(String data) {
            PhoneNumberUtil util = PhoneNumberUtil.getInstance();
            try {
                return util.isValidNumber(util.parse(data, null));
            }
            catch (NumberParseException e) {
                return false;
            }
        }

        @Override
        public String description() {
            return "valid international phone number (+<country><number>)";
        }
    }

    static IdentificationFormat matching(String regex, String description) {
        return new Matching(Pattern.compile(regex), description);
    }
}
