package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.ocmf.error.OcmfError;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed field access on a JSON object node.
 *
 * <p>A JSON {@code null} is treated like an absent key. A present value of
 * the wrong JSON type is a VALIDATION error naming the field.</p>
 */
final class JsonFields
{
    private JsonFields() {}

    static boolean present(JsonNode object, String field) {
        JsonNode value = object.get(field);
        return value != null && !value.isNull();
    }

    static Optional<String> optionalString(JsonNode object, String field) throws WireFormatException {
        if (!present(object, field)) {
            return Optional.empty();
        }
        JsonNode value = object.get(field);
        if (!value.isTextual()) {
            throw invalid(field, "must be a string (was " + value.getNodeType() + ")");
        }
        return Optional.of(value.textValue());
    }

    static String requiredString(JsonNode object, String field) throws WireFormatException {
        return optionalString(object, field).orElseThrow(() -> missing(field));
    }

    static boolean requiredBoolean(JsonNode object, String field) throws WireFormatException {
        if (!present(object, field)) {
            throw missing(field);
        }
        JsonNode value = object.get(field);
        if (!value.isBoolean()) {
            throw invalid(field, "must be a boolean (was " + value.getNodeType() + ")");
        }
        return value.booleanValue();
    }

    /**
     * Accepts a JSON number or a string holding a decimal number.
     *
     * <p>Exponent forms with a negative scale ({@code 1E3}) come back at scale
     * zero, the scale the encoder writes them with.</p>
     */
    static Optional<BigDecimal> optionalDecimal(JsonNode object, String field) throws WireFormatException {
        if (!present(object, field)) {
            return Optional.empty();
        }
        JsonNode value = object.get(field);
        if (value.isNumber()) {
            return Optional.of(nonNegativeScale(value.decimalValue()));
        }
        if (value.isTextual()) {
            try {
                return Optional.of(nonNegativeScale(new BigDecimal(value.textValue().strip())));
            }
            catch (NumberFormatException e) {
                throw invalid(field, "must be a decimal number (was '" + value.textValue() + "')");
            }
        }
        throw invalid(field, "must be a number (was " + value.getNodeType() + ")");
    }

    private static BigDecimal nonNegativeScale(BigDecimal d) {
        return d.scale() < 0 ? d.setScale(0) : d;
    }

    static Optional<Long> optionalInteger(JsonNode object, String field) throws WireFormatException {
        if (!present(object, field)) {
            return Optional.empty();
        }
        JsonNode value = object.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw invalid(field, "must be an integer (was " + value + ")");
        }
        return Optional.of(value.longValue());
    }

    /**
     * Parses a string field through a value-type factory that throws
     * {@link IllegalArgumentException} on bad input.
     */
    static <T> Optional<T> optionalParsed(JsonNode object, String field, Function<String, T> parser)
            throws WireFormatException {
        Optional<String> text = optionalString(object, field);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(text.get()));
        }
        catch (IllegalArgumentException e) {
            throw invalid(field, e.getMessage());
        }
    }

    static <T> T requiredParsed(JsonNode object, String field, Function<String, T> parser)
            throws WireFormatException {
        return optionalParsed(object, field, parser).orElseThrow(() -> missing(field));
    }

    /**
     * Looks a string field up in a code table.
     */
    static <T> Optional<T> optionalCode(JsonNode object, String field,
                                        Function<String, Optional<T>> lookup,
                                        String allowed) throws WireFormatException {
        Optional<String> text = optionalString(object, field);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Optional<T> resolved = lookup.apply(text.get());
        if (resolved.isEmpty()) {
            throw invalid(field, "unknown value '" + text.get() + "' (expected one of " + allowed + ")");
        }
        return resolved;
    }

    static <T> T requiredCode(JsonNode object, String field,
                              Function<String, Optional<T>> lookup,
                              String allowed) throws WireFormatException {
        return optionalCode(object, field, lookup, allowed).orElseThrow(() -> missing(field));
    }

    static WireFormatException missing(String field) {
        return new WireFormatException(OcmfError.validation(field, field + " is required"));
    }

    static WireFormatException invalid(String field, String detail) {
        return new WireFormatException(OcmfError.validation(field, field + " " + detail));
    }
}
