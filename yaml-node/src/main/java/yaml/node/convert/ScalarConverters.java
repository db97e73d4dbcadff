package yaml.node.convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// Built-in converters for strings, booleans, characters and numbers.
///
/// Scalar syntax follows YAML 1.1 conventions:
///
/// | Type | Accepted text |
/// |------|---------------|
/// | `Boolean` | `y/n`, `yes/no`, `true/false`, `on/off`; lower, UPPER or Capitalised |
/// | integral | optional sign; decimal, `0x` hex or leading-`0` octal |
/// | `Float`, `Double` | decimal or exponent notation; `.inf`, `-.inf`, `.nan` |
/// | `BigDecimal` | decimal or exponent notation |
/// | `Character` | exactly one character |
///
/// Numbers tolerate trailing whitespace but nothing else after the digits.
/// Digits are ASCII only, and a finite literal too large for its type is rejected.
public final class ScalarConverters {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Set<String> POSITIVE_INFINITY = Set.of(".inf", ".Inf", ".INF", "+.inf", "+.Inf", "+.INF");
    private static final Set<String> NEGATIVE_INFINITY = Set.of("-.inf", "-.Inf", "-.INF");
    private static final Set<String> NOT_A_NUMBER = Set.of(".nan", ".NaN", ".NAN");

    private static final String[][] BOOLEAN_NAMES = {
            {"y", "n"}, {"yes", "no"}, {"true", "false"}, {"on", "off"}
    };

    public static final NodeConverter<String> STRING =
            NodeConverter.scalar(s -> s, Optional::of);

    public static final NodeConverter<Boolean> BOOLEAN =
            NodeConverter.scalar(b -> b ? "true" : "false", ScalarConverters::parseBoolean);

    public static final NodeConverter<Character> CHARACTER =
            NodeConverter.scalar(Object::toString,
                    text -> text.length() == 1 ? Optional.of(text.charAt(0)) : Optional.empty());

    public static final NodeConverter<Byte> BYTE = NodeConverter.scalar(Object::toString,
            text -> parseInteger(text)
                    .filter(v -> fits(v, Byte.MIN_VALUE, Byte.MAX_VALUE))
                    .map(BigInteger::byteValue));

    public static final NodeConverter<Short> SHORT = NodeConverter.scalar(Object::toString,
            text -> parseInteger(text)
                    .filter(v -> fits(v, Short.MIN_VALUE, Short.MAX_VALUE))
                    .map(BigInteger::shortValue));

    public static final NodeConverter<Integer> INTEGER = NodeConverter.scalar(Object::toString,
            text -> parseInteger(text)
                    .filter(v -> fits(v, Integer.MIN_VALUE, Integer.MAX_VALUE))
                    .map(BigInteger::intValue));

    public static final NodeConverter<Long> LONG = NodeConverter.scalar(Object::toString,
            text -> parseInteger(text)
                    .filter(v -> fits(v, Long.MIN_VALUE, Long.MAX_VALUE))
                    .map(BigInteger::longValue));

    public static final NodeConverter<BigInteger> BIG_INTEGER =
            NodeConverter.scalar(BigInteger::toString, ScalarConverters::parseInteger);

    public static final NodeConverter<Double> DOUBLE =
            NodeConverter.scalar(ScalarConverters::formatDouble, ScalarConverters::parseDouble);

    public static final NodeConverter<Float> FLOAT = NodeConverter.scalar(
            f -> formatDouble(f.doubleValue(), Float.toString(f)),
            ScalarConverters::parseFloat);

    public static final NodeConverter<BigDecimal> BIG_DECIMAL = NodeConverter.scalar(BigDecimal::toString,
            text -> {
                final var trimmed = text.stripTrailing();
                return DECIMAL.matcher(trimmed).matches()
                        ? Optional.of(new BigDecimal(trimmed))
                        : Optional.empty();
            });

    private ScalarConverters() {
        // Static utility class
    }

    /// {@return the built-in converters keyed by the type they handle, in registration order}
    static Map<Class<?>, NodeConverter<?>> defaults() {
        final var defaults = new LinkedHashMap<Class<?>, NodeConverter<?>>();
        defaults.put(String.class, STRING);
        defaults.put(Boolean.class, BOOLEAN);
        defaults.put(Character.class, CHARACTER);
        defaults.put(Byte.class, BYTE);
        defaults.put(Short.class, SHORT);
        defaults.put(Integer.class, INTEGER);
        defaults.put(Long.class, LONG);
        defaults.put(BigInteger.class, BIG_INTEGER);
        defaults.put(Float.class, FLOAT);
        defaults.put(Double.class, DOUBLE);
        defaults.put(BigDecimal.class, BIG_DECIMAL);
        return defaults;
    }

    /// Parses a YAML 1.1 boolean.
    ///
    /// @param text the scalar text
    /// @return the boolean, or empty when `text` is not one of the accepted spellings
    public static Optional<Boolean> parseBoolean(String text) {
        if (!isFlexibleCase(text)) {
            return Optional.empty();
        }
        final var lower = text.toLowerCase(Locale.ROOT);
        for (final var names : BOOLEAN_NAMES) {
            if (names[0].equals(lower)) {
                return Optional.of(Boolean.TRUE);
            }
            if (names[1].equals(lower)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /// Parses an integer with optional sign and `0x` / leading-`0` radix prefix.
    ///
    /// @param text the scalar text
    /// @return the value, or empty when `text` is not an integer
    public static Optional<BigInteger> parseInteger(String text) {
        final var trimmed = text.stripTrailing();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        var digits = trimmed;
        var negative = false;
        final char sign = digits.charAt(0);
        if (sign == '+' || sign == '-') {
            negative = sign == '-';
            digits = digits.substring(1);
        }
        var radix = 10;
        if (digits.length() > 2 && digits.charAt(0) == '0'
                && (digits.charAt(1) == 'x' || digits.charAt(1) == 'X')) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            radix = 8;
            digits = digits.substring(1);
        }
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isAsciiDigit(digits.charAt(i), radix)) {
                return Optional.empty();
            }
        }
        final var value = new BigInteger(digits, radix);
        return Optional.of(negative ? value.negate() : value);
    }

    /// Parses a floating point number, including the YAML infinity and NaN spellings.
    ///
    /// @param text the scalar text
    /// @return the value, or empty when `text` is not a number
    public static Optional<Double> parseDouble(String text) {
        final var trimmed = text.stripTrailing();
        if (DECIMAL.matcher(trimmed).matches()) {
            // out of range literals overflow to infinity; only the .inf spellings mean that
            final var value = Double.parseDouble(trimmed);
            return Double.isInfinite(value) ? Optional.empty() : Optional.of(value);
        }
        if (POSITIVE_INFINITY.contains(trimmed)) {
            return Optional.of(Double.POSITIVE_INFINITY);
        }
        if (NEGATIVE_INFINITY.contains(trimmed)) {
            return Optional.of(Double.NEGATIVE_INFINITY);
        }
        if (NOT_A_NUMBER.contains(trimmed)) {
            return Optional.of(Double.NaN);
        }
        return Optional.empty();
    }

    private static Optional<Float> parseFloat(String text) {
        return parseDouble(text).flatMap(value -> {
            final var narrowed = value.floatValue();
            return Float.isInfinite(narrowed) && !Double.isInfinite(value)
                    ? Optional.empty()
                    : Optional.of(narrowed);
        });
    }

    private static boolean isAsciiDigit(char c, int radix) {
        return switch (radix) {
            case 8 -> c >= '0' && c <= '7';
            case 16 -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            default -> c >= '0' && c <= '9';
        };
    }

    private static String formatDouble(Double value) {
        return formatDouble(value, Double.toString(value));
    }

    private static String formatDouble(double value, String finite) {
        if (Double.isNaN(value)) {
            return ".nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? ".inf" : "-.inf";
        }
        return finite;
    }

    private static boolean fits(BigInteger value, long min, long max) {
        return value.compareTo(BigInteger.valueOf(min)) >= 0
                && value.compareTo(BigInteger.valueOf(max)) <= 0;
    }

    // all lower, ALL UPPER, or Capitalised
    private static boolean isFlexibleCase(String text) {
        if (text.isEmpty()) {
            return false;
        }
        final var rest = text.substring(1);
        final var restLower = rest.equals(rest.toLowerCase(Locale.ROOT));
        final var restUpper = rest.equals(rest.toUpperCase(Locale.ROOT));
        final char first = text.charAt(0);
        if (Character.isUpperCase(first)) {
            return restLower || restUpper;
        }
        return restLower;
    }
}
