package io.fnative.descale;

import picocli.CommandLine;

/**
 * Parses decimals and simple fractions such as {@code 1/3}. Only digits, '.' and '/' are accepted.
 */
public class FractionConverter implements CommandLine.ITypeConverter<Double> {
    @Override
    public Double convert(String value) {
        if (value.isEmpty() || !value.chars().allMatch(ch -> Character.isDigit(ch) && ch < 128 || ch == '.' || ch == '/')) {
            throw new CommandLine.TypeConversionException("Invalid characters in float parameter: '" + value + "'");
        }
        try {
            int slash = value.indexOf('/');
            if (slash < 0) return Double.parseDouble(value);
            if (value.indexOf('/', slash + 1) >= 0) throw new NumberFormatException("more than one '/'");
            double num = Double.parseDouble(value.substring(0, slash));
            double den = Double.parseDouble(value.substring(slash + 1));
            if (den == 0.0) throw new NumberFormatException("division by zero");
            return num / den;
        } catch (NumberFormatException e) {
            throw new CommandLine.TypeConversionException("Exception while parsing float '" + value + "': " + e.getMessage());
        }
    }
}
