/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.slha.io;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number parsing and formatting for the SLHA text layout.
 */
final class NumberText {

    /** Fortran writes double precision exponents with D instead of E. */
    private static final Pattern FORTRAN_EXPONENT =
            Pattern.compile("([+-]?(?:\\d+\\.?\\d*|\\.\\d+))[dD]([+-]?\\d+)");

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    /** Positional notation is used for decimal exponents in [-4, 16). */
    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 16;

    private NumberText() {
    }

    /**
     * Parses a floating point token. Accepts {@code E} and {@code D} exponents
     * and the words {@code nan}, {@code inf} and {@code infinity} in any case.
     *
     * @throws NumberFormatException if the token is not a number
     */
    static double parseDouble(String token) {
        String text = token.strip();
        Matcher fortran = FORTRAN_EXPONENT.matcher(text);
        if (fortran.matches()) {
            text = fortran.group(1) + "E" + fortran.group(2);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        String unsigned = text.startsWith("+") || text.startsWith("-") ? text.substring(1) : text;
        boolean negative = text.startsWith("-");
        switch (unsigned.toLowerCase()) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default:
                throw new NumberFormatException("Not a number: '" + token + "'");
        }
    }

    /**
     * Formats a double in its shortest round-trip form: {@code 5.5},
     * {@code 100.0}, {@code 0.0001}, {@code 1e-05}, {@code 1.5e+20}.
     */
    static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String sign = value < 0 ? "-" : "";

        if (exponent >= MIN_PLAIN_EXPONENT && exponent < MAX_PLAIN_EXPONENT) {
            String plain = decimal.abs().toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }

        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        int magnitude = Math.abs(exponent);
        return sign + mantissa + "e" + (exponent < 0 ? '-' : '+') + (magnitude < 10 ? "0" : "") + magnitude;
    }
}
