package nl.bytesoflife.deltacard.model;

import java.util.List;
import java.util.Locale;

final class Checks {

    private Checks() {
    }

    static void inRange(String field, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new ValidationException(String.format(Locale.US,
                    "%s must be in [%s, %s], got: %s", field, min, max, value));
        }
    }

    // [min, max)
    static void inHalfOpenRange(String field, double value, double min, double max) {
        if (!(value >= min && value < max)) {
            throw new ValidationException(String.format(Locale.US,
                    "%s must be in [%s, %s), got: %s", field, min, max, value));
        }
    }

    static void positive(String field, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new ValidationException(field + " must be > 0, got: " + value);
        }
    }

    static void nonNegative(String field, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new ValidationException(field + " must be >= 0, got: " + value);
        }
    }

    static void finite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(field + " must be a finite number, got: " + value);
        }
    }

    static void noNullElements(String field, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new ValidationException(field + "[" + i + "] is required");
            }
        }
    }

    static <T> T required(String field, T value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
