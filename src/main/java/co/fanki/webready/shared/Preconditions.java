package co.fanki.webready.shared;

/**
 * Argument checks shared by the analysis model and the job layer.
 *
 * <p>All checks throw {@link IllegalArgumentException}: a violated
 * precondition is a programming error on the caller side, not an
 * analysis outcome.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a line number is 1-based.
     *
     * @param line the line number to check
     * @param message the exception message if the line is not positive
     * @return the line number
     * @throws IllegalArgumentException if line is zero or negative
     */
    public static int requireLine(final int line, final String message) {
        if (line <= 0) {
            throw new IllegalArgumentException(message);
        }
        return line;
    }

    /**
     * Ensures that a count is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a percentage lies in the closed range [0, 100].
     *
     * @param value the percentage to check
     * @param message the exception message if out of range
     * @return the percentage
     * @throws IllegalArgumentException if value is NaN or outside [0, 100]
     */
    public static double requirePercentage(final double value,
            final String message) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
