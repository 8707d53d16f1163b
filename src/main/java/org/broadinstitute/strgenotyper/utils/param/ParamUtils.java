package org.broadinstitute.strgenotyper.utils.param;

/**
 * Numeric parameter checks.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public final class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the  input lies strictly between both bounds and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param min exclusive lower bound
     * @param max exclusive upper bound
     * @param message the text message that would be pass to the exception thrown.
     * @return the same value
     */
    public static double inOpenRange(final double val, final double min, final double max, final String message) {
        if ((val > min) && (val < max)){
            return val;
        } else {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that the  input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static long isPositiveOrZero(final long val, final String message) {
        if (!(val >= 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the  input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static double isPositiveOrZero(final double val, final String message) {
        if (!(val >= 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the  input is greater than zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static long isPositive(final long val, final String message) {
        if (!(val > 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the input is a valid natural-log probability, that is non-NaN and not greater than 0.
     * {@link Double#NEGATIVE_INFINITY} is accepted.
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     */
    public static double isLogProbability(final double val, final String message) {
        if (!(val <= 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
