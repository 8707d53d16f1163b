package org.broadinstitute.strgenotyper.utils;

import org.apache.commons.math3.util.FastMath;

public final class NaturalLogUtils {
    public static final double LOG_ONE_HALF = FastMath.log(0.5);

    private NaturalLogUtils() { }

    /**
     * Computes $\log(\sum_i e^{a_i})$ trying to avoid underflow issues by using the log-sum-exp trick.
     *
     * <p>
     * This trick consists of shifting all the log values by the maximum so that exponent values are
     * much larger (close to 1) before they are summed. Then the result is shifted back down by
     * the same amount in order to obtain the correct value.
     * </p>
     * @return any double value; {@link Double#NEGATIVE_INFINITY} if all inputs are.
     */
    public static double logSumExp(final double... logValues) {
        Utils.nonNull(logValues);
        return logSumExp(logValues, 0, logValues.length);
    }

    /**
     * Same as {@link #logSumExp(double...)} but restricted to the elements in {@code [start, endIndex)}.
     */
    public static double logSumExp(final double[] logValues, final int start, final int endIndex) {
        Utils.nonNull(logValues);
        if (start == endIndex) {
            return Double.NEGATIVE_INFINITY;
        }
        final int maxElementIndex = MathUtils.maxElementIndex(logValues, start, endIndex);
        final double maxValue = logValues[maxElementIndex];
        if(maxValue == Double.NEGATIVE_INFINITY) {
            return maxValue;
        }
        double sum = 1.0;
        for (int i = start; i < endIndex; i++) {
            final double curVal = logValues[i];
            if (i == maxElementIndex || curVal == Double.NEGATIVE_INFINITY) {
                continue;
            } else {
                final double scaled_val = curVal - maxValue;
                sum += Math.exp(scaled_val);
            }
        }
        if ( Double.isNaN(sum) || sum == Double.POSITIVE_INFINITY ) {
            throw new IllegalArgumentException("logValues must be non-infinite and non-NAN");
        }
        return maxValue + (sum != 1.0 ? Math.log(sum) : 0.0);
    }

    /**
     * Two-term version of {@link #logSumExp(double...)}.
     */
    public static double logSumLog(final double a, final double b) {
        if (a == Double.NEGATIVE_INFINITY) {
            return b;
        } else if (b == Double.NEGATIVE_INFINITY) {
            return a;
        }
        return a > b ? a + FastMath.log1p(FastMath.exp(b - a)) : b + FastMath.log1p(FastMath.exp(a - b));
    }
}
