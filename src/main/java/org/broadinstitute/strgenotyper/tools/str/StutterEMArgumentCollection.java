package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.strgenotyper.utils.stutter.StutterModel;

/**
 * Settings of the stutter-aware EM genotyper.
 */
public final class StutterEMArgumentCollection {

    public static final int DEFAULT_MAX_EM_ITERATIONS = 100;
    public static final double DEFAULT_MIN_LL_ABS_CHANGE = 0.01;
    public static final double DEFAULT_MIN_LL_FRAC_CHANGE = 0.001;
    public static final double DEFAULT_LL_DECREASE_TOLERANCE = 1e-6;

    public static final double DEFAULT_INFRAME_GEOM = 0.9;
    public static final double DEFAULT_INFRAME_UP = 0.05;
    public static final double DEFAULT_INFRAME_DOWN = 0.05;
    public static final double DEFAULT_OUTFRAME_GEOM = 0.9;
    public static final double DEFAULT_OUTFRAME_UP = 0.01;
    public static final double DEFAULT_OUTFRAME_DOWN = 0.01;

    public static final String MAX_EM_ITERATIONS_FULL_NAME = "max-em-iterations";
    public static final String MIN_LL_ABS_CHANGE_FULL_NAME = "min-ll-abs-change";
    public static final String MIN_LL_FRAC_CHANGE_FULL_NAME = "min-ll-frac-change";
    public static final String LL_DECREASE_TOLERANCE_FULL_NAME = "ll-decrease-tolerance";
    public static final String INFRAME_GEOM_FULL_NAME = "initial-inframe-geom";
    public static final String INFRAME_UP_FULL_NAME = "initial-inframe-up";
    public static final String INFRAME_DOWN_FULL_NAME = "initial-inframe-down";
    public static final String OUTFRAME_GEOM_FULL_NAME = "initial-outframe-geom";
    public static final String OUTFRAME_UP_FULL_NAME = "initial-outframe-up";
    public static final String OUTFRAME_DOWN_FULL_NAME = "initial-outframe-down";

    @Argument(fullName = MAX_EM_ITERATIONS_FULL_NAME,
            doc = "Maximum number of EM iterations when learning the stutter model",
            optional = true, minValue = 0)
    public int maxEMIterations = DEFAULT_MAX_EM_ITERATIONS;

    @Argument(fullName = MIN_LL_ABS_CHANGE_FULL_NAME,
            doc = "EM training stops once the total log-likelihood changes by less than this amount between iterations",
            optional = true, minValue = 0.0)
    public double minLogLikelihoodAbsChange = DEFAULT_MIN_LL_ABS_CHANGE;

    @Argument(fullName = MIN_LL_FRAC_CHANGE_FULL_NAME,
            doc = "EM training stops once the total log-likelihood changes by less than this fraction between iterations",
            optional = true, minValue = 0.0)
    public double minLogLikelihoodFracChange = DEFAULT_MIN_LL_FRAC_CHANGE;

    @Argument(fullName = LL_DECREASE_TOLERANCE_FULL_NAME,
            doc = "Log-likelihood decrease between EM iterations tolerated before it is reported as a numerical anomaly",
            optional = true, minValue = 0.0)
    public double logLikelihoodDecreaseTolerance = DEFAULT_LL_DECREASE_TOLERANCE;

    @Argument(fullName = INFRAME_GEOM_FULL_NAME,
            doc = "Geometric rate of in-frame stutter used to start training",
            optional = true)
    public double initialInframeGeom = DEFAULT_INFRAME_GEOM;

    @Argument(fullName = INFRAME_UP_FULL_NAME,
            doc = "Probability of in-frame stutter expansions used to start training",
            optional = true)
    public double initialInframeUp = DEFAULT_INFRAME_UP;

    @Argument(fullName = INFRAME_DOWN_FULL_NAME,
            doc = "Probability of in-frame stutter contractions used to start training",
            optional = true)
    public double initialInframeDown = DEFAULT_INFRAME_DOWN;

    @Argument(fullName = OUTFRAME_GEOM_FULL_NAME,
            doc = "Geometric rate of out-of-frame stutter used to start training",
            optional = true)
    public double initialOutframeGeom = DEFAULT_OUTFRAME_GEOM;

    @Argument(fullName = OUTFRAME_UP_FULL_NAME,
            doc = "Probability of out-of-frame stutter expansions used to start training",
            optional = true)
    public double initialOutframeUp = DEFAULT_OUTFRAME_UP;

    @Argument(fullName = OUTFRAME_DOWN_FULL_NAME,
            doc = "Probability of out-of-frame stutter contractions used to start training",
            optional = true)
    public double initialOutframeDown = DEFAULT_OUTFRAME_DOWN;

    /**
     * Performs some validation on the values provided to this argument collection.
     * <p>
     *     Will throw the appropriate command-line exception if it detects any inconsistency.
     * </p>
     */
    public void validate() {
        if (maxEMIterations < 0) {
            throw new CommandLineException.BadArgumentValue(MAX_EM_ITERATIONS_FULL_NAME, "must be 0 or greater but found " + maxEMIterations);
        }
        checkNonNegative(MIN_LL_ABS_CHANGE_FULL_NAME, minLogLikelihoodAbsChange);
        checkNonNegative(MIN_LL_FRAC_CHANGE_FULL_NAME, minLogLikelihoodFracChange);
        checkNonNegative(LL_DECREASE_TOLERANCE_FULL_NAME, logLikelihoodDecreaseTolerance);
        checkProbability(INFRAME_GEOM_FULL_NAME, initialInframeGeom);
        checkProbability(INFRAME_UP_FULL_NAME, initialInframeUp);
        checkProbability(INFRAME_DOWN_FULL_NAME, initialInframeDown);
        checkProbability(OUTFRAME_GEOM_FULL_NAME, initialOutframeGeom);
        checkProbability(OUTFRAME_UP_FULL_NAME, initialOutframeUp);
        checkProbability(OUTFRAME_DOWN_FULL_NAME, initialOutframeDown);
        final double stutterMass = initialInframeUp + initialInframeDown + initialOutframeUp + initialOutframeDown;
        if (stutterMass >= 1) {
            throw new CommandLineException.BadArgumentValue(INFRAME_UP_FULL_NAME,
                    "the initial up and down stutter probabilities must add up to less than 1 but their sum is " + stutterMass);
        }
    }

    /**
     * Composes the stutter model training starts from when none has been set.
     * @param motifLength the locus motif length.
     * @return never {@code null}.
     */
    public StutterModel initialStutterModel(final int motifLength) {
        return new StutterModel(initialInframeGeom, initialInframeUp, initialInframeDown,
                initialOutframeGeom, initialOutframeUp, initialOutframeDown, motifLength);
    }

    private static void checkNonNegative(final String name, final double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new CommandLineException.BadArgumentValue(name, "must be finite and 0 or greater but found " + value);
        }
    }

    private static void checkProbability(final String name, final double value) {
        if (!(value > 0 && value < 1)) {
            throw new CommandLineException.BadArgumentValue(name, "must be strictly between 0 and 1 but found " + value);
        }
    }
}
