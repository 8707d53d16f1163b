package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.strgenotyper.utils.Utils;
import org.broadinstitute.strgenotyper.utils.stutter.StutterModel;

/**
 * Weighted maximum-likelihood estimation of {@link StutterModel} parameters.
 * <p>
 *     Callers credit fractional observations of base-pair shifts with {@link #add(int, double)} and then call
 *     {@link #estimate()}. Each directional probability is the share of the total weight that fell into its
 *     category; each geometric rate is the weight of its branch divided by the weighted sum of the trial counts
 *     (repeat units for in-frame shifts, out-of-frame positions for the rest).
 * </p>
 * <p>
 *     A branch that received no weight at all keeps the parameters of the previous model and its probability
 *     mass is set aside before the remaining categories are normalized.
 * </p>
 */
final class StutterModelEstimator {

    /**
     * Smallest value any estimated probability may take; keeps the model inside its valid parameter space.
     */
    static final double MIN_PROBABILITY = 1e-6;

    private final StutterModel previous;

    private double noStutterWeight;
    private double inframeUpWeight;
    private double inframeDownWeight;
    private double inframeTrials;
    private double outframeUpWeight;
    private double outframeDownWeight;
    private double outframeTrials;

    /**
     * @param previous the model in effect; its motif length is used to classify shifts and its parameters
     *                 fill in branches without data.
     */
    StutterModelEstimator(final StutterModel previous) {
        this.previous = Utils.nonNull(previous, "the previous stutter model cannot be null");
    }

    /**
     * Credits one fractional observation of a shift.
     * @param bpDiff observed size minus source allele size.
     * @param weight non-negative weight of the observation.
     */
    void add(final int bpDiff, final double weight) {
        Utils.validateArg(weight >= 0 && Double.isFinite(weight), () -> "weights must be finite and non-negative but found " + weight);
        if (weight == 0) {
            return;
        }
        if (bpDiff == 0) {
            noStutterWeight += weight;
        } else if (previous.isInFrame(bpDiff)) {
            if (bpDiff > 0) {
                inframeUpWeight += weight;
            } else {
                inframeDownWeight += weight;
            }
            inframeTrials += weight * previous.inFrameUnits(bpDiff);
        } else {
            if (bpDiff > 0) {
                outframeUpWeight += weight;
            } else {
                outframeDownWeight += weight;
            }
            outframeTrials += weight * previous.outOfFrameSteps(Math.abs(bpDiff));
        }
    }

    double totalWeight() {
        return noStutterWeight + inframeUpWeight + inframeDownWeight + outframeUpWeight + outframeDownWeight;
    }

    /**
     * Composes the new model out of the weight accumulated so far.
     * @return never {@code null}; the previous model when nothing was added.
     */
    StutterModel estimate() {
        final double inframeWeight = inframeUpWeight + inframeDownWeight;
        final double outframeWeight = outframeUpWeight + outframeDownWeight;
        if (totalWeight() == 0) {
            return previous;
        }

        // mass reserved for branches without data, which keep their previous values.
        final double reservedMass = (inframeWeight == 0 ? previous.getInframeUp() + previous.getInframeDown() : 0)
                + (outframeWeight == 0 ? previous.getOutframeUp() + previous.getOutframeDown() : 0);
        final double scale = (1 - reservedMass) / totalWeight();

        double inframeUp = inframeWeight == 0 ? previous.getInframeUp() : floor(inframeUpWeight * scale);
        double inframeDown = inframeWeight == 0 ? previous.getInframeDown() : floor(inframeDownWeight * scale);
        double outframeUp = outframeWeight == 0 ? previous.getOutframeUp() : floor(outframeUpWeight * scale);
        double outframeDown = outframeWeight == 0 ? previous.getOutframeDown() : floor(outframeDownWeight * scale);

        final double stutterMass = inframeUp + inframeDown + outframeUp + outframeDown;
        if (stutterMass > 1 - MIN_PROBABILITY) {
            final double shrink = (1 - MIN_PROBABILITY) / stutterMass;
            inframeUp *= shrink;
            inframeDown *= shrink;
            outframeUp *= shrink;
            outframeDown *= shrink;
        }

        final double inframeGeom = inframeWeight == 0 ? previous.getInframeGeom() : geometricRate(inframeWeight, inframeTrials);
        final double outframeGeom = outframeWeight == 0 ? previous.getOutframeGeom() : geometricRate(outframeWeight, outframeTrials);
        return new StutterModel(inframeGeom, inframeUp, inframeDown, outframeGeom, outframeUp, outframeDown,
                previous.getMotifLength());
    }

    // MLE of a geometric distribution on {1, 2, ...}: observations over total trials.
    private static double geometricRate(final double weight, final double trials) {
        return Math.min(1 - MIN_PROBABILITY, floor(weight / trials));
    }

    private static double floor(final double probability) {
        return Math.max(MIN_PROBABILITY, probability);
    }
}
