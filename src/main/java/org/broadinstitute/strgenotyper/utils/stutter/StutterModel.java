package org.broadinstitute.strgenotyper.utils.stutter;

import org.broadinstitute.strgenotyper.utils.param.ParamUtils;

/**
 * Parametric model of PCR stutter at an STR locus.
 * <p>
 *     Gives the probability that a read reports a repeat length that differs by a given number of base pairs
 *     from the allele it was sequenced from. Shifts that are a multiple of the motif length (in-frame) follow
 *     a geometric distribution on the number of repeat units gained or lost; the remaining shifts (out-of-frame)
 *     follow a separate geometric distribution on the number of out-of-frame positions traversed. Each
 *     branch splits its mass between expansions (up) and contractions (down). Whatever is left is the
 *     probability of no stutter.
 * </p>
 * <p>
 *     With a motif length of 1 every shift is in-frame, so the out-of-frame branch is never emitted and the
 *     pmf sums to {@code 1 - outframeUp - outframeDown} rather than 1.
 * </p>
 * <p>
 *     Instances are immutable.
 * </p>
 */
public final class StutterModel {

    public static final String INFRAME_GEOM_NAME = "in-frame geometric rate";
    public static final String INFRAME_UP_NAME = "in-frame up probability";
    public static final String INFRAME_DOWN_NAME = "in-frame down probability";
    public static final String OUTFRAME_GEOM_NAME = "out-of-frame geometric rate";
    public static final String OUTFRAME_UP_NAME = "out-of-frame up probability";
    public static final String OUTFRAME_DOWN_NAME = "out-of-frame down probability";

    private final double inframeGeom;
    private final double inframeUp;
    private final double inframeDown;
    private final double outframeGeom;
    private final double outframeUp;
    private final double outframeDown;
    private final int motifLength;

    // cached log-scale terms.
    private final double logInframeGeom;
    private final double logInframeGeomComplement;
    private final double logInframeUp;
    private final double logInframeDown;
    private final double logOutframeGeom;
    private final double logOutframeGeomComplement;
    private final double logOutframeUp;
    private final double logOutframeDown;
    private final double logNoStutter;

    /**
     * Creates a new stutter model.
     *
     * @param inframeGeom geometric rate of in-frame shifts, in (0, 1).
     * @param inframeUp probability of an in-frame expansion, in (0, 1).
     * @param inframeDown probability of an in-frame contraction, in (0, 1).
     * @param outframeGeom geometric rate of out-of-frame shifts, in (0, 1).
     * @param outframeUp probability of an out-of-frame expansion, in (0, 1).
     * @param outframeDown probability of an out-of-frame contraction, in (0, 1).
     * @param motifLength number of base pairs in the repeat unit, 1 or greater.
     * @throws IllegalArgumentException if any parameter is out of range or the four directional probabilities
     * add up to 1 or more.
     */
    public StutterModel(final double inframeGeom, final double inframeUp, final double inframeDown,
                        final double outframeGeom, final double outframeUp, final double outframeDown,
                        final int motifLength) {
        this.inframeGeom = ParamUtils.inOpenRange(inframeGeom, 0, 1, INFRAME_GEOM_NAME + " must be in (0, 1) but found " + inframeGeom);
        this.inframeUp = ParamUtils.inOpenRange(inframeUp, 0, 1, INFRAME_UP_NAME + " must be in (0, 1) but found " + inframeUp);
        this.inframeDown = ParamUtils.inOpenRange(inframeDown, 0, 1, INFRAME_DOWN_NAME + " must be in (0, 1) but found " + inframeDown);
        this.outframeGeom = ParamUtils.inOpenRange(outframeGeom, 0, 1, OUTFRAME_GEOM_NAME + " must be in (0, 1) but found " + outframeGeom);
        this.outframeUp = ParamUtils.inOpenRange(outframeUp, 0, 1, OUTFRAME_UP_NAME + " must be in (0, 1) but found " + outframeUp);
        this.outframeDown = ParamUtils.inOpenRange(outframeDown, 0, 1, OUTFRAME_DOWN_NAME + " must be in (0, 1) but found " + outframeDown);
        this.motifLength = (int) ParamUtils.isPositive(motifLength, "motif length must be positive but found " + motifLength);
        final double stutterMass = inframeUp + inframeDown + outframeUp + outframeDown;
        ParamUtils.inOpenRange(stutterMass, 0, 1, "the stutter probabilities must add up to less than 1 but their sum is " + stutterMass);

        logInframeGeom = Math.log(inframeGeom);
        logInframeGeomComplement = Math.log1p(-inframeGeom);
        logInframeUp = Math.log(inframeUp);
        logInframeDown = Math.log(inframeDown);
        logOutframeGeom = Math.log(outframeGeom);
        logOutframeGeomComplement = Math.log1p(-outframeGeom);
        logOutframeUp = Math.log(outframeUp);
        logOutframeDown = Math.log(outframeDown);
        logNoStutter = Math.log1p(-stutterMass);
    }

    /**
     * Returns the natural log of the probability that a read shows {@code bpDiff} more base pairs than its
     * source allele.
     * @param bpDiff observed size minus the candidate allele size, in bp.
     * @return a finite value, 0 or less.
     */
    public double logStutterPmf(final int bpDiff) {
        if (bpDiff == 0) {
            return logNoStutter;
        }
        final int magnitude = Math.abs(bpDiff);
        if (isInFrame(bpDiff)) {
            final int units = magnitude / motifLength;
            return (bpDiff > 0 ? logInframeUp : logInframeDown) + logInframeGeom + (units - 1) * logInframeGeomComplement;
        } else {
            final int steps = outOfFrameSteps(magnitude);
            return (bpDiff > 0 ? logOutframeUp : logOutframeDown) + logOutframeGeom + (steps - 1) * logOutframeGeomComplement;
        }
    }

    /**
     * Whether a non-zero shift is a whole number of repeat units.
     */
    public boolean isInFrame(final int bpDiff) {
        return bpDiff % motifLength == 0;
    }

    /**
     * Number of repeat units spanned by an in-frame shift; the geometric "trial" count of the in-frame branch.
     */
    public int inFrameUnits(final int bpDiff) {
        return Math.abs(bpDiff) / motifLength;
    }

    /**
     * Number of out-of-frame positions traversed by a shift of the given absolute size; the geometric "trial"
     * count of the out-of-frame branch.
     */
    public int outOfFrameSteps(final int magnitude) {
        return magnitude - magnitude / motifLength;
    }

    public double getInframeGeom() {
        return inframeGeom;
    }

    public double getInframeUp() {
        return inframeUp;
    }

    public double getInframeDown() {
        return inframeDown;
    }

    public double getOutframeGeom() {
        return outframeGeom;
    }

    public double getOutframeUp() {
        return outframeUp;
    }

    public double getOutframeDown() {
        return outframeDown;
    }

    public int getMotifLength() {
        return motifLength;
    }

    /**
     * Probability of a read carrying no stutter at all.
     */
    public double getNoStutterProbability() {
        return Math.exp(logNoStutter);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final StutterModel that = (StutterModel) o;

        return motifLength == that.motifLength
                && Double.compare(inframeGeom, that.inframeGeom) == 0
                && Double.compare(inframeUp, that.inframeUp) == 0
                && Double.compare(inframeDown, that.inframeDown) == 0
                && Double.compare(outframeGeom, that.outframeGeom) == 0
                && Double.compare(outframeUp, that.outframeUp) == 0
                && Double.compare(outframeDown, that.outframeDown) == 0;
    }

    @Override
    public int hashCode() {
        int result = motifLength;
        result = 31 * result + Double.hashCode(inframeGeom);
        result = 31 * result + Double.hashCode(inframeUp);
        result = 31 * result + Double.hashCode(inframeDown);
        result = 31 * result + Double.hashCode(outframeGeom);
        result = 31 * result + Double.hashCode(outframeUp);
        result = 31 * result + Double.hashCode(outframeDown);
        return result;
    }

    @Override
    public String toString() {
        return String.format("StutterModel{motif=%d, inframe=(geom=%.4g, up=%.4g, down=%.4g), outframe=(geom=%.4g, up=%.4g, down=%.4g)}",
                motifLength, inframeGeom, inframeUp, inframeDown, outframeGeom, outframeUp, outframeDown);
    }
}
