package org.broadinstitute.strgenotyper.tools.str;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.strgenotyper.exceptions.GenotyperException;
import org.broadinstitute.strgenotyper.exceptions.UserException;
import org.broadinstitute.strgenotyper.utils.MathUtils;
import org.broadinstitute.strgenotyper.utils.NaturalLogUtils;
import org.broadinstitute.strgenotyper.utils.Utils;
import org.broadinstitute.strgenotyper.utils.param.ParamUtils;
import org.broadinstitute.strgenotyper.utils.stutter.StutterModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Genotypes the samples at an STR locus while modeling PCR stutter, using Expectation-Maximization.
 * <p>
 *     The hidden variables are each sample's ordered genotype (allele on haplotype 1, allele on haplotype 2)
 *     and, for each read, the haplotype it was sequenced from. Given a genotype and a haplotype, the read's observed
 *     repeat size follows the {@link StutterModel} around the allele of that haplotype and its SNP phasing
 *     log-likelihoods weigh each haplotype.
 * </p>
 * <p>
 *     {@link #train} alternates E-steps (genotype and read-phase posteriors) with M-steps (stutter model and
 *     population allele frequencies) until the total log-likelihood stabilizes. {@link #genotype} runs the E-step
 *     alone under a fixed stutter model.
 * </p>
 * <p>
 *     Posterior tensors are flat arrays indexed, from slowest to fastest varying, by allele 1, allele 2 and
 *     sample (or read and phase). They are allocated once and overwritten in place on every E-step.
 * </p>
 * <p>
 *     Instances are not thread-safe.
 * </p>
 */
public final class EMStutterGenotyper {

    private static final Logger logger = LogManager.getLogger(EMStutterGenotyper.class);

    /**
     * Phase index of reads sequenced from haplotype 1.
     */
    public static final int HAPLOTYPE_1 = 0;

    /**
     * Phase index of reads sequenced from haplotype 2.
     */
    public static final int HAPLOTYPE_2 = 1;

    /**
     * Pseudo-frequency added to every allele when re-estimating population allele frequencies.
     */
    static final double ALLELE_FREQUENCY_PSEUDOCOUNT = 1e-4;

    private final StrLocus locus;
    private final StrReadIndex reads;
    private final StutterEMArgumentCollection config;

    private final int numAlleles;
    private final int numSamples;
    private final int numReads;

    private StutterModel stutterModel;

    private final double[] logGtPriors;
    private final double[] logSamplePosteriors;
    private final double[] logReadPhasePosteriors;
    private double[] logAllelePriors;

    private boolean posteriorsAvailable;
    private EMStatus status = EMStatus.UNTRAINED;
    private final List<Double> logLikelihoodTrace = new ArrayList<>();
    private int likelihoodDecreaseCount;

    /**
     * Creates a genotyper with the default settings.
     *
     * @param contig locus contig.
     * @param start locus 1-based start.
     * @param end locus 1-based inclusive end.
     * @param bpSizes observed repeat size of each read, one row per sample.
     * @param logP1 per read log-likelihood of its SNP phasing evidence under haplotype 1, 0 or less.
     * @param logP2 per read log-likelihood of its SNP phasing evidence under haplotype 2, 0 or less.
     * @param sampleNames sample names, one per row.
     * @param motifLength base pairs per repeat unit.
     * @param referenceSize reference allele size in bp.
     */
    public EMStutterGenotyper(final String contig, final int start, final int end,
                              final int[][] bpSizes, final double[][] logP1, final double[][] logP2,
                              final List<String> sampleNames, final int motifLength, final int referenceSize) {
        this(new StrLocus(contig, start, end, motifLength), bpSizes, logP1, logP2, sampleNames, referenceSize,
                new StutterEMArgumentCollection());
    }

    /**
     * Creates a genotyper.
     *
     * @param locus the STR locus.
     * @param bpSizes observed repeat size of each read, one row per sample.
     * @param logP1 per read log-likelihood of its SNP phasing evidence under haplotype 1, 0 or less.
     * @param logP2 per read log-likelihood of its SNP phasing evidence under haplotype 2, 0 or less.
     * @param sampleNames sample names, one per row.
     * @param referenceSize reference allele size in bp.
     * @param config training settings.
     * @throws org.broadinstitute.strgenotyper.exceptions.UserException.DimensionMismatch if the read inputs and
     *  sample names do not have matching shapes.
     * @throws UserException.BadInput if the posterior tensors would not fit in an array.
     * @throws IllegalArgumentException if any phasing log-likelihood is invalid.
     */
    public EMStutterGenotyper(final StrLocus locus, final int[][] bpSizes, final double[][] logP1, final double[][] logP2,
                              final List<String> sampleNames, final int referenceSize,
                              final StutterEMArgumentCollection config) {
        this.locus = Utils.nonNull(locus, "the locus cannot be null");
        this.config = Utils.nonNull(config, "the configuration cannot be null");
        config.validate();
        this.reads = new StrReadIndex(bpSizes, logP1, logP2, sampleNames, referenceSize);
        numAlleles = reads.alleles().numberOfAlleles();
        numSamples = reads.numberOfSamples();
        numReads = reads.numberOfReads();

        logGtPriors = new double[numAlleles];
        logSamplePosteriors = new double[tensorSize("genotype posteriors", numAlleles, numAlleles, numSamples)];
        logReadPhasePosteriors = new double[tensorSize("read phase posteriors", numAlleles, numAlleles, numReads, 2)];
        initLogGtPriors();
        logger.debug(String.format("Locus %s: %d samples, %d reads, %d alleles", locus, numSamples, numReads, numAlleles));
    }

    private static int tensorSize(final String what, final int... dimensions) {
        int result = 1;
        try {
            for (final int dimension : dimensions) {
                result = Math.multiplyExact(result, dimension);
            }
        } catch (final ArithmeticException ex) {
            throw new UserException.BadInput(String.format("too many %s for a single locus %s", what, Arrays.toString(dimensions)), ex);
        }
        return result;
    }

    private int sampleIndex(final int allele1, final int allele2, final int sample) {
        return (allele1 * numAlleles + allele2) * numSamples + sample;
    }

    private int readPhaseIndex(final int allele1, final int allele2, final int read, final int phase) {
        return ((allele1 * numAlleles + allele2) * numReads + read) * 2 + phase;
    }

    /**
     * Replaces the stutter model in use. Posteriors must be recomputed before asking for genotype calls.
     */
    public void setStutterModel(final double inframeGeom, final double inframeUp, final double inframeDown,
                                final double outframeGeom, final double outframeUp, final double outframeDown) {
        stutterModel = new StutterModel(inframeGeom, inframeUp, inframeDown, outframeGeom, outframeUp, outframeDown,
                locus.getMotifLength());
        posteriorsAvailable = false;
    }

    /**
     * Replaces the stutter model in use. Posteriors must be recomputed before asking for genotype calls.
     * @param model the new model; its motif length must match the locus'.
     */
    public void setStutterModel(final StutterModel model) {
        Utils.nonNull(model, "the stutter model cannot be null");
        Utils.validateArg(model.getMotifLength() == locus.getMotifLength(), () -> String.format(
                "the stutter model motif length (%d) does not match the locus motif length (%d)",
                model.getMotifLength(), locus.getMotifLength()));
        stutterModel = model;
        posteriorsAvailable = false;
    }

    /**
     * Returns the stutter model in use.
     * @throws GenotyperException.NotConfigured if no model has been set or learned.
     */
    public StutterModel getStutterModel() {
        if (stutterModel == null) {
            throw new GenotyperException.NotConfigured("stutter model");
        }
        return stutterModel;
    }

    public boolean hasStutterModel() {
        return stutterModel != null;
    }

    /**
     * Loads per-sample genotype priors, used by {@link #genotype(boolean) genotype(false)} in place of uniform priors.
     * @param provider the source of the priors, queried once per sample and ordered allele pair.
     * @throws IllegalArgumentException if a prior is NaN or greater than 0, or every genotype of a sample is excluded.
     */
    public void setAllelePriors(final AllelePriorProvider provider) {
        Utils.nonNull(provider, "the allele prior provider cannot be null");
        final StrAlleleCatalog alleles = reads.alleles();
        final double[] priors = new double[numAlleles * numAlleles * numSamples];
        for (int sample = 0; sample < numSamples; sample++) {
            final String name = reads.sampleName(sample);
            boolean anyPossible = false;
            for (int allele1 = 0; allele1 < numAlleles; allele1++) {
                for (int allele2 = 0; allele2 < numAlleles; allele2++) {
                    final double logPrior = provider.logPrior(name, alleles.sizeOf(allele1), alleles.sizeOf(allele2));
                    ParamUtils.isLogProbability(logPrior, String.format("invalid log prior %s for sample %s genotype %d|%d",
                            logPrior, name, alleles.sizeOf(allele1), alleles.sizeOf(allele2)));
                    anyPossible |= logPrior > Double.NEGATIVE_INFINITY;
                    priors[sampleIndex(allele1, allele2, sample)] = logPrior;
                }
            }
            Utils.validateArg(anyPossible, () -> "all genotypes have zero prior probability for sample " + name);
        }
        logAllelePriors = priors;
        posteriorsAvailable = false;
    }

    /**
     * Reverts to uniform genotype priors outside population-frequency mode.
     */
    public void clearAllelePriors() {
        logAllelePriors = null;
        posteriorsAvailable = false;
    }

    public boolean hasAllelePriors() {
        return logAllelePriors != null;
    }

    private void initLogGtPriors() {
        Arrays.fill(logGtPriors, -Math.log(numAlleles));
    }

    // log stutter probability indexed by observed allele and candidate source allele.
    private double[] composeLogStutterTable() {
        final StrAlleleCatalog alleles = reads.alleles();
        final double[] result = new double[numAlleles * numAlleles];
        for (int observed = 0; observed < numAlleles; observed++) {
            for (int source = 0; source < numAlleles; source++) {
                result[observed * numAlleles + source] = stutterModel.logStutterPmf(alleles.sizeOf(observed) - alleles.sizeOf(source));
            }
        }
        return result;
    }

    /**
     * E-step: recomputes every sample's genotype posteriors.
     * @param usePopFreqs whether genotype priors come from the population allele frequencies; otherwise the loaded
     *                    allele priors are used or, failing that, uniform priors.
     * @return the total log-likelihood of the data across samples.
     */
    double recalcLogSamplePosteriors(final boolean usePopFreqs) {
        final double[] logStutter = composeLogStutterTable();
        final double logUniformPrior = -2 * Math.log(numAlleles);
        final double[] sampleLogLikelihoods = new double[numAlleles * numAlleles];
        double totalLogLikelihood = 0;
        for (int sample = 0; sample < numSamples; sample++) {
            final int readStart = reads.sampleReadStart(sample);
            final int readEnd = reads.sampleReadEnd(sample);
            if (readStart == readEnd) {
                for (int allele1 = 0; allele1 < numAlleles; allele1++) {
                    for (int allele2 = 0; allele2 < numAlleles; allele2++) {
                        logSamplePosteriors[sampleIndex(allele1, allele2, sample)] = logUniformPrior;
                    }
                }
                continue;
            }
            for (int allele1 = 0, pair = 0; allele1 < numAlleles; allele1++) {
                for (int allele2 = 0; allele2 < numAlleles; allele2++, pair++) {
                    double logLikelihood;
                    if (usePopFreqs) {
                        logLikelihood = logGtPriors[allele1] + logGtPriors[allele2];
                    } else if (logAllelePriors != null) {
                        logLikelihood = logAllelePriors[sampleIndex(allele1, allele2, sample)];
                    } else {
                        logLikelihood = logUniformPrior;
                    }
                    for (int read = readStart; read < readEnd; read++) {
                        final int observed = reads.alleleIndex(read) * numAlleles;
                        logLikelihood += NaturalLogUtils.logSumLog(
                                NaturalLogUtils.LOG_ONE_HALF + reads.logP1(read) + logStutter[observed + allele1],
                                NaturalLogUtils.LOG_ONE_HALF + reads.logP2(read) + logStutter[observed + allele2]);
                    }
                    sampleLogLikelihoods[pair] = logLikelihood;
                }
            }
            final double logNormalizer = NaturalLogUtils.logSumExp(sampleLogLikelihoods);
            final String sampleName = reads.sampleName(sample);
            Utils.validate(logNormalizer > Double.NEGATIVE_INFINITY, () -> "all genotypes are impossible for sample " + sampleName);
            for (int allele1 = 0, pair = 0; allele1 < numAlleles; allele1++) {
                for (int allele2 = 0; allele2 < numAlleles; allele2++, pair++) {
                    logSamplePosteriors[sampleIndex(allele1, allele2, sample)] = sampleLogLikelihoods[pair] - logNormalizer;
                }
            }
            totalLogLikelihood += logNormalizer;
        }
        posteriorsAvailable = true;
        return totalLogLikelihood;
    }

    /**
     * E-step: recomputes, for every genotype and read, the posterior probability of the read coming from each
     * haplotype.
     */
    void recalcLogReadPhasePosteriors() {
        final double[] logStutter = composeLogStutterTable();
        for (int allele1 = 0; allele1 < numAlleles; allele1++) {
            for (int allele2 = 0; allele2 < numAlleles; allele2++) {
                for (int read = 0; read < numReads; read++) {
                    final int observed = reads.alleleIndex(read) * numAlleles;
                    // the 1/2 haplotype prior cancels out.
                    final double logPhase1 = reads.logP1(read) + logStutter[observed + allele1];
                    final double logPhase2 = reads.logP2(read) + logStutter[observed + allele2];
                    final double logNormalizer = NaturalLogUtils.logSumLog(logPhase1, logPhase2);
                    final int index = readPhaseIndex(allele1, allele2, read, HAPLOTYPE_1);
                    logReadPhasePosteriors[index] = logPhase1 - logNormalizer;
                    logReadPhasePosteriors[index + 1] = logPhase2 - logNormalizer;
                }
            }
        }
    }

    /**
     * M-step: re-estimates the population allele frequencies from the current genotype posteriors of the samples
     * that have reads.
     */
    void recalcLogGtPriors() {
        final double[] frequencies = new double[numAlleles];
        int informativeSamples = 0;
        for (int sample = 0; sample < numSamples; sample++) {
            if (reads.readCount(sample) == 0) {
                continue;
            }
            informativeSamples++;
            for (int allele1 = 0; allele1 < numAlleles; allele1++) {
                for (int allele2 = 0; allele2 < numAlleles; allele2++) {
                    final double halfPosterior = 0.5 * Math.exp(logSamplePosteriors[sampleIndex(allele1, allele2, sample)]);
                    frequencies[allele1] += halfPosterior;
                    frequencies[allele2] += halfPosterior;
                }
            }
        }
        if (informativeSamples == 0) {
            return;
        }
        final double sampleCount = informativeSamples;
        MathUtils.applyToArrayInPlace(frequencies, f -> f / sampleCount + ALLELE_FREQUENCY_PSEUDOCOUNT);
        final double total = MathUtils.sum(frequencies);
        for (int allele = 0; allele < numAlleles; allele++) {
            logGtPriors[allele] = Math.log(frequencies[allele] / total);
        }
    }

    /**
     * M-step: re-estimates the stutter model crediting every read, haplotype and genotype with the joint posterior
     * of that genotype and that haplotype assignment, and installs the result.
     */
    void recalcStutterModel() {
        final StrAlleleCatalog alleles = reads.alleles();
        final StutterModelEstimator estimator = new StutterModelEstimator(getStutterModel());
        for (int allele1 = 0; allele1 < numAlleles; allele1++) {
            final int size1 = alleles.sizeOf(allele1);
            for (int allele2 = 0; allele2 < numAlleles; allele2++) {
                final int size2 = alleles.sizeOf(allele2);
                for (int read = 0; read < numReads; read++) {
                    final double logGtPosterior = logSamplePosteriors[sampleIndex(allele1, allele2, reads.sampleLabel(read))];
                    final int observedSize = reads.observedSize(read);
                    final int index = readPhaseIndex(allele1, allele2, read, HAPLOTYPE_1);
                    estimator.add(observedSize - size1, Math.exp(logGtPosterior + logReadPhasePosteriors[index]));
                    estimator.add(observedSize - size2, Math.exp(logGtPosterior + logReadPhasePosteriors[index + 1]));
                }
            }
        }
        stutterModel = estimator.estimate();
    }

    /**
     * Computes genotype and read-phase posteriors under the current stutter model without changing it.
     * @param usePopFreqs whether to use the population allele frequencies as genotype priors; when {@code false},
     *                    the loaded allele priors or uniform priors are used.
     * @return the total log-likelihood of the data.
     * @throws GenotyperException.NotConfigured if there is no stutter model.
     */
    public double genotype(final boolean usePopFreqs) {
        getStutterModel();
        final double logLikelihood = recalcLogSamplePosteriors(usePopFreqs);
        recalcLogReadPhasePosteriors();
        return logLikelihood;
    }

    /**
     * Learns the stutter model and population allele frequencies using the thresholds of the configuration
     * this genotyper was created with.
     * @return {@code true} if the algorithm converged.
     */
    public boolean train() {
        return train(config.maxEMIterations, config.minLogLikelihoodAbsChange, config.minLogLikelihoodFracChange);
    }

    /**
     * Learns the stutter model and population allele frequencies by Expectation-Maximization.
     * <p>
     *     Training starts from uniform allele frequencies and from the current stutter model, or the configured
     *     initial model if none was set. Each iteration re-estimates the stutter model and the allele frequencies
     *     and then recomputes the posteriors. The algorithm converges once the total log-likelihood changes by less
     *     than {@code minLLAbsChange} or by less than a {@code minLLFracChange} fraction.
     * </p>
     * @param maxIter maximum number of iterations, 0 or greater.
     * @param minLLAbsChange absolute log-likelihood change threshold.
     * @param minLLFracChange fractional log-likelihood change threshold.
     * @return {@code true} if the algorithm converged, {@code false} if it ran out of iterations; the latest
     * model and posteriors remain usable in either case.
     */
    public boolean train(final int maxIter, final double minLLAbsChange, final double minLLFracChange) {
        ParamUtils.isPositiveOrZero(maxIter, "the maximum number of iterations cannot be negative");
        ParamUtils.isPositiveOrZero(minLLAbsChange, "the absolute log-likelihood change threshold cannot be negative");
        ParamUtils.isPositiveOrZero(minLLFracChange, "the fractional log-likelihood change threshold cannot be negative");

        status = EMStatus.INITIALIZING;
        initLogGtPriors();
        if (stutterModel == null) {
            stutterModel = config.initialStutterModel(locus.getMotifLength());
        }
        logLikelihoodTrace.clear();
        likelihoodDecreaseCount = 0;
        logger.info(String.format("Training stutter model at %s with %d samples and %d reads, starting from %s",
                locus, numSamples, numReads, stutterModel));

        status = EMStatus.ITERATING;
        double logLikelihood = genotype(true);
        logLikelihoodTrace.add(logLikelihood);
        showIterationHeader();
        showIterationInfo(0, logLikelihood, Double.NaN);

        for (int iteration = 1; iteration <= maxIter; iteration++) {
            recalcStutterModel();
            recalcLogGtPriors();
            final double newLogLikelihood = genotype(true);
            logLikelihoodTrace.add(newLogLikelihood);
            final double change = newLogLikelihood - logLikelihood;
            showIterationInfo(iteration, newLogLikelihood, change);
            if (change < -config.logLikelihoodDecreaseTolerance) {
                likelihoodDecreaseCount++;
                logger.warn(String.format("Log-likelihood decreased from %.6f to %.6f at iteration %d at %s; continuing",
                        logLikelihood, newLogLikelihood, iteration, locus));
            }
            logLikelihood = newLogLikelihood;
            if (Math.abs(change) < minLLAbsChange || Math.abs(change / newLogLikelihood) < minLLFracChange) {
                status = EMStatus.CONVERGED;
                break;
            }
        }
        if (status != EMStatus.CONVERGED) {
            status = EMStatus.MAX_ITERATIONS_EXCEEDED;
        }
        logger.info(String.format("EM algorithm status at %s: %s Learned %s", locus, status.getMessage(), stutterModel));
        return status.isSuccessful();
    }

    private void showIterationHeader() {
        if (logger.isDebugEnabled()) {
            final String header = String.format("%-15s%-25s%-20s", "Iteration", "Log Likelihood", "Change");
            logger.debug(header);
            logger.debug(StringUtils.repeat("=", header.length()));
        }
    }

    private void showIterationInfo(final int iteration, final double logLikelihood, final double change) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("%-15d%-25.6f%-20.6e", iteration, logLikelihood, change));
        }
    }

    /**
     * Summarises the current posteriors of a sample into its most likely ordered genotype.
     * @param sample the sample index.
     * @return never {@code null}.
     * @throws IllegalStateException if no posteriors have been computed yet.
     */
    public StrGenotypeCall getGenotypeCall(final int sample) {
        Utils.validIndex(sample, numSamples);
        Utils.validate(posteriorsAvailable, "posteriors have not been computed; call train or genotype first");
        final double[] posteriors = getLogSamplePosteriors(sample);
        final int best = MathUtils.maxElementIndex(posteriors);
        final int allele1 = best / numAlleles;
        final int allele2 = best % numAlleles;
        final double phasedPosterior = Math.exp(posteriors[best]);
        final double unphasedPosterior = allele1 == allele2 ? phasedPosterior
                : phasedPosterior + Math.exp(posteriors[allele2 * numAlleles + allele1]);
        double haplotype1Reads = 0;
        double haplotype2Reads = 0;
        for (int read = reads.sampleReadStart(sample); read < reads.sampleReadEnd(sample); read++) {
            final int index = readPhaseIndex(allele1, allele2, read, HAPLOTYPE_1);
            haplotype1Reads += Math.exp(logReadPhasePosteriors[index]);
            haplotype2Reads += Math.exp(logReadPhasePosteriors[index + 1]);
        }
        final StrAlleleCatalog alleles = reads.alleles();
        return new StrGenotypeCall(reads.sampleName(sample), allele1, allele2,
                alleles.bpDiffFromReference(allele1), alleles.bpDiffFromReference(allele2),
                phasedPosterior, unphasedPosterior, reads.readCount(sample), haplotype1Reads, haplotype2Reads);
    }

    public StrGenotypeCall getGenotypeCall(final String sampleName) {
        return getGenotypeCall(reads.sampleIndex(sampleName));
    }

    /**
     * Genotype calls of every sample, in sample order.
     */
    public List<StrGenotypeCall> getGenotypeCalls() {
        final List<StrGenotypeCall> result = new ArrayList<>(numSamples);
        for (int sample = 0; sample < numSamples; sample++) {
            result.add(getGenotypeCall(sample));
        }
        return result;
    }

    public StrLocus getLocus() {
        return locus;
    }

    public StrAlleleCatalog getAlleles() {
        return reads.alleles();
    }

    public int getNumAlleles() {
        return numAlleles;
    }

    public int getNumSamples() {
        return numSamples;
    }

    public int getNumReads() {
        return numReads;
    }

    public List<String> getSampleNames() {
        return reads.sampleNames();
    }

    public int getSampleIndex(final String sampleName) {
        return reads.sampleIndex(sampleName);
    }

    public int[] getReadsPerSample() {
        return reads.readsPerSample();
    }

    /**
     * Returns a copy of the population allele log-frequencies.
     */
    public double[] getLogGtPriors() {
        return logGtPriors.clone();
    }

    /**
     * Log posterior of the ordered genotype (allele1, allele2) for a sample.
     */
    public double getLogSamplePosterior(final int allele1, final int allele2, final int sample) {
        Utils.validIndex(allele1, numAlleles);
        Utils.validIndex(allele2, numAlleles);
        Utils.validIndex(sample, numSamples);
        return logSamplePosteriors[sampleIndex(allele1, allele2, sample)];
    }

    /**
     * Returns a copy of a sample's genotype log posteriors, indexed by {@code allele1 * numAlleles + allele2}.
     */
    public double[] getLogSamplePosteriors(final int sample) {
        Utils.validIndex(sample, numSamples);
        final double[] result = new double[numAlleles * numAlleles];
        for (int allele1 = 0, pair = 0; allele1 < numAlleles; allele1++) {
            for (int allele2 = 0; allele2 < numAlleles; allele2++, pair++) {
                result[pair] = logSamplePosteriors[sampleIndex(allele1, allele2, sample)];
            }
        }
        return result;
    }

    /**
     * Log posterior of a read coming from a haplotype given the ordered genotype (allele1, allele2) of its sample.
     * @param phase either {@link #HAPLOTYPE_1} or {@link #HAPLOTYPE_2}.
     */
    public double getLogReadPhasePosterior(final int allele1, final int allele2, final int read, final int phase) {
        Utils.validIndex(allele1, numAlleles);
        Utils.validIndex(allele2, numAlleles);
        Utils.validIndex(read, numReads);
        Utils.validIndex(phase, 2);
        return logReadPhasePosteriors[readPhaseIndex(allele1, allele2, read, phase)];
    }

    /**
     * Total log-likelihood after each E-step of the last {@link #train} run, starting with the initial one.
     */
    public List<Double> getLogLikelihoodTrace() {
        return Collections.unmodifiableList(new ArrayList<>(logLikelihoodTrace));
    }

    /**
     * Number of iterations of the last {@link #train} run in which the log-likelihood dropped beyond tolerance.
     */
    public int getLikelihoodDecreaseCount() {
        return likelihoodDecreaseCount;
    }

    public EMStatus getStatus() {
        return status;
    }

    /**
     * This enum represents the status of the EM training.
     */
    public enum EMStatus {
        UNTRAINED(false, "Training has not been run."),
        INITIALIZING(false, "Initializing priors and stutter model."),
        ITERATING(false, "Iterating."),
        CONVERGED(true, "Success -- converged in log-likelihood change tolerance."),
        MAX_ITERATIONS_EXCEEDED(false, "Failure -- maximum iterations reached.");

        private final boolean success;
        private final String message;

        EMStatus(final boolean success, final String message) {
            this.success = success;
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        public boolean isSuccessful() {
            return success;
        }
    }
}
