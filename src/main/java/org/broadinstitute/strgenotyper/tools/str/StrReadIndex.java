package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.strgenotyper.exceptions.UserException;
import org.broadinstitute.strgenotyper.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattened, immutable view of all the reads at an STR locus.
 * <p>
 *     Reads are numbered across samples in sample order, so the reads of a sample occupy a contiguous range
 *     {@code [sampleReadStart(s), sampleReadEnd(s))}. For each read we keep the index of its repeat size in the
 *     {@link StrAlleleCatalog}, the log-likelihoods of its SNP phasing evidence under each haplotype and the index
 *     of its sample.
 * </p>
 */
public final class StrReadIndex {

    private final StrAlleleCatalog alleles;
    private final List<String> sampleNames;
    private final Map<String, Integer> sampleIndices;

    private final int[] alleleIndex;
    private final double[] logP1;
    private final double[] logP2;
    private final int[] sampleLabel;

    // sampleOffsets[s] is the first read of sample s; sampleOffsets[numberOfSamples] == numberOfReads.
    private final int[] sampleOffsets;

    /**
     * Builds the index.
     * @param bpSizes observed repeat size of each read, one row per sample.
     * @param logP1 log-likelihood of each read's phasing evidence under haplotype 1, same shape as {@code bpSizes}.
     * @param logP2 log-likelihood of each read's phasing evidence under haplotype 2, same shape as {@code bpSizes}.
     * @param sampleNames names of the samples, one per row.
     * @param referenceSize size of the reference allele in bp.
     * @throws UserException.DimensionMismatch if the input shapes do not agree.
     * @throws IllegalArgumentException if any log-likelihood is greater than 0 or NaN, both log-likelihoods of a read
     * are {@link Double#NEGATIVE_INFINITY}, or sample names are repeated.
     */
    public StrReadIndex(final int[][] bpSizes, final double[][] logP1, final double[][] logP2,
                        final List<String> sampleNames, final int referenceSize) {
        Utils.nonNull(bpSizes, "bp sizes cannot be null");
        Utils.nonNull(logP1, "log p1 cannot be null");
        Utils.nonNull(logP2, "log p2 cannot be null");
        Utils.containsNoNull(sampleNames, "sample names cannot be null nor contain nulls");
        final int numberOfSamples = bpSizes.length;
        checkLength("log p1 sample list", numberOfSamples, logP1.length);
        checkLength("log p2 sample list", numberOfSamples, logP2.length);
        checkLength("sample names", numberOfSamples, sampleNames.size());

        int numberOfReads = 0;
        for (int i = 0; i < numberOfSamples; i++) {
            final String name = sampleNames.get(i);
            Utils.nonNull(bpSizes[i], () -> "bp sizes for sample " + name + " cannot be null");
            Utils.nonNull(logP1[i], () -> "log p1 for sample " + name + " cannot be null");
            Utils.nonNull(logP2[i], () -> "log p2 for sample " + name + " cannot be null");
            checkLength("log p1 for sample " + name, bpSizes[i].length, logP1[i].length);
            checkLength("log p2 for sample " + name, bpSizes[i].length, logP2[i].length);
            numberOfReads += bpSizes[i].length;
        }

        this.sampleNames = Collections.unmodifiableList(new ArrayList<>(
                Utils.checkForDuplicatesAndReturnSet(sampleNames, "sample names must be unique.")));
        this.sampleIndices = new HashMap<>(numberOfSamples * 2);
        for (int i = 0; i < numberOfSamples; i++) {
            sampleIndices.put(this.sampleNames.get(i), i);
        }
        this.alleles = StrAlleleCatalog.of(referenceSize, bpSizes);

        alleleIndex = new int[numberOfReads];
        this.logP1 = new double[numberOfReads];
        this.logP2 = new double[numberOfReads];
        sampleLabel = new int[numberOfReads];
        sampleOffsets = new int[numberOfSamples + 1];

        int readIndex = 0;
        for (int i = 0; i < numberOfSamples; i++) {
            sampleOffsets[i] = readIndex;
            for (int j = 0; j < bpSizes[i].length; j++, readIndex++) {
                final double p1 = logP1[i][j];
                final double p2 = logP2[i][j];
                final int sample = i;
                final int read = j;
                Utils.validateArg(p1 <= 0 && p2 <= 0, () -> String.format(
                        "phasing log-likelihoods must be 0 or less but found (%s, %s) for read %d of sample %s",
                        p1, p2, read, sampleNames.get(sample)));
                Utils.validateArg(p1 > Double.NEGATIVE_INFINITY || p2 > Double.NEGATIVE_INFINITY, () -> String.format(
                        "read %d of sample %s is impossible under both haplotypes", read, sampleNames.get(sample)));
                alleleIndex[readIndex] = alleles.indexOf(bpSizes[i][j]);
                this.logP1[readIndex] = p1;
                this.logP2[readIndex] = p2;
                sampleLabel[readIndex] = i;
            }
        }
        sampleOffsets[numberOfSamples] = readIndex;
        Utils.validate(readIndex == numberOfReads, "read count does not add up");
    }

    private static void checkLength(final String what, final int expected, final int actual) {
        if (expected != actual) {
            throw new UserException.DimensionMismatch(what, expected, actual);
        }
    }

    public StrAlleleCatalog alleles() {
        return alleles;
    }

    public int numberOfReads() {
        return alleleIndex.length;
    }

    public int numberOfSamples() {
        return sampleNames.size();
    }

    public int alleleIndex(final int read) {
        return alleleIndex[read];
    }

    /**
     * Observed repeat size of a read in bp.
     */
    public int observedSize(final int read) {
        return alleles.sizeOf(alleleIndex[read]);
    }

    public double logP1(final int read) {
        return logP1[read];
    }

    public double logP2(final int read) {
        return logP2[read];
    }

    public int sampleLabel(final int read) {
        return sampleLabel[read];
    }

    public int sampleReadStart(final int sample) {
        return sampleOffsets[Utils.validIndex(sample, sampleNames.size())];
    }

    public int sampleReadEnd(final int sample) {
        return sampleOffsets[Utils.validIndex(sample, sampleNames.size()) + 1];
    }

    public int readCount(final int sample) {
        return sampleReadEnd(sample) - sampleReadStart(sample);
    }

    /**
     * Number of reads per sample, in sample order.
     */
    public int[] readsPerSample() {
        final int[] result = new int[sampleNames.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = sampleOffsets[i + 1] - sampleOffsets[i];
        }
        return result;
    }

    public List<String> sampleNames() {
        return sampleNames;
    }

    public String sampleName(final int sample) {
        return sampleNames.get(Utils.validIndex(sample, sampleNames.size()));
    }

    /**
     * Index of the sample with the given name.
     * @throws IllegalArgumentException if there is no such sample.
     */
    public int sampleIndex(final String name) {
        final Integer result = sampleIndices.get(name);
        Utils.validateArg(result != null, () -> "unknown sample: " + name);
        return result;
    }
}
