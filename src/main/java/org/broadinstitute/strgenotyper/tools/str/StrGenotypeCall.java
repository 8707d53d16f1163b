package org.broadinstitute.strgenotyper.tools.str;

/**
 * Most likely genotype of one sample at an STR locus, as summarised from the genotyper posteriors.
 * <p>
 *     Allele 1 and allele 2 are the alleles carried by haplotype 1 and haplotype 2 as defined by the reads'
 *     SNP phasing evidence.
 * </p>
 */
public final class StrGenotypeCall {

    private final String sampleName;
    private final int allele1Index;
    private final int allele2Index;
    private final int allele1BpDiff;
    private final int allele2BpDiff;
    private final double phasedPosterior;
    private final double unphasedPosterior;
    private final int depth;
    private final double haplotype1Reads;
    private final double haplotype2Reads;

    StrGenotypeCall(final String sampleName, final int allele1Index, final int allele2Index,
                    final int allele1BpDiff, final int allele2BpDiff,
                    final double phasedPosterior, final double unphasedPosterior,
                    final int depth, final double haplotype1Reads, final double haplotype2Reads) {
        this.sampleName = sampleName;
        this.allele1Index = allele1Index;
        this.allele2Index = allele2Index;
        this.allele1BpDiff = allele1BpDiff;
        this.allele2BpDiff = allele2BpDiff;
        this.phasedPosterior = phasedPosterior;
        this.unphasedPosterior = unphasedPosterior;
        this.depth = depth;
        this.haplotype1Reads = haplotype1Reads;
        this.haplotype2Reads = haplotype2Reads;
    }

    public String getSampleName() {
        return sampleName;
    }

    public int getAllele1Index() {
        return allele1Index;
    }

    public int getAllele2Index() {
        return allele2Index;
    }

    /**
     * Size difference of allele 1 with respect to the reference, in bp.
     */
    public int getAllele1BpDiff() {
        return allele1BpDiff;
    }

    public int getAllele2BpDiff() {
        return allele2BpDiff;
    }

    public boolean isHomozygous() {
        return allele1Index == allele2Index;
    }

    /**
     * Posterior probability of the ordered (phased) genotype.
     */
    public double getPhasedPosterior() {
        return phasedPosterior;
    }

    /**
     * Posterior probability of the genotype regardless of phase.
     */
    public double getUnphasedPosterior() {
        return unphasedPosterior;
    }

    /**
     * Number of reads of the sample.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Expected number of reads from haplotype 1 under the called genotype.
     */
    public double getHaplotype1Reads() {
        return haplotype1Reads;
    }

    public double getHaplotype2Reads() {
        return haplotype2Reads;
    }

    @Override
    public String toString() {
        return String.format("%s %d|%d (%d|%d bp) Q=%.4f PQ=%.4f DP=%d PDP=%.2f|%.2f", sampleName, allele1Index, allele2Index,
                allele1BpDiff, allele2BpDiff, unphasedPosterior, phasedPosterior, depth, haplotype1Reads, haplotype2Reads);
    }
}
