package org.broadinstitute.strgenotyper.tools.str;

/**
 * Source of per-sample genotype priors, typically backed by a population call set.
 */
@FunctionalInterface
public interface AllelePriorProvider {

    /**
     * Returns the natural-log prior of an ordered genotype for a sample.
     * @param sampleName the sample.
     * @param allele1Size size in bp of the allele on haplotype 1.
     * @param allele2Size size in bp of the allele on haplotype 2.
     * @return 0 or less; {@link Double#NEGATIVE_INFINITY} excludes the genotype.
     */
    double logPrior(String sampleName, int allele1Size, int allele2Size);
}
