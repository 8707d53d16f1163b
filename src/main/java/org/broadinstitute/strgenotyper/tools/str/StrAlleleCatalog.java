package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.strgenotyper.exceptions.UserException;
import org.broadinstitute.strgenotyper.utils.Utils;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ordered set of the STR allele sizes (in bp) considered at a locus.
 * <p>
 *     The reference allele is always at index {@link #REFERENCE_INDEX}; the remaining sizes follow in ascending order.
 * </p>
 */
public final class StrAlleleCatalog {

    public static final int REFERENCE_INDEX = 0;

    /**
     * Base used to pad expansions when rebuilding an allele sequence from the reference.
     */
    public static final char INSERTED_BASE = 'N';

    private final int[] sizes;
    private final Map<Integer, Integer> indexBySize;

    private StrAlleleCatalog(final int[] sizes) {
        this.sizes = sizes;
        this.indexBySize = new HashMap<>(sizes.length * 2);
        for (int i = 0; i < sizes.length; i++) {
            indexBySize.put(sizes[i], i);
        }
    }

    /**
     * Composes the catalog for a reference size and the sizes observed in reads.
     * @param referenceSize the reference allele size.
     * @param observedSizes sizes reported by reads, per sample; repeats and the reference are allowed.
     * @return never {@code null}.
     */
    public static StrAlleleCatalog of(final int referenceSize, final int[][] observedSizes) {
        Utils.nonNull(observedSizes, "observed sizes cannot be null");
        final TreeSet<Integer> others = new TreeSet<>();
        for (final int[] sampleSizes : observedSizes) {
            Utils.nonNull(sampleSizes, "observed sizes cannot contain null rows");
            for (final int size : sampleSizes) {
                others.add(size);
            }
        }
        others.remove(referenceSize);
        final int[] sizes = new int[others.size() + 1];
        sizes[REFERENCE_INDEX] = referenceSize;
        int next = REFERENCE_INDEX + 1;
        for (final int size : others) {
            sizes[next++] = size;
        }
        return new StrAlleleCatalog(sizes);
    }

    public int numberOfAlleles() {
        return sizes.length;
    }

    /**
     * Size in bp of the allele at the given index.
     */
    public int sizeOf(final int alleleIndex) {
        return sizes[Utils.validIndex(alleleIndex, sizes.length)];
    }

    /**
     * Size difference in bp between an allele and the reference.
     */
    public int bpDiffFromReference(final int alleleIndex) {
        return sizeOf(alleleIndex) - sizes[REFERENCE_INDEX];
    }

    /**
     * Index of the allele with the given size.
     * @throws IllegalArgumentException if no allele has that size.
     */
    public int indexOf(final int size) {
        final Integer result = indexBySize.get(size);
        Utils.validateArg(result != null, () -> "there is no allele with size " + size);
        return result;
    }

    public boolean contains(final int size) {
        return indexBySize.containsKey(size);
    }

    public int referenceSize() {
        return sizes[REFERENCE_INDEX];
    }

    /**
     * Returns a copy of the allele sizes in index order.
     */
    public int[] sizes() {
        return sizes.clone();
    }

    /**
     * Builds the sequence of an allele from the reference allele sequence.
     * <p>
     *     Contractions drop bases from the end of the reference sequence and expansions append
     *     {@value #INSERTED_BASE} bases, as the read evidence says nothing about the inserted content.
     * </p>
     * @param referenceSequence the reference allele bases.
     * @param bpDiff allele size minus reference size.
     * @return never {@code null}.
     * @throws UserException.BadInput if the contraction is longer than the reference sequence.
     */
    public static String alleleSequence(final String referenceSequence, final int bpDiff) {
        Utils.nonNull(referenceSequence, "the reference sequence cannot be null");
        if (bpDiff < -referenceSequence.length()) {
            throw new UserException.BadInput(String.format("a contraction of %d bp does not fit in a reference allele of length %d",
                    -bpDiff, referenceSequence.length()));
        } else if (bpDiff <= 0) {
            return referenceSequence.substring(0, referenceSequence.length() + bpDiff);
        } else {
            final StringBuilder builder = new StringBuilder(referenceSequence.length() + bpDiff).append(referenceSequence);
            for (int i = 0; i < bpDiff; i++) {
                builder.append(INSERTED_BASE);
            }
            return builder.toString();
        }
    }

    @Override
    public String toString() {
        return "StrAlleleCatalog" + Arrays.toString(sizes);
    }
}
