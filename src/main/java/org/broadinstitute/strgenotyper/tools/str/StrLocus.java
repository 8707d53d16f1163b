package org.broadinstitute.strgenotyper.tools.str;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.strgenotyper.utils.Utils;
import org.broadinstitute.strgenotyper.utils.param.ParamUtils;

/**
 * Immutable description of the STR region being genotyped: a 1-based closed interval plus the
 * length of its repeat unit.
 */
public final class StrLocus implements Locatable {
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private final String contig;
    private final int start;
    private final int end;
    private final int motifLength;

    /**
     * @param contig the name of the contig, must not be null
     * @param start  1-based inclusive start position
     * @param end  1-based inclusive end position
     * @param motifLength base pairs per repeat unit
     */
    public StrLocus(final String contig, final int start, final int end, final int motifLength) {
        Utils.validateArg(isValid(contig, start, end), () -> "Invalid interval. Contig:" + contig + " start:" + start + " end:" + end);
        this.contig = contig;
        this.start = start;
        this.end = end;
        this.motifLength = (int) ParamUtils.isPositive(motifLength, "motif length must be positive but found " + motifLength);
    }

    /**
     * Test that these are valid values for constructing a locus:
     *    contig cannot be null
     *    start must be >= 1
     *    end must be >= start
     */
    public static boolean isValid(final String contig, final int start, final int end) {
        return contig != null && start > 0 && end >= start;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public int getMotifLength() {
        return motifLength;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final StrLocus that = (StrLocus) o;

        if (end != that.end) return false;
        if (start != that.start) return false;
        if (motifLength != that.motifLength) return false;
        return contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + motifLength;
        result = 31 * result + contig.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return contig + CONTIG_SEPARATOR + start + START_END_SEPARATOR + end;
    }
}
