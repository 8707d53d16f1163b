package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.strgenotyper.GenotyperBaseTest;
import org.broadinstitute.strgenotyper.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class StrAlleleCatalogUnitTest extends GenotyperBaseTest {

    @Test
    public void testReferenceFirstThenAscending() {
        final StrAlleleCatalog catalog = StrAlleleCatalog.of(30, new int[][] {{33, 27, 33}, {}, {36, 30, 24}});
        Assert.assertEquals(catalog.sizes(), new int[] {30, 24, 27, 33, 36});
        Assert.assertEquals(catalog.numberOfAlleles(), 5);
        Assert.assertEquals(catalog.referenceSize(), 30);
        Assert.assertEquals(catalog.indexOf(30), StrAlleleCatalog.REFERENCE_INDEX);
        Assert.assertEquals(catalog.indexOf(33), 3);
        Assert.assertEquals(catalog.bpDiffFromReference(1), -6);
        Assert.assertEquals(catalog.bpDiffFromReference(4), 6);
        Assert.assertTrue(catalog.contains(27));
        Assert.assertFalse(catalog.contains(31));
    }

    @Test
    public void testReferenceAlwaysPresent() {
        final StrAlleleCatalog unobserved = StrAlleleCatalog.of(20, new int[][] {{22, 24}});
        Assert.assertEquals(unobserved.sizeOf(0), 20);
        Assert.assertEquals(unobserved.numberOfAlleles(), 3);

        final StrAlleleCatalog noReads = StrAlleleCatalog.of(20, new int[][] {{}, {}});
        Assert.assertEquals(noReads.sizes(), new int[] {20});
    }

    @Test
    public void testSizesIsACopy() {
        final StrAlleleCatalog catalog = StrAlleleCatalog.of(10, new int[][] {{12}});
        catalog.sizes()[0] = 99;
        Assert.assertEquals(catalog.referenceSize(), 10);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownSize() {
        StrAlleleCatalog.of(10, new int[][] {{12}}).indexOf(14);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidIndex() {
        StrAlleleCatalog.of(10, new int[][] {{12}}).sizeOf(2);
    }

    @DataProvider(name = "alleleSequenceData")
    public Object[][] alleleSequenceData() {
        return new Object[][] {
                { "ACACAC", 0, "ACACAC" },
                { "ACACAC", -2, "ACAC" },
                { "ACACAC", -6, "" },
                { "ACACAC", 3, "ACACACNNN" },
        };
    }

    @Test(dataProvider = "alleleSequenceData")
    public void testAlleleSequence(final String reference, final int bpDiff, final String expected) {
        Assert.assertEquals(StrAlleleCatalog.alleleSequence(reference, bpDiff), expected);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testAlleleSequenceContractionTooLong() {
        StrAlleleCatalog.alleleSequence("ACAC", -5);
    }
}
