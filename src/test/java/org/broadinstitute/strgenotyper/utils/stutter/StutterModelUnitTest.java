package org.broadinstitute.strgenotyper.utils.stutter;

import org.broadinstitute.strgenotyper.GenotyperBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class StutterModelUnitTest extends GenotyperBaseTest {

    private static StutterModel model(final int motifLength) {
        return new StutterModel(0.9, 0.05, 0.03, 0.7, 0.01, 0.02, motifLength);
    }

    @Test
    public void testNoStutter() {
        final StutterModel model = model(3);
        Assert.assertEquals(model.logStutterPmf(0), Math.log(1 - 0.05 - 0.03 - 0.01 - 0.02), 1e-12);
        Assert.assertEquals(model.getNoStutterProbability(), 0.89, 1e-12);
    }

    @DataProvider(name = "pmfData")
    public Object[][] pmfData() {
        // motif 3: in-frame shifts are multiples of 3; out-of-frame steps count the non-multiples traversed.
        return new Object[][] {
                { 3, 3, 0.05 * 0.9 },
                { 3, 6, 0.05 * 0.9 * 0.1 },
                { 3, -9, 0.03 * 0.9 * 0.1 * 0.1 },
                { 3, 1, 0.01 * 0.7 },
                { 3, 2, 0.01 * 0.7 * 0.3 },
                { 3, 4, 0.01 * 0.7 * 0.3 * 0.3 },
                { 3, -5, 0.02 * 0.7 * 0.3 * 0.3 * 0.3 },
                { 1, 2, 0.05 * 0.9 * 0.1 },
                { 1, -1, 0.03 * 0.9 },
                { 4, 8, 0.05 * 0.9 * 0.1 },
                { 4, -7, 0.02 * 0.7 * Math.pow(0.3, 5) },
        };
    }

    @Test(dataProvider = "pmfData")
    public void testLogStutterPmf(final int motifLength, final int bpDiff, final double expected) {
        assertEqualsDoubleSmart(model(motifLength).logStutterPmf(bpDiff), Math.log(expected), 1e-9);
    }

    @Test(dataProvider = "motifLengths")
    public void testPmfSumsToOne(final int motifLength) {
        final StutterModel model = model(motifLength);
        double total = 0;
        for (int bpDiff = -2000; bpDiff <= 2000; bpDiff++) {
            total += Math.exp(model.logStutterPmf(bpDiff));
        }
        Assert.assertEquals(total, 1.0, 1e-9);
    }

    @Test
    public void testPmfSumWithSingleBaseMotif() {
        final StutterModel model = model(1);
        double total = 0;
        for (int bpDiff = -2000; bpDiff <= 2000; bpDiff++) {
            total += Math.exp(model.logStutterPmf(bpDiff));
        }
        Assert.assertEquals(total, 1.0 - 0.01 - 0.02, 1e-9);
        Assert.assertEquals(model.logStutterPmf(1), Math.log(0.05 * 0.9), 1e-12);
    }

    @DataProvider(name = "motifLengths")
    public Object[][] motifLengths() {
        return new Object[][] { {2}, {3}, {4}, {6} };
    }

    @Test
    public void testFrameClassification() {
        final StutterModel model = model(4);
        Assert.assertTrue(model.isInFrame(8));
        Assert.assertTrue(model.isInFrame(-4));
        Assert.assertFalse(model.isInFrame(6));
        Assert.assertEquals(model.inFrameUnits(-12), 3);
        Assert.assertEquals(model.outOfFrameSteps(1), 1);
        Assert.assertEquals(model.outOfFrameSteps(5), 4);
        Assert.assertEquals(model.outOfFrameSteps(11), 9);
    }

    @DataProvider(name = "invalidParameters")
    public Object[][] invalidParameters() {
        return new Object[][] {
                { 0.0, 0.05, 0.05, 0.9, 0.01, 0.01, 3 },
                { 1.0, 0.05, 0.05, 0.9, 0.01, 0.01, 3 },
                { 0.9, -0.05, 0.05, 0.9, 0.01, 0.01, 3 },
                { 0.9, 0.05, 0.05, Double.NaN, 0.01, 0.01, 3 },
                { 0.9, 0.05, 0.05, 0.9, 0.01, 0.0, 3 },
                { 0.9, 0.5, 0.4, 0.9, 0.05, 0.05, 3 },
                { 0.9, 0.05, 0.05, 0.9, 0.01, 0.01, 0 },
        };
    }

    @Test(dataProvider = "invalidParameters", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidParameters(final double inframeGeom, final double inframeUp, final double inframeDown,
                                      final double outframeGeom, final double outframeUp, final double outframeDown,
                                      final int motifLength) {
        new StutterModel(inframeGeom, inframeUp, inframeDown, outframeGeom, outframeUp, outframeDown, motifLength);
    }

    @Test
    public void testEqualsAndHashCode() {
        Assert.assertEquals(model(3), model(3));
        Assert.assertEquals(model(3).hashCode(), model(3).hashCode());
        Assert.assertNotEquals(model(3), model(4));
        Assert.assertNotEquals(model(3), new StutterModel(0.9, 0.05, 0.03, 0.7, 0.01, 0.03, 3));
    }
}
