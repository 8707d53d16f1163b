package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.strgenotyper.GenotyperBaseTest;
import org.broadinstitute.strgenotyper.utils.stutter.StutterModel;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class StutterModelEstimatorUnitTest extends GenotyperBaseTest {

    private static final StutterModel PREVIOUS = new StutterEMArgumentCollection().initialStutterModel(3);

    @Test
    public void testNoWeightKeepsPreviousModel() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        Assert.assertSame(estimator.estimate(), PREVIOUS);
        estimator.add(3, 0.0);
        Assert.assertEquals(estimator.totalWeight(), 0.0);
        Assert.assertSame(estimator.estimate(), PREVIOUS);
    }

    @Test
    public void testOnlyNoStutterObservations() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(0, 5.0);
        Assert.assertEquals(estimator.estimate(), PREVIOUS);
    }

    @Test
    public void testInframeOnly() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(0, 8.0);
        estimator.add(3, 1.0);
        estimator.add(-6, 1.0);
        Assert.assertEquals(estimator.totalWeight(), 10.0, 1e-12);
        final StutterModel result = estimator.estimate();
        // out-of-frame shifts were never seen: their 0.02 mass is reserved.
        Assert.assertEquals(result.getInframeUp(), 0.098, 1e-12);
        Assert.assertEquals(result.getInframeDown(), 0.098, 1e-12);
        Assert.assertEquals(result.getInframeGeom(), 2.0 / 3.0, 1e-12);
        Assert.assertEquals(result.getOutframeGeom(), PREVIOUS.getOutframeGeom());
        Assert.assertEquals(result.getOutframeUp(), PREVIOUS.getOutframeUp());
        Assert.assertEquals(result.getOutframeDown(), PREVIOUS.getOutframeDown());
        Assert.assertEquals(result.getMotifLength(), 3);
    }

    @Test
    public void testOutframeTrialCounts() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(0, 2.0);
        estimator.add(4, 1.0);   // 3 out-of-frame steps.
        estimator.add(-2, 1.0);  // 2 out-of-frame steps.
        final StutterModel result = estimator.estimate();
        Assert.assertEquals(result.getOutframeGeom(), 0.4, 1e-12);
        Assert.assertEquals(result.getOutframeUp(), 0.225, 1e-12);
        Assert.assertEquals(result.getOutframeDown(), 0.225, 1e-12);
        Assert.assertEquals(result.getInframeUp(), PREVIOUS.getInframeUp());
        Assert.assertEquals(result.getInframeDown(), PREVIOUS.getInframeDown());
        Assert.assertEquals(result.getInframeGeom(), PREVIOUS.getInframeGeom());
    }

    @Test
    public void testProbabilitiesAreFloored() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(0, 1.0);
        estimator.add(3, 1.0);
        final StutterModel result = estimator.estimate();
        Assert.assertEquals(result.getInframeUp(), 0.49, 1e-12);
        Assert.assertEquals(result.getInframeDown(), StutterModelEstimator.MIN_PROBABILITY);
        Assert.assertEquals(result.getInframeGeom(), 1 - StutterModelEstimator.MIN_PROBABILITY, 1e-15);
    }

    @Test
    public void testStutterMassIsCapped() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(3, 1.0);
        estimator.add(-3, 1.0);
        estimator.add(1, 1.0);
        estimator.add(-1, 1.0);
        final StutterModel result = estimator.estimate();
        final double stutterMass = result.getInframeUp() + result.getInframeDown() + result.getOutframeUp() + result.getOutframeDown();
        Assert.assertTrue(stutterMass < 1);
        Assert.assertEquals(stutterMass, 1 - StutterModelEstimator.MIN_PROBABILITY, 1e-12);
        Assert.assertEquals(result.getInframeUp(), result.getOutframeDown(), 1e-15);
        Assert.assertTrue(result.getNoStutterProbability() > 0);
    }

    @Test
    public void testFractionalWeights() {
        final StutterModelEstimator estimator = new StutterModelEstimator(PREVIOUS);
        estimator.add(0, 0.75);
        estimator.add(-3, 0.25);
        estimator.add(-3, 0.25);
        estimator.add(-6, 0.25);
        estimator.add(2, 0.5);
        final StutterModel result = estimator.estimate();
        Assert.assertEquals(estimator.totalWeight(), 2.0, 1e-12);
        Assert.assertEquals(result.getInframeDown(), 0.375, 1e-12);
        Assert.assertEquals(result.getInframeUp(), StutterModelEstimator.MIN_PROBABILITY);
        Assert.assertEquals(result.getInframeGeom(), 0.75, 1e-12);
        Assert.assertEquals(result.getOutframeUp(), 0.25, 1e-12);
        Assert.assertEquals(result.getOutframeGeom(), 0.5, 1e-12);
    }

    @DataProvider(name = "invalidWeights")
    public Object[][] invalidWeights() {
        return new Object[][] { {-1.0}, {Double.NaN}, {Double.POSITIVE_INFINITY} };
    }

    @Test(dataProvider = "invalidWeights", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidWeights(final double weight) {
        new StutterModelEstimator(PREVIOUS).add(3, weight);
    }
}
