package org.broadinstitute.strgenotyper.tools.str;

import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.strgenotyper.GenotyperBaseTest;
import org.broadinstitute.strgenotyper.utils.stutter.StutterModel;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class StutterEMArgumentCollectionUnitTest extends GenotyperBaseTest {

    @Test
    public void testDefaults() {
        final StutterEMArgumentCollection args = new StutterEMArgumentCollection();
        args.validate();
        Assert.assertEquals(args.maxEMIterations, 100);
        Assert.assertEquals(args.minLogLikelihoodAbsChange, 0.01);
        Assert.assertEquals(args.minLogLikelihoodFracChange, 0.001);
        Assert.assertEquals(args.initialStutterModel(2), new StutterModel(0.9, 0.05, 0.05, 0.9, 0.01, 0.01, 2));
    }

    @Test
    public void testParseCommandLine() {
        final StutterEMArgumentCollection args = new StutterEMArgumentCollection();
        final CommandLineParser clp = new CommandLineArgumentParser(args);
        Assert.assertTrue(clp.parseArguments(System.err, new String[] {
                "--" + StutterEMArgumentCollection.MAX_EM_ITERATIONS_FULL_NAME, "5",
                "--" + StutterEMArgumentCollection.MIN_LL_ABS_CHANGE_FULL_NAME, "0.5",
                "--" + StutterEMArgumentCollection.INFRAME_UP_FULL_NAME, "0.2"}));
        args.validate();
        Assert.assertEquals(args.maxEMIterations, 5);
        Assert.assertEquals(args.minLogLikelihoodAbsChange, 0.5);
        Assert.assertEquals(args.minLogLikelihoodFracChange, StutterEMArgumentCollection.DEFAULT_MIN_LL_FRAC_CHANGE);
        Assert.assertEquals(args.initialStutterModel(3).getInframeUp(), 0.2);
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testParseOutOfRange() {
        new CommandLineArgumentParser(new StutterEMArgumentCollection()).parseArguments(System.err,
                new String[] {"--" + StutterEMArgumentCollection.MAX_EM_ITERATIONS_FULL_NAME, "-1"});
    }

    @DataProvider(name = "invalidSettings")
    public Object[][] invalidSettings() {
        return new Object[][] {
                { StutterEMArgumentCollection.MAX_EM_ITERATIONS_FULL_NAME, -1.0 },
                { StutterEMArgumentCollection.MIN_LL_ABS_CHANGE_FULL_NAME, -0.1 },
                { StutterEMArgumentCollection.MIN_LL_FRAC_CHANGE_FULL_NAME, Double.NaN },
                { StutterEMArgumentCollection.LL_DECREASE_TOLERANCE_FULL_NAME, Double.POSITIVE_INFINITY },
                { StutterEMArgumentCollection.INFRAME_GEOM_FULL_NAME, 1.0 },
                { StutterEMArgumentCollection.OUTFRAME_DOWN_FULL_NAME, 0.0 },
                { StutterEMArgumentCollection.INFRAME_UP_FULL_NAME, 0.95 },
        };
    }

    @Test(dataProvider = "invalidSettings", expectedExceptions = CommandLineException.BadArgumentValue.class)
    public void testValidate(final String name, final double value) {
        final StutterEMArgumentCollection args = new StutterEMArgumentCollection();
        switch (name) {
            case StutterEMArgumentCollection.MAX_EM_ITERATIONS_FULL_NAME: args.maxEMIterations = (int) value; break;
            case StutterEMArgumentCollection.MIN_LL_ABS_CHANGE_FULL_NAME: args.minLogLikelihoodAbsChange = value; break;
            case StutterEMArgumentCollection.MIN_LL_FRAC_CHANGE_FULL_NAME: args.minLogLikelihoodFracChange = value; break;
            case StutterEMArgumentCollection.LL_DECREASE_TOLERANCE_FULL_NAME: args.logLikelihoodDecreaseTolerance = value; break;
            case StutterEMArgumentCollection.INFRAME_GEOM_FULL_NAME: args.initialInframeGeom = value; break;
            case StutterEMArgumentCollection.OUTFRAME_DOWN_FULL_NAME: args.initialOutframeDown = value; break;
            case StutterEMArgumentCollection.INFRAME_UP_FULL_NAME: args.initialInframeUp = value; break;
            default: Assert.fail("unexpected setting " + name);
        }
        args.validate();
    }
}
