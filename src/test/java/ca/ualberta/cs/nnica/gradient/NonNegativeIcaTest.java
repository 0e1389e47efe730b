package ca.ualberta.cs.nnica.gradient;

import ca.ualberta.cs.nnica.Evaluator;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NonNegativeIcaTest {

    private static double absCosine(RealVector a, RealVector b) {
        return Math.abs(a.cosine(b));
    }

    @Test
    void recoversTwoNonNegativeSources() {
        RealMatrix s = SyntheticMixture.sources(1000, 42L);
        RealMatrix x = SyntheticMixture.mix(SyntheticMixture.MIXING_2X2, s);

        IcaResult result = NonNegativeIca.solve(x.getData(), 2, 0.03, 5000, 1e-8);

        assertEquals(2, result.getSources().getRowDimension());
        assertEquals(1000, result.getSources().getColumnDimension());
        for (double correlation : Evaluator.matchedCorrelations(s, result.getSources())) {
            assertTrue(correlation > 0.95, "correlation " + correlation);
        }
    }

    @Test
    void mixingMatrixColumnsMatchTrueMixingUpToPermutationAndScale() {
        RealMatrix s = SyntheticMixture.sources(1000, 42L);
        RealMatrix a = MatrixUtils.createRealMatrix(SyntheticMixture.MIXING_2X2);
        IcaResult result = NonNegativeIca.solve(a.multiply(s).getData(), null, null, null, null);

        int[] match = Evaluator.matchSources(Evaluator.computeCorrelations(s, result.getSources()));
        RealMatrix estimated = result.getMixingMatrix();
        for (int i = 0; i < 2; i++) {
            assertTrue(absCosine(a.getColumnVector(i), estimated.getColumnVector(match[i])) > 0.95);
        }
    }

    @Test
    void mixingMatrixInvertsUnmixingTimesWhitening() {
        RealMatrix x = SyntheticMixture.mix(SyntheticMixture.MIXING_2X2, SyntheticMixture.sources(1000, 11L));
        IcaResult result = NonNegativeIca.solve(x.getData(), null, null, null, null);

        RealMatrix wv = result.getUnmixingMatrix().multiply(result.getWhiteningMatrix());
        assertTrue(SyntheticMixture.maxDeviationFromIdentity(wv.multiply(result.getMixingMatrix())) < 1e-8);
        RealMatrix w = result.getUnmixingMatrix();
        assertTrue(SyntheticMixture.maxDeviationFromIdentity(w.multiply(w.transpose())) < 1e-6);
    }

    @Test
    void fewerSourcesThanChannels() {
        RealMatrix s = SyntheticMixture.sources(1000, 42L);
        RealMatrix x = SyntheticMixture.mix(SyntheticMixture.MIXING_3X2, s);

        IcaResult result = NonNegativeIca.solve(x.getData(), 2, null, null, null);

        assertEquals(3, result.getMixingMatrix().getRowDimension());
        assertEquals(2, result.getMixingMatrix().getColumnDimension());
        RealMatrix wv = result.getUnmixingMatrix().multiply(result.getWhiteningMatrix());
        assertTrue(SyntheticMixture.maxDeviationFromIdentity(wv.multiply(result.getMixingMatrix())) < 1e-8);
        for (double correlation : Evaluator.matchedCorrelations(s, result.getSources())) {
            assertTrue(correlation > 0.95, "correlation " + correlation);
        }
    }

    @Test
    void overRequestFailsBeforeWhitening() {
        AtomicInteger whitened = new AtomicInteger();
        Whitener counting = (x, targetDim, removeMean) -> {
            whitened.incrementAndGet();
            return new PrincipalComponentWhitener().whiten(x, targetDim, removeMean);
        };
        double[][] x = SyntheticMixture.mix(SyntheticMixture.MIXING_2X2, SyntheticMixture.sources(100, 1L)).getData();

        assertThrows(NumberIsTooLargeException.class, () -> NonNegativeIca.solve(x, 3, null, null, null));
        assertThrows(NumberIsTooLargeException.class,
                () -> new NonNegativeIca(IcaConfiguration.of(2, 3, null, null, null), counting, IterationListener.NONE)
                        .solve(MatrixUtils.createRealMatrix(x)));
        assertEquals(0, whitened.get());
    }

    @Test
    void dataWithOtherChannelCountIsRejected() {
        RealMatrix x = SyntheticMixture.mix(SyntheticMixture.MIXING_3X2, SyntheticMixture.sources(100, 1L));
        NonNegativeIca ica = new NonNegativeIca(IcaConfiguration.defaults(2));
        assertThrows(DimensionMismatchException.class, () -> ica.solve(x));
    }

    @Test
    void alreadyUnmixedDataConvergesImmediately() {
        Random random = new Random(3L);
        double[][] data = new double[2][300];
        for (int t = 0; t < 300; t++) {
            data[0][t] = random.nextDouble();
            data[1][t] = random.nextDouble() < 0.2 ? random.nextDouble() : 0.0;
        }
        RealMatrix x = MatrixUtils.createRealMatrix(data);
        Whitener identity = (raw, targetDim, removeMean) ->
                new WhiteningResult(raw.copy(), MatrixUtils.createRealIdentityMatrix(raw.getRowDimension()));

        IcaResult result = new NonNegativeIca(IcaConfiguration.defaults(2), identity, IterationListener.NONE).solve(x);

        assertTrue(result.isConverged());
        assertEquals(1, result.getIterations());
        assertEquals(0.0, result.getSources().subtract(x).getFrobeniusNorm(), 1e-10);
        assertTrue(SyntheticMixture.maxDeviationFromIdentity(result.getMixingMatrix()) < 1e-10);
    }

    @Test
    void identicalRunsGiveIdenticalResults() {
        double[][] x = SyntheticMixture.mix(SyntheticMixture.MIXING_2X2, SyntheticMixture.sources(600, 8L)).getData();
        IcaResult first = NonNegativeIca.solve(x, 2, 0.05, 800, 1e-8);
        IcaResult second = NonNegativeIca.solve(x, 2, 0.05, 800, 1e-8);

        assertEquals(first.getIterations(), second.getIterations());
        assertEquals(0.0, first.getSources().subtract(second.getSources()).getFrobeniusNorm(), 0.0);
        assertEquals(0.0, first.getMixingMatrix().subtract(second.getMixingMatrix()).getFrobeniusNorm(), 0.0);
    }

    @Test
    void exhaustedBudgetStillGivesAResult() {
        double[][] x = SyntheticMixture.mix(SyntheticMixture.MIXING_2X2, SyntheticMixture.sources(500, 4L)).getData();
        IcaResult result = NonNegativeIca.solve(x, 2, 0.03, 3, 1e-12);

        assertFalse(result.isConverged());
        assertEquals(3, result.getIterations());
        assertEquals(500, result.getSources().getColumnDimension());
    }
}
