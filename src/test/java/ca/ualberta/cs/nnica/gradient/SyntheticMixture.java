package ca.ualberta.cs.nnica.gradient;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import java.util.Random;

/**
 * Non-negative, independent test sources and their mixtures.
 */
final class SyntheticMixture {

    static final double[][] MIXING_2X2 = {
            {0.7, 0.3},
            {0.4, 0.6}
    };

    static final double[][] MIXING_3X2 = {
            {0.7, 0.3},
            {0.4, 0.6},
            {0.2, 0.9}
    };

    private SyntheticMixture() {
    }

    /**
     * Row 0 is a sparse spike train, row 1 a half-wave rectified sine.
     */
    static RealMatrix sources(int samples, long seed) {
        Random random = new Random(seed);
        double[][] s = new double[2][samples];
        for (int t = 0; t < samples; t++) {
            s[0][t] = random.nextDouble() < 0.1 ? -FastMath.log(1.0 - random.nextDouble()) : 0.0;
            s[1][t] = FastMath.max(0.0, FastMath.sin(2.0 * FastMath.PI * t / 100.0));
        }
        return MatrixUtils.createRealMatrix(s);
    }

    static RealMatrix mix(double[][] mixing, RealMatrix sources) {
        return MatrixUtils.createRealMatrix(mixing).multiply(sources);
    }

    static double maxDeviationFromIdentity(RealMatrix m) {
        RealMatrix d = m.subtract(MatrixUtils.createRealIdentityMatrix(m.getRowDimension()));
        double max = 0.0;
        for (int i = 0; i < d.getRowDimension(); i++) {
            for (int j = 0; j < d.getColumnDimension(); j++) {
                max = FastMath.max(max, FastMath.abs(d.getEntry(i, j)));
            }
        }
        return max;
    }
}
