package ca.ualberta.cs.nnica.gradient;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconstructionTest {

    private static RealMatrix rotation(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return MatrixUtils.createRealMatrix(new double[][]{{c, -s}, {s, c}});
    }

    @Test
    void mixingMatrixIsRightInverseOfWV() {
        RealMatrix w = rotation(0.7);
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{0.5, 1.2, -0.3, 0.8}, {1.1, -0.4, 0.9, 0.2}});
        RealMatrix mixing = Reconstruction.mixingMatrix(w, v);

        assertEquals(4, mixing.getRowDimension());
        assertEquals(2, mixing.getColumnDimension());
        assertTrue(SyntheticMixture.maxDeviationFromIdentity(w.multiply(v).multiply(mixing)) < 1e-12);
    }

    @Test
    void squareCaseGivesTheInverse() {
        RealMatrix w = rotation(-0.2);
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{2.0, 0.5}, {0.1, 1.5}});
        RealMatrix mixing = Reconstruction.mixingMatrix(w, v);
        RealMatrix inverse = MatrixUtils.inverse(w.multiply(v));
        assertEquals(0.0, mixing.subtract(inverse).getFrobeniusNorm(), 1e-12);
    }

    @Test
    void sourcesAreUnmixingTimesWhitenedData() {
        RealMatrix w = rotation(0.4);
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{1.0, 0.0, 0.5}, {0.0, 1.0, 0.5}});
        RealMatrix z = MatrixUtils.createRealMatrix(new double[][]{{1.0, 2.0, 3.0, 4.0}, {0.5, 0.0, -1.0, 2.0}});
        IcaResult result = Reconstruction.reconstruct(new UnmixingResult(w, 12, 1e-9, true), new WhiteningResult(z, v));

        assertEquals(0.0, result.getSources().subtract(w.multiply(z)).getFrobeniusNorm(), 1e-15);
        assertEquals(12, result.getIterations());
        assertTrue(result.isConverged());
        assertEquals(3, result.getMixingMatrix().getRowDimension());
    }

    @Test
    void resultDoesNotExposeItsMatrices() {
        RealMatrix w = rotation(0.4);
        RealMatrix v = MatrixUtils.createRealIdentityMatrix(2);
        IcaResult result = Reconstruction.reconstruct(new UnmixingResult(w, 1, 0.0, true),
                new WhiteningResult(MatrixUtils.createRealIdentityMatrix(2), v));
        result.getUnmixingMatrix().setEntry(0, 0, 100.0);
        assertEquals(w.getEntry(0, 0), result.getUnmixingMatrix().getEntry(0, 0), 0.0);
    }

    @Test
    void rankDeficientWhiteningFails() {
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{1.0, 2.0, 3.0}, {2.0, 4.0, 6.0}});
        assertThrows(NumericalFailureException.class,
                () -> Reconstruction.mixingMatrix(MatrixUtils.createRealIdentityMatrix(2), v));
    }

    @Test
    void zeroRowInWhiteningFails() {
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{1.0, 0.0, 0.0}, {0.0, 0.0, 0.0}});
        assertThrows(NumericalFailureException.class,
                () -> Reconstruction.mixingMatrix(MatrixUtils.createRealIdentityMatrix(2), v));
    }

    @Test
    void singularGramFailsThroughReconstruct() {
        RealMatrix v = MatrixUtils.createRealMatrix(new double[][]{{1.0, 2.0, 3.0}, {2.0, 4.0, 6.0}});
        RealMatrix z = MatrixUtils.createRealMatrix(new double[][]{{1.0, 2.0}, {0.5, 1.0}});
        assertThrows(NumericalFailureException.class, () -> Reconstruction.reconstruct(
                new UnmixingResult(MatrixUtils.createRealIdentityMatrix(2), 1, 0.0, true),
                new WhiteningResult(z, v)));
    }

    @Test
    void mismatchedDimensionsAreRejected() {
        RealMatrix v = MatrixUtils.createRealMatrix(3, 4);
        assertThrows(DimensionMismatchException.class,
                () -> Reconstruction.mixingMatrix(MatrixUtils.createRealIdentityMatrix(2), v));
    }
}
