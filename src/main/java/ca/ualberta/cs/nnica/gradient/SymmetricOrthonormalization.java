/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ca.ualberta.cs.nnica.gradient;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Projection of a square matrix onto the orthonormal matrices, W -> (W W^T)^(-1/2) W.
 */
public final class SymmetricOrthonormalization {

    /**
     * Eigenvalues at or below this fraction of the largest one are treated as zero.
     */
    public static final double SINGULARITY_THRESHOLD = 1E-12;

    private SymmetricOrthonormalization() {
    }

    public static RealMatrix orthonormalize(RealMatrix w) {
        return inverseSquareRoot(w.multiply(w.transpose())).multiply(w);
    }

    /**
     * Inverse principal square root E diag(lambda^(-1/2)) E^T of a symmetric positive-definite matrix.
     *
     * @throws NumericalFailureException if the matrix is not positive definite or has non-finite entries
     */
    public static RealMatrix inverseSquareRoot(RealMatrix m) {
        if (!m.isSquare()) {
            throw new DimensionMismatchException(m.getColumnDimension(), m.getRowDimension());
        }
        // exact symmetry keeps the eigensolver on its symmetric path
        RealMatrix symmetric = m.add(m.transpose()).scalarMultiply(0.5);
        checkFinite(symmetric);

        EigenDecomposition eig = new EigenDecomposition(symmetric);
        double[] lambda = eig.getRealEigenvalues();

        double max = 0.0;
        for (double l : lambda) {
            max = FastMath.max(max, l);
        }
        RealMatrix scaled = eig.getV().copy();
        for (int j = 0; j < lambda.length; j++) {
            if (!(lambda[j] > max * SINGULARITY_THRESHOLD) || max == 0.0) {
                throw new NumericalFailureException("matrix is not positive definite, eigenvalue "
                        + lambda[j] + " (largest " + max + ")");
            }
            double factor = 1.0 / FastMath.sqrt(lambda[j]);
            for (int i = 0; i < scaled.getRowDimension(); i++) {
                scaled.multiplyEntry(i, j, factor);
            }
        }
        return scaled.multiply(eig.getVT());
    }

    static void checkFinite(RealMatrix m) {
        for (int i = 0; i < m.getRowDimension(); i++) {
            for (int j = 0; j < m.getColumnDimension(); j++) {
                double v = m.getEntry(i, j);
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    throw new NumericalFailureException("non-finite entry at (" + i + "," + j + ")");
                }
            }
        }
    }
}
