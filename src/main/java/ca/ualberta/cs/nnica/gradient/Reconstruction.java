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
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Sources and mixing matrix from a converged unmixing matrix.
 */
public final class Reconstruction {

    private Reconstruction() {
    }

    public static IcaResult reconstruct(UnmixingResult unmixing, WhiteningResult whitening) {
        RealMatrix w = unmixing.getUnmixingMatrix();
        RealMatrix v = whitening.getTransform();
        RealMatrix z = whitening.getWhitenedData();
        return new IcaResult(w.multiply(z), mixingMatrix(w, v), w, v,
                unmixing.getIterations(), unmixing.isConverged());
    }

    /**
     * Right Moore-Penrose inverse A' = (WV)^T ((WV)(WV)^T)^(-1).
     * <p>
     * From y = Q s = W V A s it follows x = A s = A Q^T y = A' y, so A' equals A up to a
     * permutation of its columns. With fewer sources than channels any right inverse of W V
     * would do, A' is just the minimum-norm one.
     *
     * @throws NumericalFailureException if (WV)(WV)^T is singular
     */
    public static RealMatrix mixingMatrix(RealMatrix w, RealMatrix v) {
        if (w.getColumnDimension() != v.getRowDimension()) {
            throw new DimensionMismatchException(v.getRowDimension(), w.getColumnDimension());
        }
        RealMatrix wv = w.multiply(v);
        RealMatrix gram = wv.multiply(wv.transpose());
        SymmetricOrthonormalization.checkFinite(gram);

        SingularValueDecomposition svd = new SingularValueDecomposition(gram);
        DecompositionSolver solver = svd.getSolver();
        // the SVD solver falls back to a pseudo-inverse instead of failing
        if (!solver.isNonSingular()) {
            throw new NumericalFailureException("cannot invert (WV)(WV)^T of size "
                    + gram.getRowDimension() + ", rank " + svd.getRank());
        }
        // gram is symmetric, so (WV)^T gram^(-1) = (gram^(-1) WV)^T
        return solver.solve(wv).transpose();
    }
}
