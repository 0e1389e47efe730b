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

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;
import java.util.Comparator;

/**
 * PCA whitening. The covariance is always estimated from mean-centred channels; the mean is
 * only removed from the returned data when asked to, since the non-negative sources must stay
 * non-negative after whitening.
 */
public class PrincipalComponentWhitener implements Whitener {

    @Override
    public WhiteningResult whiten(RealMatrix x, int targetDim, boolean removeMean) {
        final int channels = x.getRowDimension();
        final int samples = x.getColumnDimension();
        if (targetDim < 1) {
            throw new NotStrictlyPositiveException(targetDim);
        }
        if (targetDim > channels) {
            throw new NumberIsTooLargeException(targetDim, channels, true);
        }
        if (samples < 1) {
            throw new NotStrictlyPositiveException(samples);
        }
        SymmetricOrthonormalization.checkFinite(x);

        RealMatrix centred = x.copy();
        for (int c = 0; c < channels; c++) {
            double mean = 0.0;
            for (int t = 0; t < samples; t++) {
                mean += x.getEntry(c, t);
            }
            mean /= samples;
            for (int t = 0; t < samples; t++) {
                centred.addToEntry(c, t, -mean);
            }
        }

        RealMatrix covariance = centred.multiply(centred.transpose()).scalarMultiply(1.0 / samples);
        covariance = covariance.add(covariance.transpose()).scalarMultiply(0.5);
        EigenDecomposition eig = new EigenDecomposition(covariance);
        final double[] lambda = eig.getRealEigenvalues();

        Integer[] order = new Integer[lambda.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> lambda[i]).reversed());

        double largest = lambda[order[0]];
        RealMatrix transform = MatrixUtils.createRealMatrix(targetDim, channels);
        for (int k = 0; k < targetDim; k++) {
            double l = lambda[order[k]];
            if (!(l > largest * SymmetricOrthonormalization.SINGULARITY_THRESHOLD) || largest <= 0.0) {
                throw new NumericalFailureException("covariance has rank below " + targetDim
                        + ", eigenvalue " + l + " (largest " + largest + ")");
            }
            RealVector e = orientated(eig.getEigenvector(order[k]));
            transform.setRowVector(k, e.mapDivide(FastMath.sqrt(l)));
        }

        RealMatrix z = transform.multiply(removeMean ? centred : x);
        return new WhiteningResult(z, transform);
    }

    /**
     * Eigenvectors are only defined up to sign; the largest component is made positive.
     */
    private static RealVector orientated(RealVector e) {
        int argMax = 0;
        for (int i = 1; i < e.getDimension(); i++) {
            if (FastMath.abs(e.getEntry(i)) > FastMath.abs(e.getEntry(argMax))) {
                argMax = i;
            }
        }
        return e.getEntry(argMax) < 0 ? e.mapMultiply(-1.0) : e;
    }
}
