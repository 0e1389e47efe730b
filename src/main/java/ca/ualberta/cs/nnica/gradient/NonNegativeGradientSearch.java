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
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealMatrixChangingVisitor;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gradient search for an orthonormal unmixing matrix W such that W Z is non-negative.
 * <p>
 * Each iteration takes a step along the skew-symmetric matrix
 * E = (f(Y) Y^T - Y f(Y)^T) / n with Y = W Z and f(y) = min(y, 0), then projects W back
 * onto the orthonormal matrices by symmetric orthonormalization.
 */
public class NonNegativeGradientSearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(NonNegativeGradientSearch.class);

    private static final RealMatrixChangingVisitor NEGATIVE_PART = new DefaultRealMatrixChangingVisitor() {
        @Override
        public double visit(int row, int column, double value) {
            return FastMath.min(value, 0.0);
        }
    };

    private final IcaConfiguration configuration;
    private final IterationListener listener;

    public NonNegativeGradientSearch(IcaConfiguration configuration) {
        this(configuration, IterationListener.NONE);
    }

    public NonNegativeGradientSearch(IcaConfiguration configuration, IterationListener listener) {
        this.configuration = configuration;
        this.listener = listener == null ? IterationListener.NONE : listener;
    }

    /**
     * Runs the iterations starting from the identity matrix.
     *
     * @param z whitened data, sources x samples.
     * @throws DimensionMismatchException if z does not have one row per source
     * @throws NumericalFailureException if W W^T becomes singular
     */
    public UnmixingResult fit(RealMatrix z) {
        final int n = configuration.getNumSources();
        if (z.getRowDimension() != n) {
            throw new DimensionMismatchException(z.getRowDimension(), n);
        }
        if (z.getColumnDimension() < 1) {
            throw new NotStrictlyPositiveException(z.getColumnDimension());
        }
        final int maxIterations = configuration.getMaxIterations();
        final double tolerance = configuration.getTolerance();

        RealMatrix w = MatrixUtils.createRealIdentityMatrix(n);
        double change = Double.POSITIVE_INFINITY;
        int numIterations = 0;
        boolean converged = false;

        while (numIterations < maxIterations) {
            numIterations++;
            RealMatrix previous = w;
            w = iterate(previous, z);
            change = w.subtract(previous).getFrobeniusNorm();
            notifyListener(numIterations, change);
            if (change < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            LOGGER.warn("No convergence after {} iterations, last W-change {} (tolerance {})",
                    numIterations, change, tolerance);
        }
        return new UnmixingResult(w, numIterations, change, converged);
    }

    /**
     * One gradient step followed by symmetric orthonormalization.
     *
     * @param w current unmixing matrix, left untouched.
     * @param z whitened data, sources x samples.
     * @return the updated, orthonormal unmixing matrix.
     */
    public RealMatrix iterate(RealMatrix w, RealMatrix z) {
        final RealMatrix y = w.multiply(z);
        final RealMatrix f = y.copy();
        f.walkInOptimizedOrder(NEGATIVE_PART);

        final RealMatrix fY = f.multiply(y.transpose());
        final RealMatrix e = fY.subtract(fY.transpose()).scalarMultiply(1.0 / y.getColumnDimension());

        RealMatrix stepped = w.subtract(e.multiply(w).scalarMultiply(configuration.getLearningRate()));
        return SymmetricOrthonormalization.orthonormalize(stepped);
    }

    private void notifyListener(int iteration, double change) {
        try {
            listener.iterationPerformed(iteration, change);
        } catch (RuntimeException e) {
            LOGGER.warn("Iteration listener failed at iteration " + iteration, e);
        }
    }
}
