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

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-negative ICA: whitening, gradient search for the unmixing matrix and reconstruction of
 * sources and mixing matrix.
 * <p>
 * Implements the method of Oja and Plumbley, "Blind Separation of Positive Sources by Globally
 * Convergent Gradient Search". The recovered sources come in an arbitrary order.
 */
public class NonNegativeIca {

    private static final Logger LOGGER = LoggerFactory.getLogger(NonNegativeIca.class);

    private final IcaConfiguration configuration;
    private final Whitener whitener;
    private final IterationListener listener;

    public NonNegativeIca(IcaConfiguration configuration) {
        this(configuration, new PrincipalComponentWhitener(), new LoggingIterationListener());
    }

    public NonNegativeIca(IcaConfiguration configuration, Whitener whitener, IterationListener listener) {
        this.configuration = configuration;
        this.whitener = whitener;
        this.listener = listener;
    }

    /**
     * @param x data matrix, channels x samples; any {@code null} setting takes its default.
     * @throws org.apache.commons.math3.exception.NumberIsTooLargeException if numSources exceeds the channel count
     * @throws NumericalFailureException on a singular matrix during orthonormalization or reconstruction
     */
    public static IcaResult solve(double[][] x, Integer numSources, Double learningRate,
                                  Integer maxIterations, Double tolerance) {
        IcaConfiguration configuration = IcaConfiguration.of(x.length, numSources, learningRate,
                maxIterations, tolerance);
        return new NonNegativeIca(configuration).solve(MatrixUtils.createRealMatrix(x));
    }

    public IcaResult solve(RealMatrix x) {
        configuration.checkChannels(x.getRowDimension());

        LOGGER.info("whitening the data ({}) ...",
                configuration.isRemoveMean() ? "removing mean" : "without removing mean");
        WhiteningResult whitening = whitener.whiten(x, configuration.getNumSources(), configuration.isRemoveMean());
        LOGGER.info("... data whitened");

        LOGGER.info("running ICA iterations ({}) ...", configuration);
        UnmixingResult unmixing = new NonNegativeGradientSearch(configuration, listener)
                .fit(whitening.getWhitenedData());
        LOGGER.info("... iterations finished after {} iterations, W-change {}",
                unmixing.getIterations(), unmixing.getLastChange());

        return Reconstruction.reconstruct(unmixing, whitening);
    }

    public IcaConfiguration getConfiguration() {
        return configuration;
    }
}
