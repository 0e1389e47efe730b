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
import org.apache.commons.math3.exception.NumberIsTooLargeException;

/**
 * Validated settings of one unmixing run. The source count is used as the whitening target
 * dimension and as the size of the unmixing matrix, and is checked against the channel count
 * once, here.
 */
public final class IcaConfiguration {

    /**
     * Default learning rate of the gradient step.
     */
    public static final double DEFAULT_LEARNING_RATE = 0.03;
    /**
     * Default maximum number of iterations.
     */
    public static final int DEFAULT_MAX_ITERATIONS = 5000;
    /**
     * Default convergence threshold on the change of the unmixing matrix.
     */
    public static final double DEFAULT_TOLERANCE = 1E-8;

    private final int channels;
    private final int numSources;
    private final double learningRate;
    private final int maxIterations;
    private final double tolerance;
    private final boolean removeMean;

    /**
     * @throws NotStrictlyPositiveException if a count, the learning rate or the tolerance is not positive
     * @throws NumberIsTooLargeException if more sources than channels are requested
     */
    public IcaConfiguration(int channels, int numSources, double learningRate, int maxIterations,
                            double tolerance, boolean removeMean) {
        if (channels < 1) {
            throw new NotStrictlyPositiveException(channels);
        }
        if (numSources < 1) {
            throw new NotStrictlyPositiveException(numSources);
        }
        if (numSources > channels) {
            throw new NumberIsTooLargeException(numSources, channels, true);
        }
        if (!(learningRate > 0)) {
            throw new NotStrictlyPositiveException(learningRate);
        }
        if (maxIterations < 1) {
            throw new NotStrictlyPositiveException(maxIterations);
        }
        if (!(tolerance > 0)) {
            throw new NotStrictlyPositiveException(tolerance);
        }
        this.channels = channels;
        this.numSources = numSources;
        this.learningRate = learningRate;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.removeMean = removeMean;
    }

    public static IcaConfiguration defaults(int channels) {
        return of(channels, null, null, null, null);
    }

    /**
     * Any {@code null} argument is replaced by its default; the source count defaults to the channel count.
     */
    public static IcaConfiguration of(int channels, Integer numSources, Double learningRate,
                                      Integer maxIterations, Double tolerance) {
        return new IcaConfiguration(channels,
                numSources == null ? channels : numSources,
                learningRate == null ? DEFAULT_LEARNING_RATE : learningRate,
                maxIterations == null ? DEFAULT_MAX_ITERATIONS : maxIterations,
                tolerance == null ? DEFAULT_TOLERANCE : tolerance,
                false);
    }

    public IcaConfiguration withNumSources(int numSources) {
        return new IcaConfiguration(channels, numSources, learningRate, maxIterations, tolerance, removeMean);
    }

    public IcaConfiguration withLearningRate(double learningRate) {
        return new IcaConfiguration(channels, numSources, learningRate, maxIterations, tolerance, removeMean);
    }

    public IcaConfiguration withMaxIterations(int maxIterations) {
        return new IcaConfiguration(channels, numSources, learningRate, maxIterations, tolerance, removeMean);
    }

    public IcaConfiguration withTolerance(double tolerance) {
        return new IcaConfiguration(channels, numSources, learningRate, maxIterations, tolerance, removeMean);
    }

    /**
     * @throws DimensionMismatchException if the data does not have the configured number of channels
     */
    public void checkChannels(int rows) {
        if (rows != channels) {
            throw new DimensionMismatchException(rows, channels);
        }
    }

    public int getChannels() {
        return channels;
    }

    public int getNumSources() {
        return numSources;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean isRemoveMean() {
        return removeMean;
    }

    @Override
    public String toString() {
        return "channels=" + channels + ", sources=" + numSources + ", lr=" + learningRate
                + ", maxIterations=" + maxIterations + ", tolerance=" + tolerance;
    }
}
