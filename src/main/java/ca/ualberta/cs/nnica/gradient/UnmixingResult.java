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

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Unmixing matrix at the end of the iterations and how the loop ended.
 */
public class UnmixingResult {

    private final RealMatrix unmixingMatrix;
    private final int iterations;
    private final double lastChange;
    private final boolean converged;

    public UnmixingResult(RealMatrix unmixingMatrix, int iterations, double lastChange, boolean converged) {
        this.unmixingMatrix = unmixingMatrix;
        this.iterations = iterations;
        this.lastChange = lastChange;
        this.converged = converged;
    }

    public RealMatrix getUnmixingMatrix() {
        return unmixingMatrix.copy();
    }

    public int getIterations() {
        return iterations;
    }

    public double getLastChange() {
        return lastChange;
    }

    /**
     * @return false if the iteration budget ran out before the change dropped below the tolerance.
     */
    public boolean isConverged() {
        return converged;
    }
}
