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
 * Outcome of a complete run. Sources and mixing matrix are only determined up to a
 * permutation of the sources.
 */
public class IcaResult {

    private final RealMatrix sources;
    private final RealMatrix mixingMatrix;
    private final RealMatrix unmixingMatrix;
    private final RealMatrix whiteningMatrix;
    private final int iterations;
    private final boolean converged;

    public IcaResult(RealMatrix sources, RealMatrix mixingMatrix, RealMatrix unmixingMatrix,
                     RealMatrix whiteningMatrix, int iterations, boolean converged) {
        this.sources = sources;
        this.mixingMatrix = mixingMatrix;
        this.unmixingMatrix = unmixingMatrix;
        this.whiteningMatrix = whiteningMatrix;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * @return Y = W Z, sources x samples.
     */
    public RealMatrix getSources() {
        return sources.copy();
    }

    /**
     * @return A', channels x sources.
     */
    public RealMatrix getMixingMatrix() {
        return mixingMatrix.copy();
    }

    /**
     * @return W, sources x sources.
     */
    public RealMatrix getUnmixingMatrix() {
        return unmixingMatrix.copy();
    }

    /**
     * @return V, sources x channels.
     */
    public RealMatrix getWhiteningMatrix() {
        return whiteningMatrix.copy();
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }
}
