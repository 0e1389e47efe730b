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
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Whitened data together with the transform that produced it.
 */
public class WhiteningResult {

    private final RealMatrix whitenedData;
    private final RealMatrix transform;

    public WhiteningResult(RealMatrix whitenedData, RealMatrix transform) {
        if (whitenedData.getRowDimension() != transform.getRowDimension()) {
            throw new DimensionMismatchException(transform.getRowDimension(), whitenedData.getRowDimension());
        }
        this.whitenedData = whitenedData;
        this.transform = transform;
    }

    /**
     * @return Z, targetDim x samples.
     */
    public RealMatrix getWhitenedData() {
        return whitenedData.copy();
    }

    /**
     * @return V, targetDim x channels.
     */
    public RealMatrix getTransform() {
        return transform.copy();
    }
}
