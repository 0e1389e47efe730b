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
 * Decorrelates and rescales the raw channels before the unmixing iterations.
 */
public interface Whitener {

    /**
     * @param x raw data, channels x samples.
     * @param targetDim number of whitened dimensions to keep.
     * @param removeMean whether the channel means are subtracted from the returned data.
     * @return whitened data (targetDim x samples) and the whitening transform (targetDim x channels).
     */
    WhiteningResult whiten(RealMatrix x, int targetDim, boolean removeMean);
}
