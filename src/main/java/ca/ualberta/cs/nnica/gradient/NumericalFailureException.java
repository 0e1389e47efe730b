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

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

/**
 * Raised when a matrix that has to be inverted (or raised to the power -1/2) is singular,
 * not positive definite or contains non-finite entries. The computation is aborted, no
 * regularisation is attempted.
 */
public class NumericalFailureException extends MathIllegalStateException {

    private static final long serialVersionUID = 20211104L;

    public NumericalFailureException(String detail) {
        super(LocalizedFormats.SIMPLE_MESSAGE, detail);
    }

    public NumericalFailureException(Throwable cause, String detail) {
        super(cause, LocalizedFormats.SIMPLE_MESSAGE, detail);
    }
}
