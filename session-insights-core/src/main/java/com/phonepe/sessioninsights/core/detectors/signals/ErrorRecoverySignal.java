/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessioninsights.core.detectors.signals;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.sessioninsights.core.detectors.PatternSignal;
import lombok.Builder;
import lombok.Value;

/**
 * Tool failures and whether the assistant picked up right after them
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorRecoverySignal implements PatternSignal {
    int errorsEncountered;
    int recoveryAttempts;
    boolean hasErrorRecovery;

    /**
     * recoveryAttempts / errorsEncountered, in [0, 1]. 0 when there were no errors.
     */
    double recoveryRate;

    @Override
    public boolean detected() {
        return hasErrorRecovery;
    }
}
