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

package com.phonepe.sessioninsights.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Conditions that stop a run. Malformed or missing session data is never one of these.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SOURCE_NOT_READABLE("Session source could not be read: %s"),
    CONFIG_NOT_READABLE("Configuration could not be read from %s. Error: %s"),
    OUTPUT_NOT_WRITABLE("Output location is not writable: %s"),
    SERIALIZATION_ERROR("Error serializing report to %s. Error: %s"),
    ;

    private final String message;
}
