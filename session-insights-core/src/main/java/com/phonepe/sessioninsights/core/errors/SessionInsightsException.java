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

import lombok.Getter;

/**
 * Fatal failure in the I/O layers around the analysis engine
 */
@Getter
public class SessionInsightsException extends RuntimeException {
    private final ErrorType errorType;

    public SessionInsightsException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static SessionInsightsException error(ErrorType errorType, Object... args) {
        return new SessionInsightsException(errorType, String.format(errorType.getMessage(), args), null);
    }

    public static SessionInsightsException error(ErrorType errorType, Throwable cause, Object... args) {
        return new SessionInsightsException(errorType, String.format(errorType.getMessage(), args), cause);
    }
}
