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

package com.phonepe.sessioninsights.core.analysis;

import com.phonepe.sessioninsights.core.session.RawSession;

import java.util.List;

/**
 * Supplies raw sessions to the analyzer. Sessions with missing metadata or messages may be included; they are
 * filtered out during analysis.
 */
@FunctionalInterface
public interface SessionSource {
    List<RawSession> readSessions();
}
