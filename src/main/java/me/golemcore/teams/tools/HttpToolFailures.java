/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.teams.tools;

import feign.FeignException;
import feign.RetryableException;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;

/**
 * Maps HTTP API failures of remote tools onto tool failure kinds. Rate limits,
 * server errors and connection failures are TRANSIENT so the gateway retries
 * them; other client errors are final.
 */
final class HttpToolFailures {

    private HttpToolFailures() {
    }

    static ToolOutput fromFeign(String service, FeignException e) {
        int status = e.status();
        if (e instanceof RetryableException || status <= 0) {
            return ToolOutput.failure(ToolFailureKind.TRANSIENT, service + " unreachable: " + e.getMessage());
        }
        if (status == 408 || status == 429 || status >= 500) {
            return ToolOutput.failure(ToolFailureKind.TRANSIENT, service + " returned HTTP " + status);
        }
        if (status == 404) {
            return ToolOutput.failure(ToolFailureKind.PROVIDER_ERROR, service + " resource not found");
        }
        return ToolOutput.failure(ToolFailureKind.PROVIDER_ERROR, service + " returned HTTP " + status);
    }
}
