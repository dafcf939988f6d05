/*
 * Copyright 2024 Firefly Software Solutions Inc.
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
 */
package com.firefly.core.retention.exception;

/**
 * Raised when a legal-hold-exempt policy wants to delete data that is under
 * an active hold. The deletion is not carried out and a review is requested.
 */
public class ComplianceConflictException extends RetentionException {

    private final String policyId;
    private final String dataId;

    public ComplianceConflictException(String policyId, String dataId) {
        super("Policy " + policyId + " is legal-hold exempt but data " + dataId + " is under an active legal hold");
        this.policyId = policyId;
        this.dataId = dataId;
    }

    public String getPolicyId() {
        return policyId;
    }

    public String getDataId() {
        return dataId;
    }
}
