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
package com.firefly.core.retention.service.hold;

import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.exception.LegalHoldValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a legal hold definition before it is created.
 */
public class LegalHoldValidator {

    public void validate(LegalHold hold) {
        List<String> errors = collectErrors(hold);
        if (!errors.isEmpty()) {
            throw new LegalHoldValidationException(errors);
        }
    }

    public List<String> collectErrors(LegalHold hold) {
        List<String> errors = new ArrayList<>();
        if (hold == null) {
            errors.add("Legal hold is required");
            return errors;
        }
        if (isBlank(hold.getName())) {
            errors.add("Hold name is required");
        }
        if (hold.getType() == null) {
            errors.add("Hold type is required");
        }
        if (hold.getMatter() == null || isBlank(hold.getMatter().getId()) || isBlank(hold.getMatter().getName())) {
            errors.add("Matter ID and name are required");
        }
        if (hold.getScope() == null || hold.getScope().getDataTypes() == null || hold.getScope().getDataTypes().isEmpty()) {
            errors.add("At least one data type must be specified in scope");
        }
        if (hold.getCustodians() == null || hold.getCustodians().isEmpty()) {
            errors.add("At least one custodian must be specified");
        }
        if (hold.getExpirationDate() != null && hold.getEffectiveDate() != null
                && !hold.getExpirationDate().isAfter(hold.getEffectiveDate())) {
            errors.add("Expiration date must be after effective date");
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
