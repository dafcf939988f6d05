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
package com.firefly.core.retention.service;

import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.hold.Custodian;
import com.firefly.core.retention.domain.model.hold.HoldOperationResult;
import com.firefly.core.retention.domain.model.hold.HoldReport;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.report.RetentionReport;
import com.firefly.core.retention.domain.model.schedule.RetentionExecutionResult;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import com.firefly.core.retention.service.policy.RetentionPolicyService;
import com.firefly.core.retention.service.report.RetentionReportService;
import com.firefly.core.retention.service.schedule.RetentionExecutor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the retention library.
 *
 * <p>Groups the policy, schedule, legal hold and report operations behind one
 * bean. Every operation is reactive; nothing happens until the returned
 * publisher is subscribed.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * {@code
 * @Autowired
 * private RetentionEngine retentionEngine;
 *
 * public void nightly() {
 *     retentionEngine.runTick()
 *         .doOnNext(result -> log.info("{} processed {}", result.getPolicyId(), result.getProcessed()))
 *         .blockLast();
 * }
 * }
 * </pre>
 */
public class RetentionEngine {

    private final RetentionPolicyService policyService;
    private final RetentionExecutor executor;
    private final LegalHoldRegistry holdRegistry;
    private final RetentionReportService reportService;

    public RetentionEngine(RetentionPolicyService policyService,
                           RetentionExecutor executor,
                           LegalHoldRegistry holdRegistry,
                           RetentionReportService reportService) {
        this.policyService = policyService;
        this.executor = executor;
        this.holdRegistry = holdRegistry;
        this.reportService = reportService;
    }

    public Mono<RetentionPolicy> createPolicy(RetentionPolicy policy) {
        return policyService.createPolicy(policy);
    }

    public Mono<RetentionPolicy> updatePolicy(String policyId, RetentionPolicy changes) {
        return policyService.updatePolicy(policyId, changes);
    }

    public Mono<RetentionPolicy> getPolicy(String policyId) {
        return policyService.getPolicy(policyId);
    }

    public Mono<List<RetentionScheduleEntry>> registerDataItem(DataItem item) {
        return policyService.registerDataItem(item);
    }

    /**
     * Expires overdue holds, then runs every enabled policy once.
     *
     * @return Flux with one result per enabled policy
     */
    public Flux<RetentionExecutionResult> runTick() {
        return holdRegistry.expireHolds()
            .then()
            .thenMany(Flux.defer(executor::runTick));
    }

    /**
     * Runs a single policy once.
     *
     * @param policyId the policy ID
     * @return Flux with the policy's result
     */
    public Flux<RetentionExecutionResult> runTick(String policyId) {
        return executor.runTick(policyId);
    }

    public Mono<LegalHold> createHold(LegalHold hold) {
        return holdRegistry.createHold(hold);
    }

    public Mono<HoldOperationResult> applyHold(String holdId, Collection<String> dataIds) {
        return holdRegistry.applyHold(holdId, dataIds);
    }

    public Mono<HoldOperationResult> applyHold(LegalHold hold, Collection<String> dataIds) {
        return holdRegistry.applyHold(hold, dataIds);
    }

    public Mono<HoldOperationResult> releaseHold(String holdId, String releasedBy, String reason, boolean releaseData) {
        return holdRegistry.releaseHold(holdId, releasedBy, reason, releaseData);
    }

    public Mono<HoldOperationResult> releaseHeldData(String holdId) {
        return holdRegistry.releaseHeldData(holdId);
    }

    public Flux<LegalHold> expireHolds() {
        return holdRegistry.expireHolds();
    }

    public boolean isHeld(String dataId) {
        return holdRegistry.isHeld(dataId);
    }

    public Mono<Custodian> addCustodian(String holdId, Custodian custodian) {
        return holdRegistry.addCustodian(holdId, custodian);
    }

    public Mono<LegalHold> removeCustodian(String holdId, String custodianId) {
        return holdRegistry.removeCustodian(holdId, custodianId);
    }

    public Mono<Custodian> acknowledgeNotice(String holdId, String custodianId, String acknowledgedBy) {
        return holdRegistry.acknowledgeNotice(holdId, custodianId, acknowledgedBy);
    }

    public Mono<Custodian> confirmPreservation(String holdId, String custodianId) {
        return holdRegistry.confirmPreservation(holdId, custodianId);
    }

    public Mono<HoldReport> generateHoldReport(String holdId) {
        return holdRegistry.generateHoldReport(holdId);
    }

    public Mono<RetentionReport> generateRetentionReport(Instant start, Instant end) {
        return reportService.generateRetentionReport(start, end);
    }
}
