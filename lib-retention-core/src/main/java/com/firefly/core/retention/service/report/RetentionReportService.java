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
package com.firefly.core.retention.service.report;

import com.firefly.core.retention.domain.enums.policy.ComplianceFramework;
import com.firefly.core.retention.domain.enums.policy.ComplianceStatus;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.report.FrameworkCompliance;
import com.firefly.core.retention.domain.model.report.PolicyReport;
import com.firefly.core.retention.domain.model.report.RetentionReport;
import com.firefly.core.retention.domain.model.report.SpaceSummary;
import com.firefly.core.retention.domain.model.report.TierUsage;
import com.firefly.core.retention.domain.model.report.UpcomingActions;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds retention reports from the policy store, the schedule and the catalog.
 * Rendering the report is left to the caller.
 */
@Slf4j
public class RetentionReportService {

    private final RetentionPolicyStore policyStore;
    private final ScheduleEntryStore entryStore;
    private final DataCatalogPort dataCatalog;
    private final LegalHoldRegistry holdRegistry;
    private final Duration overdueTolerance;
    private final Clock clock;

    public RetentionReportService(RetentionPolicyStore policyStore,
                                  ScheduleEntryStore entryStore,
                                  DataCatalogPort dataCatalog,
                                  LegalHoldRegistry holdRegistry,
                                  Duration overdueTolerance,
                                  Clock clock) {
        this.policyStore = policyStore;
        this.entryStore = entryStore;
        this.dataCatalog = dataCatalog;
        this.holdRegistry = holdRegistry;
        this.overdueTolerance = overdueTolerance;
        this.clock = clock;
    }

    /**
     * Report over every policy for data created in {@code [start, end]}.
     *
     * @param start period start, inclusive
     * @param end period end, inclusive
     * @return Mono containing the report
     */
    public Mono<RetentionReport> generateRetentionReport(Instant start, Instant end) {
        Instant now = clock.instant();
        return policyStore.findAll()
            .concatMap(policy -> Mono.zip(
                    dataCatalog.findByRetentionPolicy(policy.getId())
                        .filter(item -> inPeriod(item, start, end))
                        .collectList(),
                    entryStore.findByPolicyId(policy.getId()).collectList())
                .map(tuple -> new PolicySnapshot(policy, tuple.getT1(), tuple.getT2())))
            .collectList()
            .map(snapshots -> {
                List<PolicyReport> policies = snapshots.stream()
                    .map(snapshot -> policyReport(snapshot, now))
                    .collect(Collectors.toList());
                log.debug("Generated retention report for {} policies between {} and {}", policies.size(), start, end);
                return RetentionReport.builder()
                    .periodStart(start)
                    .periodEnd(end)
                    .generatedAt(now)
                    .policies(policies)
                    .spaceSummary(spaceSummary(snapshots))
                    .build();
            });
    }

    private PolicyReport policyReport(PolicySnapshot snapshot, Instant now) {
        RetentionPolicy policy = snapshot.policy;
        Set<String> itemIds = snapshot.items.stream().map(DataItem::getId).collect(Collectors.toSet());
        List<RetentionScheduleEntry> entries = snapshot.entries.stream()
            .filter(entry -> itemIds.contains(entry.getDataId()))
            .collect(Collectors.toList());

        Map<StorageTier, TierUsage> distribution = new EnumMap<>(StorageTier.class);
        for (DataItem item : snapshot.items) {
            StorageTier tier = item.getCurrentTier() != null ? item.getCurrentTier() : StorageTier.HOT;
            TierUsage usage = distribution.getOrDefault(tier, TierUsage.builder().build());
            distribution.put(tier, TierUsage.builder()
                .count(usage.getCount() + 1)
                .sizeBytes(usage.getSizeBytes() + item.getSizeBytes())
                .build());
        }

        List<RetentionScheduleEntry> upcoming = entries.stream()
            .filter(entry -> entry.getStatus() == ScheduleStatus.PENDING || entry.getStatus() == ScheduleStatus.PAUSED)
            .collect(Collectors.toList());

        return PolicyReport.builder()
            .policyId(policy.getId())
            .policyName(policy.getName())
            .policyVersion(policy.getVersion())
            .enabled(policy.isEnabled())
            .dataCount(snapshot.items.size())
            .totalSize(snapshot.items.stream().mapToLong(DataItem::getSizeBytes).sum())
            .tierDistribution(distribution)
            .upcomingActions(UpcomingActions.builder()
                .transitions(count(upcoming, ScheduledAction.TRANSITION))
                .deletions(count(upcoming, ScheduledAction.DELETE))
                .reviews(count(upcoming, ScheduledAction.REVIEW))
                .build())
            .failedEntries((int) entries.stream().filter(entry -> entry.getStatus() == ScheduleStatus.FAILED).count())
            .pausedEntries((int) entries.stream().filter(entry -> entry.getStatus() == ScheduleStatus.PAUSED).count())
            .compliance(policy.getComplianceFrameworks().stream()
                .map(framework -> assess(framework, policy, entries, now))
                .collect(Collectors.toList()))
            .build();
    }

    FrameworkCompliance assess(String framework, RetentionPolicy policy, List<RetentionScheduleEntry> entries, Instant now) {
        List<String> issues = new ArrayList<>();
        boolean nonCompliant = false;
        boolean atRisk = false;

        ComplianceFramework known = ComplianceFramework.fromTag(framework).orElse(null);
        if (known != null && policy.getTotalRetention() < known.getMinimumRetentionDays()) {
            nonCompliant = true;
            issues.add("Total retention of " + policy.getTotalRetention() + " days is below the "
                    + known.name() + " minimum of " + known.getMinimumRetentionDays() + " days");
        }

        long failedDeletions = entries.stream()
            .filter(entry -> entry.getStatus() == ScheduleStatus.FAILED && entry.getScheduledAction() == ScheduledAction.DELETE)
            .count();
        if (failedDeletions > 0) {
            nonCompliant = true;
            issues.add(failedDeletions + " deletions have failed");
        }

        long overdueDeletions = entries.stream()
            .filter(entry -> entry.getStatus() == ScheduleStatus.PENDING && entry.getScheduledAction() == ScheduledAction.DELETE)
            .filter(entry -> entry.getGracePeriodEnd() != null && entry.getGracePeriodEnd().plus(overdueTolerance).isBefore(now))
            .filter(entry -> !holdRegistry.isHeld(entry.getDataId()))
            .count();
        if (overdueDeletions > 0) {
            nonCompliant = true;
            issues.add(overdueDeletions + " deletions are overdue past their grace period");
        }

        long failed = entries.stream().filter(entry -> entry.getStatus() == ScheduleStatus.FAILED).count();
        if (failed > failedDeletions) {
            atRisk = true;
            issues.add((failed - failedDeletions) + " transitions or reviews have failed");
        }

        long overdue = entries.stream()
            .filter(entry -> entry.getStatus() == ScheduleStatus.PENDING)
            .filter(entry -> entry.getScheduledDate().plus(overdueTolerance).isBefore(now))
            .count();
        if (overdue > 0) {
            atRisk = true;
            issues.add(overdue + " entries are overdue");
        }

        ComplianceStatus status = nonCompliant ? ComplianceStatus.NON_COMPLIANT
            : atRisk ? ComplianceStatus.AT_RISK : ComplianceStatus.COMPLIANT;
        return FrameworkCompliance.builder()
            .framework(framework)
            .status(status)
            .issues(issues)
            .build();
    }

    private SpaceSummary spaceSummary(List<PolicySnapshot> snapshots) {
        Map<StorageTier, Long> bytes = new EnumMap<>(StorageTier.class);
        long projected = 0;
        Set<String> counted = new HashSet<>();

        for (PolicySnapshot snapshot : snapshots) {
            Map<String, DataItem> items = snapshot.items.stream()
                .collect(Collectors.toMap(DataItem::getId, item -> item, (a, b) -> a));
            for (DataItem item : snapshot.items) {
                StorageTier tier = item.getCurrentTier() != null ? item.getCurrentTier() : StorageTier.HOT;
                bytes.merge(tier, item.getSizeBytes(), Long::sum);
            }
            for (RetentionScheduleEntry entry : snapshot.entries) {
                DataItem item = items.get(entry.getDataId());
                if (item == null || entry.getStatus() != ScheduleStatus.PENDING || !reclaims(entry)) {
                    continue;
                }
                if (counted.add(item.getId())) {
                    projected += item.getSizeBytes();
                }
            }
        }

        return SpaceSummary.builder()
            .totalBytes(bytes.values().stream().mapToLong(Long::longValue).sum())
            .hotBytes(bytes.getOrDefault(StorageTier.HOT, 0L))
            .warmBytes(bytes.getOrDefault(StorageTier.WARM, 0L))
            .coldBytes(bytes.getOrDefault(StorageTier.COLD, 0L))
            .archiveBytes(bytes.getOrDefault(StorageTier.ARCHIVE, 0L))
            .projectedSavings(projected)
            .build();
    }

    private static boolean reclaims(RetentionScheduleEntry entry) {
        if (entry.getScheduledAction() == ScheduledAction.DELETE) {
            return true;
        }
        return entry.getScheduledAction() == ScheduledAction.TRANSITION
            && entry.getNextTier() != null && entry.getNextTier().reclaimsSpace();
    }

    private static int count(List<RetentionScheduleEntry> entries, ScheduledAction action) {
        return (int) entries.stream().filter(entry -> entry.getScheduledAction() == action).count();
    }

    private static boolean inPeriod(DataItem item, Instant start, Instant end) {
        Instant created = item.getCreatedAt();
        if (created == null) {
            return false;
        }
        return !created.isBefore(start) && !created.isAfter(end);
    }

    private static final class PolicySnapshot {
        private final RetentionPolicy policy;
        private final List<DataItem> items;
        private final List<RetentionScheduleEntry> entries;

        private PolicySnapshot(RetentionPolicy policy, List<DataItem> items, List<RetentionScheduleEntry> entries) {
            this.policy = policy;
            this.items = items;
            this.entries = entries;
        }
    }
}
