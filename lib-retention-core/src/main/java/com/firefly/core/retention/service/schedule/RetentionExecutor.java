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
package com.firefly.core.retention.service.schedule;

import com.firefly.core.retention.config.RetentionProperties;
import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import com.firefly.core.retention.domain.enums.event.ReviewReason;
import com.firefly.core.retention.domain.enums.policy.RuleActionType;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.schedule.RetentionExecutionResult;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.domain.model.storage.StorageOperationResult;
import com.firefly.core.retention.event.RetentionEventBus;
import com.firefly.core.retention.exception.ComplianceConflictException;
import com.firefly.core.retention.exception.InvariantViolationException;
import com.firefly.core.retention.exception.PolicyNotFoundException;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import com.firefly.core.retention.service.policy.RetentionPolicyValidator;
import com.firefly.core.retention.service.policy.RuleEvaluator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs due schedule entries. The executor has no timer of its own: the host (or
 * the optional scheduler in the auto-configuration) calls {@link #runTick()}.
 *
 * <p>Each entry is claimed with a conditional PENDING to PROCESSING update before
 * anything happens to it, so concurrent ticks never act on the same entry twice.
 * A failure of one entry is recorded and the batch continues; a failure of one
 * policy is reported in its result and the other policies continue.</p>
 */
@Slf4j
public class RetentionExecutor {

    public static final String METADATA_PAUSED_REASON = "pausedReason";
    public static final String METADATA_DEFERRED_FROM = "deferredFrom";
    public static final String METADATA_PRESERVED = "preserved";
    public static final String METADATA_REVIEW_REASON = "reviewReason";

    private final RetentionPolicyStore policyStore;
    private final ScheduleEntryStore entryStore;
    private final DataCatalogPort dataCatalog;
    private final StorageBackendPort storageBackend;
    private final LegalHoldRegistry holdRegistry;
    private final RuleEvaluator ruleEvaluator;
    private final RetentionPolicyValidator policyValidator;
    private final RetentionEventBus eventBus;
    private final RetentionProperties.Executor settings;
    private final Clock clock;

    private final Set<String> runningPolicies = ConcurrentHashMap.newKeySet();

    public RetentionExecutor(RetentionPolicyStore policyStore,
                             ScheduleEntryStore entryStore,
                             DataCatalogPort dataCatalog,
                             StorageBackendPort storageBackend,
                             LegalHoldRegistry holdRegistry,
                             RuleEvaluator ruleEvaluator,
                             RetentionPolicyValidator policyValidator,
                             RetentionEventBus eventBus,
                             RetentionProperties.Executor settings,
                             Clock clock) {
        this.policyStore = policyStore;
        this.entryStore = entryStore;
        this.dataCatalog = dataCatalog;
        this.storageBackend = storageBackend;
        this.holdRegistry = holdRegistry;
        this.ruleEvaluator = ruleEvaluator;
        this.policyValidator = policyValidator;
        this.eventBus = eventBus;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs one tick over every enabled policy, one policy after another.
     *
     * @return Flux with one result per enabled policy
     */
    public Flux<RetentionExecutionResult> runTick() {
        return policyStore.findAll()
            .filter(RetentionPolicy::isEnabled)
            .concatMap(this::executePolicy);
    }

    /**
     * Runs one tick for a single policy.
     *
     * @param policyId the policy ID
     * @return Flux with the policy's result, or an error if the policy does not exist
     */
    public Flux<RetentionExecutionResult> runTick(String policyId) {
        return policyStore.findById(policyId)
            .switchIfEmpty(Mono.error(new PolicyNotFoundException(policyId)))
            .flatMap(this::executePolicy)
            .flux();
    }

    /**
     * Whether a tick of the policy is in progress.
     */
    public boolean isRunning(String policyId) {
        return runningPolicies.contains(policyId);
    }

    private Mono<RetentionExecutionResult> executePolicy(RetentionPolicy policy) {
        return Mono.defer(() -> {
            Instant start = clock.instant();
            ExecutionAccumulator accumulator = new ExecutionAccumulator(policy.getId(), start);

            if (!policy.isEnabled()) {
                accumulator.error(null, "POLICY", "Policy " + policy.getId() + " is disabled", start);
                return Mono.just(accumulator.toResult(start, true));
            }
            List<String> problems = policyValidator.collectErrors(policy);
            if (!problems.isEmpty()) {
                log.error("Skipping malformed policy {}: {}", policy.getId(), problems);
                problems.forEach(problem -> accumulator.error(null, "POLICY", problem, start));
                return Mono.just(accumulator.toResult(start, true));
            }
            if (!runningPolicies.add(policy.getId())) {
                log.warn("Policy {} is still running a previous tick; skipping", policy.getId());
                accumulator.warning(null, "Policy " + policy.getId() + " is already running");
                return Mono.just(accumulator.toResult(start, true));
            }

            return entryStore.findDue(policy.getId(), start, settings.getBatchSize())
                .flatMap(entry -> processEntry(policy, entry, accumulator), settings.getConcurrency())
                .then(Mono.defer(() -> sendDeletionWarnings(policy, accumulator)))
                .timeout(settings.getTickTimeout())
                .then(Mono.fromCallable(() -> accumulator.toResult(clock.instant())))
                .onErrorResume(error -> {
                    log.error("Execution of policy {} aborted: {}", policy.getId(), error.getMessage(), error);
                    accumulator.error(null, "POLICY", "Execution aborted: " + error.getMessage(), clock.instant());
                    return releaseClaims(accumulator).then(Mono.fromCallable(() -> accumulator.toResult(clock.instant())));
                })
                .doOnNext(result -> publishCompletion(result))
                .doFinally(signal -> runningPolicies.remove(policy.getId()));
        });
    }

    private Mono<Void> processEntry(RetentionPolicy policy, RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        return entryStore.claim(entry.getId()).flatMap(claimed -> {
            if (!claimed) {
                log.debug("Entry {} of {} was claimed elsewhere or is no longer pending", entry.getId(), entry.getDataId());
                return Mono.<Void>empty();
            }
            RetentionScheduleEntry processing = entry.withStatus(ScheduleStatus.PROCESSING, clock.instant());
            accumulator.claimed(processing);
            return Mono.defer(() -> dispatch(policy, processing, accumulator))
                .onErrorResume(error -> handleFailure(processing, error.getMessage(), accumulator))
                .doOnSuccess(v -> accumulator.settled(processing.getId()));
        });
    }

    private Mono<Void> dispatch(RetentionPolicy policy, RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        switch (entry.getScheduledAction()) {
            case TRANSITION:
                return executeTransition(entry, accumulator);
            case DELETE:
                return executeDeletion(policy, entry, accumulator);
            case REVIEW:
                publishReview(entry, ReviewReason.SCHEDULED_REVIEW, "Scheduled review is due");
                return complete(entry, Map.of());
            default:
                return failPermanently(entry, "Unsupported action " + entry.getScheduledAction(), accumulator);
        }
    }

    private Mono<Void> executeTransition(RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        StorageTier target = entry.getNextTier();
        if (target == null) {
            return failPermanently(entry, "Transition entry has no target tier", accumulator);
        }
        return findItem(entry).flatMap(item -> {
            if (item.getCurrentTier() != null && !target.isAfter(item.getCurrentTier())) {
                accumulator.warning(item.getId(), "Already in " + item.getCurrentTier() + "; transition to " + target + " skipped");
                return complete(entry, Map.of());
            }
            return Mono.defer(() -> {
                if (isTransitionBlocked(item.getId(), target)) {
                    return pause(entry, "Transition to " + target + " suspended by legal hold "
                            + holdRegistry.activeHoldIds(item.getId()), accumulator);
                }
                return callBackend(storageBackend.transition(item.getId(), target)).flatMap(result -> {
                    if (!result.isSuccess()) {
                        return handleFailure(entry, result.getError(), accumulator);
                    }
                    long size = result.getSizeBytes() > 0 ? result.getSizeBytes() : item.getSizeBytes();
                    accumulator.transitioned(target, size);
                    return complete(entry, Map.of())
                        .then(dataCatalog.save(item.toBuilder().currentTier(target).build()))
                        .doOnSuccess(saved -> {
                            log.info("Moved {} from {} to {}", item.getId(), item.getCurrentTier(), target);
                            eventBus.publish(eventBus.event(RetentionEventType.ENTRY_TRANSITIONED)
                                .policyId(entry.getPolicyId())
                                .dataId(item.getId())
                                .entryId(entry.getId())
                                .message("Moved to " + target)
                                .attributes(Map.of("from", String.valueOf(item.getCurrentTier()), "to", target.name()))
                                .build());
                        })
                        .then();
                });
            });
        });
    }

    private Mono<Void> executeDeletion(RetentionPolicy policy, RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        return findItem(entry).flatMap(item -> {
            String dataId = item.getId();
            Instant now = clock.instant();

            if (holdRegistry.isDeletionBlocked(dataId)) {
                return blockDeletion(policy, entry, accumulator);
            }

            List<RuleActionType> ruleActions = ruleEvaluator.matchingActions(policy, item, now).stream()
                .map(RuleAction::getType)
                .collect(Collectors.toList());
            if (ruleActions.contains(RuleActionType.HOLD)) {
                publishReview(entry, ReviewReason.RULE_HOLD, "Deletion held by a custom rule of policy " + policy.getId());
                accumulator.warning(dataId, "Deletion converted to review by custom rule");
                return complete(entry.toBuilder().scheduledAction(ScheduledAction.REVIEW).build(),
                        Map.of(METADATA_REVIEW_REASON, ReviewReason.RULE_HOLD.name()));
            }
            if (ruleActions.contains(RuleActionType.PRESERVE)) {
                accumulator.warning(dataId, "Deletion skipped: item preserved by custom rule");
                return complete(entry, Map.of(METADATA_PRESERVED, "true"));
            }
            if (entry.isRetroactive() && entry.getGracePeriodEnd() != null && now.isBefore(entry.getGracePeriodEnd())) {
                return deferToGraceEnd(entry, accumulator);
            }

            return Mono.defer(() -> {
                if (holdRegistry.isDeletionBlocked(dataId)) {
                    return blockDeletion(policy, entry, accumulator);
                }
                return callBackend(storageBackend.delete(dataId)).flatMap(result -> {
                    if (!result.isSuccess()) {
                        return handleFailure(entry, result.getError(), accumulator);
                    }
                    long size = result.getSizeBytes() > 0 ? result.getSizeBytes() : item.getSizeBytes();
                    accumulator.deleted(size);
                    return entryStore.deleteByDataId(dataId)
                        .then(dataCatalog.delete(dataId))
                        .doOnSuccess(v -> {
                            log.info("Deleted {} under policy {}", dataId, policy.getId());
                            eventBus.publish(eventBus.event(RetentionEventType.ENTRY_DELETED)
                                .policyId(policy.getId())
                                .dataId(dataId)
                                .entryId(entry.getId())
                                .message("Data deleted")
                                .attributes(Map.of("sizeBytes", size))
                                .build());
                        });
                });
            });
        });
    }

    private Mono<Void> blockDeletion(RetentionPolicy policy, RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        String dataId = entry.getDataId();
        holdRegistry.recordPreventedDeletion(dataId);
        if (policy.isLegalHoldExempt()) {
            ComplianceConflictException conflict = new ComplianceConflictException(policy.getId(), dataId);
            log.warn(conflict.getMessage());
            publishReview(entry, ReviewReason.COMPLIANCE_CONFLICT, conflict.getMessage());
            return pause(entry, conflict.getMessage(), accumulator);
        }
        InvariantViolationException violation = new InvariantViolationException(
                "Refused deletion of " + dataId + ": active legal hold " + holdRegistry.activeHoldIds(dataId) + " forbids deletion");
        log.warn(violation.getMessage());
        return pause(entry, "Deletion suspended by legal hold " + holdRegistry.activeHoldIds(dataId), accumulator);
    }

    private Mono<Void> deferToGraceEnd(RetentionScheduleEntry entry, ExecutionAccumulator accumulator) {
        Map<String, String> metadata = new HashMap<>(entry.getMetadata());
        metadata.put(METADATA_DEFERRED_FROM, entry.getScheduledDate().toString());
        RetentionScheduleEntry deferred = entry.toBuilder()
            .status(ScheduleStatus.PENDING)
            .scheduledDate(entry.getGracePeriodEnd())
            .metadata(metadata)
            .updatedAt(clock.instant())
            .build();
        accumulator.warning(entry.getDataId(), "Retroactive deletion deferred until grace period ends at " + entry.getGracePeriodEnd());
        return entryStore.replaceIfStatus(deferred, ScheduleStatus.PROCESSING).then();
    }

    private Mono<Void> pause(RetentionScheduleEntry entry, String reason, ExecutionAccumulator accumulator) {
        Map<String, String> metadata = new HashMap<>(entry.getMetadata());
        metadata.put(METADATA_PAUSED_REASON, reason);
        RetentionScheduleEntry paused = entry.toBuilder()
            .status(ScheduleStatus.PAUSED)
            .metadata(metadata)
            .updatedAt(clock.instant())
            .build();
        accumulator.warning(entry.getDataId(), reason);
        return entryStore.replaceIfStatus(paused, ScheduleStatus.PROCESSING)
            .flatMap(replaced -> {
                if (replaced) {
                    eventBus.publish(eventBus.event(RetentionEventType.ENTRY_PAUSED)
                        .policyId(entry.getPolicyId())
                        .dataId(entry.getDataId())
                        .entryId(entry.getId())
                        .message(reason)
                        .build());
                }
                // the hold may have been released while this entry was PROCESSING
                if (replaced && !holdRegistry.isHeld(entry.getDataId())) {
                    return entryStore.resumeByDataId(entry.getDataId(), clock.instant()).then();
                }
                return Mono.<Void>empty();
            });
    }

    private Mono<Void> complete(RetentionScheduleEntry entry, Map<String, String> extraMetadata) {
        Map<String, String> metadata = new HashMap<>(entry.getMetadata());
        metadata.putAll(extraMetadata);
        RetentionScheduleEntry completed = entry.toBuilder()
            .status(ScheduleStatus.COMPLETED)
            .metadata(metadata)
            .updatedAt(clock.instant())
            .build();
        return entryStore.replaceIfStatus(completed, ScheduleStatus.PROCESSING)
            .doOnNext(replaced -> {
                if (!replaced) {
                    log.warn("Entry {} changed status while processing; completion not recorded", entry.getId());
                }
            })
            .then();
    }

    private Mono<Void> handleFailure(RetentionScheduleEntry entry, String message, ExecutionAccumulator accumulator) {
        Instant now = clock.instant();
        int attempts = entry.getRetryCount() + 1;
        boolean exhausted = attempts >= settings.getMaxRetries();
        accumulator.error(entry.getDataId(), String.valueOf(entry.getScheduledAction()), message, now);

        RetentionScheduleEntry updated = entry.toBuilder()
            .retryCount(attempts)
            .lastError(message)
            .status(exhausted ? ScheduleStatus.FAILED : ScheduleStatus.PENDING)
            .updatedAt(now)
            .build();

        return entryStore.replaceIfStatus(updated, ScheduleStatus.PROCESSING)
            .doOnNext(replaced -> {
                if (exhausted) {
                    log.error("{} of {} failed after {} attempts: {}", entry.getScheduledAction(), entry.getDataId(), attempts, message);
                    publishFailure(updated, message);
                } else {
                    log.warn("{} of {} failed (attempt {} of {}): {}", entry.getScheduledAction(), entry.getDataId(),
                            attempts, settings.getMaxRetries(), message);
                }
            })
            .then();
    }

    private Mono<Void> failPermanently(RetentionScheduleEntry entry, String message, ExecutionAccumulator accumulator) {
        Instant now = clock.instant();
        accumulator.error(entry.getDataId(), String.valueOf(entry.getScheduledAction()), message, now);
        RetentionScheduleEntry failed = entry.toBuilder()
            .status(ScheduleStatus.FAILED)
            .lastError(message)
            .updatedAt(now)
            .build();
        log.error("Entry {} of {} failed: {}", entry.getId(), entry.getDataId(), message);
        return entryStore.replaceIfStatus(failed, ScheduleStatus.PROCESSING)
            .doOnNext(replaced -> publishFailure(failed, message))
            .then();
    }

    /**
     * Puts entries still PROCESSING after an aborted tick back to PENDING so the
     * next tick can claim them again. The retry count is left unchanged.
     */
    private Mono<Void> releaseClaims(ExecutionAccumulator accumulator) {
        return Flux.fromIterable(accumulator.inFlight())
            .concatMap(entry -> entryStore.replaceIfStatus(
                    entry.withStatus(ScheduleStatus.PENDING, clock.instant()), ScheduleStatus.PROCESSING)
                .doOnNext(released -> {
                    if (released) {
                        log.warn("Released claim on entry {} of {} after aborted tick", entry.getId(), entry.getDataId());
                    }
                }))
            .then();
    }

    private Mono<Void> sendDeletionWarnings(RetentionPolicy policy, ExecutionAccumulator accumulator) {
        if (policy.getNotifications() == null || policy.getNotifications().getWarnDaysBefore().isEmpty()) {
            return Mono.empty();
        }
        List<Integer> thresholds = policy.getNotifications().getWarnDaysBefore();
        Instant now = clock.instant();

        return entryStore.findByPolicyIdAndStatus(policy.getId(), ScheduleStatus.PENDING)
            .filter(entry -> entry.getScheduledAction() == ScheduledAction.DELETE)
            .filter(entry -> entry.getScheduledDate().isAfter(now))
            .concatMap(entry -> {
                long daysUntil = Duration.between(now, entry.getScheduledDate()).toDays();
                long crossed = thresholds.stream().filter(days -> days >= daysUntil).count();
                if (crossed <= entry.getNotificationsSent().size()) {
                    return Mono.<Void>empty();
                }
                List<Instant> sent = new ArrayList<>(entry.getNotificationsSent());
                while (sent.size() < crossed) {
                    sent.add(now);
                }
                RetentionScheduleEntry notified = entry.toBuilder().notificationsSent(sent).updatedAt(now).build();
                return entryStore.replaceIfStatus(notified, ScheduleStatus.PENDING)
                    .filter(Boolean::booleanValue)
                    .doOnNext(replaced -> {
                        accumulator.warning(entry.getDataId(), "Deletion due in " + daysUntil + " day(s)");
                        eventBus.publish(eventBus.event(RetentionEventType.DELETION_WARNING)
                            .policyId(policy.getId())
                            .dataId(entry.getDataId())
                            .entryId(entry.getId())
                            .message("Data scheduled for deletion in " + daysUntil + " day(s)")
                            .attributes(Map.of("scheduledDate", entry.getScheduledDate(),
                                    "recipients", policy.getNotifications().getRecipients()))
                            .build());
                    })
                    .then();
            })
            .then();
    }

    private boolean isTransitionBlocked(String dataId, StorageTier target) {
        if (holdRegistry.isModificationBlocked(dataId)) {
            return true;
        }
        return target == StorageTier.ARCHIVE && holdRegistry.isHeld(dataId);
    }

    private Mono<DataItem> findItem(RetentionScheduleEntry entry) {
        return dataCatalog.findById(entry.getDataId())
            .switchIfEmpty(Mono.error(new IllegalStateException("Data item " + entry.getDataId() + " not found in catalog")));
    }

    private static Mono<StorageOperationResult> callBackend(Mono<StorageOperationResult> call) {
        return call
            .onErrorResume(error -> Mono.just(StorageOperationResult.failure(error.getMessage())))
            .defaultIfEmpty(StorageOperationResult.failure("Storage backend returned no result"));
    }

    private void publishReview(RetentionScheduleEntry entry, ReviewReason reason, String message) {
        eventBus.publish(eventBus.event(RetentionEventType.REVIEW_REQUIRED)
            .policyId(entry.getPolicyId())
            .dataId(entry.getDataId())
            .entryId(entry.getId())
            .message(message)
            .attributes(Map.of("reason", reason.name()))
            .build());
    }

    private void publishFailure(RetentionScheduleEntry entry, String message) {
        eventBus.publish(eventBus.event(RetentionEventType.ENTRY_FAILED)
            .policyId(entry.getPolicyId())
            .dataId(entry.getDataId())
            .entryId(entry.getId())
            .message(message)
            .attributes(Map.of("action", String.valueOf(entry.getScheduledAction()), "retryCount", entry.getRetryCount()))
            .build());
    }

    private void publishCompletion(RetentionExecutionResult result) {
        log.info("Policy {} tick: processed={}, transitioned={}, deleted={}, errors={}, warnings={} in {} ms",
                result.getPolicyId(), result.getProcessed(), result.getTransitioned().total(), result.getDeleted(),
                result.getErrors().size(), result.getWarnings().size(), result.getTotalTimeMs());
        eventBus.publish(eventBus.event(RetentionEventType.EXECUTION_COMPLETED)
            .policyId(result.getPolicyId())
            .message("Execution completed")
            .attributes(Map.of("processed", result.getProcessed(), "deleted", result.getDeleted(),
                    "spaceSaved", result.getSpaceSaved()))
            .build());
    }
}
