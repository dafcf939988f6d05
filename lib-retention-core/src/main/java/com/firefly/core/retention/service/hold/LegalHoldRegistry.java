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

import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import com.firefly.core.retention.domain.enums.hold.LegalHoldStatus;
import com.firefly.core.retention.domain.enums.hold.PreservationStatus;
import com.firefly.core.retention.domain.enums.hold.RiskLevel;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.hold.Custodian;
import com.firefly.core.retention.domain.model.hold.CustodianStatus;
import com.firefly.core.retention.domain.model.hold.DataUnderHold;
import com.firefly.core.retention.domain.model.hold.HoldOperationResult;
import com.firefly.core.retention.domain.model.hold.HoldReport;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.domain.model.storage.StorageOperationResult;
import com.firefly.core.retention.event.RetentionEventBus;
import com.firefly.core.retention.exception.InvariantViolationException;
import com.firefly.core.retention.exception.LegalHoldNotFoundException;
import com.firefly.core.retention.exception.RetentionException;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.port.store.LegalHoldStore;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import com.firefly.core.retention.service.schedule.ScheduleGenerator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Owns legal holds and answers "is this item held?" for the executor.
 *
 * <p>The store is the source of truth. The registry keeps an index of active
 * holds per data item so that hold checks are constant-time lookups; the index
 * is rebuilt from the store by {@link #reload()}.</p>
 *
 * <p>An item counts as held while at least one ACTIVE hold references it. Its
 * schedule entries are paused when the first hold is applied and resumed only
 * when the last one is released. Resumed entries that are already past due run
 * on the next executor tick, never from inside the release call.</p>
 */
@Slf4j
public class LegalHoldRegistry {

    private static final double HIGH_RISK_THRESHOLD = 0.5;
    private static final double MEDIUM_RISK_THRESHOLD = 0.8;

    private final LegalHoldStore holdStore;
    private final ScheduleEntryStore entryStore;
    private final DataCatalogPort dataCatalog;
    private final StorageBackendPort storageBackend;
    private final RetentionPolicyStore policyStore;
    private final ScheduleGenerator scheduleGenerator;
    private final LegalHoldValidator validator;
    private final RetentionEventBus eventBus;
    private final Clock clock;

    private final Map<String, LegalHold> activeHolds = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> activeHoldsByData = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> preventedDeletions = new ConcurrentHashMap<>();

    public LegalHoldRegistry(LegalHoldStore holdStore,
                             ScheduleEntryStore entryStore,
                             DataCatalogPort dataCatalog,
                             StorageBackendPort storageBackend,
                             RetentionPolicyStore policyStore,
                             ScheduleGenerator scheduleGenerator,
                             LegalHoldValidator validator,
                             RetentionEventBus eventBus,
                             Clock clock) {
        this.holdStore = holdStore;
        this.entryStore = entryStore;
        this.dataCatalog = dataCatalog;
        this.storageBackend = storageBackend;
        this.policyStore = policyStore;
        this.scheduleGenerator = scheduleGenerator;
        this.validator = validator;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Rebuilds the active-hold index from the store.
     *
     * @return Mono completing once the index is loaded
     */
    public Mono<Void> reload() {
        return holdStore.findHoldsByStatus(LegalHoldStatus.ACTIVE)
            .collectList()
            .flatMapMany(holds -> {
                activeHolds.clear();
                activeHoldsByData.clear();
                holds.forEach(hold -> activeHolds.put(hold.getId(), hold));
                return Flux.fromIterable(holds);
            })
            .concatMap(hold -> holdStore.findDataUnderHold(hold.getId()))
            .doOnNext(binding -> index(binding.getHoldId(), binding.getDataId()))
            .then()
            .doOnSuccess(v -> log.info("Loaded {} active legal hold(s) covering {} data item(s)",
                    activeHolds.size(), activeHoldsByData.size()));
    }

    /**
     * Validates and stores a new hold, notifying its custodians.
     *
     * @param draft the hold definition; id and status are assigned here
     * @return Mono containing the created hold
     */
    public Mono<LegalHold> createHold(LegalHold draft) {
        return Mono.defer(() -> {
            validator.validate(draft);
            Instant now = clock.instant();

            List<Custodian> custodians = draft.getCustodians().stream()
                .map(custodian -> notified(custodian, now))
                .collect(Collectors.toList());

            LegalHold hold = draft.toBuilder()
                .id(draft.getId() != null ? draft.getId() : "hold-" + UUID.randomUUID())
                .status(LegalHoldStatus.ACTIVE)
                .custodians(custodians)
                .effectiveDate(draft.getEffectiveDate() != null ? draft.getEffectiveDate() : now)
                .createdAt(now)
                .updatedAt(now)
                .build();

            return holdStore.saveHold(hold);
        })
        .doOnNext(hold -> {
            activeHolds.put(hold.getId(), hold);
            log.info("Created legal hold {} ({}) for matter {}", hold.getId(), hold.getName(), hold.getMatter().getId());
            eventBus.publish(eventBus.event(RetentionEventType.LEGAL_HOLD_CREATED)
                .holdId(hold.getId())
                .message("Legal hold created: " + hold.getName())
                .build());
            hold.getCustodians().forEach(custodian -> publishCustodianNotice(hold, custodian));
        });
    }

    /**
     * Creates the hold if it has no id yet, then applies it to the given items.
     *
     * @param hold the hold, new or existing
     * @param dataIds the data items to hold
     * @return Mono containing per-item results
     */
    public Mono<HoldOperationResult> applyHold(LegalHold hold, Collection<String> dataIds) {
        if (hold.getId() == null) {
            return createHold(hold).flatMap(created -> applyHold(created.getId(), dataIds));
        }
        return holdStore.findHold(hold.getId())
            .switchIfEmpty(Mono.defer(() -> createHold(hold)))
            .flatMap(stored -> applyHold(stored.getId(), dataIds));
    }

    /**
     * Applies an active hold to data items. Applying a hold to an item that
     * already carries it changes nothing.
     *
     * @param holdId the hold ID
     * @param dataIds the data items to hold
     * @return Mono containing per-item results
     */
    public Mono<HoldOperationResult> applyHold(String holdId, Collection<String> dataIds) {
        return requireHold(holdId).flatMap(hold -> {
            if (!hold.isActive()) {
                return Mono.error(new InvariantViolationException(
                        "Legal hold " + holdId + " is " + hold.getStatus() + " and cannot be applied"));
            }
            Instant now = clock.instant();
            return Flux.fromIterable(new LinkedHashSet<>(dataIds))
                .concatMap(dataId -> applyToItem(hold, dataId, now))
                .collectList()
                .map(outcomes -> summarize(holdId, outcomes))
                .doOnNext(result -> {
                    log.info("Applied legal hold {}: {} held, {} already held, {} failed, {} entries paused",
                            holdId, result.getSucceeded().size(), result.getSkipped().size(),
                            result.getFailures().size(), result.getAffectedEntries());
                    eventBus.publish(eventBus.event(RetentionEventType.LEGAL_HOLD_APPLIED)
                        .holdId(holdId)
                        .message("Legal hold applied to " + result.getSucceeded().size() + " item(s)")
                        .attributes(Map.of("applied", result.getSucceeded(), "failed", result.getFailures().keySet()))
                        .build());
                });
        });
    }

    /**
     * Releases an active hold.
     *
     * @param holdId the hold ID
     * @param releasedBy who released it
     * @param reason why it was released
     * @param releaseData when false the hold is released administratively and its
     *                    items stay flagged and paused until {@link #releaseHeldData(String)}
     * @return Mono containing per-item results
     */
    public Mono<HoldOperationResult> releaseHold(String holdId, String releasedBy, String reason, boolean releaseData) {
        return requireHold(holdId).flatMap(hold -> {
            if (!hold.isActive()) {
                return Mono.error(new InvariantViolationException(
                        "Legal hold " + holdId + " is " + hold.getStatus() + " and cannot be released"));
            }
            Instant now = clock.instant();
            LegalHold released = hold.toBuilder()
                .status(LegalHoldStatus.RELEASED)
                .releasedAt(now)
                .releasedBy(releasedBy)
                .releaseReason(reason)
                .updatedAt(now)
                .build();

            Mono<HoldOperationResult> dataRelease = releaseData
                ? releaseHeldData(holdId)
                : Mono.just(HoldOperationResult.builder().holdId(holdId).build());

            return holdStore.saveHold(released)
                .flatMap(this::deactivate)
                .then(dataRelease)
                .doOnNext(result -> {
                    log.info("Released legal hold {} by {}: {}", holdId, releasedBy, reason);
                    eventBus.publish(eventBus.event(RetentionEventType.LEGAL_HOLD_RELEASED)
                        .holdId(holdId)
                        .message("Legal hold released: " + reason)
                        .attributes(Map.of("releasedBy", String.valueOf(releasedBy),
                                "released", result.getSucceeded(), "stillHeld", result.getSkipped()))
                        .build());
                });
        });
    }

    /**
     * Clears the items of a released or expired hold: removes the backend flag
     * and resumes schedules of items no other active hold covers.
     *
     * @param holdId the hold ID
     * @return Mono containing per-item results
     */
    public Mono<HoldOperationResult> releaseHeldData(String holdId) {
        return requireHold(holdId).flatMap(hold -> {
            if (hold.isActive()) {
                return Mono.error(new InvariantViolationException(
                        "Legal hold " + holdId + " is still active; release it before releasing its data"));
            }
            Instant now = clock.instant();
            return holdStore.findDataUnderHold(holdId)
                .concatMap(binding -> releaseItem(binding, now))
                .collectList()
                .map(outcomes -> summarize(holdId, outcomes));
        });
    }

    /**
     * Expires every active hold whose expiration date has passed and releases its data.
     *
     * @return Flux of expired holds
     */
    public Flux<LegalHold> expireHolds() {
        Instant now = clock.instant();
        return holdStore.findHoldsByStatus(LegalHoldStatus.ACTIVE)
            .filter(hold -> hold.getExpirationDate() != null && !hold.getExpirationDate().isAfter(now))
            .concatMap(hold -> {
                LegalHold expired = hold.toBuilder()
                    .status(LegalHoldStatus.EXPIRED)
                    .releasedAt(now)
                    .releaseReason("Expired")
                    .updatedAt(now)
                    .build();
                return holdStore.saveHold(expired)
                    .flatMap(this::deactivate)
                    .then(releaseHeldData(hold.getId()))
                    .doOnNext(result -> {
                        log.info("Legal hold {} expired; released {} item(s)", hold.getId(), result.getSucceeded().size());
                        eventBus.publish(eventBus.event(RetentionEventType.LEGAL_HOLD_EXPIRED)
                            .holdId(hold.getId())
                            .message("Legal hold expired")
                            .build());
                    })
                    .thenReturn(expired);
            });
    }

    /**
     * Whether at least one active hold references the item.
     */
    public boolean isHeld(String dataId) {
        Set<String> holds = activeHoldsByData.get(dataId);
        return holds != null && !holds.isEmpty();
    }

    /**
     * Whether an active hold on the item forbids deletion.
     */
    public boolean isDeletionBlocked(String dataId) {
        return anyActiveHold(dataId, hold -> hold.getCompliance().isPreventDeletion());
    }

    /**
     * Whether an active hold on the item forbids tier moves and other changes.
     */
    public boolean isModificationBlocked(String dataId) {
        return anyActiveHold(dataId, hold -> hold.getCompliance().isPreventModification());
    }

    /**
     * IDs of the active holds referencing the item.
     */
    public Set<String> activeHoldIds(String dataId) {
        Set<String> holds = activeHoldsByData.get(dataId);
        return holds == null ? Set.of() : Set.copyOf(holds);
    }

    /**
     * Counts a deletion the executor refused, against every active hold on the item.
     */
    public void recordPreventedDeletion(String dataId) {
        activeHoldIds(dataId).forEach(holdId ->
            preventedDeletions.computeIfAbsent(holdId, k -> new AtomicLong()).incrementAndGet());
    }

    public Mono<Custodian> addCustodian(String holdId, Custodian custodian) {
        return requireHold(holdId).flatMap(hold -> {
            if (!hold.isActive()) {
                return Mono.error(new InvariantViolationException("Cannot add custodians to " + hold.getStatus() + " hold " + holdId));
            }
            Custodian added = notified(custodian, clock.instant());
            List<Custodian> custodians = new ArrayList<>(hold.getCustodians());
            custodians.add(added);
            return saveUpdated(hold.toBuilder().custodians(custodians).build())
                .doOnNext(saved -> publishCustodianNotice(saved, added))
                .thenReturn(added);
        });
    }

    public Mono<LegalHold> removeCustodian(String holdId, String custodianId) {
        return requireHold(holdId).flatMap(hold -> {
            requireCustodian(hold, custodianId);
            if (hold.isActive() && hold.getCustodians().size() == 1) {
                return Mono.error(new InvariantViolationException("Legal hold " + holdId + " must keep at least one custodian"));
            }
            List<Custodian> custodians = hold.getCustodians().stream()
                .filter(custodian -> !custodian.getId().equals(custodianId))
                .collect(Collectors.toList());
            return saveUpdated(hold.toBuilder().custodians(custodians).build());
        });
    }

    public Mono<Custodian> acknowledgeNotice(String holdId, String custodianId, String acknowledgedBy) {
        Instant now = clock.instant();
        return updateCustodian(holdId, custodianId, custodian -> custodian.toBuilder()
            .acknowledged(true)
            .acknowledgedAt(now)
            .acknowledgedBy(acknowledgedBy)
            .build());
    }

    public Mono<Custodian> confirmPreservation(String holdId, String custodianId) {
        Instant now = clock.instant();
        return updateCustodian(holdId, custodianId, custodian -> custodian.toBuilder()
            .dataPreserved(true)
            .preservationConfirmedAt(now)
            .build());
    }

    /**
     * Builds the status report of a hold.
     *
     * @param holdId the hold ID
     * @return Mono containing the report
     */
    public Mono<HoldReport> generateHoldReport(String holdId) {
        return requireHold(holdId).flatMap(hold -> holdStore.findDataUnderHold(holdId).collectList()
            .map(bindings -> buildReport(hold, bindings)));
    }

    private HoldReport buildReport(LegalHold hold, List<DataUnderHold> bindings) {
        Instant now = clock.instant();
        List<Custodian> custodians = hold.getCustodians();
        int custodianCount = custodians.size();
        int acknowledged = (int) custodians.stream().filter(Custodian::isAcknowledged).count();
        int preserved = (int) custodians.stream().filter(Custodian::isDataPreserved).count();

        List<CustodianStatus> statuses = custodians.stream()
            .map(custodian -> CustodianStatus.builder()
                .custodian(custodian)
                .preservationStatus(custodian.isDataPreserved() ? PreservationStatus.COMPLETE
                        : custodian.isAcknowledged() ? PreservationStatus.PARTIAL : PreservationStatus.PENDING)
                .lastActivity(Optional.ofNullable(custodian.lastActivity()).orElse(hold.getCreatedAt()))
                .build())
            .collect(Collectors.toList());

        List<String> issues = new ArrayList<>();
        if (custodianCount == 0) {
            issues.add("No custodians are assigned to the hold");
        }
        if (acknowledged < custodianCount) {
            issues.add((custodianCount - acknowledged) + " custodians have not acknowledged the hold");
        }
        if (preserved < custodianCount) {
            issues.add((custodianCount - preserved) + " custodians have not confirmed data preservation");
        }
        if (hold.isActive() && hold.getExpirationDate() != null && hold.getExpirationDate().isBefore(now)) {
            issues.add("Legal hold has expired but is still active");
        }

        AtomicLong prevented = preventedDeletions.get(hold.getId());

        return HoldReport.builder()
            .hold(hold)
            .generatedAt(now)
            .totalDataItems(bindings.size())
            .totalSize(bindings.stream().mapToLong(DataUnderHold::getSizeBytes).sum())
            .custodianCount(custodianCount)
            .acknowledgedCustodians(acknowledged)
            .preservedCustodians(preserved)
            .pendingCustodians(custodianCount - preserved)
            .custodianStatus(statuses)
            .dataByType(countBy(bindings, DataUnderHold::getDataType))
            .dataByClassification(countBy(bindings, DataUnderHold::getClassification))
            .overriddenPolicies((int) bindings.stream().filter(binding -> binding.getOriginalRetentionPolicy() != null).count())
            .preventedDeletions(prevented == null ? 0 : prevented.get())
            .riskLevel(assessRisk(custodianCount, acknowledged, preserved))
            .issues(issues)
            .build();
    }

    static RiskLevel assessRisk(int custodianCount, int acknowledged, int preserved) {
        if (custodianCount == 0) {
            return RiskLevel.HIGH;
        }
        double acknowledgmentRate = (double) acknowledged / custodianCount;
        double preservationRate = (double) preserved / custodianCount;
        if (acknowledgmentRate < HIGH_RISK_THRESHOLD || preservationRate < HIGH_RISK_THRESHOLD) {
            return RiskLevel.HIGH;
        }
        if (acknowledgmentRate < MEDIUM_RISK_THRESHOLD || preservationRate < MEDIUM_RISK_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private Mono<ItemOutcome> applyToItem(LegalHold hold, String dataId, Instant now) {
        return holdStore.findHoldsForData(dataId)
            .any(binding -> binding.getHoldId().equals(hold.getId()))
            .flatMap(alreadyHeld -> {
                if (alreadyHeld) {
                    log.debug("Data {} already under hold {}", dataId, hold.getId());
                    return Mono.just(ItemOutcome.skipped(dataId));
                }
                return dataCatalog.findById(dataId)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(item -> bind(hold, dataId, item.orElse(null), now));
            });
    }

    private Mono<ItemOutcome> bind(LegalHold hold, String dataId, DataItem item, Instant now) {
        DataUnderHold binding = DataUnderHold.builder()
            .holdId(hold.getId())
            .dataId(dataId)
            .originalRetentionPolicy(item != null ? item.getRetentionPolicyId() : null)
            .holdAppliedAt(now)
            .dataType(item != null ? item.getDataType() : null)
            .classification(item != null ? item.getClassification() : null)
            .sizeBytes(item != null ? item.getSizeBytes() : 0)
            .build();

        return holdStore.addDataUnderHold(binding).flatMap(added -> {
            if (!added) {
                return Mono.just(ItemOutcome.skipped(dataId));
            }
            index(hold.getId(), dataId);
            return callBackend(storageBackend.setHeldFlag(dataId, true, hold.getId()))
                .flatMap(result -> {
                    if (result.isSuccess()) {
                        return entryStore.pauseByDataId(dataId, now)
                            .map(paused -> ItemOutcome.succeeded(dataId, paused));
                    }
                    log.warn("Could not flag {} as held by {}; rolling back: {}", dataId, hold.getId(), result.getError());
                    unindex(hold.getId(), dataId);
                    return holdStore.removeDataUnderHold(hold.getId(), dataId)
                        .then(resumeUnlessHeld(dataId))
                        .thenReturn(ItemOutcome.failed(dataId, "Failed to set legal hold flag: " + result.getError()));
                });
        });
    }

    // a tick may have paused entries while the item was indexed for the failed apply
    private Mono<Void> resumeUnlessHeld(String dataId) {
        if (isHeld(dataId)) {
            return Mono.empty();
        }
        return entryStore.resumeByDataId(dataId, clock.instant())
            .doOnNext(resumed -> {
                if (resumed > 0) {
                    log.info("Resumed {} entries of {} after rolling back a failed hold", resumed, dataId);
                }
            })
            .then();
    }

    private Mono<ItemOutcome> releaseItem(DataUnderHold binding, Instant now) {
        String dataId = binding.getDataId();
        String holdId = binding.getHoldId();

        if (isHeld(dataId)) {
            log.debug("Data {} stays held by {}", dataId, activeHoldIds(dataId));
            return holdStore.removeDataUnderHold(holdId, dataId)
                .thenReturn(ItemOutcome.skipped(dataId));
        }

        return callBackend(storageBackend.setHeldFlag(dataId, false, holdId))
            .flatMap(result -> {
                if (!result.isSuccess()) {
                    log.warn("Could not clear legal hold flag of {} for {}: {}", dataId, holdId, result.getError());
                    return Mono.just(ItemOutcome.failed(dataId, "Failed to clear legal hold flag: " + result.getError()));
                }
                return holdStore.removeDataUnderHold(holdId, dataId)
                    .then(restorePolicy(binding))
                    .then(entryStore.resumeByDataId(dataId, now))
                    .flatMap(resumed -> {
                        if (isHeld(dataId)) {
                            return entryStore.pauseByDataId(dataId, now).thenReturn(ItemOutcome.skipped(dataId));
                        }
                        return Mono.just(ItemOutcome.succeeded(dataId, resumed));
                    });
            });
    }

    private Mono<Void> restorePolicy(DataUnderHold binding) {
        String original = binding.getOriginalRetentionPolicy();
        if (original == null) {
            return Mono.empty();
        }
        return dataCatalog.findById(binding.getDataId())
            .filter(item -> !original.equals(item.getRetentionPolicyId()))
            .flatMap(item -> policyStore.findById(original)
                .flatMap(policy -> {
                    log.info("Reinstating policy {} for {} after hold release", original, item.getId());
                    DataItem restored = item.toBuilder().retentionPolicyId(original).build();
                    return dataCatalog.save(restored).flatMap(saved -> scheduleGenerator.regenerate(saved, policy, this::isHeld));
                }))
            .then();
    }

    private Mono<Void> deactivate(LegalHold hold) {
        activeHolds.remove(hold.getId());
        return holdStore.findDataUnderHold(hold.getId())
            .doOnNext(binding -> unindex(hold.getId(), binding.getDataId()))
            .then();
    }

    private Mono<Custodian> updateCustodian(String holdId, String custodianId, UnaryOperator<Custodian> change) {
        return requireHold(holdId).flatMap(hold -> {
            Custodian updated = change.apply(requireCustodian(hold, custodianId));
            List<Custodian> custodians = hold.getCustodians().stream()
                .map(custodian -> custodian.getId().equals(custodianId) ? updated : custodian)
                .collect(Collectors.toList());
            return saveUpdated(hold.toBuilder().custodians(custodians).build()).thenReturn(updated);
        });
    }

    private Mono<LegalHold> saveUpdated(LegalHold hold) {
        LegalHold updated = hold.toBuilder().updatedAt(clock.instant()).build();
        return holdStore.saveHold(updated).doOnNext(saved -> {
            if (saved.isActive()) {
                activeHolds.put(saved.getId(), saved);
            }
        });
    }

    private Mono<LegalHold> requireHold(String holdId) {
        return holdStore.findHold(holdId)
            .switchIfEmpty(Mono.error(new LegalHoldNotFoundException(holdId)));
    }

    private static Custodian requireCustodian(LegalHold hold, String custodianId) {
        return hold.findCustodian(custodianId)
            .orElseThrow(() -> new RetentionException("Custodian " + custodianId + " not found on hold " + hold.getId()));
    }

    private Custodian notified(Custodian custodian, Instant now) {
        return custodian.toBuilder()
            .id(custodian.getId() != null ? custodian.getId() : "cust-" + UUID.randomUUID())
            .notified(true)
            .notifiedAt(now)
            .build();
    }

    private void publishCustodianNotice(LegalHold hold, Custodian custodian) {
        eventBus.publish(eventBus.event(RetentionEventType.CUSTODIAN_NOTIFIED)
            .holdId(hold.getId())
            .message("Legal hold notice sent to " + custodian.getName())
            .attributes(Map.of("custodianId", custodian.getId(),
                    "email", String.valueOf(custodian.getEmail())))
            .build());
    }

    private boolean anyActiveHold(String dataId, Predicate<LegalHold> condition) {
        Set<String> holds = activeHoldsByData.get(dataId);
        if (holds == null) {
            return false;
        }
        return holds.stream()
            .map(activeHolds::get)
            .anyMatch(hold -> hold != null && condition.test(hold));
    }

    private void index(String holdId, String dataId) {
        activeHoldsByData.computeIfAbsent(dataId, k -> ConcurrentHashMap.newKeySet()).add(holdId);
    }

    private void unindex(String holdId, String dataId) {
        activeHoldsByData.computeIfPresent(dataId, (k, holds) -> {
            holds.remove(holdId);
            return holds.isEmpty() ? null : holds;
        });
    }

    private static Mono<StorageOperationResult> callBackend(Mono<StorageOperationResult> call) {
        return call
            .onErrorResume(error -> Mono.just(StorageOperationResult.failure(error.getMessage())))
            .defaultIfEmpty(StorageOperationResult.failure("Storage backend returned no result"));
    }

    private static Map<String, Integer> countBy(List<DataUnderHold> bindings,
                                                java.util.function.Function<DataUnderHold, String> key) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DataUnderHold binding : bindings) {
            counts.merge(Optional.ofNullable(key.apply(binding)).orElse("unknown"), 1, Integer::sum);
        }
        return counts;
    }

    private static HoldOperationResult summarize(String holdId, List<ItemOutcome> outcomes) {
        List<String> succeeded = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        int entries = 0;
        for (ItemOutcome outcome : outcomes) {
            switch (outcome.kind) {
                case SUCCEEDED:
                    succeeded.add(outcome.dataId);
                    entries += outcome.entries;
                    break;
                case SKIPPED:
                    skipped.add(outcome.dataId);
                    break;
                default:
                    failures.put(outcome.dataId, outcome.error);
            }
        }
        return HoldOperationResult.builder()
            .holdId(holdId)
            .succeeded(Collections.unmodifiableList(succeeded))
            .skipped(Collections.unmodifiableList(skipped))
            .failures(Collections.unmodifiableMap(failures))
            .affectedEntries(entries)
            .build();
    }

    private enum OutcomeKind {
        SUCCEEDED, SKIPPED, FAILED
    }

    private static final class ItemOutcome {
        private final String dataId;
        private final OutcomeKind kind;
        private final int entries;
        private final String error;

        private ItemOutcome(String dataId, OutcomeKind kind, int entries, String error) {
            this.dataId = dataId;
            this.kind = kind;
            this.entries = entries;
            this.error = error;
        }

        static ItemOutcome succeeded(String dataId, int entries) {
            return new ItemOutcome(dataId, OutcomeKind.SUCCEEDED, entries, null);
        }

        static ItemOutcome skipped(String dataId) {
            return new ItemOutcome(dataId, OutcomeKind.SKIPPED, 0, null);
        }

        static ItemOutcome failed(String dataId, String error) {
            return new ItemOutcome(dataId, OutcomeKind.FAILED, 0, error);
        }
    }
}
