package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.ValidationSystemException;
import org.safeshipper.engine.domain.model.CapacityResult;
import org.safeshipper.engine.domain.model.CompatibilityLevel;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.DriverQualificationResult;
import org.safeshipper.engine.domain.model.DriverSnapshot;
import org.safeshipper.engine.domain.model.EquipmentComplianceResult;
import org.safeshipper.engine.domain.model.RankedCandidate;
import org.safeshipper.engine.domain.model.ScoreInputs;
import org.safeshipper.engine.domain.model.ScoringPolicy;
import org.safeshipper.engine.domain.model.SegregationResult;
import org.safeshipper.engine.domain.model.ShipmentSnapshot;
import org.safeshipper.engine.domain.model.SubjectType;
import org.safeshipper.engine.domain.model.ValidationResult;
import org.safeshipper.engine.domain.model.ValidationState;
import org.safeshipper.engine.domain.model.ValidationType;
import org.safeshipper.engine.domain.model.VehicleSnapshot;
import org.safeshipper.engine.reference.ReferenceDataRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of ValidationOrchestrator.
 * Runs the validators in dependency order and folds their findings into one verdict.
 *
 * Level rule: any critical issue gives INCOMPATIBLE; warnings give CONDITIONAL in strict mode
 * and COMPATIBLE_WITH_WARNINGS otherwise; no findings give FULL.
 */
public final class ValidationOrchestratorImpl implements ValidationOrchestrator {

    private static final Logger LOG = Logger.getLogger(ValidationOrchestratorImpl.class.getName());

    private final ScoringPolicy policy;
    private final CompatibilityScorer scorer;
    private final Clock clock;
    private final ExecutorService executor;

    private final DangerousGoodsAggregator aggregator;
    private final SegregationCompatibilityChecker segregationChecker;
    private final VehicleEquipmentComplianceChecker equipmentChecker;
    private final TransportRestrictionChecker restrictionChecker;
    private final CapacityValidator capacityValidator;
    private final DriverQualificationValidator driverValidator;

    public ValidationOrchestratorImpl(ReferenceDataRegistry registry, Clock clock, ExecutorService executor) {
        this(registry, new CompatibilityScorerImpl(), clock, executor,
                registry.getScoringPolicy().getExpiryWarningDays());
    }

    public ValidationOrchestratorImpl(ReferenceDataRegistry registry, CompatibilityScorer scorer, Clock clock,
                                      ExecutorService executor, int expiryWarningDays) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.policy = registry.getScoringPolicy();
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");

        this.aggregator = new DangerousGoodsAggregator(registry.getHazardClasses());
        this.segregationChecker = new SegregationCompatibilityChecker(registry.getSegregationRules());
        this.equipmentChecker = new VehicleEquipmentComplianceChecker(registry.getEquipmentRequirements(),
                registry.getFireExtinguisherRequirements(), expiryWarningDays);
        this.restrictionChecker = new TransportRestrictionChecker();
        this.capacityValidator = new CapacityValidator(policy);
        this.driverValidator = new DriverQualificationValidator(expiryWarningDays);
    }

    @Override
    public ValidationResult validateVehicle(ShipmentSnapshot shipment, VehicleSnapshot vehicle, boolean strictMode) {
        require(vehicle, "vehicle");
        return evaluate(shipment, vehicle, null, SubjectType.VEHICLE, vehicle.getId(), strictMode,
                clock.instant());
    }

    @Override
    public ValidationResult validateDriver(ShipmentSnapshot shipment, DriverSnapshot driver, boolean strictMode) {
        require(driver, "driver");
        return evaluate(shipment, null, driver, SubjectType.DRIVER, driver.getId(), strictMode, clock.instant());
    }

    @Override
    public ValidationResult validateAssignment(ShipmentSnapshot shipment, VehicleSnapshot vehicle,
                                               DriverSnapshot driver, boolean strictMode) {
        require(vehicle, "vehicle");
        require(driver, "driver");
        return evaluate(shipment, vehicle, driver, SubjectType.ASSIGNMENT,
                vehicle.getId() + "/" + driver.getId(), strictMode, clock.instant());
    }

    @Override
    public List<RankedCandidate> rankVehicles(ShipmentSnapshot shipment, List<VehicleSnapshot> vehicles,
                                              boolean includeWarnings) {
        require(vehicles, "vehicles");
        Instant now = clock.instant();
        return rank(shipment, vehicles, includeWarnings, vehicle -> {
            require(vehicle, "vehicle");
            ValidationResult result = evaluate(shipment, vehicle, null, SubjectType.VEHICLE, vehicle.getId(),
                    !includeWarnings, now);
            return new RankedCandidate(vehicle.getId(), vehicle.getLabel(), result);
        });
    }

    @Override
    public List<RankedCandidate> rankDrivers(ShipmentSnapshot shipment, List<DriverSnapshot> drivers,
                                             boolean includeWarnings) {
        require(drivers, "drivers");
        Instant now = clock.instant();
        return rank(shipment, drivers, includeWarnings, driver -> {
            require(driver, "driver");
            ValidationResult result = evaluate(shipment, null, driver, SubjectType.DRIVER, driver.getId(),
                    !includeWarnings, now);
            return new RankedCandidate(driver.getId(), driver.getLabel(), result);
        });
    }

    /**
     * Validates every candidate on the executor, then keeps the compatible ones sorted best first.
     */
    private <T> List<RankedCandidate> rank(ShipmentSnapshot shipment, List<T> candidates, boolean includeWarnings,
                                           Function<T, RankedCandidate> validation) {
        require(shipment, "shipment");
        List<CompletableFuture<RankedCandidate>> futures = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> validation.apply(candidate), executor));
        }

        List<RankedCandidate> ranked = new ArrayList<>();
        for (CompletableFuture<RankedCandidate> future : futures) {
            RankedCandidate candidate = join(future, shipment);
            if (candidate.getResult().isCompatible()) {
                ranked.add(candidate);
            }
        }
        Collections.sort(ranked);

        LOG.info(() -> String.format("Ranked %d/%d candidates for shipment %s (includeWarnings=%b)",
                ranked.size(), candidates.size(), shipment.getId(), includeWarnings));
        return Collections.unmodifiableList(ranked);
    }

    private RankedCandidate join(CompletableFuture<RankedCandidate> future, ShipmentSnapshot shipment) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ValidationSystemException) {
                throw (ValidationSystemException) cause;
            }
            throw new ValidationSystemException("Ranking failed for shipment " + shipment.getId(), cause);
        }
    }

    private ValidationResult evaluate(ShipmentSnapshot shipment, VehicleSnapshot vehicle, DriverSnapshot driver,
                                      SubjectType subjectType, String subjectId, boolean strictMode, Instant now) {
        require(shipment, "shipment");
        ValidationState state = ValidationState.EVALUATING;
        LOG.fine(() -> String.format("%s %s/%s: %s", ValidationState.NOT_EVALUATED, shipment.getId(), subjectId,
                ValidationState.EVALUATING));
        try {
            LocalDate today = now.atZone(clock.getZone()).toLocalDate();
            Findings findings = new Findings();

            DgProfile profile = aggregator.aggregate(shipment.getItems());
            findings.addProfile(profile);
            if (profile.containsDangerousGoods()) {
                findings.addSegregation(segregationChecker.check(profile));
            }

            if (vehicle != null) {
                if (profile.containsDangerousGoods()) {
                    findings.addEquipment(equipmentChecker.check(profile.getAdrClasses(), vehicle, today));
                    TransportRestrictionChecker.Result restrictions =
                            restrictionChecker.check(profile.getAdrClasses(), vehicle);
                    findings.critical.addAll(restrictions.getCriticalIssues());
                    findings.warnings.addAll(restrictions.getWarnings());
                    if (!restrictions.getCriticalIssues().isEmpty()) {
                        findings.recommendations.add("Assign a vehicle type authorised for the hazard classes carried");
                    }
                } else {
                    findings.addEquipment(equipmentChecker.checkGeneralFreight(vehicle, today));
                }
                findings.addCapacity(capacityValidator.validate(vehicle, profile));
            }
            if (driver != null) {
                findings.addDriver(driverValidator.validate(driver, profile, today));
            }

            if (findings.manualReview) {
                findings.recommendations.add("Refer the shipment to a dangerous goods adviser for manual review");
            }

            CompatibilityLevel level = CompatibilityLevel.from(!findings.critical.isEmpty(),
                    !findings.warnings.isEmpty(), strictMode);
            double score = scorer.score(findings.toScoreInputs(), policy);

            ValidationResult result = ValidationResult.builder()
                    .shipmentId(shipment.getId())
                    .subject(subjectType, subjectId)
                    .validationType(profile.containsDangerousGoods()
                            ? ValidationType.DANGEROUS_GOODS
                            : ValidationType.NON_DANGEROUS_GOODS)
                    .compatibilityLevel(level)
                    .addCriticalIssues(findings.critical)
                    .addWarnings(findings.warnings)
                    .addMissingEquipment(findings.missingEquipment)
                    .addExpiredEquipment(findings.expiredEquipment)
                    .addEquipmentFindings(findings.equipment != null
                            ? findings.equipment.getFindings()
                            : Collections.emptyList())
                    .equipmentCompliancePercentage(findings.equipment != null
                            ? findings.equipment.getCompliancePercentage()
                            : null)
                    .addSegregationRequirements(findings.segregation != null
                            ? findings.segregation.getRequirements()
                            : Collections.emptyList())
                    .capacity(findings.capacity)
                    .driverQualification(findings.driver)
                    .score(score)
                    .addRecommendations(findings.recommendations)
                    .manualReviewRequired(findings.manualReview)
                    .evaluatedAt(now)
                    .build();

            state = result.getState();
            final ValidationState terminal = state;
            LOG.fine(() -> String.format("%s %s/%s: %s (score=%.1f)", ValidationState.EVALUATING, shipment.getId(),
                    subjectId, terminal, score));
            return result;
        } catch (ValidationSystemException e) {
            throw e;
        } catch (RuntimeException e) {
            final ValidationState failedIn = state;
            LOG.log(Level.SEVERE, e, () -> String.format("Validation of %s %s for shipment %s failed in state %s",
                    subjectType, subjectId, shipment.getId(), failedIn));
            throw new ValidationSystemException("Validation of " + subjectType + " " + subjectId
                    + " for shipment " + shipment.getId() + " could not complete", e);
        }
    }

    private static void require(Object value, String name) {
        if (value == null) {
            throw new ValidationSystemException(name + " snapshot must not be null");
        }
    }

    /**
     * Mutable accumulator for one evaluation. Never shared between calls.
     */
    private static final class Findings {
        private final Set<String> critical = new LinkedHashSet<>();
        private final Set<String> warnings = new LinkedHashSet<>();
        private final List<String> missingEquipment = new ArrayList<>();
        private final List<String> expiredEquipment = new ArrayList<>();
        private final Set<String> recommendations = new LinkedHashSet<>();
        private EquipmentComplianceResult equipment;
        private SegregationResult segregation;
        private CapacityResult capacity;
        private DriverQualificationResult driver;
        private boolean manualReview;

        void addProfile(DgProfile profile) {
            critical.addAll(profile.getIntegrityIssues());
            if (!profile.getIntegrityIssues().isEmpty()) {
                recommendations.add("Complete the UN number and hazard class of every dangerous goods item");
            }
            if (!profile.getReferenceGaps().isEmpty()) {
                warnings.addAll(profile.getReferenceGaps());
                manualReview = true;
            }
        }

        void addSegregation(SegregationResult result) {
            segregation = result;
            critical.addAll(result.getConflicts());
            warnings.addAll(result.getWarnings());
            manualReview |= result.isManualReviewRequired();
            if (!result.isCompatible()) {
                recommendations.add("Split prohibited hazard class combinations into separate shipments");
            }
            if (!result.getRequirements().isEmpty()) {
                recommendations.add("Load segregated goods at the required separation distance");
            }
        }

        void addEquipment(EquipmentComplianceResult result) {
            equipment = result;
            critical.addAll(result.getCriticalIssues());
            warnings.addAll(result.getWarnings());
            missingEquipment.addAll(result.getMissingEquipment());
            expiredEquipment.addAll(result.getExpiredEquipment());
            for (String name : result.getMissingEquipment()) {
                recommendations.add("Install " + name);
            }
            for (String name : result.getExpiredEquipment()) {
                recommendations.add("Replace expired " + name);
            }
            for (String name : result.getInspectionOverdueEquipment()) {
                recommendations.add("Schedule inspection of " + name);
            }
        }

        void addCapacity(CapacityResult result) {
            capacity = result;
            critical.addAll(result.getCriticalIssues());
            warnings.addAll(result.getWarnings());
            if (result.isOverloaded()) {
                recommendations.add(String.format("Use a vehicle with at least %.2f kg capacity or split the shipment",
                        result.getLoadKg()));
            } else if (!result.isCapacityKnown()) {
                recommendations.add("Record the vehicle's load capacity");
            }
        }

        void addDriver(DriverQualificationResult result) {
            driver = result;
            critical.addAll(result.getCriticalIssues());
            warnings.addAll(result.getWarnings());
            for (Map.Entry<String, Boolean> entry : result.getQualifiedClasses().entrySet()) {
                if (!entry.getValue()) {
                    recommendations.add("Driver needs Class " + entry.getKey() + " dangerous goods certification");
                }
            }
            if (!result.getWarnings().isEmpty()) {
                recommendations.add("Renew expiring driver documents before dispatch");
            }
        }

        ScoreInputs toScoreInputs() {
            return new ScoreInputs(critical.size(), warnings.size(), missingEquipment.size(),
                    expiredEquipment.size(), equipment != null ? equipment.getExtinguisherMarginPercent() : null);
        }
    }
}
