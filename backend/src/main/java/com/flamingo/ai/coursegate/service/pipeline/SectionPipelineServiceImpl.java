package com.flamingo.ai.coursegate.service.pipeline;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.ErrorKind;
import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.enums.StepStatus;
import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import com.flamingo.ai.coursegate.domain.model.Violation;
import com.flamingo.ai.coursegate.domain.state.ErrorEntry;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.domain.state.SectionState;
import com.flamingo.ai.coursegate.domain.state.SectionUpdate;
import com.flamingo.ai.coursegate.domain.state.StateUpdate;
import com.flamingo.ai.coursegate.exception.ClassificationException;
import com.flamingo.ai.coursegate.exception.RunInProgressException;
import com.flamingo.ai.coursegate.exception.StateCorruptedException;
import com.flamingo.ai.coursegate.exception.StateStoreException;
import com.flamingo.ai.coursegate.exception.StateTransitionException;
import com.flamingo.ai.coursegate.service.classification.ClassificationResult;
import com.flamingo.ai.coursegate.service.classification.ClassifierService;
import com.flamingo.ai.coursegate.service.gate.GateResult;
import com.flamingo.ai.coursegate.service.gate.QualityGateService;
import com.flamingo.ai.coursegate.service.gate.RevisionDecision;
import com.flamingo.ai.coursegate.service.gate.RevisionPolicy;
import com.flamingo.ai.coursegate.service.quota.QuotaResult;
import com.flamingo.ai.coursegate.service.quota.QuotaService;
import com.flamingo.ai.coursegate.service.report.ErrorReporterService;
import com.flamingo.ai.coursegate.service.report.Report;
import com.flamingo.ai.coursegate.service.state.StateStore;
import com.flamingo.ai.coursegate.service.validation.ConstraintValidationService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Implementation of the SectionPipelineService. */
@Service
@Slf4j
public class SectionPipelineServiceImpl implements SectionPipelineService {

  static final String CLASSIFICATION = "classification";
  static final String VALIDATION = "validation";
  static final String QUOTA = "quota";
  static final String GATE = "gate";
  static final String REPORT = "report";

  private final ClassifierService classifierService;
  private final ConstraintValidationService validationService;
  private final QuotaService quotaService;
  private final QualityGateService qualityGateService;
  private final ErrorReporterService errorReporterService;
  private final RevisionPolicy revisionPolicy;
  private final StateStore stateStore;
  private final PipelineConfig pipelineConfig;
  private final Executor sectionExecutor;
  private final MeterRegistry meterRegistry;

  private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

  public SectionPipelineServiceImpl(
      ClassifierService classifierService,
      ConstraintValidationService validationService,
      QuotaService quotaService,
      QualityGateService qualityGateService,
      ErrorReporterService errorReporterService,
      RevisionPolicy revisionPolicy,
      StateStore stateStore,
      PipelineConfig pipelineConfig,
      @Qualifier("sectionExecutor") Executor sectionExecutor,
      MeterRegistry meterRegistry) {
    this.classifierService = classifierService;
    this.validationService = validationService;
    this.quotaService = quotaService;
    this.qualityGateService = qualityGateService;
    this.errorReporterService = errorReporterService;
    this.revisionPolicy = revisionPolicy;
    this.stateStore = stateStore;
    this.pipelineConfig = pipelineConfig;
    this.sectionExecutor = sectionExecutor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public RunSummary run(String runId, List<SectionWorkload> workloads) {
    AtomicBoolean stopFlag = new AtomicBoolean(false);
    if (activeRuns.putIfAbsent(runId, stopFlag) != null) {
      throw new RunInProgressException(runId);
    }
    try {
      PipelineState state = stateStore.read(runId);
      if (state.getStatus() == PipelineStatus.COMPLETED) {
        log.info("Run {} is already completed; nothing to do", runId);
        return new RunSummary(runId, PipelineStatus.COMPLETED, false, List.of());
      }
      if (state.getStatus() != PipelineStatus.IN_PROGRESS) {
        // PENDING starts, RECOVERED resumes; FAILED is rejected by the store
        stateStore.write(runId, StateUpdate.builder().status(PipelineStatus.IN_PROGRESS).build());
      }
      log.info("Running {} section(s) of run {}", workloads.size(), runId);

      Map<String, SectionState> known = state.getSections();
      List<CompletableFuture<SectionOutcome>> futures = new ArrayList<>();
      for (SectionWorkload workload : workloads) {
        SectionState existing = known.get(workload.section());
        futures.add(
            CompletableFuture.supplyAsync(
                () -> runSection(runId, workload, existing, stopFlag), sectionExecutor));
      }

      List<SectionOutcome> outcomes = new ArrayList<>();
      for (CompletableFuture<SectionOutcome> future : futures) {
        outcomes.add(join(future));
      }

      PipelineStatus finalStatus = finish(runId, stopFlag.get());
      log.info("Run {} finished with status {}", runId, finalStatus);
      return new RunSummary(runId, finalStatus, stopFlag.get(), outcomes);
    } finally {
      activeRuns.remove(runId);
    }
  }

  @Override
  public boolean requestStop(String runId) {
    AtomicBoolean flag = activeRuns.get(runId);
    if (flag == null) {
      return false;
    }
    flag.set(true);
    log.info("Stop requested for run {}", runId);
    return true;
  }

  @Override
  public boolean isRunning(String runId) {
    return activeRuns.containsKey(runId);
  }

  private SectionOutcome runSection(
      String runId, SectionWorkload workload, SectionState existing, AtomicBoolean stopFlag) {
    String section = workload.section();
    if (existing != null && existing.getStatus() == PipelineStatus.COMPLETED) {
      log.debug("Section {} of run {} already completed; skipping", section, runId);
      return skipped(section, PipelineStatus.COMPLETED);
    }
    if (existing != null && existing.getStatus() == PipelineStatus.FAILED) {
      log.warn(
          "Section {} of run {} failed earlier; recover from a checkpoint to rerun",
          section,
          runId);
      return skipped(section, PipelineStatus.FAILED);
    }
    if (stopFlag.get()) {
      log.info("Run {} stopping; section {} not started", runId, section);
      return skipped(section, existing == null ? PipelineStatus.PENDING : existing.getStatus());
    }

    // In-flight results of an interrupted attempt were never trusted; start the steps over
    stateStore.write(
        runId,
        StateUpdate.builder()
            .currentSection(section)
            .currentStep(CLASSIFICATION)
            .section(
                section,
                SectionUpdate.builder()
                    .status(PipelineStatus.IN_PROGRESS)
                    .resetProgress(true)
                    .step(CLASSIFICATION, StepStatus.IN_PROGRESS)
                    .build())
            .build());

    String step = CLASSIFICATION;
    SectionOutcome.SectionOutcomeBuilder outcome = SectionOutcome.builder().section(section);
    try {
      List<Violation> findings = new ArrayList<>();

      ClassificationResult classification = null;
      if (!workload.items().isEmpty()) {
        classification = classifierService.classifyBatch(workload.items());
        classification
            .shortfalls()
            .forEach(
                s ->
                    findings.add(
                        Violation.builder()
                            .location(section + "/category:" + s.categoryId())
                            .rule(RuleType.CATEGORY_POPULATION)
                            .severity(Severity.WARNING)
                            .message(
                                "category "
                                    + s.categoryId()
                                    + " has "
                                    + s.assigned()
                                    + " item(s) (min "
                                    + s.minimum()
                                    + ")")
                            .measured(s.assigned())
                            .limit(s.minimum())
                            .build()));
      }
      outcome.classification(classification);
      step = advance(runId, section, CLASSIFICATION, VALIDATION);

      findings.addAll(validationService.validateAll(workload.units()).violations());
      step = advance(runId, section, VALIDATION, QUOTA);

      QuotaResult quota =
          quotaService.checkQuota(workload.units().size(), specialSubTypes(workload));
      findings.addAll(quota.violations());
      outcome.quota(quota);
      step = advance(runId, section, QUOTA, GATE);

      GateResult gate = qualityGateService.evaluate(findings);
      outcome.gate(gate);
      List<Double> previousScores =
          existing == null || existing.getGateScores() == null
              ? List.of()
              : List.copyOf(existing.getGateScores());
      step = advance(runId, section, GATE, REPORT, gate.weightedTotal());

      List<Violation> errors = findings.stream().filter(Violation::isError).toList();
      List<Violation> warnings = findings.stream().filter(v -> !v.isError()).toList();
      Report report = errorReporterService.report(errors, warnings);
      RevisionDecision decision = revisionPolicy.decide(gate, previousScores, report);
      outcome.report(report).decision(decision);

      PipelineStatus status = complete(runId, section, gate, decision);
      meterRegistry.counter("pipeline.sections", "status", status.name()).increment();
      return outcome.status(status).build();
    } catch (RuntimeException e) {
      log.error(
          "Section {} of run {} failed at step {}: {}", section, runId, step, e.getMessage(), e);
      meterRegistry
          .counter("pipeline.sections", "status", PipelineStatus.FAILED.name())
          .increment();
      markFailed(runId, section, step, e);
      return outcome.status(PipelineStatus.FAILED).error(e.getMessage()).build();
    }
  }

  private String advance(String runId, String section, String done, String next) {
    return advance(runId, section, done, next, null);
  }

  private String advance(String runId, String section, String done, String next, Double gateScore) {
    SectionUpdate.SectionUpdateBuilder update =
        SectionUpdate.builder()
            .lastStep(done)
            .step(done, StepStatus.COMPLETED)
            .step(next, StepStatus.IN_PROGRESS);
    if (gateScore != null) {
      update.gateScore(gateScore);
    }
    stateStore.write(
        runId, StateUpdate.builder().currentStep(next).section(section, update.build()).build());
    return next;
  }

  /** Records the revision decision; returns the resulting section status. */
  private PipelineStatus complete(
      String runId, String section, GateResult gate, RevisionDecision decision) {
    SectionUpdate.SectionUpdateBuilder update = SectionUpdate.builder();
    StateUpdate.StateUpdateBuilder state = StateUpdate.builder();
    PipelineStatus status;

    switch (decision.action()) {
      case ACCEPT -> {
        update.status(PipelineStatus.COMPLETED).lastStep(REPORT).step(REPORT, StepStatus.COMPLETED);
        status = PipelineStatus.COMPLETED;
      }
      case RETRY -> {
        // Back to generation: the section stays in progress with its steps reset
        update.resetProgress(true);
        status = PipelineStatus.IN_PROGRESS;
        log.info(
            "Section {} of run {} scored {} and goes back for revision ({} action item(s))",
            section,
            runId,
            gate.weightedTotal(),
            decision.actionItems().size());
      }
      default -> {
        update
            .status(PipelineStatus.FAILED)
            .lastStep(REPORT)
            .step(GATE, StepStatus.FAILED)
            .step(REPORT, StepStatus.COMPLETED);
        state.error(
            ErrorEntry.of(
                ErrorKind.GATE_AUTO_FAIL,
                section,
                GATE,
                "Escalated after attempt "
                    + decision.attempt()
                    + " ("
                    + decision.reason()
                    + "), score "
                    + gate.weightedTotal()
                    + (gate.isAutoFailed() ? ", " + gate.autoFailReasons() : "")));
        status = PipelineStatus.FAILED;
      }
    }
    stateStore.write(runId, state.section(section, update.build()).build());
    return status;
  }

  private void markFailed(String runId, String section, String step, RuntimeException cause) {
    try {
      stateStore.write(
          runId,
          StateUpdate.builder()
              .section(
                  section,
                  SectionUpdate.builder()
                      .status(PipelineStatus.FAILED)
                      .step(step, StepStatus.FAILED)
                      .build())
              .error(ErrorEntry.of(kindOf(cause), section, step, cause.getMessage()))
              .build());
    } catch (RuntimeException e) {
      log.error(
          "Could not record failure of section {} in run {}: {}",
          section,
          runId,
          e.getMessage(),
          e);
    }
  }

  private PipelineStatus finish(String runId, boolean stopped) {
    PipelineState state = stateStore.read(runId);
    if (stopped) {
      return state.getStatus();
    }
    boolean allCompleted =
        !state.getSections().isEmpty()
            && state.getSections().values().stream().allMatch(SectionState::isCompleted);
    boolean anyOpen =
        state.getSections().values().stream()
            .anyMatch(
                s ->
                    s.getStatus() == PipelineStatus.IN_PROGRESS
                        || s.getStatus() == PipelineStatus.PENDING);
    boolean anyFailed =
        state.getSections().values().stream().anyMatch(s -> s.getStatus() == PipelineStatus.FAILED);

    PipelineStatus target = null;
    if (allCompleted) {
      target = PipelineStatus.COMPLETED;
    } else if (anyFailed && !anyOpen) {
      target = PipelineStatus.FAILED;
    }
    if (target == null) {
      return state.getStatus();
    }
    return stateStore.write(runId, StateUpdate.builder().status(target).build()).getStatus();
  }

  private List<String> specialSubTypes(SectionWorkload workload) {
    PipelineConfig.Quota quota = pipelineConfig.getQuota();
    return workload.units().stream()
        .filter(unit -> unit.type() == quota.getSpecialUnitType())
        .map(unit -> subType(unit, quota.getSubTypeField()))
        .toList();
  }

  private static String subType(ContentUnit unit, String field) {
    String value = unit.field(field);
    return value == null || value.isBlank() ? "unspecified" : value.strip();
  }

  private static SectionOutcome skipped(String section, PipelineStatus status) {
    return SectionOutcome.builder().section(section).status(status).skipped(true).build();
  }

  private static SectionOutcome join(CompletableFuture<SectionOutcome> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }

  static ErrorKind kindOf(Throwable error) {
    if (error instanceof ClassificationException) {
      return ErrorKind.CLASSIFICATION;
    }
    if (error instanceof StateCorruptedException) {
      return ErrorKind.STATE_CORRUPTION;
    }
    if (error instanceof StateTransitionException) {
      return ErrorKind.STATE_INCONSISTENCY;
    }
    if (error instanceof StateStoreException) {
      return ErrorKind.IO;
    }
    return ErrorKind.CONSTRAINT;
  }
}
