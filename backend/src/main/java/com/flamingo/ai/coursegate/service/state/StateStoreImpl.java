package com.flamingo.ai.coursegate.service.state;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.ErrorKind;
import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.StepStatus;
import com.flamingo.ai.coursegate.domain.repository.StateRepository;
import com.flamingo.ai.coursegate.domain.state.Checkpoint;
import com.flamingo.ai.coursegate.domain.state.CheckpointRef;
import com.flamingo.ai.coursegate.domain.state.ErrorEntry;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.domain.state.SectionState;
import com.flamingo.ai.coursegate.domain.state.SectionUpdate;
import com.flamingo.ai.coursegate.domain.state.StateUpdate;
import com.flamingo.ai.coursegate.exception.CheckpointNotFoundException;
import com.flamingo.ai.coursegate.exception.DuplicateCheckpointException;
import com.flamingo.ai.coursegate.exception.RecoveryException;
import com.flamingo.ai.coursegate.exception.StateCorruptedException;
import com.flamingo.ai.coursegate.exception.StateStoreException;
import com.flamingo.ai.coursegate.exception.StateTransitionException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the StateStore over a {@link StateRepository}, one lock per run. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateStoreImpl implements StateStore {

  static final String RETRY_NAME = "state-store";

  private final StateRepository stateRepository;
  private final StateValidator stateValidator;
  private final PipelineConfig pipelineConfig;
  private final RetryRegistry retryRegistry;
  private final MeterRegistry meterRegistry;

  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Override
  public PipelineState read(String runId) {
    return withLock(runId, () -> loadOrEmpty(runId).copy());
  }

  @Override
  @Timed(value = "state.write", description = "Time to merge and persist a state update")
  public PipelineState write(String runId, StateUpdate update) {
    return withLock(
        runId,
        () -> {
          PipelineState state = loadOrEmpty(runId);
          apply(runId, state, update);
          persist(state);
          meterRegistry.counter("state.writes").increment();
          return state.copy();
        });
  }

  @Override
  public StateValidationResult validate(String runId) {
    return withLock(
        runId,
        () -> {
          Optional<PipelineState> state;
          try {
            state = io(runId, () -> stateRepository.load(runId));
          } catch (StateCorruptedException e) {
            log.warn("State of run {} is corrupted: {}", runId, e.getMessage());
            return StateValidationResult.corrupted(runId, e.getMessage());
          }
          return state
              .map(s -> StateValidationResult.of(runId, stateValidator.check(s)))
              .orElseGet(() -> StateValidationResult.of(runId, List.of()));
        });
  }

  @Override
  public StateValidationResult repair(String runId) {
    return withLock(
        runId,
        () -> {
          Optional<PipelineState> loaded;
          try {
            loaded = io(runId, () -> stateRepository.load(runId));
          } catch (StateCorruptedException e) {
            log.warn(
                "State of run {} is corrupted and cannot be repaired: {}", runId, e.getMessage());
            return StateValidationResult.corrupted(runId, e.getMessage());
          }
          if (loaded.isEmpty()) {
            return StateValidationResult.of(runId, List.of());
          }

          PipelineState state = loaded.get();
          List<String> repaired = new ArrayList<>();
          for (Map.Entry<String, SectionState> entry : state.getSections().entrySet()) {
            SectionState section = entry.getValue();
            PipelineStatus derivedStatus = stateValidator.deriveStatus(section);
            boolean startedWithoutSteps =
                section.getStatus() == PipelineStatus.IN_PROGRESS
                    && derivedStatus == PipelineStatus.PENDING;
            if (section.getStatus() != derivedStatus && !startedWithoutSteps) {
              repaired.add(
                  entry.getKey() + " status " + section.getStatus() + " -> " + derivedStatus);
              section.setStatus(derivedStatus);
            }
            String derivedLastStep = stateValidator.deriveLastStep(section);
            if (!Objects.equals(section.getLastStep(), derivedLastStep)) {
              repaired.add(
                  entry.getKey()
                      + " last step "
                      + section.getLastStep()
                      + " -> "
                      + derivedLastStep);
              section.setLastStep(derivedLastStep);
            }
          }

          if (!repaired.isEmpty()) {
            state
                .getErrors()
                .add(
                    ErrorEntry.of(
                        ErrorKind.STATE_INCONSISTENCY, null, null, "Repaired: " + repaired));
            persist(state);
            meterRegistry.counter("state.repairs").increment();
            log.info("Repaired state of run {}: {}", runId, repaired);
          }
          return StateValidationResult.of(runId, stateValidator.check(state));
        });
  }

  @Override
  public CheckpointRef checkpoint(String runId, String name) {
    return withLock(
        runId,
        () -> {
          PipelineState state = loadOrEmpty(runId);
          boolean taken =
              state.getCheckpoints().stream().anyMatch(ref -> ref.name().equals(name))
                  || io(runId, () -> stateRepository.checkpointExists(runId, name));
          if (taken) {
            throw new DuplicateCheckpointException(runId, name);
          }

          Checkpoint checkpoint = new Checkpoint(name, Instant.now(), state.copy());
          io(
              runId,
              () -> {
                stateRepository.saveCheckpoint(runId, checkpoint);
                return null;
              });
          state.getCheckpoints().add(checkpoint.toRef());
          persist(state);

          meterRegistry.counter("state.checkpoints").increment();
          log.info(
              "Created checkpoint {} of run {} at version {}", name, runId, state.getVersion());
          return checkpoint.toRef();
        });
  }

  @Override
  @Timed(value = "state.recover", description = "Time to recover a run from a checkpoint")
  public PipelineState recover(String runId, String name) {
    return withLock(
        runId,
        () -> {
          Checkpoint checkpoint =
              io(runId, () -> stateRepository.loadCheckpoint(runId, name))
                  .orElseThrow(() -> new CheckpointNotFoundException(runId, name));
          PipelineState snapshot = checkpoint.snapshot();

          List<String> issues = stateValidator.check(snapshot);
          if (!issues.isEmpty()) {
            throw new RecoveryException(runId, name, issues);
          }

          // Keep the live registry; a corrupted live record is rebuilt from the stored checkpoints
          List<CheckpointRef> registry;
          long liveVersion;
          Instant liveModified;
          try {
            Optional<PipelineState> live = io(runId, () -> stateRepository.load(runId));
            registry = live.map(PipelineState::getCheckpoints).orElseGet(ArrayList::new);
            liveVersion = live.map(PipelineState::getVersion).orElse(0L);
            liveModified = live.map(PipelineState::getLastModified).orElse(null);
          } catch (StateCorruptedException e) {
            log.warn("Live state of run {} is corrupted; rebuilding checkpoint registry", runId);
            registry = storedCheckpoints(runId);
            liveVersion = 0L;
            liveModified = null;
          }

          snapshot.setStatus(PipelineStatus.RECOVERED);
          snapshot.setRecoveredFrom(name);
          snapshot.setCheckpoints(new ArrayList<>(registry));
          snapshot.setVersion(Math.max(liveVersion, snapshot.getVersion()));
          if (liveModified != null && liveModified.isAfter(snapshot.getLastModified())) {
            snapshot.setLastModified(liveModified);
          }
          persist(snapshot);

          meterRegistry.counter("state.recoveries").increment();
          log.info("Recovered run {} from checkpoint {}", runId, name);
          return snapshot.copy();
        });
  }

  @Override
  public List<CheckpointRef> listCheckpoints(String runId) {
    return List.copyOf(read(runId).getCheckpoints());
  }

  @Override
  public PipelineProgress progress(String runId) {
    PipelineState state = read(runId);
    List<String> steps = pipelineConfig.getState().getSteps();
    int completedSections = 0;
    int failedSections = 0;
    int completedSteps = 0;
    int inProgressSteps = 0;
    int failedSteps = 0;
    for (SectionState section : state.getSections().values()) {
      if (section.getStatus() == PipelineStatus.COMPLETED) {
        completedSections++;
      } else if (section.getStatus() == PipelineStatus.FAILED) {
        failedSections++;
      }
      for (String step : steps) {
        StepStatus status = section.stepStatus(step);
        if (status == StepStatus.COMPLETED) {
          completedSteps++;
        } else if (status == StepStatus.IN_PROGRESS) {
          inProgressSteps++;
        } else if (status == StepStatus.FAILED) {
          failedSteps++;
        }
      }
    }
    int totalSteps = state.getSections().size() * steps.size();
    double percent =
        totalSteps == 0 ? 0.0 : Math.round(completedSteps * 1000.0 / totalSteps) / 10.0;
    return new PipelineProgress(
        runId,
        state.getStatus(),
        state.getCurrentSection(),
        state.getCurrentStep(),
        state.getSections().size(),
        completedSections,
        failedSections,
        totalSteps,
        completedSteps,
        inProgressSteps,
        failedSteps,
        percent);
  }

  private void apply(String runId, PipelineState state, StateUpdate update) {
    if (update.getStatus() != null) {
      requireTransition(runId, "run", state.getStatus(), update.getStatus());
      state.setStatus(update.getStatus());
    }
    if (update.getCurrentStep() != null) {
      state.setCurrentStep(update.getCurrentStep());
    }
    if (update.getCurrentSection() != null) {
      state.setCurrentSection(update.getCurrentSection());
    }

    Instant now = Instant.now();
    update
        .getSections()
        .forEach(
            (name, sectionUpdate) -> {
              SectionState section =
                  state.getSections().computeIfAbsent(name, n -> SectionState.builder().build());
              merge(runId, name, section, sectionUpdate);
              section.setUpdatedAt(now);
            });

    state.getErrors().addAll(update.getErrors());
    state.getCheckpoints().addAll(update.getCheckpoints());
  }

  private void merge(String runId, String name, SectionState section, SectionUpdate update) {
    if (update.getStatus() != null) {
      requireTransition(runId, "section " + name, section.getStatus(), update.getStatus());
      section.setStatus(update.getStatus());
    }
    if (update.isResetProgress()) {
      section.getSteps().replaceAll((step, status) -> StepStatus.PENDING);
      pipelineConfig
          .getState()
          .getSteps()
          .forEach(step -> section.getSteps().put(step, StepStatus.PENDING));
      section.setLastStep(null);
    }
    if (update.getLastStep() != null) {
      section.setLastStep(update.getLastStep());
    }
    section.getSteps().putAll(update.getSteps());
    section.getGateScores().addAll(update.getGateScores());
  }

  private void requireTransition(
      String runId, String subject, PipelineStatus from, PipelineStatus to) {
    if (!from.canTransitionTo(to)) {
      throw new StateTransitionException(runId, subject, from, to);
    }
  }

  /** Advances version and last-modified time, then saves with one retry on I/O failure. */
  private void persist(PipelineState state) {
    Instant now = Instant.now();
    Instant floor =
        state.getLastModified() == null ? state.getCreatedAt() : state.getLastModified();
    state.setLastModified(floor != null && floor.isAfter(now) ? floor : now);
    state.setVersion(state.getVersion() + 1);
    io(
        state.getRunId(),
        () -> {
          stateRepository.save(state);
          return null;
        });
  }

  private PipelineState loadOrEmpty(String runId) {
    return io(runId, () -> stateRepository.load(runId)).orElseGet(() -> PipelineState.empty(runId));
  }

  private List<CheckpointRef> storedCheckpoints(String runId) {
    List<CheckpointRef> refs = new ArrayList<>();
    for (String name : io(runId, () -> stateRepository.listCheckpointNames(runId))) {
      try {
        io(runId, () -> stateRepository.loadCheckpoint(runId, name))
            .ifPresent(c -> refs.add(c.toRef()));
      } catch (StateCorruptedException e) {
        log.warn("Skipping unreadable checkpoint {} of run {}: {}", name, runId, e.getMessage());
      }
    }
    refs.sort(Comparator.comparing(CheckpointRef::createdAt));
    return refs;
  }

  private <T> T io(String runId, Supplier<T> operation) {
    Retry retry = retryRegistry.retry(RETRY_NAME);
    try {
      return retry.executeSupplier(operation);
    } catch (UncheckedIOException e) {
      meterRegistry.counter("state.io_failures").increment();
      log.error("State store I/O failed for run {}: {}", runId, e.getMessage(), e);
      throw new StateStoreException(runId, e.getMessage(), e);
    }
  }

  private <T> T withLock(String runId, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(runId, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
