package com.flamingo.ai.coursegate.service.state;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.StepStatus;
import com.flamingo.ai.coursegate.domain.state.CheckpointRef;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.domain.state.SectionState;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Cross-field consistency rules for a parsed pipeline state. */
@Component
@RequiredArgsConstructor
public class StateValidator {

  private final PipelineConfig pipelineConfig;

  /** Returns every consistency issue found; an empty list means the state is consistent. */
  public List<String> check(PipelineState state) {
    List<String> steps = steps();
    List<String> issues = new ArrayList<>();

    int furthestEarlierStep = -1;
    for (Map.Entry<String, SectionState> entry : state.getSections().entrySet()) {
      String name = entry.getKey();
      SectionState section = entry.getValue();

      for (String step : section.getSteps().keySet()) {
        if (!steps.contains(step)) {
          issues.add("section " + name + " has unknown step '" + step + "'");
        }
      }

      PipelineStatus derived = deriveStatus(section);
      boolean startedWithoutSteps =
          section.getStatus() == PipelineStatus.IN_PROGRESS && derived == PipelineStatus.PENDING;
      if (section.getStatus() != derived && !startedWithoutSteps) {
        issues.add(
            "section " + name + " is " + section.getStatus() + " but its steps imply " + derived);
      }

      if (section.isCompleted()) {
        for (String step : steps) {
          if (section.stepStatus(step) != StepStatus.COMPLETED) {
            issues.add(
                String.format(
                    "section %s is COMPLETED but step %s is %s",
                    name, step, section.stepStatus(step)));
          }
        }
      }

      String derivedLastStep = deriveLastStep(section);
      if (!Objects.equals(section.getLastStep(), derivedLastStep)) {
        issues.add(
            "section "
                + name
                + " records last step "
                + section.getLastStep()
                + " but its steps imply "
                + derivedLastStep);
      }

      int lastIndex = section.getLastStep() == null ? -1 : steps.indexOf(section.getLastStep());
      if (section.isCompleted() && lastIndex < furthestEarlierStep) {
        issues.add(
            "section " + name + " is COMPLETED but its last step precedes an earlier section's");
      }
      furthestEarlierStep = Math.max(furthestEarlierStep, lastIndex);
    }

    if (state.getCurrentSection() != null
        && !state.getSections().containsKey(state.getCurrentSection())) {
      issues.add("current section " + state.getCurrentSection() + " does not exist");
    }
    if (state.getCurrentStep() != null && !steps.contains(state.getCurrentStep())) {
      issues.add("current step " + state.getCurrentStep() + " is not a pipeline step");
    }

    Set<String> names = new HashSet<>();
    for (CheckpointRef ref : state.getCheckpoints()) {
      if (!names.add(ref.name())) {
        issues.add("checkpoint name " + ref.name() + " is not unique");
      }
    }

    if (state.getLastModified().isBefore(state.getCreatedAt())) {
      issues.add("lastModified precedes createdAt");
    }

    if (state.getStatus() == PipelineStatus.COMPLETED) {
      state.getSections().entrySet().stream()
          .filter(e -> !e.getValue().isCompleted())
          .forEach(e -> issues.add("run is COMPLETED but section " + e.getKey() + " is not"));
    }
    return issues;
  }

  /** Section status implied by its step statuses. */
  public PipelineStatus deriveStatus(SectionState section) {
    List<String> steps = steps();
    boolean anyStarted = false;
    boolean allCompleted = true;
    for (String step : steps) {
      StepStatus status = section.stepStatus(step);
      if (status == StepStatus.FAILED) {
        return PipelineStatus.FAILED;
      }
      anyStarted |= status != StepStatus.PENDING;
      allCompleted &= status == StepStatus.COMPLETED;
    }
    if (allCompleted) {
      return PipelineStatus.COMPLETED;
    }
    return anyStarted ? PipelineStatus.IN_PROGRESS : PipelineStatus.PENDING;
  }

  /** The furthest completed step in pipeline order, or {@code null} if none completed. */
  public String deriveLastStep(SectionState section) {
    String last = null;
    for (String step : steps()) {
      if (section.stepStatus(step) == StepStatus.COMPLETED) {
        last = step;
      }
    }
    return last;
  }

  private List<String> steps() {
    return pipelineConfig.getState().getSteps();
  }
}
