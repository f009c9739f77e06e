package com.flamingo.ai.coursegate.service.quota;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.config.PipelineConfig.Band;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.enums.Verdict;
import com.flamingo.ai.coursegate.domain.model.Violation;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the QuotaService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaServiceImpl implements QuotaService {

  private static final String LOCATION = "collection";

  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public QuotaResult checkQuota(int collectionSize, int specialItemCount) {
    return checkQuota(collectionSize, specialItemCount, pipelineConfig.getQuota());
  }

  @Override
  public QuotaResult checkQuota(int collectionSize, List<String> specialItemSubTypes) {
    QuotaResult base =
        checkQuota(collectionSize, specialItemSubTypes.size(), pipelineConfig.getQuota());
    List<String> distinct =
        specialItemSubTypes.stream().filter(Objects::nonNull).distinct().toList();
    if (specialItemSubTypes.size() <= 2 || distinct.size() != 1) {
      return base;
    }
    // Diversity is advisory only and never changes the verdict
    List<Violation> violations = new ArrayList<>(base.violations());
    violations.add(
        Violation.builder()
            .location(LOCATION)
            .rule(RuleType.QUOTA_DIVERSITY)
            .severity(Severity.WARNING)
            .message(
                "all "
                    + specialItemSubTypes.size()
                    + " special items share sub-type '"
                    + distinct.get(0)
                    + "'")
            .measured(distinct.size())
            .build());
    return new QuotaResult(
        base.verdict(),
        base.collectionSize(),
        base.specialItemCount(),
        base.band(),
        base.deficit(),
        violations);
  }

  @Override
  public QuotaResult checkQuota(
      int collectionSize, int specialItemCount, PipelineConfig.Quota quotaTable) {
    if (collectionSize < 0 || specialItemCount < 0) {
      throw new IllegalArgumentException("Collection size and special-item count must be >= 0");
    }

    Optional<Band> selected = findBand(collectionSize, quotaTable.getBands());
    if (selected.isEmpty()) {
      log.warn("No quota band covers collection size {}", collectionSize);
      record(Verdict.FAIL);
      return new QuotaResult(
          Verdict.FAIL,
          collectionSize,
          specialItemCount,
          null,
          0,
          List.of(
              Violation.builder()
                  .location(LOCATION)
                  .rule(RuleType.QUOTA_BAND_MISSING)
                  .severity(Severity.ERROR)
                  .message("no quota band covers collection size " + collectionSize)
                  .measured(collectionSize)
                  .build()));
    }

    Band band = selected.get();
    List<Violation> violations = new ArrayList<>();
    Verdict verdict;
    int deficit = 0;

    if (specialItemCount < band.getMinimum()) {
      deficit = band.getMinimum() - specialItemCount;
      verdict = Verdict.FAIL;
      violations.add(
          Violation.builder()
              .location(LOCATION)
              .rule(RuleType.QUOTA_MINIMUM)
              .severity(Severity.ERROR)
              .message(
                  "collection of "
                      + collectionSize
                      + " has "
                      + specialItemCount
                      + " special item(s) (min "
                      + band.getMinimum()
                      + ", deficit "
                      + deficit
                      + ")")
              .measured(specialItemCount)
              .limit(band.getMinimum())
              .build());
    } else if (specialItemCount < band.getTargetMin()) {
      verdict = Verdict.WARN;
      violations.add(
          target(
              specialItemCount,
              band.getTargetMin(),
              "below target range " + band.getTargetMin() + "-" + band.getTargetMax()));
    } else if (specialItemCount > band.getTargetMax()) {
      verdict = Verdict.WARN;
      violations.add(
          target(
              specialItemCount,
              band.getTargetMax(),
              "above target range " + band.getTargetMin() + "-" + band.getTargetMax()));
    } else {
      verdict = Verdict.PASS;
    }

    Double maxShare = quotaTable.getMaxShare();
    if (maxShare != null && collectionSize > 0) {
      double share = (double) specialItemCount / collectionSize;
      if (share > maxShare) {
        verdict = verdict.worst(Verdict.WARN);
        violations.add(
            Violation.builder()
                .location(LOCATION)
                .rule(RuleType.QUOTA_SHARE)
                .severity(Severity.WARNING)
                .message(
                    String.format(
                        "special items take %.0f%% of the collection (max %.0f%%)",
                        share * 100, maxShare * 100))
                .measured(specialItemCount)
                .limit((int) Math.floor(maxShare * collectionSize))
                .build());
      }
    }

    log.debug(
        "Quota for size {} with {} special item(s): {} (band {}-{})",
        collectionSize,
        specialItemCount,
        verdict,
        band.getMinSize(),
        band.getMaxSize());
    record(verdict);
    return new QuotaResult(verdict, collectionSize, specialItemCount, band, deficit, violations);
  }

  private Optional<Band> findBand(int size, List<Band> bands) {
    return bands.stream()
        .filter(b -> size >= b.getMinSize() && (b.getMaxSize() == null || size <= b.getMaxSize()))
        .findFirst();
  }

  private Violation target(int measured, int limit, String detail) {
    return Violation.builder()
        .location(LOCATION)
        .rule(RuleType.QUOTA_TARGET)
        .severity(Severity.WARNING)
        .message(measured + " special item(s) is " + detail)
        .measured(measured)
        .limit(limit)
        .build();
  }

  private void record(Verdict verdict) {
    meterRegistry.counter("quota.checks", "verdict", verdict.name()).increment();
  }
}
