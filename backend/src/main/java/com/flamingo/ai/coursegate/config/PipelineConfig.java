package com.flamingo.ai.coursegate.config;

import com.flamingo.ai.coursegate.domain.enums.FindingCategory;
import com.flamingo.ai.coursegate.domain.enums.Priority;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.enums.UnitType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Single canonical configuration for the quality-gate pipeline. Every limit, quota band, weight and
 * threshold used by the components is read from here; none of them is repeated in code.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private List<CategoryDefinition> categories = new ArrayList<>();
  private Classification classification = new Classification();
  private Limits limits = new Limits();
  private Quota quota = new Quota();
  private Gate gate = new Gate();
  private Report report = new Report();
  private State state = new State();
  private Workers workers = new Workers();

  /** One entry of the category catalog. Order in the list is catalog order. */
  @Getter
  @Setter
  public static class CategoryDefinition {
    private String id;
    private String label;

    /** Minimum number of items a batch should assign here before a reviewer is alerted. */
    private int minimumPopulation = 1;

    /** Subject-matter keywords used by the primary routing table. */
    private List<String> routingKeywords = new ArrayList<>();

    /** Narrower keyword lists keyed by focus name (technique, period, population, ...). */
    private Map<String, List<String>> focusKeywords = new LinkedHashMap<>();

    /** Keywords marking content this category lays the foundation for. */
    private List<String> foundationKeywords = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Classification {
    /** Routing-keyword hits another category needs before an XREF flag is attached. */
    private int xrefMinimumHits = 2;

    /** How many times the runner-up's hits the leader needs for the dominance test. */
    private double dominanceRatio = 2.0;

    /** Secondary focus heuristics, evaluated in this order. */
    private List<String> secondaryFocuses =
        new ArrayList<>(List.of("technique", "period", "population"));

    /** Phrases that introduce a definition ("X is defined as ..."). */
    private List<String> definitionCues =
        new ArrayList<>(List.of("is defined as", "refers to", "means", "is a", "is an"));
  }

  @Getter
  @Setter
  public static class Limits {
    /** Limits keyed by field name (header, body, tip, notes, ...). */
    private Map<String, FieldLimits> fields = new LinkedHashMap<>();

    /** Fields every unit of a given type must carry. */
    private Map<UnitType, List<String>> requiredFields = new EnumMap<>(UnitType.class);
  }

  /** Limits for one field. A {@code null} limit is not checked. */
  @Getter
  @Setter
  public static class FieldLimits {
    private Integer maxLines;
    private Integer maxCharsPerLine;
    private Integer minWords;
    private Integer maxWords;
    private List<MarkerRequirement> markers = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class MarkerRequirement {
    /** Literal token, matched case-insensitively, e.g. {@code [PAUSE]}. */
    private String token;

    private int minCount = 1;
    private Severity severity = Severity.WARNING;
  }

  @Getter
  @Setter
  public static class Quota {
    /** Size bands, ascending, contiguous and non-overlapping. */
    private List<Band> bands = new ArrayList<>();

    /** Largest share of the collection special items may take before an advisory is raised. */
    private Double maxShare = 0.40;

    /** Unit type counted as a special item when checking a section. */
    private UnitType specialUnitType = UnitType.VISUAL;

    /** Field of a special unit holding its sub-type, used for the diversity advisory. */
    private String subTypeField = "visual_type";
  }

  @Getter
  @Setter
  public static class Band {
    private int minSize;

    /** Inclusive upper bound; {@code null} leaves the band open-ended. */
    private Integer maxSize;

    private int minimum;
    private int targetMin;
    private int targetMax;
  }

  @Getter
  @Setter
  public static class Gate {
    private double passThreshold = 90.0;
    private double warnThreshold = 80.0;

    /** Scored dimensions in report order. Weights must sum to 1.0. */
    private Map<String, Dimension> dimensions = new LinkedHashMap<>();

    /** Points deducted per violation, by rule type. */
    private Map<RuleType, Integer> penalties = new EnumMap<>(RuleType.class);

    private int defaultPenalty = 5;

    /** Violation counts above which the gate fails outright, by rule type. */
    private Map<RuleType, Integer> maxViolations = new EnumMap<>(RuleType.class);

    private double dimensionPassScore = 80.0;
    private double dimensionWarnScore = 60.0;
    private int maxRevisionIterations = 3;
  }

  @Getter
  @Setter
  public static class Dimension {
    private double weight;

    /** Individual minimum score; below it the gate fails regardless of the total. */
    private Double floor;

    /** Rule types whose violations are deducted from this dimension. */
    private List<RuleType> rules = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Report {
    private List<SeverityRule> severityRules = new ArrayList<>();
  }

  /** Priority override; a {@code null} field matches any field. */
  @Getter
  @Setter
  public static class SeverityRule {
    private FindingCategory category;
    private RuleType rule;
    private String field;
    private Priority priority;
  }

  @Getter
  @Setter
  public static class State {
    /** Root directory holding one sub-directory per run. */
    private String basePath = "data/state";

    /** Steps every section passes through, in order. */
    private List<String> steps =
        new ArrayList<>(List.of("classification", "validation", "quota", "gate", "report"));
  }

  @Getter
  @Setter
  public static class Workers {
    private int poolSize = 4;
    private int queueCapacity = 100;
  }
}
