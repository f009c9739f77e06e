package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.domain.model.Item;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds which items define a term that other items in the same batch use.
 *
 * <p>A term is the short subject of a sentence built around a definition cue, e.g. "Preload
 * refers to ..." defines {@code preload}. Any other item mentioning the term depends on the
 * defining item.
 */
@Component
@Slf4j
public class DependencyMapper {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?;]+\\s*");
  private static final Pattern LEADING_TAG = Pattern.compile("^\\s*\\[[^\\]]*\\]\\s*");
  private static final Pattern LEADING_ARTICLE =
      Pattern.compile("^(a|an|the)\\s+", Pattern.CASE_INSENSITIVE);
  private static final int MAX_TERM_WORDS = 4;

  /**
   * Maps each defining item to the ids of the items depending on it. Items that define nothing,
   * or whose terms nobody uses, are absent from the result.
   */
  public Map<Integer, Set<Integer>> mapDependencies(List<Item> items, List<String> definitionCues) {
    List<Pattern> cues =
        definitionCues.stream()
            .map(cue -> cue.toLowerCase(Locale.ROOT).strip())
            .filter(cue -> !cue.isEmpty())
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(cue -> Pattern.compile("\\s" + Pattern.quote(cue) + "(?![\\p{L}\\p{N}])"))
            .toList();

    Map<Integer, Set<Integer>> dependents = new LinkedHashMap<>();
    for (Item definer : items) {
      Set<String> terms = definedTerms(definer.text(), cues);
      if (terms.isEmpty()) {
        continue;
      }
      List<Pattern> termPatterns = terms.stream().map(KeywordMatcher::compile).toList();
      Set<Integer> users = new TreeSet<>();
      for (Item other : items) {
        if (other.id() == definer.id()) {
          continue;
        }
        for (Pattern term : termPatterns) {
          if (term.matcher(other.text()).find()) {
            users.add(other.id());
            break;
          }
        }
      }
      if (!users.isEmpty()) {
        log.debug("Item {} defines {} used by items {}", definer.id(), terms, users);
        dependents.put(definer.id(), users);
      }
    }
    return dependents;
  }

  /** Terms defined in the text, lower-cased, in order of appearance. */
  Set<String> definedTerms(String text, List<Pattern> cues) {
    Set<String> terms = new LinkedHashSet<>();
    for (String sentence : SENTENCE_END.split(LEADING_TAG.matcher(text).replaceFirst(""))) {
      String lower = sentence.toLowerCase(Locale.ROOT).strip();
      for (Pattern cue : cues) {
        Matcher matcher = cue.matcher(lower);
        if (!matcher.find()) {
          continue;
        }
        String subject =
            LEADING_ARTICLE.matcher(lower.substring(0, matcher.start()).strip())
                .replaceFirst("")
                .strip();
        int words = subject.isEmpty() ? 0 : subject.split("\\s+").length;
        if (words > 0 && words <= MAX_TERM_WORDS) {
          terms.add(subject);
        }
        break;
      }
    }
    return terms;
  }
}
