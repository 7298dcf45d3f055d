package com.piigateway.api.analysis;

import com.piigateway.api.config.GatewayProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Regex-based {@link TextAnalyzer} with built-in recognizers plus configured custom ones.
 *
 * <p>Recognizers are language independent; the language only has to be supported.
 */
@Component
public class PatternTextAnalyzer implements TextAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(PatternTextAnalyzer.class);

  private final List<Recognizer> recognizers;
  private final Set<String> supportedLanguages;
  private final double minScore;

  public PatternTextAnalyzer(GatewayProperties properties) {
    GatewayProperties.Analyzer analyzer = properties.getAnalyzer();
    this.supportedLanguages = Set.copyOf(analyzer.getSupportedLanguages());
    this.minScore = analyzer.getMinConfidenceScore();

    List<Recognizer> all = new ArrayList<>(builtIns());
    for (GatewayProperties.Recognizer custom : analyzer.getRecognizers()) {
      all.add(fromConfig(custom));
    }
    this.recognizers = List.copyOf(all);
    log.info("Pattern analyzer ready: {} recognizers, languages={}, minScore={}",
        recognizers.size(), supportedLanguages, minScore);
  }

  @Override
  public List<RecognizedSpan> analyze(String text, String language) {
    if (language == null || !supportedLanguages.contains(language.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("unsupported language: " + language);
    }

    List<RecognizedSpan> spans = new ArrayList<>();
    for (Recognizer recognizer : recognizers) {
      if (recognizer.score() < minScore) {
        continue;
      }
      Matcher matcher = recognizer.pattern().matcher(text);
      while (matcher.find()) {
        if (recognizer.validator().test(matcher.group())) {
          spans.add(new RecognizedSpan(
              recognizer.entityType(), matcher.start(), matcher.end(), recognizer.score()));
        }
      }
    }
    spans.sort(Comparator.comparingInt(RecognizedSpan::start)
        .thenComparing(Comparator.comparingDouble(RecognizedSpan::score).reversed()));
    return spans;
  }

  private static List<Recognizer> builtIns() {
    return List.of(
        new Recognizer(
            "EMAIL_ADDRESS",
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
            0.85,
            value -> true),
        new Recognizer(
            "CREDIT_CARD",
            Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b"),
            1.0,
            PatternTextAnalyzer::passesLuhn),
        new Recognizer(
            "US_SSN",
            Pattern.compile("\\b(?!000|666|9\\d{2})\\d{3}-(?!00)\\d{2}-(?!0000)\\d{4}\\b"),
            0.85,
            value -> true),
        new Recognizer(
            "PHONE_NUMBER",
            Pattern.compile("(?<![\\w-])(?:\\+?1[ .-]?)?\\(?\\d{3}\\)?[ .-]\\d{3}[ .-]\\d{4}\\b"),
            0.75,
            value -> true),
        new Recognizer(
            "IP_ADDRESS",
            Pattern.compile(
                "\\b(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\b"),
            0.6,
            value -> true),
        new Recognizer(
            "URL",
            Pattern.compile("\\bhttps?://[^\\s/$.?#][^\\s]*", Pattern.CASE_INSENSITIVE),
            0.6,
            value -> true));
  }

  private static Recognizer fromConfig(GatewayProperties.Recognizer custom) {
    if (!StringUtils.hasText(custom.getEntityType()) || !StringUtils.hasText(custom.getRegex())) {
      throw new IllegalArgumentException("custom recognizer needs entity-type and regex");
    }
    try {
      return new Recognizer(
          custom.getEntityType(), Pattern.compile(custom.getRegex()), custom.getScore(), v -> true);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException(
          "invalid regex for recognizer " + custom.getEntityType(), ex);
    }
  }

  static boolean passesLuhn(String candidate) {
    String digits = candidate.replaceAll("[ -]", "");
    if (digits.length() < 13 || digits.length() > 19) {
      return false;
    }
    int sum = 0;
    boolean doubleIt = false;
    for (int i = digits.length() - 1; i >= 0; i--) {
      int digit = digits.charAt(i) - '0';
      if (doubleIt) {
        digit *= 2;
        if (digit > 9) {
          digit -= 9;
        }
      }
      sum += digit;
      doubleIt = !doubleIt;
    }
    return sum % 10 == 0;
  }

  private record Recognizer(
      String entityType, Pattern pattern, double score, Predicate<String> validator) {}
}
