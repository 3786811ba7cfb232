package io.confluent.translation.filter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.kafka.common.config.ConfigException;

/**
 * Matches strings against a list of patterns.
 *
 * <p>Each pattern is one of
 * <ul>
 *   <li>an exact value, e.g. {@code cpu.idle}</li>
 *   <li>a glob using {@code *}, {@code ?}, {@code [...]} and {@code {a,b}}, e.g. {@code cpu.*}</li>
 *   <li>a regular expression between slashes, e.g. {@code /^cpu\.(idle|nice)$/}</li>
 * </ul>
 * and may be negated with a leading {@code !}. A string matches if it matches no negated pattern
 * and either matches a positive pattern or there are only negated patterns.
 */
public class StringFilter {

  private final Set<String> exact;
  private final List<Pattern> patterns;
  private final Set<String> negatedExact;
  private final List<Pattern> negatedPatterns;

  public StringFilter(List<String> items) {
    Set<String> exact = new HashSet<>();
    List<Pattern> patterns = new ArrayList<>();
    Set<String> negatedExact = new HashSet<>();
    List<Pattern> negatedPatterns = new ArrayList<>();

    for (String item : items) {
      if (item == null || item.isEmpty()) {
        throw new ConfigException("Filter patterns must not be empty");
      }
      boolean negated = item.startsWith("!");
      String pattern = negated ? item.substring(1) : item;

      if (isRegex(pattern)) {
        (negated ? negatedPatterns : patterns).add(compile(pattern.substring(1, pattern.length() - 1), item));
      } else if (isGlob(pattern)) {
        (negated ? negatedPatterns : patterns).add(compile(globToRegex(pattern), item));
      } else {
        (negated ? negatedExact : exact).add(pattern);
      }
    }

    this.exact = ImmutableSet.copyOf(exact);
    this.patterns = ImmutableList.copyOf(patterns);
    this.negatedExact = ImmutableSet.copyOf(negatedExact);
    this.negatedPatterns = ImmutableList.copyOf(negatedPatterns);
  }

  public boolean matches(String value) {
    if (negatedExact.contains(value) || anyMatch(negatedPatterns, value)) {
      return false;
    }
    if (exact.isEmpty() && patterns.isEmpty()) {
      return !negatedExact.isEmpty() || !negatedPatterns.isEmpty();
    }
    return exact.contains(value) || anyMatch(patterns, value);
  }

  private static boolean anyMatch(List<Pattern> patterns, String value) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(value).find()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isRegex(String pattern) {
    return pattern.length() > 2 && pattern.startsWith("/") && pattern.endsWith("/");
  }

  private static boolean isGlob(String pattern) {
    return pattern.contains("*") || pattern.contains("?") || pattern.contains("[") || pattern.contains("{");
  }

  private static Pattern compile(String regex, String item) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new ConfigException("Filter pattern " + item + " is not valid: " + e.getDescription());
    }
  }

  // globs must match the whole value, hence the anchors
  static String globToRegex(String glob) {
    StringBuilder regex = new StringBuilder("^");
    boolean inClass = false;
    boolean inGroup = false;
    for (char c : glob.toCharArray()) {
      if (inClass) {
        regex.append(c);
        if (c == ']') {
          inClass = false;
        }
        continue;
      }
      switch (c) {
        case '*':
          regex.append(".*");
          break;
        case '?':
          regex.append('.');
          break;
        case '[':
          inClass = true;
          regex.append(c);
          break;
        case '{':
          inGroup = true;
          regex.append("(?:");
          break;
        case '}':
          if (inGroup) {
            inGroup = false;
            regex.append(')');
          } else {
            regex.append("\\}");
          }
          break;
        case ',':
          regex.append(inGroup ? "|" : ",");
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return regex.append('$').toString();
  }
}
