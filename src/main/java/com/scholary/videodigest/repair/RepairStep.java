package com.scholary.videodigest.repair;

import java.util.regex.Pattern;

/**
 * Text transforms applied, in declaration order, to a backend reply before each parse attempt.
 *
 * <p>Each step receives the output of the previous one, so later steps see fenced-code markers
 * already stripped and the JSON-looking region already extracted.
 */
public enum RepairStep {

  /** Trimmed raw text. */
  DIRECT {
    @Override
    public String apply(String text) {
      return text.strip();
    }
  },

  /** Strip a leading {@code ```lang} marker and a trailing {@code ```}. */
  STRIP_CODE_FENCE {
    @Override
    public String apply(String text) {
      String stripped = LEADING_FENCE.matcher(text.strip()).replaceFirst("");
      return TRAILING_FENCE.matcher(stripped).replaceFirst("").strip();
    }
  },

  /** Keep the region from the first opening bracket to the last matching closing bracket. */
  EXTRACT_JSON {
    @Override
    public String apply(String text) {
      int object = text.indexOf('{');
      int array = text.indexOf('[');
      int start;
      if (object < 0) {
        start = array;
      } else if (array < 0) {
        start = object;
      } else {
        start = Math.min(object, array);
      }
      if (start < 0) {
        return text;
      }

      char close = text.charAt(start) == '{' ? '}' : ']';
      int end = text.lastIndexOf(close);
      if (end <= start) {
        return text;
      }
      return text.substring(start, end + 1);
    }
  },

  /** Single quotes to double quotes and Python literals to JSON literals. */
  NORMALIZE_LITERALS {
    @Override
    public String apply(String text) {
      String normalized = text.replace('\'', '"');
      normalized = TRUE_LITERAL.matcher(normalized).replaceAll("true");
      normalized = FALSE_LITERAL.matcher(normalized).replaceAll("false");
      return NONE_LITERAL.matcher(normalized).replaceAll("null");
    }
  },

  /** Drop commas that directly precede a closing bracket. */
  REMOVE_TRAILING_COMMAS {
    @Override
    public String apply(String text) {
      return TRAILING_COMMA.matcher(text).replaceAll("$1");
    }
  },

  /** Turn line breaks and tabs into spaces and drop remaining control and format characters. */
  STRIP_CONTROL_CHARACTERS {
    @Override
    public String apply(String text) {
      String spaced = WHITESPACE_CONTROLS.matcher(text).replaceAll(" ");
      return NON_PRINTABLE.matcher(spaced).replaceAll("").strip();
    }
  };

  private static final Pattern LEADING_FENCE = Pattern.compile("^```[\\w+-]*");
  private static final Pattern TRAILING_FENCE = Pattern.compile("```\\s*$");
  private static final Pattern TRUE_LITERAL = Pattern.compile("\\bTrue\\b");
  private static final Pattern FALSE_LITERAL = Pattern.compile("\\bFalse\\b");
  private static final Pattern NONE_LITERAL = Pattern.compile("\\bNone\\b");
  private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
  private static final Pattern WHITESPACE_CONTROLS = Pattern.compile("[\\t\\r\\n]");
  private static final Pattern NON_PRINTABLE = Pattern.compile("[\\p{Cc}\\p{Cf}]");

  public abstract String apply(String text);
}
