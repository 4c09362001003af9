package com.example.datalake.fieldcheck.util;

import com.example.datalake.fieldcheck.dao.RecordRow;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RowFormatUtils {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

  private RowFormatUtils() {}

  /**
   * Render a row through a {@code {field}} template, e.g. {@code "{name} ({code})"}. Unknown
   * fields render as {@code "null"}.
   */
  public static String format(String template, RecordRow row) {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(row, "row");
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      Object value = row.get(matcher.group(1));
      matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(value)));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  /** Replace literal {@code {name}} placeholders in a message with the given value. */
  public static String substitute(String message, String name, Object value) {
    if (message == null) {
      return null;
    }
    return message.replace("{" + name + "}", String.valueOf(value));
  }
}
