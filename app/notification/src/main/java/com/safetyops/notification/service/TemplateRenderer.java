/*
 * Where: Notification service layer
 * What: Substitutes {{key}} tokens in subject/body templates
 * Why: Templates are administrator-authored HTML; only literal token replacement is allowed
 */
package com.safetyops.notification.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TemplateRenderer {

  private static final Pattern TOKEN = Pattern.compile("\\{\\{([^{}]*)}}");

  private TemplateRenderer() {}

  /**
   * Replaces every {@code {{key}}} with {@code variables.get(key)}, or the empty string when the key
   * is absent. Single pass: substituted values are never scanned for further tokens.
   */
  public static String render(String template, Map<String, String> variables) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    final Map<String, String> values = variables == null ? Map.of() : variables;
    final Matcher matcher = TOKEN.matcher(template);
    final StringBuilder rendered = new StringBuilder(template.length());
    while (matcher.find()) {
      final String value = values.get(matcher.group(1));
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }
}
