package com.consullo.orchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Running plain and detailed text for one turn.
 *
 * <p>
 * Plain text joins chunks with a paragraph break unless one side already
 * carries whitespace at the seam. Detailed text follows the same rule and also
 * renders tool calls and results inline.
 * </p>
 */
public final class TextAccumulator {

  static final int INPUT_PREVIEW_LIMIT = 100;

  private final StringBuilder plain = new StringBuilder();
  private final StringBuilder detailed = new StringBuilder();

  public void appendAssistant(final String chunk) {
    appendWithSpacing(plain, chunk);
    appendWithSpacing(detailed, chunk);
  }

  public void appendToolCall(final ToolActivity activity) {
    detailed.append("\n\n[Tool: ").append(activity.name()).append("]\n");
    final Iterator<Map.Entry<String, JsonNode>> fields = activity.input().fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final JsonNode value = field.getValue();
      final String text = value.isTextual() ? value.asText() : value.toString();
      detailed.append("  ")
              .append(field.getKey())
              .append(": ")
              .append(ToolActivity.preview(text, INPUT_PREVIEW_LIMIT))
              .append('\n');
    }
  }

  public void appendToolResult(final ToolActivity activity) {
    detailed.append("\n\n[Tool Result: ")
            .append(activity.isError() ? "ERROR" : "SUCCESS")
            .append("]\n")
            .append(activity.resultText() != null ? activity.resultText() : "")
            .append('\n');
  }

  public String plainText() {
    return plain.toString();
  }

  public String detailedText() {
    return detailed.toString();
  }

  public boolean isEmpty() {
    return plain.length() == 0 && detailed.length() == 0;
  }

  public void clear() {
    plain.setLength(0);
    detailed.setLength(0);
  }

  /**
   * Joins {@code chunk} onto {@code target}, inserting a paragraph break when
   * neither side has whitespace at the seam.
   */
  static void appendWithSpacing(final StringBuilder target, final String chunk) {
    if (chunk == null || chunk.isEmpty()) {
      return;
    }
    if (target.length() > 0
            && !Character.isWhitespace(target.charAt(target.length() - 1))
            && !Character.isWhitespace(chunk.charAt(0))) {
      target.append("\n\n");
    }
    target.append(chunk);
  }

  /**
   * Joins two texts with the same spacing rule.
   */
  public static String concatWithSpacing(final String left, final String right) {
    final StringBuilder sb = new StringBuilder(left != null ? left : "");
    appendWithSpacing(sb, right);
    return sb.toString();
  }
}
