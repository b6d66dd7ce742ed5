package me.christianrobert.vbs2js.transformer.validation;

import me.christianrobert.vbs2js.transformer.postprocess.JavaScriptScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports VBScript keywords left in code positions of generated JavaScript.
 *
 * A finding means a line was passed through without being translated. Strings, comments and
 * member names ({@code promise.then}) are ignored. Findings are informational only.
 */
public class ResidualKeywordScanner {

  private static final Pattern RESIDUAL_KEYWORD = Pattern.compile(
      "(?<![\\w$.])("
          + "End\\s+(?:If|Sub|Function|Select|With|Class|Property)"
          + "|Select\\s+Case"
          + "|Loop\\s+(?:While|Until)"
          + "|Exit\\s+(?:Function|Sub|For|Do)"
          + "|ElseIf|Then|Wend|ReDim|Dim|Next"
          + "|Sub\\s+[A-Za-z_]\\w*"
          + ")(?![\\w$])",
      Pattern.CASE_INSENSITIVE);

  /**
   * Scans generated text.
   *
   * @param javaScript Generated text
   * @return One entry per finding, formatted as "Line N: keyword" (1-based output lines)
   */
  public static List<String> scan(String javaScript) {
    List<String> findings = new ArrayList<>();
    if (javaScript == null || javaScript.isEmpty()) {
      return findings;
    }

    boolean[] mask = JavaScriptScanner.codeMask(javaScript);
    Matcher matcher = RESIDUAL_KEYWORD.matcher(javaScript);
    while (matcher.find()) {
      if (!mask[matcher.start()]) {
        continue;
      }
      findings.add("Line " + lineOf(javaScript, matcher.start()) + ": "
          + matcher.group(1).replaceAll("\\s+", " "));
    }
    return findings;
  }

  private static int lineOf(String text, int index) {
    int line = 1;
    for (int i = 0; i < index; i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }
}
