package com.optwise.docai.app.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/**
 * Prompt template loaded from YAML or JSON.
 *
 * <p>Templates use {@code {name}} placeholders that are substituted literally; braces that do not
 * name a known variable (JSON examples, for instance) are left alone.
 */
@Data
public class PromptConfig {
  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules;

  public String renderSystem(Map<String, String> vars) {
    return render(systemTemplate, vars);
  }

  public String renderUser(Map<String, String> vars) {
    return render(userTemplate, vars);
  }

  private String render(String template, Map<String, String> vars) {
    if (template == null) return null;
    String out = template;
    if (rules != null) {
      for (Map.Entry<String, String> e : rules.entrySet()) {
        out = out.replace("{" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
      }
    }
    for (Map.Entry<String, String> e : vars.entrySet()) {
      out = out.replace("{" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
    }
    return out;
  }
}
