package com.optwise.docai.app.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.optwise.docai.app.prompt.PromptConfig;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Loads prompt templates (YAML first, JSON as a fallback) from any Spring resource location. */
@Log4j2
@RequiredArgsConstructor
public class PromptLoaderService {

  private final ResourceLoader resourceLoader;

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();

  public PromptConfig load(String location) {
    Resource resource = resourceLoader.getResource(location);
    String raw;
    try (InputStream in = resource.getInputStream()) {
      raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (Exception e) {
      log.error("prompt.load failed location={}", location, e);
      throw new IllegalStateException("Failed to load prompt from " + location, e);
    }

    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      PromptConfig cfg = new PromptConfig();
      cfg.setSystemTemplate(asString(map.get("system")));
      cfg.setUserTemplate(asString(map.get("user")));
      cfg.setRules(toStringMap(map.get("rules")));
      requireUserTemplate(cfg, location);
      log.info("prompt.loaded location={} format=yaml", location);
      return cfg;
    } catch (IllegalStateException e) {
      throw e;
    } catch (Exception yamlErr) {
      log.warn("prompt.yaml parse failed, trying JSON. reason={}", yamlErr.getMessage());
    }

    try {
      PromptConfig cfg = jsonMapper.readValue(raw, PromptConfig.class);
      if (cfg.getRules() == null) {
        cfg.setRules(Map.of());
      }
      requireUserTemplate(cfg, location);
      log.info("prompt.loaded location={} format=json", location);
      return cfg;
    } catch (IllegalStateException e) {
      throw e;
    } catch (Exception e) {
      log.error("prompt.parse failed location={}", location, e);
      throw new IllegalStateException("Failed to parse prompt from " + location, e);
    }
  }

  private static void requireUserTemplate(PromptConfig cfg, String location) {
    if (cfg.getUserTemplate() == null || cfg.getUserTemplate().isBlank()) {
      throw new IllegalStateException("Prompt at " + location + " has no 'user' template");
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  private static Map<String, String> toStringMap(Object node) {
    if (node == null) return Map.of();
    if (node instanceof Map<?, ?> src) {
      Map<String, String> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : src.entrySet()) {
        String k = Objects.toString(e.getKey(), "");
        String v = (e.getValue() == null) ? null : e.getValue().toString();
        out.put(k, v);
      }
      return out;
    }
    return Map.of();
  }
}
