package io.stagewise.core.template;

import java.util.Map;

/// Resolves `{variable}` placeholders in prompt templates. Pure utility, no dependencies.
public interface TemplateResolver {
    String resolve(String template, Map<String, Object> context);
}
