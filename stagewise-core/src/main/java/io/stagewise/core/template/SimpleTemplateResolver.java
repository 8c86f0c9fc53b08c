package io.stagewise.core.template;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based resolver for `{snake_case}` placeholders.
///
/// Placeholders without a value in the context are left as written, so literal braces in
/// instructions survive. Substituted values are not scanned again.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{([a-z][a-z0-9_]*)}");

    @Override
    public String resolve(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variable = matcher.group(1);
            String replacement = context.containsKey(variable)
                    ? String.valueOf(context.get(variable))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }
}
