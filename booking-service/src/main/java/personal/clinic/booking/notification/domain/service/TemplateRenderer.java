package personal.clinic.booking.notification.domain.service;

import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 템플릿 렌더러
 * <ul>
 *     <li>{{#var}}...{{/var}}: var가 비어 있으면 구간 전체 제거, 아니면 태그만 제거</li>
 *     <li>{{var}}: 값으로 치환, 없는 변수는 빈 문자열</li>
 * </ul>
 */
public final class TemplateRenderer {

    private static final Pattern SECTION = Pattern.compile("\\{\\{#(\\w+)}}(.*?)\\{\\{/\\1}}", Pattern.DOTALL);
    private static final Pattern VARIABLE = Pattern.compile("\\{\\{(\\w+)}}");

    private TemplateRenderer() {
    }

    public static String render(String template, Map<String, String> variables) {
        if (template == null) {
            return "";
        }
        String withSections = replace(SECTION, template, matcher -> {
            String value = variables.get(matcher.group(1));
            return value == null || value.isBlank() ? "" : matcher.group(2);
        });
        return replace(VARIABLE, withSections, matcher -> {
            String value = variables.get(matcher.group(1));
            return value == null ? "" : value;
        });
    }

    private static String replace(Pattern pattern, String input,
                                  Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
