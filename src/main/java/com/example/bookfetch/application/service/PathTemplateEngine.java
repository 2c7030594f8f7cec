package com.example.bookfetch.application.service;

import com.example.bookfetch.domain.model.TemplateValidationResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders library paths from templates such as {@code {author}/{series}/{seriesPart - }{title}}.
 *
 * <p>A brace group whose content is exactly a variable name is a plain placeholder. Any other brace
 * group is a conditional block: it renders, literal text included, only when every variable it
 * mentions has a value. {@code \{} and {@code \}} produce literal braces.
 */
@Component
public class PathTemplateEngine {

    public static final String DEFAULT_TEMPLATE = "{author}/{title} {asin}";

    public static final List<String> VALID_VARIABLES = Collections.unmodifiableList(
            Arrays.asList("author", "title", "narrator", "asin", "year", "series", "seriesPart"));

    private static final int MAX_COMPONENT_LENGTH = 200;

    private static final char LBRACE_PLACEHOLDER = '\uE000';
    private static final char RBRACE_PLACEHOLDER = '\uE001';

    private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^}]+)\\}");
    private static final Pattern ESCAPED_BRACE = Pattern.compile("\\\\[{}]");
    private static final Pattern INVALID_PATH_CHARS = Pattern.compile("[<>:\"|?*]");
    private static final Pattern VALUE_ILLEGAL_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern LONE_BACKSLASH = Pattern.compile("\\\\(?![{}])");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[a-zA-Z]:");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]+");

    /** Longest names first so {@code seriesPart} is never read as {@code series}. */
    private static final List<String> VARIABLES_BY_LENGTH = VALID_VARIABLES.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.toList());

    private static final Pattern ANY_VARIABLE_WORD = Pattern.compile(
            "(?<![a-zA-Z0-9])(" + String.join("|", VARIABLES_BY_LENGTH) + ")(?![a-zA-Z0-9])");

    private static final Map<String, Pattern> VARIABLE_WORD_PATTERNS = new LinkedHashMap<>();

    static {
        for (String name : VALID_VARIABLES) {
            VARIABLE_WORD_PATTERNS.put(name, Pattern.compile("(?<![a-zA-Z0-9])" + name + "(?![a-zA-Z0-9])"));
        }
    }

    public List<String> getValidVariables() {
        return new ArrayList<>(VALID_VARIABLES);
    }

    /**
     * Substitutes {@code variables} into {@code template} and cleans the result into a relative path.
     * Missing variables render as nothing; the result never starts or ends with a separator.
     */
    public String substitute(String template, Map<String, String> variables) {
        String result = template
                .replace("\\{", String.valueOf(LBRACE_PLACEHOLDER))
                .replace("\\}", String.valueOf(RBRACE_PLACEHOLDER));

        result = resolveConditionalBlocks(result, variables);

        for (String name : VALID_VARIABLES) {
            String value = variables.get(name);
            String replacement = isBlank(value) ? "" : sanitizeValue(value.trim());
            result = result.replace("{" + name + "}", replacement);
        }

        result = SEPARATORS.matcher(result).replaceAll("/");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        List<String> components = new ArrayList<>();
        for (String part : result.split("/")) {
            String cleaned = cleanComponent(part);
            if (!cleaned.isEmpty()) {
                components.add(cleaned);
            }
        }
        result = String.join("/", components);

        return result.replace(LBRACE_PLACEHOLDER, '{').replace(RBRACE_PLACEHOLDER, '}');
    }

    public TemplateValidationResult validateTemplate(String template) {
        if (isBlank(template)) {
            return TemplateValidationResult.invalid("Template cannot be empty");
        }
        if (template.startsWith("/")
                || (template.startsWith("\\") && !template.startsWith("\\{") && !template.startsWith("\\}"))
                || DRIVE_PREFIX.matcher(template).find()) {
            return TemplateValidationResult.invalid(
                    "Template must be a relative path (no absolute paths like \"/\" or \"C:\\\")");
        }
        TemplateValidationResult blocks = validateBraceGroups(template, "path templates");
        if (!blocks.isValid()) {
            return blocks;
        }
        if (LONE_BACKSLASH.matcher(template).find()) {
            return TemplateValidationResult.invalid(
                    "Use forward slashes (/) for path separators, not backslashes (\\)");
        }
        return TemplateValidationResult.ok();
    }

    public TemplateValidationResult validateFilenameTemplate(String template) {
        if (isBlank(template)) {
            return TemplateValidationResult.invalid("Filename template cannot be empty");
        }
        if (template.contains("/")) {
            return TemplateValidationResult.invalid(
                    "Filename template cannot contain \"/\" (directory separators). "
                            + "Use the organization template for directory structure.");
        }
        if (LONE_BACKSLASH.matcher(template).find()) {
            return TemplateValidationResult.invalid(
                    "Filename template cannot contain backslashes. "
                            + "Use the organization template for directory structure.");
        }
        return validateBraceGroups(template, "filenames");
    }

    /**
     * Renders a file name from a filename template, keeping the original extension.
     *
     * @param index 1-based position for multi-file books, or {@code null} for a single file
     */
    public String buildRenamedFilename(String template,
                                       Map<String, String> variables,
                                       String originalExtension,
                                       Integer index) {
        String baseName = substitute(template, variables).replace("/", "").replace("\\", "");
        baseName = sanitizeValue(baseName);
        if (index != null) {
            baseName = baseName + " - " + index;
        }
        String ext = originalExtension.startsWith(".") ? originalExtension : "." + originalExtension;
        return baseName + ext;
    }

    /**
     * Sample renderings for a settings screen.
     */
    public List<String> generatePreviews(String template) {
        List<String> previews = new ArrayList<>();
        for (Map<String, String> sample : sampleBooks()) {
            previews.add(substitute(template, sample));
        }
        return previews;
    }

    private String resolveConditionalBlocks(String template, Map<String, String> variables) {
        Matcher matcher = BRACE_GROUP.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String content = matcher.group(1);
            String replacement;
            if (VALID_VARIABLES.contains(content)) {
                replacement = matcher.group();
            } else {
                List<String> found = findVariablesInContent(content);
                if (found.isEmpty()) {
                    replacement = matcher.group();
                } else if (!allPresent(found, variables)) {
                    replacement = "";
                } else {
                    replacement = renderBlock(content, variables);
                }
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /** Single pass, so a substituted value is never scanned for variable names again. */
    private String renderBlock(String content, Map<String, String> variables) {
        Matcher matcher = ANY_VARIABLE_WORD.matcher(content);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String value = sanitizeValue(variables.get(matcher.group(1)).trim());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private TemplateValidationResult validateBraceGroups(String template, String scope) {
        String stripped = ESCAPED_BRACE.matcher(template).replaceAll("");
        Matcher matcher = BRACE_GROUP.matcher(stripped);
        StringBuffer outside = new StringBuffer();
        while (matcher.find()) {
            String content = matcher.group(1);
            if (!VALID_VARIABLES.contains(content)) {
                List<String> found = findVariablesInContent(content);
                if (found.isEmpty()) {
                    return TemplateValidationResult.invalid("No valid variable found in conditional block: {"
                            + content + "}. Valid variables are: " + VALID_VARIABLES.stream()
                            .map(v -> "{" + v + "}")
                            .collect(Collectors.joining(", ")));
                }
                String literal = content;
                for (String name : found) {
                    literal = VARIABLE_WORD_PATTERNS.get(name).matcher(literal).replaceAll("");
                }
                TemplateValidationResult literalCheck = checkInvalidChars(literal, scope);
                if (!literalCheck.isValid()) {
                    return literalCheck;
                }
            }
            matcher.appendReplacement(outside, "");
        }
        matcher.appendTail(outside);
        return checkInvalidChars(outside.toString(), scope);
    }

    private TemplateValidationResult checkInvalidChars(String text, String scope) {
        Matcher matcher = INVALID_PATH_CHARS.matcher(text);
        Set<String> found = new LinkedHashSet<>();
        while (matcher.find()) {
            found.add(matcher.group());
        }
        if (found.isEmpty()) {
            return TemplateValidationResult.ok();
        }
        return TemplateValidationResult.invalid("Invalid characters found: " + String.join(", ", found)
                + ". These characters are not allowed in " + scope + ".");
    }

    private List<String> findVariablesInContent(String content) {
        List<String> found = new ArrayList<>();
        for (String name : VARIABLES_BY_LENGTH) {
            if (VARIABLE_WORD_PATTERNS.get(name).matcher(content).find()) {
                found.add(name);
            }
        }
        return found;
    }

    private boolean allPresent(List<String> names, Map<String, String> variables) {
        for (String name : names) {
            if (isBlank(variables.get(name))) {
                return false;
            }
        }
        return true;
    }

    /** Cleans one substituted value: no separators or reserved characters, no edge dots. */
    static String sanitizeValue(String value) {
        String cleaned = VALUE_ILLEGAL_CHARS.matcher(value).replaceAll("").trim();
        cleaned = stripEdgeDots(cleaned);
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.length() > MAX_COMPONENT_LENGTH ? cleaned.substring(0, MAX_COMPONENT_LENGTH) : cleaned;
    }

    private static String cleanComponent(String part) {
        String cleaned = stripEdgeDots(part.trim()).trim();
        if (cleaned.length() > MAX_COMPONENT_LENGTH) {
            cleaned = cleaned.substring(0, MAX_COMPONENT_LENGTH).trim();
        }
        return cleaned;
    }

    private static String stripEdgeDots(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '.') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '.') {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static List<Map<String, String>> sampleBooks() {
        List<Map<String, String>> samples = new ArrayList<>();
        samples.add(sample("Brandon Sanderson", "Mistborn: The Final Empire", "Michael Kramer",
                "B002UZMLXM", "2006", "The Mistborn Saga", "1"));
        samples.add(sample("Douglas Adams", "The Hitchhiker's Guide to the Galaxy", "Stephen Fry",
                "B0009JKV9W", "2005", "Hitchhiker's Guide", "1"));
        samples.add(sample("Andy Weir", "Project Hail Mary", null, "B08G9PRS1K", "2021", null, null));
        return samples;
    }

    private static Map<String, String> sample(String author, String title, String narrator, String asin,
                                              String year, String series, String seriesPart) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("author", author);
        values.put("title", title);
        values.put("narrator", narrator);
        values.put("asin", asin);
        values.put("year", year);
        values.put("series", series);
        values.put("seriesPart", seriesPart);
        return values;
    }
}
