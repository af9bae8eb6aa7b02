package com.customdim.service.core.extraction;

import com.customdim.core.error.ExtractionFailure;
import com.customdim.core.error.InvalidExtractionException;
import com.customdim.core.model.ExtractionRule;
import com.customdim.service.core.config.CustomDimensionsProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.stereotype.Component;

/**
 * Validates an ordered list of extraction rules. The returned list keeps the input order, which
 * decides precedence at ingestion time.
 */
@Component
public class ExtractionRulesValidator {

    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z0-9_\\-\\[\\].]+");

    private final ExtractionSourceRegistry registry;
    private final int maxRules;
    private final int maxPatternLength;

    public ExtractionRulesValidator(ExtractionSourceRegistry registry, CustomDimensionsProperties properties) {
        this.registry = registry;
        this.maxRules = properties.getExtractions().getMaxRules();
        this.maxPatternLength = properties.getExtractions().getMaxPatternLength();
    }

    public List<ExtractionRule> validate(List<ExtractionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        if (rules.size() > maxRules) {
            throw new InvalidExtractionException(
                    ExtractionFailure.TOO_MANY_RULES,
                    -1,
                    "extractions",
                    "At most " + maxRules + " extractions are allowed per dimension, got " + rules.size());
        }
        List<ExtractionRule> normalized = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            normalized.add(validateRule(rules.get(i), i));
        }
        return List.copyOf(normalized);
    }

    private ExtractionRule validateRule(ExtractionRule rule, int position) {
        String field = "extractions[" + position + "]";
        if (rule == null) {
            throw new InvalidExtractionException(
                    ExtractionFailure.UNSUPPORTED_SOURCE, position, field, "Extraction " + position + " is missing");
        }
        String sourceId = rule.dimension() == null ? null : rule.dimension().trim();
        ExtractionSource source = registry.find(sourceId)
                .orElseThrow(() -> new InvalidExtractionException(
                        ExtractionFailure.UNSUPPORTED_SOURCE,
                        position,
                        field + ".dimension",
                        "Extraction dimension '" + rule.dimension() + "' is not supported, supported are: "
                                + String.join(", ", registry.getSupportedSourceDimensions().keySet())));

        String pattern = rule.pattern();
        String patternField = field + ".pattern";
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidExtractionException(
                    ExtractionFailure.MALFORMED_PATTERN, position, patternField, "Extraction pattern must not be empty");
        }
        if (pattern.length() > maxPatternLength) {
            throw new InvalidExtractionException(
                    ExtractionFailure.MALFORMED_PATTERN,
                    position,
                    patternField,
                    "Extraction pattern exceeds " + maxPatternLength + " characters");
        }

        if (source.patternKind() == PatternKind.PARAMETER_NAME) {
            if (!PARAMETER_NAME.matcher(pattern).matches()) {
                throw new InvalidExtractionException(
                        ExtractionFailure.MALFORMED_PATTERN,
                        position,
                        patternField,
                        "'" + pattern + "' is not a valid URL parameter name");
            }
        } else {
            int groups = captureGroups(pattern, position, patternField);
            if (groups != 1) {
                throw new InvalidExtractionException(
                        ExtractionFailure.CAPTURE_GROUP_COUNT,
                        position,
                        patternField,
                        "Extraction pattern must contain exactly one capture group, e.g. 'index_(.+).html', found "
                                + groups);
            }
        }
        return new ExtractionRule(sourceId, pattern);
    }

    private static int captureGroups(String pattern, int position, String field) {
        try {
            return Pattern.compile(pattern).matcher("").groupCount();
        } catch (PatternSyntaxException e) {
            throw new InvalidExtractionException(
                    ExtractionFailure.MALFORMED_PATTERN,
                    position,
                    field,
                    "Extraction pattern does not compile: " + e.getDescription());
        }
    }
}
