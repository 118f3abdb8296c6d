package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.entity.ExclusionRule;
import com.contentvalidator.validation.entity.ExclusionRuleType;
import com.contentvalidator.validation.entity.ScanJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Decides which discovered pages are left out of a scan.
 */
@Component
@Slf4j
public class PageExclusionFilter {

    public static final List<ExclusionRule> DEFAULT_RULES = Stream
            .of("privacy", "terms", "cookie", "login", "account", "portal")
            .map(ExclusionRule::urlContains)
            .toList();

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * Rules in effect for a job: the defaults (unless turned off) followed by the job's own rules.
     */
    public List<ExclusionRule> rulesFor(ScanJob job) {
        List<ExclusionRule> rules = new ArrayList<>();
        if (!Boolean.FALSE.equals(job.getApplyDefaultExclusions())) {
            rules.addAll(DEFAULT_RULES);
        }
        if (job.getExclusionRules() != null) {
            rules.addAll(job.getExclusionRules());
        }
        return rules;
    }

    public boolean isExcluded(String url, List<ExclusionRule> rules) {
        if (url == null || rules.isEmpty()) {
            return false;
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        for (ExclusionRule rule : rules) {
            if (rule == null || rule.type() == null || rule.value() == null || rule.value().isBlank()) {
                continue;
            }
            String value = rule.value().toLowerCase(Locale.ROOT);
            boolean matched = switch (rule.type()) {
                case URL_CONTAINS -> lowerUrl.contains(value);
                case URL_REGEX -> matchesRegex(rule.value(), url);
                case PATH_BLOCKLIST -> part(url, URI::getRawPath).contains(value);
                case DOMAIN_BLOCKLIST -> part(url, URI::getHost).contains(value);
            };
            if (matched) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws PatternSyntaxException when a {@code url_regex} rule does not compile
     */
    public static void validate(List<ExclusionRule> rules) {
        if (rules == null) {
            return;
        }
        for (ExclusionRule rule : rules) {
            if (rule != null && rule.type() == ExclusionRuleType.URL_REGEX && rule.value() != null) {
                Pattern.compile(rule.value(), Pattern.CASE_INSENSITIVE);
            }
        }
    }

    private boolean matchesRegex(String regex, String url) {
        try {
            return patterns.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                    .matcher(url)
                    .find();
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid exclusion pattern '{}': {}", regex, e.getDescription());
            return false;
        }
    }

    private static String part(String url, Function<URI, String> accessor) {
        try {
            String value = accessor.apply(URI.create(url.trim()));
            return value != null ? value.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable page URL {}: {}", url, e.getMessage());
            return "";
        }
    }
}
