package com.contentvalidator.validation.client;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.dto.ValidationContext;
import com.contentvalidator.validation.entity.IssueSource;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs an axe-core audit through the external axe runner and maps violations to findings.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AccessibilityClient implements ContentValidator {

    private static final int NODE_HTML_LIMIT = 100;

    private final WebClient webClient;
    private final ScanProperties scanProperties;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AxeNode(String html) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AxeViolation(String id, String impact, String description, String help, String helpUrl,
                        List<AxeNode> nodes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AxeAuditResponse(List<AxeViolation> violations) {
    }

    @Override
    public IssueSource source() {
        return IssueSource.AXE;
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = scanProperties.getClients().getAxeBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public List<RawFinding> validate(PageContent content, ValidationContext context) {
        AxeAuditResponse response = webClient.post()
                .uri(scanProperties.getClients().getAxeBaseUrl() + "/audit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", content.url()))
                .retrieve()
                .bodyToMono(AxeAuditResponse.class)
                .timeout(scanProperties.getTimeouts().getAxe())
                .block();

        if (response == null || response.violations() == null) {
            return List.of();
        }
        List<RawFinding> findings = response.violations().stream()
                .filter(Objects::nonNull)
                .map(AccessibilityClient::toFinding)
                .toList();
        log.debug("axe reported {} violations for {}", findings.size(), content.url());
        return findings;
    }

    static RawFinding toFinding(AxeViolation violation) {
        String evidence = violation.nodes() == null ? "" : violation.nodes().stream()
                .map(AxeNode::html)
                .filter(html -> html != null && !html.isBlank())
                .map(html -> html.length() > NODE_HTML_LIMIT ? html.substring(0, NODE_HTML_LIMIT) : html)
                .collect(Collectors.joining("; "));
        String help = violation.help() != null ? violation.help() : "";
        String fix = violation.helpUrl() != null && !violation.helpUrl().isBlank()
                ? help + " (see: " + violation.helpUrl() + ")"
                : help;

        return RawFinding.builder()
                .category("accessibility")
                .type(violation.id())
                .severity(violation.impact())
                .evidence(evidence.isBlank() ? help : evidence)
                .explanation(violation.description())
                .proposedFix(fix)
                .confidence(0.95)
                .build();
    }
}
