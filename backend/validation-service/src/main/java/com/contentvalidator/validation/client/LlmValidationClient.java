package com.contentvalidator.validation.client;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.ContentChunk;
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the guideline-matching LLM service for one page.
 * The service answers {@code {"issues": [...]}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmValidationClient implements ContentValidator {

    private final WebClient webClient;
    private final ScanProperties scanProperties;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LlmValidationResponse(List<RawFinding> issues) {
    }

    @Override
    public IssueSource source() {
        return IssueSource.LLM;
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = scanProperties.getClients().getLlmBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public List<RawFinding> validate(PageContent content, ValidationContext context) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("pageUrl", content.url());
        payload.put("title", content.title());
        payload.put("guidelineSetId", context.guidelineSetId());
        payload.put("guidelineVersion", context.guidelineVersion());
        List<Map<String, Object>> chunks = new ArrayList<>();
        for (ContentChunk chunk : content.chunks()) {
            chunks.add(Map.of(
                    "headingPath", String.join(" > ", chunk.headingPath()),
                    "text", chunk.text()));
        }
        payload.put("chunks", chunks);

        LlmValidationResponse response = webClient.post()
                .uri(scanProperties.getClients().getLlmBaseUrl() + "/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(LlmValidationResponse.class)
                .timeout(scanProperties.getTimeouts().getValidator())
                .block();

        List<RawFinding> findings = response != null && response.issues() != null ? response.issues() : List.of();
        log.debug("LLM validator returned {} findings for {}", findings.size(), content.url());
        return findings;
    }
}
