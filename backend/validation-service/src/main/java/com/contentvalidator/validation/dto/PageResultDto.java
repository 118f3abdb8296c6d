package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.ScrapeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResultDto {

    private Long id;
    private String url;
    private String title;
    private ScrapeStatus scrapeStatus;
    private List<IssueDto> issues;
    private List<Map<String, Object>> errors;
}
