package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.PageSource;

public record PageCandidate(String url, String title, PageSource source) {
}
