package com.contentvalidator.validation.dto;

/**
 * One fingerprint of a diff partition: a representative issue and how many
 * issues of the job carried that fingerprint.
 */
public record DiffEntry(String fingerprint, IssueDto issue, int instances) {
}
