package com.contentvalidator.validation.repository;

import com.contentvalidator.validation.entity.Issue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IssueRepository extends JpaRepository<Issue, Long> {

    List<Issue> findByScanJobIdOrderByIdAsc(Long scanJobId);

    long countByScanJobId(Long scanJobId);
}
