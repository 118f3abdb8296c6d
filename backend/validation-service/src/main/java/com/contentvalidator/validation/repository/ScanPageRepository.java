package com.contentvalidator.validation.repository;

import com.contentvalidator.validation.entity.ScanPage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScanPageRepository extends JpaRepository<ScanPage, Long> {

    List<ScanPage> findByScanJobIdOrderByIdAsc(Long scanJobId);

    long countByScanJobId(Long scanJobId);
}
