package com.contentvalidator.validation.repository;

import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ScanJobRepository extends JpaRepository<ScanJob, Long> {

    /**
     * Find jobs by status (restart recovery)
     */
    List<ScanJob> findByStatus(ScanJobStatus status);

    /**
     * All scans of a site, newest first
     */
    List<ScanJob> findBySiteKeyOrderByCreatedAtDesc(String siteKey);

    /**
     * Recent scans across all sites
     */
    @Query("SELECT j FROM ScanJob j ORDER BY j.createdAt DESC")
    List<ScanJob> findRecent(Pageable pageable);

    /**
     * Completed scans of a site that finished before the given instant, latest first.
     * Backed by the (site_key, status, finished_at) index.
     */
    @Query("SELECT j FROM ScanJob j WHERE j.siteKey = :siteKey AND j.status = :status " +
            "AND j.id <> :excludeId AND j.finishedAt < :before ORDER BY j.finishedAt DESC, j.id DESC")
    List<ScanJob> findPreviousByStatus(
            @Param("siteKey") String siteKey,
            @Param("status") ScanJobStatus status,
            @Param("excludeId") Long excludeId,
            @Param("before") LocalDateTime before,
            Pageable pageable
    );
}
