package com.example.cloudinvestigator.repository;

import com.example.cloudinvestigator.domain.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByInvestigationIdOrderByTimestampDesc(String investigationId);

    @Query("SELECT a FROM AuditLog a ORDER BY a.timestamp DESC")
    Page<AuditLog> findAllPaged(Pageable pageable);

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:action IS NULL OR a.action = :action) AND " +
           "(:provider IS NULL OR a.provider = :provider) " +
           "ORDER BY a.timestamp DESC")
    List<AuditLog> findFiltered(String action, String provider);

    long countByAction(String action);
}
