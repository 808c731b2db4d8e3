package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowInstance;
import com.receptionkit.backend.workflow.domain.WorkflowInstanceStatus;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowInstanceRepository extends JpaRepository<WorkflowInstance, UUID> {

  List<WorkflowInstance> findByTenantIdOrderByCreatedAtDesc(String tenantId);

  List<WorkflowInstance> findByTenantIdAndStatusOrderByCreatedAtDesc(
      String tenantId, WorkflowInstanceStatus status);

  @Query(
      "select case when count(i) > 0 then true else false end from WorkflowInstance i where i.status = :status "
          + "and (i.templateId = :templateId or i.rootTemplateId = :templateId)")
  boolean existsAnchoredOn(
      @Param("templateId") UUID templateId, @Param("status") WorkflowInstanceStatus status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select i from WorkflowInstance i where i.id = :id")
  Optional<WorkflowInstance> findByIdForUpdate(@Param("id") UUID id);
}
