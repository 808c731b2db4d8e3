package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowTemplateRepository extends JpaRepository<WorkflowTemplate, UUID> {

  List<WorkflowTemplate> findByScopeKeyOrderByNameAsc(String scopeKey);

  List<WorkflowTemplate> findByScopeKeyAndActiveTrueOrderByNameAsc(String scopeKey);

  List<WorkflowTemplate> findByScopeKeyInOrderByNameAsc(Collection<String> scopeKeys);

  boolean existsByScopeKeyAndNameIgnoreCase(String scopeKey, String name);

  boolean existsByScopeKeyAndNameIgnoreCaseAndIdNot(String scopeKey, String name, UUID id);

  Optional<WorkflowTemplate> findFirstByScopeKeyAndSourceTemplateId(String scopeKey, UUID sourceTemplateId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select t from WorkflowTemplate t where t.id = :id")
  Optional<WorkflowTemplate> findByIdForUpdate(@Param("id") UUID id);
}
