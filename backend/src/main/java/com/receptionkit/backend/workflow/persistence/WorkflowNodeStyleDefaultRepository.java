package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowNodeStyleDefault;
import com.receptionkit.backend.workflow.domain.WorkflowNodeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowNodeStyleDefaultRepository
    extends JpaRepository<WorkflowNodeStyleDefault, UUID> {

  List<WorkflowNodeStyleDefault> findByTemplateIdOrderByNodeTypeAsc(UUID templateId);

  Optional<WorkflowNodeStyleDefault> findByTemplateIdAndNodeType(UUID templateId, WorkflowNodeType nodeType);

  @Modifying
  @Query("delete from WorkflowNodeStyleDefault d where d.templateId = :templateId")
  int deleteByTemplateId(@Param("templateId") UUID templateId);

  @Modifying
  @Query(
      "delete from WorkflowNodeStyleDefault d where d.templateId = :templateId and d.nodeType = :nodeType")
  int deleteByTemplateIdAndNodeType(
      @Param("templateId") UUID templateId, @Param("nodeType") WorkflowNodeType nodeType);
}
