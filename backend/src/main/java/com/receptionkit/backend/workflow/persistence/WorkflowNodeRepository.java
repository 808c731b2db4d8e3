package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowNode;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, UUID> {

  List<WorkflowNode> findByTemplate_IdOrderBySortOrderAsc(UUID templateId);

  List<WorkflowNode> findByTemplate_IdAndIdIn(UUID templateId, Collection<UUID> ids);

  long countByTemplate_Id(UUID templateId);

  @Query("select coalesce(max(n.sortOrder), -1) from WorkflowNode n where n.template.id = :templateId")
  int findMaxSortOrder(@Param("templateId") UUID templateId);

  @Modifying
  @Query("delete from WorkflowNode n where n.template.id = :templateId")
  int deleteByTemplateId(@Param("templateId") UUID templateId);
}
