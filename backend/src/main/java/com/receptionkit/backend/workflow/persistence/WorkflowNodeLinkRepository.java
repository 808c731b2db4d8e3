package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowNodeLink;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowNodeLinkRepository extends JpaRepository<WorkflowNodeLink, UUID> {

  List<WorkflowNodeLink> findByNode_IdOrderBySortOrderAsc(UUID nodeId);

  @Query(
      "select l from WorkflowNodeLink l where l.node.template.id = :templateId order by l.sortOrder asc, l.id asc")
  List<WorkflowNodeLink> findByTemplateId(@Param("templateId") UUID templateId);

  boolean existsByNode_IdAndTargetTemplateId(UUID nodeId, UUID targetTemplateId);

  @Query("select coalesce(max(l.sortOrder), -1) from WorkflowNodeLink l where l.node.id = :nodeId")
  int findMaxSortOrder(@Param("nodeId") UUID nodeId);

  @Modifying
  @Query(
      "delete from WorkflowNodeLink l where l.node.id in "
          + "(select n.id from WorkflowNode n where n.template.id = :templateId)")
  int deleteByTemplateId(@Param("templateId") UUID templateId);

  @Query(
      "select distinct l.node.template.id from WorkflowNodeLink l "
          + "where l.targetTemplateId = :templateId and l.node.template.id <> :templateId")
  List<UUID> findOwnerTemplateIdsByTargetTemplateId(@Param("templateId") UUID templateId);

  @Modifying
  @Query("delete from WorkflowNodeLink l where l.targetTemplateId = :templateId")
  int deleteByTargetTemplateId(@Param("templateId") UUID templateId);
}
