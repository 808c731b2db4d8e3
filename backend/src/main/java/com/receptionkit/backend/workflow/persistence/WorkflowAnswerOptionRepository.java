package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowAnswerOption;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowAnswerOptionRepository extends JpaRepository<WorkflowAnswerOption, UUID> {

  List<WorkflowAnswerOption> findByNode_IdOrderByCreatedAtAscIdAsc(UUID nodeId);

  @Query(
      "select o from WorkflowAnswerOption o where o.node.template.id = :templateId order by o.createdAt asc, o.id asc")
  List<WorkflowAnswerOption> findByTemplateId(@Param("templateId") UUID templateId);

  long countByNode_Id(UUID nodeId);

  @Modifying
  @Query(
      "delete from WorkflowAnswerOption o where o.node.id in "
          + "(select n.id from WorkflowNode n where n.template.id = :templateId)")
  int deleteByTemplateId(@Param("templateId") UUID templateId);
}
