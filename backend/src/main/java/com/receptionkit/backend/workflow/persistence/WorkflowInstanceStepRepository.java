package com.receptionkit.backend.workflow.persistence;

import com.receptionkit.backend.workflow.domain.WorkflowInstanceStep;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowInstanceStepRepository extends JpaRepository<WorkflowInstanceStep, UUID> {

  List<WorkflowInstanceStep> findByInstance_IdOrderBySequenceNoAsc(UUID instanceId);

  long countByInstance_Id(UUID instanceId);
}
