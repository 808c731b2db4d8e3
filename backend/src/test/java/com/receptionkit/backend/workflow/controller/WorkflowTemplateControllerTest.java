package com.receptionkit.backend.workflow.controller;

import static com.receptionkit.backend.workflow.TestWorkflowFactory.template;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.receptionkit.backend.common.exception.WorkflowException;
import com.receptionkit.backend.workflow.api.TemplateCreateRequest;
import com.receptionkit.backend.workflow.config.WorkflowSecurityProperties;
import com.receptionkit.backend.workflow.domain.TemplateScope;
import com.receptionkit.backend.workflow.domain.WorkflowApprovalStatus;
import com.receptionkit.backend.workflow.domain.WorkflowTemplate;
import com.receptionkit.backend.workflow.security.HeaderWorkflowCallerResolver;
import com.receptionkit.backend.workflow.security.WorkflowAccessPolicy;
import com.receptionkit.backend.workflow.security.WorkflowCaller;
import com.receptionkit.backend.workflow.service.ApprovalService;
import com.receptionkit.backend.workflow.service.EffectiveTemplateService;
import com.receptionkit.backend.workflow.service.TemplateCloneService;
import com.receptionkit.backend.workflow.service.TemplateService;
import com.receptionkit.backend.workflow.service.WorkflowGraphStore;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WorkflowTemplateController.class)
@EnableConfigurationProperties(WorkflowSecurityProperties.class)
@Import({HeaderWorkflowCallerResolver.class, WorkflowAccessPolicy.class})
class WorkflowTemplateControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private TemplateService templateService;
  @MockBean private ApprovalService approvalService;
  @MockBean private TemplateCloneService cloneService;
  @MockBean private EffectiveTemplateService effectiveTemplateService;
  @MockBean private WorkflowGraphStore graphStore;

  @Test
  void createReturnsDraftAtFirstRevision() throws Exception {
    WorkflowTemplate created = template(TemplateScope.tenant("clinic-1"), "Letters", WorkflowApprovalStatus.DRAFT);
    given(templateService.createTemplate(any(WorkflowCaller.class), any(TemplateCreateRequest.class)))
        .willReturn(created);

    mockMvc
        .perform(
            post("/api/workflow/templates")
                .header("X-Caller-Id", "admin-1")
                .header("X-Tenant-Id", "clinic-1")
                .header("X-Caller-Roles", "Tenant-Admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Letters\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.scope", equalTo("tenant:clinic-1")))
        .andExpect(jsonPath("$.approvalStatus", equalTo("DRAFT")))
        .andExpect(jsonPath("$.revision", equalTo(1)));

    verify(templateService)
        .createTemplate(eq(WorkflowCaller.tenantAdmin("admin-1", "clinic-1")), any(TemplateCreateRequest.class));
  }

  @Test
  void blankNameIsRejectedBeforeReachingService() throws Exception {
    mockMvc
        .perform(
            post("/api/workflow/templates")
                .header("X-Caller-Id", "admin-1")
                .header("X-Tenant-Id", "clinic-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"  \"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.kind", equalTo("VALIDATION")));
  }

  @Test
  void effectiveListDefaultsToCallersTenant() throws Exception {
    given(effectiveTemplateService.listEffective(any(WorkflowCaller.class), eq("clinic-1"), eq(false), eq(false)))
        .willReturn(List.of());

    mockMvc
        .perform(
            get("/api/workflow/templates/effective")
                .header("X-Caller-Id", "staff-1")
                .header("X-Tenant-Id", "clinic-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void unknownTemplateIsNotFound() throws Exception {
    UUID templateId = UUID.randomUUID();
    given(graphStore.loadContents(eq(templateId), any(WorkflowCaller.class)))
        .willThrow(WorkflowException.notFound("Workflow template not found: " + templateId));

    mockMvc
        .perform(
            get("/api/workflow/templates/" + templateId)
                .header("X-Caller-Id", "staff-1")
                .header("X-Tenant-Id", "clinic-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.kind", equalTo("NOT_FOUND")));
  }
}
