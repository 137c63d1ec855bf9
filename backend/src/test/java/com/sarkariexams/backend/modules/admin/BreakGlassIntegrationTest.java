package com.sarkariexams.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.sarkariexams.backend.modules.auth.domain.AdminRole;
import com.sarkariexams.backend.support.AbstractAdminApiIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class BreakGlassIntegrationTest extends AbstractAdminApiIntegrationTest {

    private static final String LONG_REASON = "Result link broken during counselling window";

    private AdminLogin admin;
    private String stepUpToken;

    @BeforeEach
    void setUp() throws Exception {
        admin = login(testAdminAccounts.create(AdminRole.ADMIN));
        stepUpToken = stepUp(admin);
    }

    @Test
    void breakGlassIsRefusedWhileDisabled() throws Exception {
        mockMvc.perform(json(authed(post("/admin/announcements"), admin), publishedAnnouncement("Agniveer rally dates"))
                        .header(STEP_UP_HEADER, stepUpToken)
                        .header(BREAK_GLASS_HEADER, LONG_REASON))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("break_glass_disabled"));

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM approval_request", Integer.class)).isZero();
    }

    @Test
    void shortReasonIsRefusedAndLongReasonBypassesApproval() throws Exception {
        updatePolicy(true, 12)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.breakGlassEnabled").value(true))
                .andExpect(jsonPath("$.data.breakGlassMinReasonLength").value(12));

        Map<String, Object> body = publishedAnnouncement("JEE Main session 2 result");

        mockMvc.perform(json(authed(post("/admin/announcements"), admin), body)
                        .header(STEP_UP_HEADER, stepUpToken)
                        .header(BREAK_GLASS_HEADER, "typo!"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("break_glass_reason_too_short"));

        JsonNode created = read(mockMvc.perform(json(authed(post("/admin/announcements"), admin), body)
                        .header(STEP_UP_HEADER, stepUpToken)
                        .header(BREAK_GLASS_HEADER, LONG_REASON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("published")));
        String announcementId = created.path("data").path("id").asText();

        JsonNode audit = read(mockMvc.perform(get("/admin/audit")
                        .param("announcementId", announcementId)
                        .param("action", "create")
                        .cookie(admin.sessionCookie()))
                .andExpect(status().isOk()));
        assertThat(audit.path("data")).hasSize(1);
        JsonNode metadata = audit.path("data").get(0).path("metadata");
        assertThat(metadata.path("breakGlassUsed").asBoolean()).isTrue();
        assertThat(metadata.path("breakGlassReason").asText()).isEqualTo(LONG_REASON);

        JsonNode denied = read(mockMvc.perform(get("/admin/audit")
                        .param("action", "admin_action_denied")
                        .cookie(admin.sessionCookie()))
                .andExpect(status().isOk()));
        assertThat(denied.path("data").get(0).path("metadata").path("error").asText())
                .isEqualTo("break_glass_reason_too_short");
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM approval_request", Integer.class)).isZero();
    }

    @Test
    void policyUpdateNeedsStepUp() throws Exception {
        mockMvc.perform(json(authed(put("/admin/policies"), admin), policyBody(true, 20)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("step_up_required"));

        mockMvc.perform(get("/admin/policies").cookie(admin.sessionCookie()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.breakGlassEnabled").value(false));
    }

    @Test
    void policyBelowMinimumsIsRejected() throws Exception {
        Map<String, Object> body = policyBody(true, 12);
        body.put("approvalExpiryMinutes", 1);

        mockMvc.perform(json(authed(put("/admin/policies"), admin), body).header(STEP_UP_HEADER, stepUpToken))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void disablingDualApprovalLetsSteppedUpPublishRunImmediately() throws Exception {
        Map<String, Object> body = policyBody(false, 12);
        body.put("dualApprovalRequired", false);
        mockMvc.perform(json(authed(put("/admin/policies"), admin), body).header(STEP_UP_HEADER, stepUpToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dualApprovalRequired").value(false));

        mockMvc.perform(json(authed(post("/admin/announcements"), admin), publishedAnnouncement("GATE 2027 brochure"))
                        .header(STEP_UP_HEADER, stepUpToken))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("published"));
    }

    @Test
    void editorCannotChangePolicies() throws Exception {
        AdminLogin editor = login(testAdminAccounts.create(AdminRole.EDITOR));

        mockMvc.perform(json(authed(put("/admin/policies"), editor), policyBody(true, 12))
                        .header(STEP_UP_HEADER, stepUp(editor)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("forbidden"));
    }

    private ResultActions updatePolicy(boolean breakGlass, int minReason)
            throws Exception {
        return mockMvc.perform(json(authed(put("/admin/policies"), admin), policyBody(breakGlass, minReason))
                .header(STEP_UP_HEADER, stepUpToken));
    }

    private static Map<String, Object> policyBody(boolean breakGlass, int minReason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dualApprovalRequired", true);
        body.put("breakGlassEnabled", breakGlass);
        body.put("breakGlassMinReasonLength", minReason);
        body.put("stepUpTtlSeconds", 600);
        body.put("stepUpSingleUse", false);
        body.put("approvalExpiryMinutes", 30);
        return body;
    }

    private static Map<String, Object> publishedAnnouncement(String title) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", title);
        body.put("type", "result");
        body.put("category", "Engineering Entrance");
        body.put("organization", "National Testing Agency");
        body.put("content", "Scorecards are available for download.");
        body.put("externalLink", "https://jeemain.nta.ac.in");
        body.put("status", "published");
        return body;
    }
}
