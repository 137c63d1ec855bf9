package com.sarkariexams.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;

import jakarta.servlet.http.Cookie;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

/**
 * Login, CSRF and step-up plumbing shared by the HTTP-level tests.
 */
public abstract class AbstractAdminApiIntegrationTest extends AbstractPostgresIntegrationTest {

    protected static final String CSRF_HEADER = "X-CSRF-Token";
    protected static final String STEP_UP_HEADER = "X-Admin-Step-Up-Token";
    protected static final String APPROVAL_HEADER = "X-Admin-Approval-Id";
    protected static final String BREAK_GLASS_HEADER = "X-Admin-Break-Glass-Reason";

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected TestAdminAccounts testAdminAccounts;

    protected AdminLogin login(AdminUser user) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/auth/login")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "email": "%s",
                                          "password": "%s"
                                        }
                                        """.formatted(user.getEmail(), TestAdminAccounts.DEFAULT_PASSWORD))
                )
                .andExpect(status().isOk())
                .andReturn();

        JsonNode body = read(result);
        return new AdminLogin(
                user,
                result.getResponse().getCookie("admin_auth_token"),
                result.getResponse().getCookie("csrf_token"),
                body.path("data").path("csrfToken").asText()
        );
    }

    protected String stepUp(AdminLogin login) throws Exception {
        MvcResult result = mockMvc.perform(
                        authed(post("/auth/admin/step-up"), login)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "email": "%s",
                                          "password": "%s"
                                        }
                                        """.formatted(login.user().getEmail(), TestAdminAccounts.DEFAULT_PASSWORD))
                )
                .andExpect(status().isOk())
                .andReturn();
        return read(result).path("data").path("token").asText();
    }

    /**
     * Attaches the session and CSRF cookies plus the matching CSRF header.
     */
    protected MockHttpServletRequestBuilder authed(MockHttpServletRequestBuilder builder, AdminLogin login) {
        return builder
                .cookie(login.sessionCookie(), login.csrfCookie())
                .header(CSRF_HEADER, login.csrfToken());
    }

    protected MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder builder, Object body) throws Exception {
        return builder
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body));
    }

    protected JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    protected JsonNode read(ResultActions actions) throws Exception {
        return read(actions.andReturn());
    }

    protected record AdminLogin(AdminUser user, Cookie sessionCookie, Cookie csrfCookie, String csrfToken) {
    }
}
