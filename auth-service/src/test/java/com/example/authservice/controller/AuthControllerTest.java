package com.example.authservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests through the real Spring context: register, login, gated endpoints.
 *
 * Every test registers its own email so tests share the in-memory store safely.
 */
@SpringBootTest(properties = {
    "auth.jwt.secret=test-secret-for-auth-controller-tests",
    "auth.password.work-factor=4"
})
@AutoConfigureMockMvc
class AuthControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void register_returns201WithTokenAndProfile() throws Exception {
        String email = uniqueEmail();

        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(email.toUpperCase(), "password1", "Ann", null)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.message").value("User registered successfully"))
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(jsonPath("$.user.role").value("student"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
    }

    @Test
    void register_duplicateEmail_409() throws Exception {
        String email = uniqueEmail();
        register(email, "password1", "student");

        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(email, "password2", "Again", null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("EMAIL_EXISTS"))
                .andExpect(jsonPath("$.error.message").value("Email already registered"));
    }

    @Test
    void register_invalidRole_400() throws Exception {
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(uniqueEmail(), "password1", "Eve", "superuser")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message")
                        .value("Invalid role. Must be admin, instructor, or student"));
    }

    @Test
    void register_shortPassword_400() throws Exception {
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(uniqueEmail(), "abc", "Short", null)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Password must be at least 6 characters long"));
    }

    @Test
    void register_malformedBody_400() throws Exception {
        mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void login_succeedsAndTokenOpensMe() throws Exception {
        String email = uniqueEmail();
        register(email, "password1", "instructor");

        String body = objectMapper.writeValueAsString(Map.of("email", email, "password", "password1"));
        String response = mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Login successful"))
                .andReturn().getResponse().getContentAsString();
        String token = objectMapper.readTree(response).get("token").asText();

        mvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(jsonPath("$.user.role").value("instructor"));
    }

    @Test
    void login_wrongPasswordOrUnknownEmail_sameResponse() throws Exception {
        String email = uniqueEmail();
        register(email, "password1", "student");

        for (String body : new String[] {
                objectMapper.writeValueAsString(Map.of("email", email, "password", "wrong-pass")),
                objectMapper.writeValueAsString(Map.of("email", uniqueEmail(), "password", "password1"))}) {
            mvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error.code").value("INVALID_CREDENTIALS"))
                    .andExpect(jsonPath("$.error.message").value("Invalid email or password"));
        }
    }

    @Test
    void me_withoutToken_401() throws Exception {
        mvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

        mvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer "))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.message").value("No token provided"));

        mvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("INVALID_TOKEN"))
                .andExpect(jsonPath("$.error.message").value("Invalid or expired token"));
    }

    @Test
    void session_reflectsOptionalAuthentication() throws Exception {
        mvc.perform(get("/api/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.userId").doesNotExist());

        String email = uniqueEmail();
        String token = register(email, "password1", "student");
        mvc.perform(get("/api/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.role").value("student"));
    }

    @Test
    void userEndpoints_enforceRoles() throws Exception {
        String student = register(uniqueEmail(), "password1", "student");
        String instructor = register(uniqueEmail(), "password1", "instructor");
        String admin = register(uniqueEmail(), "password1", "admin");

        mvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, "Bearer " + student))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.error.message")
                        .value("Access denied. Required role(s): admin. Your role: student"));

        mvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, "Bearer " + admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users").isArray());

        mvc.perform(get("/api/users/1").header(HttpHeaders.AUTHORIZATION, "Bearer " + instructor))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.message")
                        .value("Access denied. Required role(s): admin. Your role: instructor"));

        mvc.perform(get("/api/users/1").header(HttpHeaders.AUTHORIZATION, "Bearer " + admin))
                .andExpect(status().isOk());

        mvc.perform(get("/api/users/999999").header(HttpHeaders.AUTHORIZATION, "Bearer " + admin))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("USER_NOT_FOUND"));
    }

    @Test
    void errorBodyEchoesRequestId() throws Exception {
        mvc.perform(post("/api/auth/login")
                        .header("X-Request-ID", "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"\",\"password\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.requestId").value("trace-123"));
    }

    @Test
    void login_wrongContentType_415() throws Exception {
        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("email=a@b.com"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));
    }

    @Test
    void unsupportedMethod_405() throws Exception {
        mvc.perform(get("/api/auth/login"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));
    }

    @Test
    void apiDocs_arePublic() throws Exception {
        mvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Auth Service API"))
                .andExpect(jsonPath("$.components.securitySchemes.bearerAuth.scheme").value("bearer"));
    }

    private String register(String email, String password, String role) throws Exception {
        String response = mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(email, password, "User", role)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(response);
        assertTrue(json.get("ok").asBoolean());
        return json.get("token").asText();
    }

    private String registerBody(String email, String password, String name, String role) throws Exception {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("password", password);
        body.put("name", name);
        if (role != null) {
            body.put("role", role);
        }
        return objectMapper.writeValueAsString(body);
    }

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID() + "@example.com";
    }
}
