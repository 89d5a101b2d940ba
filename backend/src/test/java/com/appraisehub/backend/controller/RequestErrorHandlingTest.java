package com.appraisehub.backend.controller;

import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.security.AppraisalActor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RequestErrorHandlingTest {

    @Autowired
    private MockMvc mockMvc;

    private static UsernamePasswordAuthenticationToken as(long userId, User.UserRole role) {
        return new UsernamePasswordAuthenticationToken(new AppraisalActor(userId, role), null,
                List.of(new SimpleGrantedAuthority("ROLE_" + role.name())));
    }

    @Test
    @DisplayName("an unknown status value is a 400 naming the field")
    void unknownEnumValue() throws Exception {
        mockMvc.perform(patch("/api/evaluations/1")
                        .with(authentication(as(4L, User.UserRole.ADMIN)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"BOGUS\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid value 'BOGUS' for status"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("a body that is not JSON is a 400")
    void malformedJson() throws Exception {
        mockMvc.perform(post("/api/appraisal-groups")
                        .with(authentication(as(900L, User.UserRole.HR_MANAGER)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    @DisplayName("a non-numeric evaluation id is a 400")
    void nonNumericPathId() throws Exception {
        mockMvc.perform(get("/api/evaluations/abc")
                        .with(authentication(as(4L, User.UserRole.ADMIN))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid value 'abc' for id"));
    }
}
