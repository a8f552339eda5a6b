package com.levelsync.enrollment.membership.controller;

import com.levelsync.enrollment.membership.service.MembershipEventAdapter;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import com.levelsync.shared.security.ServiceAuthValidator;
import com.levelsync.shared.security.exception.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MembershipInternalController.class)
@DisplayName("MembershipInternalController 테스트")
class MembershipInternalControllerTest {

    private static final String API_KEY = "billing-key";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MembershipEventAdapter membershipEventAdapter;

    @MockBean
    private ServiceAuthValidator serviceAuthValidator;

    @Test
    @DisplayName("POST /internal/v1/memberships/users/{userId}/cancellations - 접근 모델 기준 취소")
    void cancelMembership() throws Exception {
        given(serviceAuthValidator.validateAndGetCaller(API_KEY)).willReturn("membership-billing");
        given(membershipEventAdapter.onMembershipCancelled(6L, 2L))
                .willReturn(new ReconciliationResult(Set.of(), Set.of(10L), Set.of()));

        mockMvc.perform(post("/internal/v1/memberships/users/6/cancellations")
                        .header("X-Api-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"levelId\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(6))
                .andExpect(jsonPath("$.unenrolledCourseIds[0]").value(10))
                .andExpect(jsonPath("$.enrolledCourseIds").isEmpty());
    }

    @Test
    @DisplayName("POST /internal/v1/memberships/users/{userId}/reconciliations - 재조정")
    void reconcile() throws Exception {
        given(serviceAuthValidator.validateAndGetCaller(API_KEY)).willReturn("operations");
        given(membershipEventAdapter.onReconcileRequested(8L, List.of(5L)))
                .willReturn(new ReconciliationResult(Set.of(12L), Set.of(10L), Set.of(11L)));

        mockMvc.perform(post("/internal/v1/memberships/users/8/reconciliations")
                        .header("X-Api-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"previousLevelIds\":[5]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enrolledCourseIds[0]").value(12))
                .andExpect(jsonPath("$.unenrolledCourseIds[0]").value(10))
                .andExpect(jsonPath("$.failedCourseIds[0]").value(11));
    }

    @Test
    @DisplayName("잘못된 API Key는 401")
    void invalidApiKeyIsUnauthorized() throws Exception {
        given(serviceAuthValidator.validateAndGetCaller("wrong"))
                .willThrow(new UnauthorizedException("Invalid API Key"));

        mockMvc.perform(post("/internal/v1/memberships/users/6/cancellations")
                        .header("X-Api-Key", "wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"levelId\":2}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));

        then(membershipEventAdapter).should(never()).onMembershipCancelled(anyLong(), anyLong());
    }

    @Test
    @DisplayName("X-Api-Key 헤더가 없으면 401")
    void missingApiKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/internal/v1/memberships/users/6/cancellations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"levelId\":2}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("levelId가 없으면 400")
    void missingLevelIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/internal/v1/memberships/users/6/cancellations")
                        .header("X-Api-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));

        then(membershipEventAdapter).should(never()).onMembershipCancelled(any(), any());
    }
}
