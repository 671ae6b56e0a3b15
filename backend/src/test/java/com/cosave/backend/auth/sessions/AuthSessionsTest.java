package com.cosave.backend.auth.sessions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.cosave.backend.auth.AbstractAuthIntegrationTest;
import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.domain.UserRole;
import com.cosave.backend.auth.support.AuthFlowSupport;
import com.cosave.backend.auth.support.AuthHttpSupport;
import com.cosave.backend.auth.support.AuthHttpSupport.LoginResult;
import com.cosave.backend.auth.token.domain.RefreshRevokeReason;
import com.cosave.backend.global.ErrorCode;

@DisplayName("[Auth][Sessions] 세션 목록 / 단건 종료 / 관리자")
class AuthSessionsTest extends AbstractAuthIntegrationTest {

    private static final String OTHER_EMAIL = "bob@cosave.dev";
    private static final String OTHER_PASSWORD = "bob-pass-1!";

    @Autowired MockMvc mvc;

    private User user;
    private User other;

    @BeforeEach
    void seedUsers() {
        user = createDefaultUser();
        other = createUser(OTHER_EMAIL, OTHER_PASSWORD, "Bob", UserRole.USER);
    }

    @Test
    @DisplayName("sessions: 내 활성 세션만 최신순으로 + 요청 쿠키의 세션은 current=true")
    void list_marks_current() throws Exception {
        LoginResult phone = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult laptop = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, true);
        AuthFlowSupport.loginOk(mvc, OTHER_EMAIL, OTHER_PASSWORD, false);

        AuthHttpSupport.performListSessions(mvc, laptop.accessToken(), AuthHttpSupport.refreshCookie(laptop.refreshRaw()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[?(@.recordId == '%s')].current".formatted(recordIdOf(laptop.refreshRaw()))).value(true))
                .andExpect(jsonPath("$[?(@.recordId == '%s')].current".formatted(recordIdOf(phone.refreshRaw()))).value(false));
    }

    @Test
    @DisplayName("sessions: 폐기된 세션은 목록에서 빠진다")
    void list_excludes_revoked() throws Exception {
        LoginResult phone = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult laptop = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        AuthHttpSupport.performLogout(mvc, AuthHttpSupport.refreshCookie(phone.refreshRaw()));

        AuthHttpSupport.performListSessions(mvc, laptop.accessToken(), null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].recordId").value(recordIdOf(laptop.refreshRaw())))
                .andExpect(jsonPath("$[0].current").value(false));
    }

    @Test
    @DisplayName("sessions: 내 세션 종료 → 204 + REVOKED_BY_USER")
    void revoke_own_session() throws Exception {
        LoginResult phone = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult laptop = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        String phoneId = recordIdOf(phone.refreshRaw());

        AuthHttpSupport.performRevokeSession(mvc, laptop.accessToken(), phoneId)
                .andExpect(status().isNoContent());

        assertThat(record(phoneId).getRevokeReason()).isEqualTo(RefreshRevokeReason.REVOKED_BY_USER);
        assertThat(recordOf(laptop.refreshRaw()).isRevoked()).isFalse();
    }

    @Test
    @DisplayName("sessions: 남의 세션 종료 시도 → 404 SESSION_NOT_FOUND + 변화 없음")
    void cannot_revoke_others_session() throws Exception {
        LoginResult mine = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult bobs = AuthFlowSupport.loginOk(mvc, OTHER_EMAIL, OTHER_PASSWORD, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRevokeSession(mvc, mine.accessToken(), recordIdOf(bobs.refreshRaw())),
                ErrorCode.SESSION_NOT_FOUND);

        assertThat(recordOf(bobs.refreshRaw()).isRevoked()).isFalse();
    }

    @Test
    @DisplayName("sessions: 존재하지 않는 세션 → 404 SESSION_NOT_FOUND")
    void revoke_unknown_session() throws Exception {
        LoginResult mine = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRevokeSession(mvc, mine.accessToken(), "00000000-0000-0000-0000-000000000000"),
                ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    @DisplayName("admin: 일반 사용자는 /auth/admin/** 접근 불가 → 403 ACCESS_DENIED")
    void admin_endpoints_require_admin_role() throws Exception {
        LoginResult mine = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performAdminListSessions(mvc, mine.accessToken(), other.getId()),
                ErrorCode.ACCESS_DENIED);
    }

    @Test
    @DisplayName("admin: 임의 소유자 세션 조회 + 강제 종료 → REVOKED_BY_ADMIN")
    void admin_can_list_and_revoke_any_session() throws Exception {
        createAdmin();
        LoginResult admin = AuthFlowSupport.loginOk(mvc, ADMIN_EMAIL, ADMIN_PASSWORD, false);
        LoginResult bobs = AuthFlowSupport.loginOk(mvc, OTHER_EMAIL, OTHER_PASSWORD, false);
        String bobsId = recordIdOf(bobs.refreshRaw());

        AuthHttpSupport.performAdminListSessions(mvc, admin.accessToken(), other.getId())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].recordId").value(bobsId))
                .andExpect(jsonPath("$[0].ownerId").value(other.getId().intValue()));

        AuthHttpSupport.performAdminRevokeSession(mvc, admin.accessToken(), bobsId)
                .andExpect(status().isNoContent());

        assertThat(record(bobsId).getRevokeReason()).isEqualTo(RefreshRevokeReason.REVOKED_BY_ADMIN);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, AuthHttpSupport.refreshCookie(bobs.refreshRaw())),
                ErrorCode.REFRESH_INVALID);
    }
}
