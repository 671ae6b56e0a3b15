package com.cosave.backend.auth.me;

import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import com.cosave.backend.auth.AbstractAuthIntegrationTest;
import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.support.AuthFlowSupport;
import com.cosave.backend.auth.support.AuthHttpSupport;
import com.cosave.backend.auth.support.AuthHttpSupport.LoginResult;
import com.cosave.backend.global.ErrorCode;
import com.cosave.backend.infra.TestClockConfig;

@DisplayName("[Auth][Me] access token 인증 (identity-probe)")
class AuthMeTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("me: 유효한 Bearer → 200 + 사용자 정보")
    void me_ok() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(user.getId().intValue()))
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.nickname").value(NICKNAME))
                .andExpect(jsonPath("$.roles[0]").value("USER"))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    @DisplayName("me: TTL 15분 access → T+14분 통과, T+16분 401 ACCESS_INVALID")
    void access_ttl_boundary() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(14));
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk());

        TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(2));
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: refresh 레코드를 모두 폐기해도 이미 발급된 access는 만료 전까지 유효")
    void access_is_stateless() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.performLogoutAll(mvc, login.accessToken());

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 계정 정지 → 401 ACCESS_INVALID")
    void suspended_user_rejected() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        suspend(user.getId());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: refresh 토큰을 access처럼 사용 → 401 ACCESS_INVALID")
    void refresh_token_as_access_rejected() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.refreshRaw())),
                ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: Authorization 없음 / Bearer 아님 → 401 AUTH_REQUIRED (EntryPoint)")
    void missing_token() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, null), ErrorCode.AUTH_REQUIRED);
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Basic abc"), ErrorCode.AUTH_REQUIRED);
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Bearer   "), ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: 레거시 x-auth-token 헤더도 허용")
    void legacy_header_accepted() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        mvc.perform(MockMvcRequestBuilders.get(AuthHttpSupport.ME_ENDPOINT).header("x-auth-token", login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(user.getId().intValue()));
    }

    @Test
    @DisplayName("me: 형식이 깨진 토큰 → 401 ACCESS_INVALID + Cache-Control: no-store")
    void malformed_token() throws Exception {
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer("abc.def.ghi"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(ErrorCode.ACCESS_INVALID.name()))
                .andExpect(header().string("Cache-Control", "no-store"));
    }
}
