package com.cosave.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/** "성공 플로우"를 짧게 만드는 고수준 유틸 (테스트 전용) */
public final class AuthFlowSupport {
    private AuthFlowSupport() {}

    /** POST /auth/login → 200 + accessToken(body) + refresh(Set-Cookie) */
    public static AuthHttpSupport.LoginResult loginOk(
            MockMvc mvc,
            String email,
            String password,
            boolean rememberMe
    ) throws Exception {

        MvcResult res = AuthHttpSupport.performLogin(mvc, email, password, rememberMe)
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();

        String accessToken = extractAccessToken(res, "login");
        List<String> setCookieHeaders = extractSetCookieHeaders(res, "login");
        String refreshRaw = extractRequiredCookieValue(setCookieHeaders, "login");

        return new AuthHttpSupport.LoginResult(accessToken, refreshRaw, setCookieHeaders);
    }

    /** POST /auth/refresh → 200 + 새 accessToken + 새 refresh */
    public static AuthHttpSupport.RefreshResult refreshOk(MockMvc mvc, String refreshRaw) throws Exception {
        assertThat(refreshRaw)
                .as("refreshOk 호출 시 refreshRaw는 비어있으면 안 됨")
                .isNotBlank();

        MvcResult res = AuthHttpSupport.performRefresh(mvc, AuthHttpSupport.refreshCookie(refreshRaw))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();

        String accessToken = extractAccessToken(res, "refresh");
        List<String> setCookieHeaders = extractSetCookieHeaders(res, "refresh");
        String newRefreshRaw = extractRequiredCookieValue(setCookieHeaders, "refresh");

        return new AuthHttpSupport.RefreshResult(accessToken, newRefreshRaw, setCookieHeaders);
    }

    private static String extractAccessToken(MvcResult res, String flowName) throws Exception {
        var json = AuthHttpSupport.readJson(res);
        String token = json.path("accessToken").asText(null);

        assertThat(token)
                .as("[%s] 응답 JSON에 accessToken이 있어야 함", flowName)
                .isNotBlank();
        assertThat(json.path("expiresAt").asText(null))
                .as("[%s] 응답 JSON에 expiresAt이 있어야 함", flowName)
                .isNotBlank();

        return token;
    }

    private static List<String> extractSetCookieHeaders(MvcResult res, String flowName) {
        List<String> headers = res.getResponse().getHeaders(HttpHeaders.SET_COOKIE);

        assertThat(headers)
                .as("[%s] Set-Cookie 헤더가 최소 1개 이상 있어야 함", flowName)
                .isNotNull()
                .isNotEmpty();

        return headers;
    }

    private static String extractRequiredCookieValue(List<String> setCookieHeaders, String flowName) {
        String value = AuthHttpSupport.extractCookieValue(setCookieHeaders, AuthHttpSupport.REFRESH_COOKIE);

        assertThat(value)
                .as("[%s] Set-Cookie에서 refresh 쿠키 값을 추출해야 함. headers=%s", flowName, setCookieHeaders)
                .isNotBlank();

        return value;
    }
}
