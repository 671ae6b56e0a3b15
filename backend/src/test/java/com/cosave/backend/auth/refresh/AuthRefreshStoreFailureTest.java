package com.cosave.backend.auth.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.cosave.backend.auth.AbstractAuthIntegrationTest;
import com.cosave.backend.auth.domain.User;
import com.cosave.backend.auth.support.AuthFlowSupport;
import com.cosave.backend.auth.support.AuthHttpSupport;
import com.cosave.backend.auth.support.AuthHttpSupport.LoginResult;
import com.cosave.backend.auth.token.domain.RefreshRecord;
import com.cosave.backend.auth.token.store.RefreshRecordStore;
import com.cosave.backend.auth.token.store.StoreUnavailableException;
import com.cosave.backend.global.ErrorCode;
import com.cosave.backend.infra.TestClockConfig;

@DisplayName("[Auth][Refresh] 저장소 장애 시 refresh는 실패(503)이고 세션은 그대로 남는다")
class AuthRefreshStoreFailureTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @SpyBean RefreshRecordStore store;

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("rotate 타임아웃 → 503 AUTH_STORE_UNAVAILABLE + Retry-After: 1 + 쿠키 유지 + 기존 레코드 활성")
    void rotate_timeout_is_a_retryable_failure() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        String recordId = recordIdOf(login.refreshRaw());

        doThrow(new StoreUnavailableException("rotate", new QueryTimeoutException("lock wait timeout")))
                .when(store).rotate(anyString(), any());

        MvcResult res = AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, AuthHttpSupport.refreshCookie(login.refreshRaw())),
                ErrorCode.AUTH_STORE_UNAVAILABLE);

        assertThat(res.getResponse().getStatus()).isEqualTo(503);
        assertThat(res.getResponse().getHeader(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        assertThat(res.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .as("저장소 장애는 거절이 아니므로 refresh 쿠키를 지우지 않는다")
                .noneMatch(line -> line.startsWith(AuthHttpSupport.REFRESH_COOKIE + "="));

        RefreshRecord old = record(recordId);
        assertThat(old.isRevoked()).isFalse();
        assertThat(old.isActive(TestClockConfig.now())).isTrue();
        assertThat(old.getReplacedBy()).isNull();

        List<RefreshRecord> all = recordsOf(user.getId());
        assertThat(all).hasSize(1);
    }

    @Test
    @DisplayName("저장소 복구 후 같은 쿠키로 재시도하면 정상 로테이션")
    void same_cookie_works_after_store_recovers() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        doThrow(new StoreUnavailableException("rotate", new QueryTimeoutException("lock wait timeout")))
                .when(store).rotate(anyString(), any());
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, AuthHttpSupport.refreshCookie(login.refreshRaw())),
                ErrorCode.AUTH_STORE_UNAVAILABLE);

        doCallRealMethod().when(store).rotate(anyString(), any());
        AuthFlowSupport.refreshOk(mvc, login.refreshRaw());

        assertThat(recordOf(login.refreshRaw()).isRotated()).isTrue();
    }
}
