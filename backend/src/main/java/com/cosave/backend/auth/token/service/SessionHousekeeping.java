package com.cosave.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.token.store.RefreshRecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 종료 상태(폐기 + 만료) refresh 레코드 정리
 * - 요청 처리 경로에서는 삭제하지 않는다. 이 작업만 삭제한다.
 * - 보존 기간(retention-days)이 지난 것만 지워 감사/조사용 흔적을 남긴다.
 * - cron "-" 이면 스케줄 비활성 (테스트 프로필)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionHousekeeping {

    private final RefreshRecordStore store;
    private final AuthProperties props;
    private final Clock clock;

    @Scheduled(cron = "${app.auth.housekeeping.cron}")
    public void scheduledPurge() {
        purge();
    }

    public int purge() {
        LocalDateTime before = LocalDateTime.now(clock).minusDays(props.housekeeping().retentionDays());
        int deleted = store.purgeExpiredRevoked(before);

        log.info("refresh 레코드 정리 완료: before={}, deleted={}", before, deleted);
        return deleted;
    }
}
