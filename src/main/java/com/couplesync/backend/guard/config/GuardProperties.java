package com.couplesync.backend.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.guard")
public class GuardProperties {

    private Lockout lockout = new Lockout();
    private Rate rate = new Rate();

    /** 多久沒被碰過的 key 由 janitor 清掉 */
    private Duration idleEviction = Duration.ofHours(1);

    @Data
    public static class Lockout {
        /** window 內失敗幾次就鎖 */
        private int threshold = 5;

        /** 失敗紀錄的滑動視窗 */
        private Duration attemptWindow = Duration.ofMinutes(15);

        /** 鎖多久 */
        private Duration lockDuration = Duration.ofMinutes(5);
    }

    @Data
    public static class Rate {
        private boolean enabled = true;

        /** 固定視窗長度 */
        private Duration window = Duration.ofMinutes(15);

        /** /auth/** 失敗請求上限（每個來源 IP） */
        private int authLimit = 100;

        /** 登入失敗上限（每個來源 IP，比 authLimit 嚴） */
        private int failedLoginLimit = 50;

        /** 一般 API 上限（每個來源 IP） */
        private int apiLimit = 1000;
    }
}
