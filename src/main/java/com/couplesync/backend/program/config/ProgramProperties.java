package com.couplesync.backend.program.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.program")
public class ProgramProperties {

    /** 開始幾個 step 之後解鎖下一期 */
    private int stepsRequiredForUnlock = 7;

    /** 生成計畫的天數 */
    private int planDays = 14;
}
