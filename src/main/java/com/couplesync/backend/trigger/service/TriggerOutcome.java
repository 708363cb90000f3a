package com.couplesync.backend.trigger.service;

/**
 * 一則 user message 對 step 狀態機造成的結果
 * NoContribution → OnePartyContributed（WAITING_FOR_PARTNER）→ Fired（FIRED）
 */
public enum TriggerOutcome {
    /** program 沒有 accepted pairing：只存訊息 */
    NOT_PAIRED,
    /** 不是這個人在這 step 的第一則 */
    REPEAT_CONTRIBUTION,
    WAITING_FOR_PARTNER,
    FIRED,
    /** marker 已被設過（理論上 step lock 下不會發生） */
    ALREADY_FIRED
}
