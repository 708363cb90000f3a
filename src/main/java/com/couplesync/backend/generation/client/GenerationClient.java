package com.couplesync.backend.generation.client;

/**
 * 外部文字生成
 * 失敗一律丟 GenerationException（含 timeout）
 */
public interface GenerationClient {

    String providerCode();

    /**
     * @return 模型回傳的原始文字（尚未驗證）
     */
    String complete(GenerationRequest request);
}
