package com.couplesync.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIp {

    private ClientIp() {}

    /**
     * 只認 socket 位址；X-Forwarded-For 由 client 自己填，不能拿來當限流 key
     * 在 proxy 後面時由 server.forward-headers-strategy 決定要不要改寫 remoteAddr
     */
    public static String of(HttpServletRequest req) {
        return req.getRemoteAddr();
    }
}
