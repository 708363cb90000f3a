package com.couplesync.backend.generation.safety;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 使用者文字嵌進 prompt 前的清洗（防 prompt injection）
 */
@Slf4j
public final class PromptSanitizer {

    public static final int MAX_LEN = 2000;

    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");
    private static final Pattern ROLE_PREFIX_LINE = Pattern.compile("\\n\\s*(System|Assistant|Human|User|AI):\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROLE_PREFIX_START = Pattern.compile("^(System|Assistant|Human|User|AI):\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern INST_BLOCK = Pattern.compile("\\[INST\\][\\s\\S]*?\\[/INST\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern INST_TAG = Pattern.compile("\\[/?INST\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROL_SEQ = Pattern.compile("<\\|.*?\\|>");
    private static final Pattern OVERRIDE_PHRASE = Pattern.compile(
            "ignore\\s+previous\\s+instructions|forget\\s+everything|new\\s+instructions|override\\s+instructions",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MANY_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern MANY_SPACES = Pattern.compile("\\s{3,}");

    private static final List<Pattern> SUSPICIOUS = List.of(
            Pattern.compile("prompt\\s*injection", Pattern.CASE_INSENSITIVE),
            Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ignore\\s+instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*override", Pattern.CASE_INSENSITIVE),
            Pattern.compile("developer\\s*mode", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unrestricted\\s*mode", Pattern.CASE_INSENSITIVE),
            Pattern.compile("god\\s*mode", Pattern.CASE_INSENSITIVE),
            Pattern.compile("admin\\s*access", Pattern.CASE_INSENSITIVE),
            Pattern.compile("root\\s*access", Pattern.CASE_INSENSITIVE)
    );

    private PromptSanitizer() {}

    public static String sanitize(String input) {
        if (input == null) return "";

        String s = CODE_BLOCK.matcher(input).replaceAll("[code block removed]");
        s = INLINE_CODE.matcher(s).replaceAll("$1");
        s = ROLE_PREFIX_LINE.matcher(s).replaceAll("\n");
        s = ROLE_PREFIX_START.matcher(s).replaceAll("");
        s = INST_BLOCK.matcher(s).replaceAll("[instruction removed]");
        s = INST_TAG.matcher(s).replaceAll("");
        s = CONTROL_SEQ.matcher(s).replaceAll("[control sequence removed]");
        s = OVERRIDE_PHRASE.matcher(s).replaceAll("[instruction attempt removed]");
        s = MANY_NEWLINES.matcher(s).replaceAll("\n\n");
        s = MANY_SPACES.matcher(s).replaceAll(" ");
        s = s.trim();

        return (s.length() > MAX_LEN) ? s.substring(0, MAX_LEN) : s;
    }

    /** true = 看起來在試探模型，呼叫端應拒絕 */
    public static boolean isSuspicious(String input) {
        if (input == null) return false;
        for (Pattern p : SUSPICIOUS) {
            if (p.matcher(input).find()) {
                log.warn("security_suspicious_input pattern={}", p.pattern());
                return true;
            }
        }
        return false;
    }
}
