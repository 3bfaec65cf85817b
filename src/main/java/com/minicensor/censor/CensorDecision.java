package com.minicensor.censor;

import java.util.Objects;
import java.util.Optional;

/**
 * CensorDecision - 一次查询检查的结果
 *
 * 放行的查询没有拒绝原因;白名单放行和黑名单拒绝时带有命中的模式文本。
 */
public final class CensorDecision {

    private final Verdict verdict;

    private final Reason reason;

    private final String matchedPattern;

    private CensorDecision(Verdict verdict, Reason reason, String matchedPattern) {
        this.verdict = verdict;
        this.reason = reason;
        this.matchedPattern = matchedPattern;
    }

    static CensorDecision allow(String matchedPattern) {
        return new CensorDecision(Verdict.ALLOW, null, matchedPattern);
    }

    static CensorDecision deny(Reason reason, String matchedPattern) {
        return new CensorDecision(Verdict.DENY, Objects.requireNonNull(reason, "reason"), matchedPattern);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOW;
    }

    /**
     * 拒绝原因,放行时为空
     */
    public Optional<Reason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * 命中的模式文本
     */
    public Optional<String> getMatchedPattern() {
        return Optional.ofNullable(matchedPattern);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CensorDecision{").append(verdict);
        if (reason != null) {
            sb.append(", ").append(reason);
        }
        if (matchedPattern != null) {
            sb.append(", pattern=").append(matchedPattern);
        }
        return sb.append('}').toString();
    }

    public enum Verdict {
        ALLOW,
        DENY
    }

    /**
     * 拒绝原因
     */
    public enum Reason {
        /** 黑名单中有模式匹配该查询 */
        QUERY_IN_BLACKLIST("query's structure is forbidden"),
        /** 白名单中没有模式匹配该查询 */
        QUERY_NOT_IN_WHITELIST("query's structure is forbidden"),
        /** 查询无法解析 */
        QUERY_SYNTAX_ERROR("fail to parse specified query");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
