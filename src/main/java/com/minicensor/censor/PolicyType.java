package com.minicensor.censor;

/**
 * PolicyType - 模式集合的使用方式
 */
public enum PolicyType {
    /** 白名单: 匹配任一模式才放行 */
    WHITELIST,
    /** 黑名单: 匹配任一模式即拒绝 */
    BLACKLIST
}
