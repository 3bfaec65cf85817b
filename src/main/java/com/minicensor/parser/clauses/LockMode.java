package com.minicensor.parser.clauses;

/**
 * LockMode - SELECT的加锁方式
 */
public enum LockMode {
    /** 不加锁 */
    NONE,
    /** FOR UPDATE */
    FOR_UPDATE,
    /** LOCK IN SHARE MODE */
    SHARE_MODE
}
