package com.minicensor.parser.clauses;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifier - 标识符(列名、表名、别名、库名)
 *
 * MySQL中列名与别名大小写不敏感,因此equals按小写规范形式比较。
 *
 * 保留标识符只由模式通配符 %%COLUMN%% 产生,与真实输入中的同名标识符
 * (例如 `%%COLUMN%%`)永远不相等。
 */
public final class Identifier {

    /** 原始文本(已去除反引号) */
    private final String value;

    /** 规范形式(小写) */
    private final String normalized;

    /** 是否为保留的通配符标识符 */
    private final boolean reserved;

    private Identifier(String value, boolean reserved) {
        this.value = Objects.requireNonNull(value, "identifier");
        this.normalized = value.toLowerCase(Locale.ROOT);
        this.reserved = reserved;
    }

    public static Identifier of(String value) {
        return new Identifier(value, false);
    }

    /**
     * 创建保留标识符,仅供通配符注册表使用
     */
    public static Identifier reserved(String value) {
        return new Identifier(value, true);
    }

    public String getValue() {
        return value;
    }

    public String getNormalized() {
        return normalized;
    }

    public boolean isReserved() {
        return reserved;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identifier)) {
            return false;
        }
        Identifier that = (Identifier) o;
        return reserved == that.reserved && normalized.equals(that.normalized);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalized, reserved);
    }

    @Override
    public String toString() {
        return value;
    }
}
