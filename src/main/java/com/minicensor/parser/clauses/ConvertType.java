package com.minicensor.parser.clauses;

import com.minicensor.parser.expressions.LiteralExpression;

import java.util.Objects;
import java.util.Optional;

/**
 * ConvertType - CONVERT(expr, type) / CAST(expr AS type) 中的目标类型
 *
 * 例如 DECIMAL(10, 2)、CHAR(20) CHARACTER SET utf8mb4、BINARY。
 */
public final class ConvertType {

    /** 类型名 */
    private final String typeName;

    /** 长度(没有时为null) */
    private final LiteralExpression length;

    /** 小数位(没有时为null) */
    private final LiteralExpression scale;

    /** 字符集(没有时为null) */
    private final String charset;

    public ConvertType(String typeName, LiteralExpression length, LiteralExpression scale, String charset) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.length = length;
        this.scale = scale;
        this.charset = charset;
    }

    public String getTypeName() {
        return typeName;
    }

    public Optional<LiteralExpression> getLength() {
        return Optional.ofNullable(length);
    }

    public Optional<LiteralExpression> getScale() {
        return Optional.ofNullable(scale);
    }

    public Optional<String> getCharset() {
        return Optional.ofNullable(charset);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(typeName);
        if (length != null) {
            sb.append('(').append(length);
            if (scale != null) {
                sb.append(", ").append(scale);
            }
            sb.append(')');
        }
        if (charset != null) {
            sb.append(" CHARACTER SET ").append(charset);
        }
        return sb.toString();
    }
}
