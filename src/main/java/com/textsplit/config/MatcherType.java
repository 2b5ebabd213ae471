package com.textsplit.config;

/** 分隔符匹配器类型 */
public enum MatcherType {
    /** 字面量分隔符 */
    LITERAL,
    /** 任一字符 */
    ANY_OF,
    /** 连续空白 */
    WHITESPACE,
    /** 正则表达式 */
    REGEX
}
