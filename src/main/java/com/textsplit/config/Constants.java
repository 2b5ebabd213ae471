package com.textsplit.config;

import com.textsplit.text.SplitLimit;

/**
 * 全局常量定义
 * 
 * 包含切分限制取值、默认分隔符与命令行参数上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 切分限制 ====================
    /** 不限次数且保留全部空词项 */
    public static final int UNBOUNDED_LIMIT = SplitLimit.UNBOUNDED_VALUE;
    
    // ==================== 默认值 ====================
    /** 默认分隔符 */
    public static final String DEFAULT_DELIMITER = ",";
    /** 默认匹配器类型 */
    public static final MatcherType DEFAULT_MATCHER_TYPE = MatcherType.LITERAL;
    /** 默认输出格式 */
    public static final String DEFAULT_FORMAT = "text";
    /** 默认输入字符集 */
    public static final String DEFAULT_CHARSET = "UTF-8";
    
    // ==================== 命令行参数上限 ====================
    /** 命令行分隔符最大长度 */
    public static final int MAX_DELIMITER_LENGTH = 256;
}
