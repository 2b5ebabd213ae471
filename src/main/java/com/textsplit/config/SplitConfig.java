package com.textsplit.config;

import com.textsplit.text.DelimiterMatcher;
import com.textsplit.text.Matchers;
import com.textsplit.text.SplitLimit;

import java.nio.charset.Charset;

/**
 * 切分运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class SplitConfig {
    private MatcherType matcherType = Constants.DEFAULT_MATCHER_TYPE;
    private String delimiter = Constants.DEFAULT_DELIMITER;
    private Integer limit;
    private String format = Constants.DEFAULT_FORMAT;
    private Charset charset = Charset.forName(Constants.DEFAULT_CHARSET);
    
    public MatcherType getMatcherType() {
        return matcherType;
    }
    
    public void setMatcherType(MatcherType matcherType) {
        this.matcherType = matcherType;
    }
    
    public String getDelimiter() {
        return delimiter;
    }
    
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }
    
    /**
     * 可空：null 表示默认模式
     */
    public Integer getLimit() {
        return limit;
    }
    
    public void setLimit(Integer limit) {
        this.limit = limit;
    }
    
    public String getFormat() {
        return format;
    }
    
    public void setFormat(String format) {
        this.format = format;
    }
    
    public Charset getCharset() {
        return charset;
    }
    
    public void setCharset(Charset charset) {
        this.charset = charset;
    }
    
    /**
     * 按匹配器类型与分隔符构造匹配器
     * 
     * @throws IllegalArgumentException 分隔符为空或超过长度上限
     */
    public DelimiterMatcher toMatcher() {
        if (matcherType == MatcherType.WHITESPACE) {
            return Matchers.whitespaceRun();
        }
        if (delimiter != null && delimiter.length() > Constants.MAX_DELIMITER_LENGTH) {
            throw new IllegalArgumentException("分隔符长度超过限制（最大 " + Constants.MAX_DELIMITER_LENGTH + " 字符）");
        }
        switch (matcherType) {
            case ANY_OF:
                return Matchers.anyOf(delimiter);
            case REGEX:
                return Matchers.regex(delimiter);
            case LITERAL:
            default:
                return Matchers.literal(delimiter);
        }
    }
    
    /**
     * @throws com.textsplit.text.InvalidLimitException limit 取值非法
     */
    public SplitLimit toSplitLimit() {
        return SplitLimit.of(limit);
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static SplitConfig defaults() {
        return new SplitConfig();
    }
}
