package com.textsplit.ingest;

import com.textsplit.text.DelimiterMatcher;
import com.textsplit.text.DelimiterTokenizer;
import com.textsplit.text.SplitLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 按行读取文本并逐行切分，例如 CSV 行或日志字段。
 */
public class LineSplitter {
    private static final Logger logger = LoggerFactory.getLogger(LineSplitter.class);

    private final DelimiterMatcher matcher;
    private final SplitLimit limit;

    public LineSplitter(DelimiterMatcher matcher, SplitLimit limit) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.limit = Objects.requireNonNull(limit, "limit");
    }

    /**
     * 切分单行文本。
     */
    public SplitRecord splitLine(long lineNumber, String line) {
        return new SplitRecord(lineNumber, DelimiterTokenizer.tokenize(line, matcher, limit));
    }

    /**
     * 读取全部行并返回切分结果，行号从 1 开始。
     */
    public List<SplitRecord> splitAll(Reader reader) throws IOException {
        List<SplitRecord> records = new ArrayList<>();
        splitEach(reader, records::add);
        return List.copyOf(records);
    }

    /**
     * 逐行切分并回调，返回处理的行数。
     */
    public long splitEach(Reader reader, Consumer<SplitRecord> consumer) throws IOException {
        BufferedReader bufferedReader = reader instanceof BufferedReader
            ? (BufferedReader) reader
            : new BufferedReader(reader);

        long lineNumber = 0;
        long tokenCount = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            SplitRecord splitRecord = splitLine(lineNumber, line);
            tokenCount += splitRecord.tokens().size();
            consumer.accept(splitRecord);
        }
        logger.debug("Split {} lines into {} tokens (limit={})", lineNumber, tokenCount, limit);
        return lineNumber;
    }

    public DelimiterMatcher getMatcher() {
        return matcher;
    }

    public SplitLimit getLimit() {
        return limit;
    }
}
