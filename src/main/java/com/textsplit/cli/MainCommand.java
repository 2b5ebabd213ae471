package com.textsplit.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.textsplit.config.Constants;
import com.textsplit.config.MatcherType;
import com.textsplit.config.SplitConfig;
import com.textsplit.ingest.LineSplitter;
import com.textsplit.ingest.SplitRecord;
import com.textsplit.text.DelimiterMatcher;
import com.textsplit.text.InvalidLimitException;
import com.textsplit.text.SplitLimit;
import com.textsplit.text.TokenizeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.PatternSyntaxException;

@Command(
    name = "tsplit",
    description = "✂️ 按分隔符切分文本行",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SplitSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("✂️ 按分隔符切分文本行");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    @Command(name = "split", description = "🔪 切分文件或标准输入中的每一行")
    static class SplitSubcommand implements Callable<Integer> {
        private static final Logger logger = LoggerFactory.getLogger(SplitSubcommand.class);

        @Parameters(description = "输入文件，缺省时读取标准输入", arity = "0..*")
        private List<Path> inputPaths;

        @Option(names = {"-m", "--matcher"}, description = "匹配器类型 (${COMPLETION-CANDIDATES})", defaultValue = "LITERAL")
        private MatcherType matcherType;

        @Option(names = {"-d", "--delimiter"}, description = "分隔符、字符集合或正则表达式", defaultValue = Constants.DEFAULT_DELIMITER)
        private String delimiter;

        @Option(names = {"-l", "--limit"}, description = "最多产生的词项数，" + Constants.UNBOUNDED_LIMIT + " 表示保留全部空词项")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = Constants.DEFAULT_FORMAT)
        private String format;

        @Option(names = {"--charset"}, description = "输入字符集", defaultValue = Constants.DEFAULT_CHARSET)
        private Charset charset;

        @Spec
        private CommandLine.Model.CommandSpec spec;

        private ObjectMapper mapper = new ObjectMapper();

        @Override
        public Integer call() {
            SplitConfig config = toConfig();
            LineSplitter splitter = new LineSplitter(resolveMatcher(config), resolveLimit(config));
            boolean json = "json".equalsIgnoreCase(config.getFormat());

            try {
                if (inputPaths == null || inputPaths.isEmpty()) {
                    BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, config.getCharset()));
                    splitter.splitEach(reader, splitRecord -> printRecord(splitRecord, json));
                    return 0;
                }
                for (Path inputPath : inputPaths) {
                    try (BufferedReader reader = Files.newBufferedReader(inputPath, config.getCharset())) {
                        splitter.splitEach(reader, splitRecord -> printRecord(splitRecord, json));
                    }
                }
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 读取输入失败: " + exception.getMessage());
                logger.debug("Input read failed", exception);
                return 1;
            } catch (UncheckedIOException exception) {
                System.err.println("❌ 输出失败: " + exception.getCause().getMessage());
                logger.debug("Output write failed", exception);
                return 1;
            } catch (TokenizeException exception) {
                System.err.println("❌ 切分失败: " + exception.getMessage());
                logger.debug("Tokenize failed", exception);
                return 1;
            }
        }

        SplitConfig toConfig() {
            SplitConfig config = SplitConfig.defaults();
            config.setMatcherType(matcherType != null ? matcherType : Constants.DEFAULT_MATCHER_TYPE);
            config.setDelimiter(delimiter);
            config.setLimit(limit);
            config.setFormat(format != null ? format : Constants.DEFAULT_FORMAT);
            if (charset != null) {
                config.setCharset(charset);
            }
            return config;
        }

        private DelimiterMatcher resolveMatcher(SplitConfig config) {
            try {
                return config.toMatcher();
            } catch (PatternSyntaxException exception) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "非法正则表达式: " + exception.getDescription());
            } catch (IllegalArgumentException exception) {
                throw new CommandLine.ParameterException(spec.commandLine(), exception.getMessage());
            }
        }

        private SplitLimit resolveLimit(SplitConfig config) {
            try {
                return config.toSplitLimit();
            } catch (InvalidLimitException exception) {
                throw new CommandLine.ParameterException(spec.commandLine(), exception.getMessage());
            }
        }

        private void printRecord(SplitRecord splitRecord, boolean json) {
            if (!json) {
                System.out.println(String.join("\t", splitRecord.tokens()));
                return;
            }
            try {
                System.out.println(mapper.writeValueAsString(splitRecord));
            } catch (IOException exception) {
                throw new UncheckedIOException(exception);
            }
        }
    }
}
