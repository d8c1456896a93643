package com.webtext.app;

import com.webtext.app.cli.CliArguments;
import com.webtext.app.cli.ConsoleConfirmation;
import com.webtext.app.cli.UsageException;
import com.webtext.app.logging.LogSetup;
import com.webtext.core.model.BatchSummary;
import com.webtext.core.model.ExtractConfig;
import com.webtext.core.service.BatchExtractionService;
import com.webtext.core.service.DirectoryConfirmation;
import com.webtext.core.service.OutputDirectoryResolver;
import com.webtext.core.service.PreflightException;
import com.webtext.core.service.export.RunReportWriter;
import com.webtext.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * CLI 진입점.
 * 종료 코드: 0 = 배치 완료(항목별 성공/실패와 무관), 1 = 치명적 설정/사전 점검 오류, 2 = 인자 오류
 */
public final class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        LogSetup.init();
        int code = run(args, new ConsoleConfirmation(System.in, System.out), System.out, System.err);
        System.exit(code);
    }

    static int run(String[] args, DirectoryConfirmation confirmation, PrintStream out, PrintStream err) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (cli.help()) {
            out.println(CliArguments.USAGE);
            return EXIT_OK;
        }

        ExtractConfig config;
        try {
            config = (cli.config() == null) ? ExtractConfig.defaults() : YamlConfigLoader.load(cli.config());
            config.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_FATAL;
        }

        // 네트워크 작업 전에 입력/출력 경로를 모두 확정
        Path outputDir;
        try {
            outputDir = new OutputDirectoryResolver(config, confirmation).prepare(cli.file(), cli.output());
        } catch (PreflightException e) {
            err.println(e.getMessage());
            return EXIT_FATAL;
        }

        BatchSummary summary;
        try {
            summary = new BatchExtractionService(config, outputDir).run(cli.file());
        } catch (IOException e) {
            err.println("Could not read " + cli.file() + ": " + e.getMessage());
            return EXIT_FATAL;
        }

        if (cli.report() != null) {
            try {
                Path written = new RunReportWriter().write(summary, cli.report());
                LOG.info("Wrote run report: {}", written);
            } catch (IOException e) {
                LOG.warn("Could not write run report {}: {}", cli.report(), e.getMessage());
            }
        }

        out.printf("Processed %d URL(s) into %s (%d ok, %d failed, %d line(s) skipped)%n",
                summary.attempted(), outputDir, summary.succeeded(), summary.failed(), summary.skipped());
        return EXIT_OK;
    }
}
