package com.webtext.app.cli;

import com.webtext.core.util.PathUtil;

import java.nio.file.Path;

/**
 * 명령행 인자:
 *   -f, --file   &lt;path&gt;  URL 목록(.txt, 한 줄에 하나), 필수
 *   -o, --output &lt;dir&gt;   결과 디렉터리(생략 시 설정의 기본 경로)
 *   -c, --config &lt;yaml&gt;  설정 파일
 *   -r, --report &lt;json&gt;  실행 요약 JSON
 *   -h, --help
 * "--file=a.txt" 형태도 받는다.
 */
public final class CliArguments {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: webtext -f <urls.txt> [-o <output-dir>] [-c <webtext.yml>] [-r <report.json>]",
            "",
            "Reads URLs from a text file (one per line), retrieves the main content of each page,",
            "strips the HTML and saves one .txt file per URL into the output directory.",
            "",
            "  -f, --file <path>     Text file containing URLs, one URL per line (required)",
            "  -o, --output <dir>    Directory where extracted text files are saved",
            "                        (default: ~/Documents/URL Text, or output.defaultDir from the config)",
            "  -c, --config <yaml>   Optional configuration file",
            "  -r, --report <json>   Write a JSON summary of the run to this file",
            "  -h, --help            Show this help");

    private final Path file;
    private final Path output;
    private final Path config;
    private final Path report;
    private final boolean help;

    private CliArguments(Path file, Path output, Path config, Path report, boolean help) {
        this.file = file;
        this.output = output;
        this.config = config;
        this.report = report;
        this.help = help;
    }

    public Path file() { return file; }
    /** null이면 기본 출력 디렉터리 */
    public Path output() { return output; }
    public Path config() { return config; }
    public Path report() { return report; }
    public boolean help() { return help; }

    public static CliArguments parse(String... args) throws UsageException {
        Path file = null, output = null, config = null, report = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }

            switch (name) {
                case "-h":
                case "--help":
                    help = true;
                    break;
                case "-f":
                case "--file":
                    if (value == null) value = next(args, ++i, name);
                    file = path(value, name);
                    break;
                case "-o":
                case "--output":
                    if (value == null) value = next(args, ++i, name);
                    output = path(value, name);
                    break;
                case "-c":
                case "--config":
                    if (value == null) value = next(args, ++i, name);
                    config = path(value, name);
                    break;
                case "-r":
                case "--report":
                    if (value == null) value = next(args, ++i, name);
                    report = path(value, name);
                    break;
                default:
                    throw new UsageException("Unknown argument: " + arg);
            }
        }

        if (!help && file == null) {
            throw new UsageException("the following arguments are required: -f/--file");
        }
        return new CliArguments(file, output, config, report, help);
    }

    private static String next(String[] args, int i, String name) throws UsageException {
        if (i >= args.length || args[i].startsWith("-")) {
            throw new UsageException("argument " + name + ": expected one argument");
        }
        return args[i];
    }

    private static Path path(String value, String name) throws UsageException {
        if (value.isBlank()) throw new UsageException("argument " + name + ": empty value");
        try {
            return PathUtil.expandHome(value);
        } catch (java.nio.file.InvalidPathException e) {
            throw new UsageException("argument " + name + ": invalid path " + value);
        }
    }
}
