package com.webtext.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정(SLF4J는 slf4j-jdk14로 여기로 들어온다).
 * System props:
 *  -Dwt.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dwt.log.dir=&lt;dir&gt;  지정 시 dir/webtext-%g.log 롤링 파일 추가
 *  -Dwt.log.sizeMb=2, -Dwt.log.files=5
 *  -Dwt.log.events=true  구조화 이벤트(JSON 줄)를 콘솔에도 출력
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wt.log.level", "INFO"));
        boolean events = Boolean.parseBoolean(System.getProperty("wt.log.events", "false"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        if (!events) console.setFilter(r -> r.getLoggerName() == null || !r.getLoggerName().endsWith(".events"));
        root.addHandler(console);

        String dir = System.getProperty("wt.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir), level);
        }
        root.setLevel(level);
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb = parseInt(System.getProperty("wt.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("wt.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("webtext-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 콘솔 로그만으로 계속 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.', logger.endsWith(".events") ? logger.length() - 8 : logger.length());
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
