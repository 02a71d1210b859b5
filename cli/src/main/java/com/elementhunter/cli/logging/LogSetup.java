package com.elementhunter.cli.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정(CLI 용). SLF4J 는 slf4j-jdk14 로 여기에 합류한다.
 * - 콘솔(stderr) 한 줄 포맷, verbose 면 FINE
 * System props:
 *  -Deh.log.level=FINE|INFO|WARNING|SEVERE (verbose 가 아닐 때 기본 INFO)
 *  -Deh.log.dir=logs  지정 시 파일 롤링(2MB x 5) 추가
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(boolean verbose) {
        if (initialized) return;
        initialized = true;

        Level level = verbose ? Level.FINE : toLevel(System.getProperty("eh.log.level", "INFO"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("eh.log.dir");
        if (dir != null && !dir.isBlank()) {
            try {
                Path logDir = Path.of(dir);
                Files.createDirectories(logDir);
                FileHandler file = new FileHandler(logDir.resolve("crawl-%g.log").toString(),
                        2 * 1024 * 1024, 5, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 진행
                Logger.getLogger(LogSetup.class.getName())
                        .log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }
        root.setLevel(level);
    }

    /** 실행 중 레벨 변경(콘솔/파일 모두) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level toLevel(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 한 줄 포맷 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(), shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
