package com.habrok.core.util;

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
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정. SLF4J(slf4j-jdk14)와 StructuredLog 모두 여기로 모인다.
 * System props:
 *  -Dhabrok.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** 콘솔만 */
    public static void init(Level rootLevel) {
        init(null, rootLevel, 0, 0);
    }

    /** logDir가 null이 아니면 logDir/habrok-%g.log 로 롤링 저장 */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Level level = (rootLevel != null) ? rootLevel : Level.INFO;

        Logger root = Logger.getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("habrok-%g.log").toString();
                FileHandler file = new FileHandler(pattern, Math.max(1, maxBytes), Math.max(1, fileCount), true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER); // 같은 포맷
                root.addHandler(file);
            } catch (IOException e) {
                // 콘솔 핸들러는 이미 붙었으니 경고만 남기고 진행
                Logger.getLogger(LoggingConfigurator.class.getName())
                        .log(Level.WARNING, "File log disabled: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
    }

    /** -Dhabrok.log.level 해석(실패 시 INFO) */
    public static Level levelFromSystem() {
        String s = System.getProperty("habrok.log.level", "INFO");
        try { return Level.parse(s.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
