package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class Util {

    private static final long KB = 1024;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    private static final Logger logger = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    public static ThreadFactory threadFactory(final String name) {
        final AtomicLong count = new AtomicLong();
        return new ThreadFactory() {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = Executors.defaultThreadFactory().newThread(runnable);
                thread.setName(name + "-" + Long.toString(count.getAndIncrement()));
                thread.setDaemon(true);
                //doesn't catch everything, just for extra safety
                thread.setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                    @Override
                    public void uncaughtException(Thread t, Throwable e) {
                        logger.error("uncaught error", e);
                    }
                });
                return thread;
            }
        };
    }

    public static long clock() {
        return System.nanoTime() / 1000000;
    }

    public static void closeQuietly(Closeable closeable) {
        try {
            if (closeable != null) {
                closeable.close();
            }
        }
        catch (IOException e) {
            logger.warn("problem closing. {}", e.toString());
        }
    }

    public static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static boolean isNullOrEmpty(String string) {
        return string == null || string.isEmpty();
    }

    /**
     * Human readable size, e.g. "512 bytes", "1.5 KB", "2.25 MB".
     */
    public static String toSizeString(long bytes) {
        if (bytes >= GB) {
            return round(bytes, GB) + " GB";
        }
        if (bytes >= MB) {
            return round(bytes, MB) + " MB";
        }
        if (bytes >= KB) {
            return round(bytes, KB) + " KB";
        }
        return bytes + " bytes";
    }

    private static String round(long bytes, long unit) {
        return BigDecimal.valueOf(bytes)
                .divide(BigDecimal.valueOf(unit), 2, RoundingMode.HALF_EVEN)
                .stripTrailingZeros()
                .toPlainString();
    }

    /**
     * Elapsed time with only the non-zero units, milliseconds always present, e.g. "1m 5s 20ms".
     */
    public static String elapsedTimeString(long elapsedMillis) {
        long days = TimeUnit.MILLISECONDS.toDays(elapsedMillis);
        long hours = TimeUnit.MILLISECONDS.toHours(elapsedMillis) % 24;
        long minutes = TimeUnit.MILLISECONDS.toMinutes(elapsedMillis) % 60;
        long seconds = TimeUnit.MILLISECONDS.toSeconds(elapsedMillis) % 60;
        long millis = elapsedMillis % 1000;
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append("d ");
        }
        if (hours > 0) {
            sb.append(hours).append("h ");
        }
        if (minutes > 0) {
            sb.append(minutes).append("m ");
        }
        if (seconds > 0) {
            sb.append(seconds).append("s ");
        }
        sb.append(millis).append("ms");
        return sb.toString();
    }

    public static String messageCountString(long count) {
        return count + (count == 1 ? " message" : " messages");
    }

}
