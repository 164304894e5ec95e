package org.muma.respkv.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories for the server's own background threads.
 */
public final class ThreadUtils {

    private ThreadUtils() {
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        return new KvThreadFactory(prefix);
    }

    private static class KvThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        KvThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true); // never keeps the JVM alive on its own
            return t;
        }
    }
}
