package com.blissfly.proxy.core.services;

import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-resort handler for exceptions escaping any thread. Logs the failure and, unless
 * running in debug mode, terminates the process with status 1.
 */
public class FatalErrorHandler implements Thread.UncaughtExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(FatalErrorHandler.class);

    /** Exit status used for fatal errors. */
    public static final int EXIT_STATUS = 1;

    private final boolean debug;
    private final IntConsumer exit;

    public FatalErrorHandler(boolean debug) {
        this(debug, System::exit);
    }

    /**
     * @param debug Keep the process alive after logging.
     * @param exit  Called with the exit status when the process must terminate.
     */
    public FatalErrorHandler(boolean debug, IntConsumer exit) {
        this.debug = debug;
        this.exit = exit;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        log.error("Uncaught exception in thread {}", thread.getName(), error);
        if (!debug) {
            exit.accept(EXIT_STATUS);
        }
    }
}
