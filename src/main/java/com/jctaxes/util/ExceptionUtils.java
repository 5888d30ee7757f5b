package com.jctaxes.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/** Formatting of exceptions for log messages. */
public abstract class ExceptionUtils {

    /** The full stack trace, including all causes, as printed to the console. */
    public static String stackTraceString (Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        throwable.printStackTrace(new PrintWriter(stringWriter));
        return stringWriter.toString();
    }

    /**
     * One line naming each exception in the cause chain with its message, outermost first. Enough to tell an
     * operator what went wrong when a stack trace would only be noise.
     */
    public static String causeChainString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        while (throwable != null && seen.put(throwable, Boolean.TRUE) == null) {
            String message = throwable.getMessage();
            items.add(message == null
                    ? throwable.getClass().getSimpleName()
                    : throwable.getClass().getSimpleName() + ": " + message);
            throwable = throwable.getCause();
        }
        return String.join(", caused by ", items);
    }

}
