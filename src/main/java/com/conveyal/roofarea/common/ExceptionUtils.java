package com.conveyal.roofarea.common;

import com.conveyal.roofarea.RoofAreaException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Turning throwables into messages for people running the command line tools.
 */
public abstract class ExceptionUtils {

    /** The full stack trace with all causes, as printed by Throwable.printStackTrace(). */
    public static String stackTraceString (Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        throwable.printStackTrace(new PrintWriter(stringWriter));
        return stringWriter.toString();
    }

    /**
     * A one-line explanation of a failure. Our own exceptions carry messages written for the user, so only the message
     * is shown. For anything else the chain of causes is spelled out with class names, outermost first, since the
     * class name (e.g. NoSuchFileException) is often the most informative part.
     */
    public static String userMessage (Throwable throwable) {
        if (throwable instanceof RoofAreaException && throwable.getMessage() != null) {
            return throwable.getMessage();
        }
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = throwable; t != null && seen.add(t); t = t.getCause()) {
            items.add(t.getMessage() == null
                    ? t.getClass().getSimpleName()
                    : t.getClass().getSimpleName() + ": " + t.getMessage());
        }
        return String.join(", caused by ", items);
    }

}
