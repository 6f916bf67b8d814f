package com.boxline.billing.application;

import java.io.PrintWriter;
import java.io.StringWriter;

/** Error text for persistence and result payloads. */
public final class Errors {

    private static final int MAX_MESSAGE = 500;
    private static final int MAX_TRACE = 4000;

    private Errors() {}

    /** Message or class name, truncated to 500 chars. */
    public static String safeError(Throwable e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) msg = e.getClass().getSimpleName();
        return msg.length() > MAX_MESSAGE ? msg.substring(0, MAX_MESSAGE) : msg;
    }

    public static String stackTrace(Throwable e) {
        StringWriter out = new StringWriter();
        e.printStackTrace(new PrintWriter(out));
        String s = out.toString();
        return s.length() > MAX_TRACE ? s.substring(0, MAX_TRACE) : s;
    }
}
