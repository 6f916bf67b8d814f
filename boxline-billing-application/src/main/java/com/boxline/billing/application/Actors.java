package com.boxline.billing.application;

/** Actor names recorded when no user is behind a change. */
public final class Actors {

    public static final String SYSTEM = "system";
    public static final String GATEWAY = "gateway";
    public static final String SCHEDULER = "scheduler";

    private Actors() {}
}
