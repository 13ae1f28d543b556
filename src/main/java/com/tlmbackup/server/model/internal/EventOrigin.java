package com.tlmbackup.server.model.internal;

public final class EventOrigin {

    public static final String SCHEDULER = "scheduler";

    public static final String UPLOAD = "upload";

    public static final String SYSTEM = "system";

    private EventOrigin() {
    }

    public static String job(String jobName) {
        return "job:" + jobName;
    }
}
