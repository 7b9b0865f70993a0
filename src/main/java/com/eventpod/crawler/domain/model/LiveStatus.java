package com.eventpod.crawler.domain.model;

public enum LiveStatus {

    LIVE((short) 0),
    SCHEDULED((short) 1),
    FINISHED((short) 2);

    private final short code;

    LiveStatus(short code) {
        this.code = code;
    }

    public short code() {
        return code;
    }

    public static LiveStatus fromCode(short code) {
        for (LiveStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown live status code: " + code);
    }
}
