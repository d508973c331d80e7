package io.github.drompincen.aigov.protocol.api;

public enum NotificationType {
    ESCALATION("Escalation - Decision Needed"),
    WORK_REQUEST("Work Request"),
    REVIEW_REQUEST("Review Request"),
    FYI("For Your Information");

    private final String label;

    NotificationType(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public String wireName() { return name().toLowerCase(); }

    public static NotificationType fromString(String value) {
        for (NotificationType type : values()) {
            if (type.name().equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
