package dev.newsroom.entity;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    public boolean matches(String priority) {
        return this.name().equals(priority);
    }
}
