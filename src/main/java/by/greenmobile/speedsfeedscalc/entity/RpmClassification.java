package by.greenmobile.speedsfeedscalc.entity;

public record RpmClassification(RpmStatus status, String message) {
}
