package fr.lapetina.factcheck.domain.model;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH
}
