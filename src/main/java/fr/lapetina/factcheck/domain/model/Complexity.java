package fr.lapetina.factcheck.domain.model;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}
