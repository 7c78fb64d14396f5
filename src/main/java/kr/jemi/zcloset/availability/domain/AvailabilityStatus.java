package kr.jemi.zcloset.availability.domain;

public enum AvailabilityStatus {
    FREE,
    WANTED,
    LOCKED
}
