package com.subtrack.subbackend.database;

public record MigrationOutcome(Result result, int scriptsApplied, String schemaVersion) {

    public enum Result {
        APPLIED,
        NO_CHANGE_NEEDED
    }

    public static MigrationOutcome applied(int scriptsApplied, String schemaVersion) {
        return new MigrationOutcome(Result.APPLIED, scriptsApplied, schemaVersion);
    }

    public static MigrationOutcome noChangeNeeded(String schemaVersion) {
        return new MigrationOutcome(Result.NO_CHANGE_NEEDED, 0, schemaVersion);
    }
}
