package info.isaksson.erland.dtsxmigrate.core;

/**
 * {@code PARTIAL}: some packages failed but the rest were merged. {@code FAILED}: the project graph
 * has a cycle, so no project-level mapping was produced.
 */
public enum ProjectStatus {
    OK,
    PARTIAL,
    FAILED
}
