package tech.compendium.sdk.presentation;

/**
 * Display state of one stage in a job's stage grid.
 *
 * @param stage   1-indexed stage number
 * @param name    stage display name
 * @param tone    severity of the stage's status
 * @param label   status label
 * @param tooltip full description for hover text
 * @param current whether this is the job's current stage
 */
public record StageCell(
    int stage,
    String name,
    StatusTone tone,
    String label,
    String tooltip,
    boolean current
) {}
