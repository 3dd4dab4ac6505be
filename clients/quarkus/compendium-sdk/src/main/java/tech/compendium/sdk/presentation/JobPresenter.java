package tech.compendium.sdk.presentation;

import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.dto.JobStage;
import tech.compendium.sdk.enums.JobStatus;
import tech.compendium.sdk.enums.StageStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives display values from job state. Every method is a pure function of its arguments;
 * a missing or unrecognised status degrades to the {@link StatusTone#UNKNOWN} tone.
 */
public final class JobPresenter {

    /** Stages in a job when the server does not send them */
    public static final int STAGE_COUNT = 8;

    private JobPresenter() {
    }

    /**
     * Progress clamped to 0..100; a missing value reads as 0.
     */
    public static int percent(Job job) {
        Integer progress = job.progress();
        if (progress == null) {
            return 0;
        }
        return Math.max(0, Math.min(100, progress));
    }

    public static StatusTone tone(JobStatus status) {
        if (status == null) {
            return StatusTone.UNKNOWN;
        }
        return switch (status) {
            case PENDING -> StatusTone.PENDING;
            case PROCESSING -> StatusTone.INFO;
            case COMPLETED -> StatusTone.SUCCESS;
            case FAILED -> StatusTone.DANGER;
            default -> StatusTone.UNKNOWN;
        };
    }

    public static StatusTone tone(StageStatus status) {
        if (status == null) {
            return StatusTone.UNKNOWN;
        }
        return switch (status) {
            case PENDING -> StatusTone.PENDING;
            case PROCESSING -> StatusTone.INFO;
            case COMPLETED -> StatusTone.SUCCESS;
            case FAILED -> StatusTone.DANGER;
            default -> StatusTone.UNKNOWN;
        };
    }

    public static String label(JobStatus status) {
        if (status == null) {
            return "Unknown";
        }
        return switch (status) {
            case PENDING -> "Pending";
            case PROCESSING -> "Processing";
            case COMPLETED -> "Completed";
            case FAILED -> "Failed";
            default -> "Unknown";
        };
    }

    public static String label(StageStatus status) {
        if (status == null) {
            return "Unknown";
        }
        return switch (status) {
            case PENDING -> "Waiting";
            case PROCESSING -> "In progress";
            case COMPLETED -> "Done";
            case FAILED -> "Failed";
            default -> "Unknown";
        };
    }

    /**
     * One-line summary for a job's status badge.
     */
    public static String tooltip(Job job) {
        JobStatus status = job.statusOrUnknown();
        return switch (status) {
            case PENDING -> "Waiting to start";
            case PROCESSING -> stageLine(job) + " (" + percent(job) + "%)";
            case COMPLETED -> "Deck ready";
            case FAILED -> job.errorMessage() != null && !job.errorMessage().isBlank()
                ? "Failed: " + job.errorMessage()
                : "Failed";
            default -> "Status unavailable";
        };
    }

    public static String tooltip(JobStage stage) {
        String prefix = "Stage " + stage.stage() + ": " + (stage.name() != null ? stage.name() : "Unnamed stage");
        if (stage.status() == StageStatus.FAILED && stage.error() != null && !stage.error().isBlank()) {
            return prefix + " failed: " + stage.error();
        }
        return prefix + " (" + label(stage.status()).toLowerCase() + ")";
    }

    /**
     * "Stage 3 of 8: Identifying topics", or "Stage 3 of 8" when the stage name is unknown.
     */
    public static String stageLine(Job job) {
        int total = job.stages() != null && !job.stages().isEmpty() ? job.stages().size() : STAGE_COUNT;
        int current = job.currentStage() != null ? Math.max(1, Math.min(total, job.currentStage())) : 1;
        String name = job.stageName();
        if (name == null) {
            name = job.stagesOrEmpty().stream()
                .filter(stage -> stage.stage() == current)
                .map(JobStage::name)
                .findFirst()
                .orElse(null);
        }
        String line = "Stage " + current + " of " + total;
        return name != null && !name.isBlank() ? line + ": " + name : line;
    }

    /**
     * One cell per stage in stage order.
     */
    public static List<StageCell> stageGrid(Job job) {
        List<StageCell> cells = new ArrayList<>();
        Integer currentStage = job.currentStage();
        job.stagesOrEmpty().stream()
            .sorted((a, b) -> Integer.compare(a.stage(), b.stage()))
            .forEach(stage -> cells.add(new StageCell(
                stage.stage(),
                stage.name(),
                tone(stage.status()),
                label(stage.status()),
                tooltip(stage),
                currentStage != null && currentStage == stage.stage())));
        return cells;
    }
}
