package tech.compendium.pipeline.job.statemachine;

import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.entity.Stage;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;

import java.util.List;

/**
 * Structural checks every stored job must pass.
 */
public final class JobInvariants {

    private JobInvariants() {
    }

    /**
     * @throws IllegalStateException describing the first violated invariant
     */
    public static void validate(Job job) {
        List<Stage> stages = job.stages();
        if (job.status() == null) {
            throw violation(job, "status is missing");
        }
        if (stages.size() != PipelineStage.COUNT) {
            throw violation(job, "expected " + PipelineStage.COUNT + " stages, found " + stages.size());
        }
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            if (stage.stage() != i + 1) {
                throw violation(job, "stage at position " + (i + 1) + " is numbered " + stage.stage());
            }
            if ((stage.status() == StageStatus.FAILED) != (stage.error() != null)) {
                throw violation(job, "stage " + stage.stage() + " error must be present iff it failed");
            }
        }
        if (job.currentStage() < 1 || job.currentStage() > PipelineStage.COUNT) {
            throw violation(job, "current stage out of range: " + job.currentStage());
        }
        if (job.progress() < 0 || job.progress() > 100) {
            throw violation(job, "progress out of range: " + job.progress());
        }

        boolean allCompleted = stages.stream().allMatch(Stage::isCompleted);
        boolean completed = job.status() == JobStatus.COMPLETED;
        if (completed != (allCompleted && job.currentStage() == PipelineStage.COUNT)) {
            throw violation(job, "completed status must match all stages completed at the last stage");
        }

        // Everything before the current stage is done and everything after it has not started
        int current = job.currentStage();
        for (Stage stage : stages) {
            if (stage.stage() < current && !stage.isCompleted()) {
                throw violation(job, "stage " + stage.stage() + " precedes the current stage but is " + stage.status().getValue());
            }
            if (stage.stage() > current && !stage.isPending()) {
                throw violation(job, "stage " + stage.stage() + " follows the current stage but is " + stage.status().getValue());
            }
        }

        StageStatus currentStatus = job.stage(current).status();
        switch (job.status()) {
            case PENDING -> {
                if (currentStatus != StageStatus.PENDING) {
                    throw violation(job, "pending job has current stage " + currentStatus.getValue());
                }
            }
            case PROCESSING -> {
                if (currentStatus == StageStatus.FAILED || currentStatus == StageStatus.COMPLETED) {
                    throw violation(job, "processing job has current stage " + currentStatus.getValue());
                }
            }
            case FAILED -> {
                if (currentStatus != StageStatus.FAILED) {
                    throw violation(job, "failed job has no failed stage");
                }
            }
            case COMPLETED -> {
                // covered above
            }
        }
    }

    private static IllegalStateException violation(Job job, String detail) {
        return new IllegalStateException("Job " + job.id() + " violates invariants: " + detail);
    }
}
