package com.dataflywheel.job;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.exception.AggregationException;
import com.dataflywheel.scoring.ReportArtifact;
import com.dataflywheel.scoring.ScoringAggregator;

/**
 * Rebuilds a job's report from its persisted snapshot without calling any model.
 */
public class ReportRegenerator {
    private static final Logger log = LoggerFactory.getLogger(ReportRegenerator.class);

    private final JobSnapshotStore snapshotStore;
    private final ScoringAggregator aggregator;

    public ReportRegenerator(JobSnapshotStore snapshotStore, ScoringAggregator aggregator) {
        this.snapshotStore = snapshotStore;
        this.aggregator = aggregator;
    }

    public ReportArtifact regenerate(String jobId) throws IOException {
        FlywheelJobSnapshot snapshot = snapshotStore.load(jobId);
        if (snapshot.baseline() == null) {
            throw new AggregationException("Job " + jobId + " has no baseline result (state " + snapshot.state() + ")");
        }
        ReportArtifact report = aggregator.aggregate(snapshot.baseline(), snapshot.candidates());
        log.info("report.regenerated jobId={} candidates={} path={}",
                jobId, report.candidates().size(), snapshotStore.writeReport(jobId, report));
        return report;
    }
}
