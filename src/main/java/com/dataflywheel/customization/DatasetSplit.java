package com.dataflywheel.customization;

import java.util.List;

import com.dataflywheel.records.InteractionRecord;

public record DatasetSplit(
        List<InteractionRecord> evaluation,
        List<InteractionRecord> training,
        List<InteractionRecord> validation) {

    public DatasetSplit {
        evaluation = List.copyOf(evaluation);
        training = List.copyOf(training);
        validation = List.copyOf(validation);
    }
}
