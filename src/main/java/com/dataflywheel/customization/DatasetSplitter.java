package com.dataflywheel.customization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import com.dataflywheel.exception.DatasetException;
import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.runtime.AppConfig;

public class DatasetSplitter {
    private final AppConfig.DataSplitConfig config;

    public DatasetSplitter(AppConfig.DataSplitConfig config) {
        this.config = config;
    }

    public DatasetSplit split(List<InteractionRecord> records) {
        List<InteractionRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingLong(InteractionRecord::timestamp));
        if (config.getLimit() > 0 && ordered.size() > config.getLimit()) {
            ordered = new ArrayList<>(ordered.subList(ordered.size() - config.getLimit(), ordered.size()));
        }
        if (ordered.isEmpty() || ordered.size() < config.getMinTotalRecords()) {
            throw new DatasetException("Dataset has " + ordered.size() + " records, at least "
                    + Math.max(1, config.getMinTotalRecords()) + " required");
        }

        if (config.getEvalSize() == 0) {
            return new DatasetSplit(ordered, trainingPart(ordered), validationPart(ordered));
        }

        List<InteractionRecord> shuffled = new ArrayList<>(ordered);
        Collections.shuffle(shuffled, new Random(config.getRandomSeed()));
        int evalCount = Math.min(config.getEvalSize(), shuffled.size());
        List<InteractionRecord> evaluation = sorted(shuffled.subList(0, evalCount));
        List<InteractionRecord> pool = sorted(shuffled.subList(evalCount, shuffled.size()));
        return new DatasetSplit(evaluation, trainingPart(pool), validationPart(pool));
    }

    private List<InteractionRecord> trainingPart(List<InteractionRecord> pool) {
        return pool.subList(0, pool.size() - validationCount(pool));
    }

    private List<InteractionRecord> validationPart(List<InteractionRecord> pool) {
        return pool.subList(pool.size() - validationCount(pool), pool.size());
    }

    private int validationCount(List<InteractionRecord> pool) {
        return (int) Math.floor(pool.size() * config.getValRatio());
    }

    private static List<InteractionRecord> sorted(List<InteractionRecord> records) {
        List<InteractionRecord> copy = new ArrayList<>(records);
        copy.sort(Comparator.comparingLong(InteractionRecord::timestamp));
        return copy;
    }
}
