package com.dataflywheel.customization;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.dataflywheel.exception.DatasetException;
import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.records.TestRecords;
import com.dataflywheel.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetSplitterTest {

    @Test
    void shouldEvaluateOnEveryRecordByDefault() {
        List<InteractionRecord> records = TestRecords.numbered(300, 1_000, "w1", "c1");

        DatasetSplit split = new DatasetSplitter(new AppConfig.DataSplitConfig()).split(records);

        assertEquals(records, split.evaluation());
        assertEquals(270, split.training().size());
        assertEquals(30, split.validation().size());
        assertEquals(records.get(299), split.validation().get(29));
    }

    @Test
    void shouldHoldOutDeterministicDisjointEvaluationSlice() {
        AppConfig.DataSplitConfig config = new AppConfig.DataSplitConfig();
        config.setEvalSize(20);
        config.setValRatio(0.25);
        List<InteractionRecord> records = TestRecords.numbered(100, 1_000, "w1", "c1");

        DatasetSplit first = new DatasetSplitter(config).split(records);
        DatasetSplit second = new DatasetSplitter(config).split(new ArrayList<>(records));

        assertEquals(first, second);
        assertEquals(20, first.evaluation().size());
        assertEquals(60, first.training().size());
        assertEquals(20, first.validation().size());
        Set<InteractionRecord> seen = new HashSet<>(first.evaluation());
        first.training().forEach(record -> assertTrue(seen.add(record)));
        first.validation().forEach(record -> assertTrue(seen.add(record)));
        assertEquals(100, seen.size());
    }

    @Test
    void shouldKeepMostRecentRecordsWithinLimit() {
        AppConfig.DataSplitConfig config = new AppConfig.DataSplitConfig();
        config.setLimit(10);
        config.setValRatio(0.0);

        DatasetSplit split = new DatasetSplitter(config).split(TestRecords.numbered(50, 1_000, "w1", "c1"));

        assertEquals(10, split.evaluation().size());
        assertEquals(1_040L, split.evaluation().get(0).timestamp());
        assertEquals(10, split.training().size());
        assertTrue(split.validation().isEmpty());
    }

    @Test
    void shouldRejectDatasetBelowMinimum() {
        AppConfig.DataSplitConfig config = new AppConfig.DataSplitConfig();
        config.setMinTotalRecords(50);

        assertThrows(DatasetException.class,
                () -> new DatasetSplitter(config).split(TestRecords.numbered(49, 1_000, "w1", "c1")));
        assertThrows(DatasetException.class,
                () -> new DatasetSplitter(new AppConfig.DataSplitConfig()).split(List.of()));
    }
}
