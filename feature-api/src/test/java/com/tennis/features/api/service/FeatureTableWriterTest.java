package com.tennis.features.api.service;

import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.RenameCollectionOptions;
import com.tennis.features.api.config.FeatureEngineProperties;
import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.feature.FeatureAssembler;
import com.tennis.features.engine.model.FeatureRow;
import com.tennis.features.engine.model.Surface;
import com.tennis.features.engine.ranking.RankingLookup;
import com.tennis.features.engine.replay.TrackerSnapshot;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeatureTableWriterTest {

    private static final String TARGET = "match_features";
    private static final String STAGING = "match_features_staging";

    private MongoTemplate mongoTemplate;
    private MongoCollection<Document> staging;
    private FeatureTableWriter writer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        staging = mock(MongoCollection.class);
        MongoDatabase database = mock(MongoDatabase.class);
        when(mongoTemplate.getCollection(STAGING)).thenReturn(staging);
        when(mongoTemplate.getDb()).thenReturn(database);
        when(database.getName()).thenReturn("tennis");

        FeatureEngineProperties properties = new FeatureEngineProperties();
        properties.getReplay().setBatchSize(2);
        writer = new FeatureTableWriter(mongoTemplate, properties);
    }

    private static List<FeatureRow> rows(int count) {
        FeatureAssembler assembler = new FeatureAssembler();
        TrackerSnapshot state = new TrackerSnapshot(EngineConfig.defaults(), RankingLookup.empty(500), Map.of());
        return IntStream.range(0, count)
                .mapToObj(i -> new FeatureRow(
                        assembler.build(state, 1, 2 + i, Surface.HARD, LocalDate.of(2023, 1, 1), "m" + i), 1))
                .toList();
    }

    @Test
    @DisplayName("A full rebuild is renamed over the live table, replacing it")
    void replaceAllRenamesStagingOverTarget() {
        writer.replaceAll(rows(3));

        verify(mongoTemplate).createCollection(STAGING);
        verify(mongoTemplate, times(2)).insert(anyList(), eq(STAGING));

        ArgumentCaptor<MongoNamespace> namespace = ArgumentCaptor.forClass(MongoNamespace.class);
        ArgumentCaptor<RenameCollectionOptions> options = ArgumentCaptor.forClass(RenameCollectionOptions.class);
        verify(staging).renameCollection(namespace.capture(), options.capture());
        assertThat(namespace.getValue().getFullName()).isEqualTo("tennis." + TARGET);
        assertThat(options.getValue().isDropTarget()).isTrue();
        verify(mongoTemplate, never()).dropCollection(STAGING);
    }

    @Test
    @DisplayName("A leftover staging collection is cleared before writing")
    void staleStagingIsDropped() {
        when(mongoTemplate.collectionExists(STAGING)).thenReturn(true);

        writer.replaceAll(rows(1));

        verify(mongoTemplate).dropCollection(STAGING);
        verify(staging).renameCollection(any(MongoNamespace.class), any(RenameCollectionOptions.class));
    }

    @Test
    @DisplayName("A failed insert drops staging and leaves the live table alone")
    void failedInsertDropsStaging() {
        when(mongoTemplate.insert(anyList(), eq(STAGING))).thenThrow(new IllegalStateException("write failed"));

        assertThatThrownBy(() -> writer.replaceAll(rows(3)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("write failed");

        verify(mongoTemplate).dropCollection(STAGING);
        verify(staging, never()).renameCollection(any(MongoNamespace.class), any(RenameCollectionOptions.class));
        verify(mongoTemplate, never()).dropCollection(TARGET);
    }
}
