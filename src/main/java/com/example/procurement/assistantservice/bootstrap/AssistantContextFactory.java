package com.example.procurement.assistantservice.bootstrap;

import com.example.procurement.assistantservice.chunk.ChunkBuilder;
import com.example.procurement.assistantservice.config.DataProperties;
import com.example.procurement.assistantservice.ingest.RecordNormalizer;
import com.example.procurement.assistantservice.ingest.SpendSummaryCalculator;
import com.example.procurement.assistantservice.ingest.TabularSource;
import com.example.procurement.assistantservice.ingest.TabularSources;
import com.example.procurement.assistantservice.model.Chunk;
import com.example.procurement.assistantservice.model.CleanRecord;
import com.example.procurement.assistantservice.model.SpendSummary;
import com.example.procurement.assistantservice.service.AssistantPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Loads the spend data and builds the index while the context is starting. Any
 * build failure propagates and aborts startup, so the context bean only exists
 * over a fully built index.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AssistantContextFactory {

    private static final Logger logger = LoggerFactory.getLogger(AssistantContextFactory.class);

    @Bean
    AssistantContext assistantContext(DataProperties dataProperties,
                                      RecordNormalizer normalizer,
                                      SpendSummaryCalculator summaryCalculator,
                                      ChunkBuilder chunkBuilder,
                                      AssistantPipeline pipeline,
                                      @Value("${app.index.force-rebuild:false}") boolean forceRebuild) {
        logger.info("Loading and processing data from {}", dataProperties.getPath());
        TabularSource source = TabularSources.forLocation(dataProperties.getPath());
        List<CleanRecord> records = normalizer.normalize(source.read());
        SpendSummary summary = summaryCalculator.summarize(records);
        List<Chunk> chunks = chunkBuilder.build(records);

        if (forceRebuild) {
            pipeline.rebuildIndex(chunks);
        } else {
            pipeline.buildIndex(chunks);
        }
        logger.info("Startup complete: {} records, {} chunks, index {}",
                summary.totalRecords(), chunks.size(), pipeline.index().state());
        return new AssistantContext(pipeline, summary, chunks.size(), source.description());
    }
}
