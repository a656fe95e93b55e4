package com.example.procurement.assistantservice.config;

import com.example.procurement.assistantservice.chunk.ChunkBuilder;
import com.example.procurement.assistantservice.chunk.SpendFormatter;
import com.example.procurement.assistantservice.chunk.StandardChunkViews;
import com.example.procurement.assistantservice.repo.BuildMarkerRepository;
import com.example.procurement.assistantservice.repo.ChunkRepository;
import com.example.procurement.assistantservice.store.InMemoryVectorStore;
import com.example.procurement.assistantservice.store.MongoVectorStore;
import com.example.procurement.assistantservice.store.VectorStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    ChunkBuilder chunkBuilder(ChunkProperties chunkProperties) {
        return new ChunkBuilder(StandardChunkViews.defaults(new SpendFormatter(chunkProperties)));
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.vector", name = "store", havingValue = "memory", matchIfMissing = true)
    VectorStore inMemoryVectorStore() {
        return new InMemoryVectorStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.vector", name = "store", havingValue = "mongo")
    VectorStore mongoVectorStore(ChunkRepository chunkRepository, BuildMarkerRepository buildMarkerRepository) {
        return new MongoVectorStore(chunkRepository, buildMarkerRepository);
    }
}
