package com.example.procurement.assistantservice.repo;

import com.example.procurement.assistantservice.store.IndexedChunk;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ChunkRepository extends MongoRepository<IndexedChunk, String> {

    List<IndexedChunk> findAllByOrderByPositionAsc();
}
