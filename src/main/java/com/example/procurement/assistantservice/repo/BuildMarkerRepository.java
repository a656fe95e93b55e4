package com.example.procurement.assistantservice.repo;

import com.example.procurement.assistantservice.store.BuildMarkerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface BuildMarkerRepository extends MongoRepository<BuildMarkerDocument, String> {
}
