package io.github.drompincen.knowpipe.persistence.repository;

import io.github.drompincen.knowpipe.persistence.document.KnowledgeGapDocument;
import io.github.drompincen.knowpipe.protocol.api.GapStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface KnowledgeGapRepository extends MongoRepository<KnowledgeGapDocument, String> {
    List<KnowledgeGapDocument> findByLocationAndStatus(String location, GapStatus status);
}
