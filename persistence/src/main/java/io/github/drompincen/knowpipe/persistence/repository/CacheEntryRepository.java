package io.github.drompincen.knowpipe.persistence.repository;

import io.github.drompincen.knowpipe.persistence.document.CacheEntryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface CacheEntryRepository extends MongoRepository<CacheEntryDocument, String> {
    List<CacheEntryDocument> findByExpiresAtGreaterThan(Instant now);
    long deleteByExpiresAtLessThanEqual(Instant now);
}
