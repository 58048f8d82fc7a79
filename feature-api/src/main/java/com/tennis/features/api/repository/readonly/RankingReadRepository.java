package com.tennis.features.api.repository.readonly;

import com.tennis.features.api.model.readonly.RankingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for ranking rows.
 */
@Repository
public interface RankingReadRepository extends MongoRepository<RankingDocument, String> {
}
