package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.core.SourceType;
import com.purchasingpower.codegraph.model.CodeSourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data repository for registered code sources.
 */
@Repository
public interface CodeSourceRepository extends JpaRepository<CodeSourceEntity, String> {

    /**
     * Filtered listing; null parameters match everything.
     */
    @Query("SELECT s FROM CodeSourceEntity s " +
           "WHERE (:tenant IS NULL OR s.tenant = :tenant) " +
           "AND (:sourceType IS NULL OR s.sourceType = :sourceType) " +
           "AND (:enabledOnly = false OR s.enabled = true) " +
           "ORDER BY s.tenant, s.sourceId")
    List<CodeSourceEntity> search(@Param("tenant") String tenant,
                                  @Param("sourceType") SourceType sourceType,
                                  @Param("enabledOnly") boolean enabledOnly);

    @Modifying
    @Query("UPDATE CodeSourceEntity s SET s.lastAnalyzedRevision = :revision, " +
           "s.lastAnalyzedTime = :time, s.updatedAt = :time WHERE s.sourceId = :sourceId")
    int updateRevision(@Param("sourceId") String sourceId,
                       @Param("revision") String revision,
                       @Param("time") LocalDateTime time);

    @Modifying
    @Query("UPDATE CodeSourceEntity s SET s.lastAnalyzedRevision = NULL, " +
           "s.lastAnalyzedTime = NULL, s.updatedAt = :time WHERE s.sourceId = :sourceId")
    int clearRevision(@Param("sourceId") String sourceId, @Param("time") LocalDateTime time);

    @Modifying
    @Query("UPDATE CodeSourceEntity s SET s.enabled = :enabled, s.updatedAt = :time WHERE s.sourceId = :sourceId")
    int updateEnabled(@Param("sourceId") String sourceId,
                      @Param("enabled") boolean enabled,
                      @Param("time") LocalDateTime time);
}
