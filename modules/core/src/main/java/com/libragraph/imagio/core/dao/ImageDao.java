package com.libragraph.imagio.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ImageRecord.class)
public interface ImageDao {

    @SqlQuery("SELECT uuid, category, mime, created_at FROM image WHERE uuid = :uuid")
    Optional<ImageRecord> findByUuid(@Bind("uuid") String uuid);

    @SqlUpdate("INSERT INTO image (uuid, category, mime, created_at) " +
            "VALUES (:uuid, :category, :mime, :createdAt)")
    void insert(@BindMethods ImageRecord record);

    @SqlUpdate("DELETE FROM image WHERE uuid = :uuid")
    int deleteByUuid(@Bind("uuid") String uuid);

    /**
     * Newest first; {@code skip} rows are dropped before {@code limit} are returned.
     */
    @SqlQuery("SELECT uuid, category, mime, created_at FROM image " +
            "WHERE category = :category " +
            "ORDER BY created_at DESC, uuid " +
            "LIMIT :limit OFFSET :skip")
    List<ImageRecord> listByCategory(@Bind("category") String category,
                                     @Bind("limit") int limit,
                                     @Bind("skip") int skip);
}
