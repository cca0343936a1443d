package com.libragraph.imagio.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * Metadata for one stored image. The uuid is assigned once at upload and
 * denotes exactly one immutable original byte stream.
 */
public record ImageRecord(
        @ColumnName("uuid") String uuid,
        @ColumnName("category") String category,
        @ColumnName("mime") String mime,
        @ColumnName("created_at") Instant createdAt
) {}
