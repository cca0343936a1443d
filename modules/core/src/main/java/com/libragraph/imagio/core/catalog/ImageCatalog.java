package com.libragraph.imagio.core.catalog;

import com.libragraph.imagio.core.dao.ImageDao;
import com.libragraph.imagio.core.dao.ImageRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.List;

/**
 * Metadata store: get / put / delete / list over the {@code image} table.
 */
@ApplicationScoped
public class ImageCatalog {

    static final int MAX_PAGE_SIZE = 1000;

    @Inject
    Jdbi jdbi;

    /**
     * @throws ImageNotFoundException if no record exists for the uuid
     */
    public ImageRecord get(String uuid) {
        return jdbi.withExtension(ImageDao.class, dao -> dao.findByUuid(uuid))
                .orElseThrow(() -> new ImageNotFoundException(uuid));
    }

    public void put(ImageRecord record) {
        jdbi.useExtension(ImageDao.class, dao -> dao.insert(record));
    }

    /**
     * Removes the record and returns what was removed.
     *
     * @throws ImageNotFoundException if no record exists for the uuid
     */
    public ImageRecord delete(String uuid) {
        return jdbi.inTransaction(h -> {
            ImageDao dao = h.attach(ImageDao.class);
            ImageRecord record = dao.findByUuid(uuid)
                    .orElseThrow(() -> new ImageNotFoundException(uuid));
            dao.deleteByUuid(uuid);
            return record;
        });
    }

    /** Records in a category, newest first. */
    public List<ImageRecord> list(String category, int limit, int skip) {
        if (limit < 0 || skip < 0) {
            throw new IllegalArgumentException("limit and skip must be >= 0");
        }
        int pageSize = Math.min(limit, MAX_PAGE_SIZE);
        return jdbi.withExtension(ImageDao.class, dao -> dao.listByCategory(category, pageSize, skip));
    }
}
