package org.audioshelf.service.source.catalog;

import org.audioshelf.exception.SourceUnavailableException;

/**
 * Wire client of a bibliographic search API. Endpoints and credentials are the implementation's
 * concern; pages are zero-based.
 */
public interface CatalogClient {

    CatalogPage search(CatalogQuery query, int page) throws SourceUnavailableException;

    default boolean isAvailable() {
        return true;
    }
}
