package com.example.scvl.cache;

import java.util.Optional;

/**
 * Fast, volatile tier holding {@code slug -> URL} and {@code slug -> OGP id}. Entries may vanish at
 * any time. Implementations never throw on backend failure: reads degrade to a miss and writes to a
 * no-op.
 */
public interface PageCache {

    Optional<String> getUrl(String slug);

    void setUrl(String slug, String url);

    /**
     * @return the cached OGP id, or {@code 0} when none is cached
     */
    long getOgpId(String slug);

    void setOgpId(String slug, long ogpId);

    void deleteOgpId(String slug);
}
