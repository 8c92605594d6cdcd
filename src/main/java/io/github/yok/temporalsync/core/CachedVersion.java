package io.github.yok.temporalsync.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Cache entry for the current version of one natural key: its content digest and surrogate id.
 */
@Getter
@RequiredArgsConstructor
public final class CachedVersion {

    private final String digest;

    private final Long id;

    @Override
    public String toString() {
        return "CachedVersion[id=" + id + ", digest=" + digest + "]";
    }
}
