package com.work.shortkey.core.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.ReservedKey;
import com.work.shortkey.core.repository.ReservedKeyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requireValidIdentifier;

/**
 * 保留短键过滤器：全量集合缓存在进程内，大小写不敏感。
 * <p>
 * 缓存按 reservedRefresh 异步刷新；刷新失败时 Caffeine 保留旧集合继续服务。
 * 首次加载失败会直接抛出存储异常。
 */
@Service
public class ReservedKeyFilter {

    private static final Logger log = LoggerFactory.getLogger(ReservedKeyFilter.class);
    private static final String ALL = "all";

    private final ReservedKeyRepository reservedKeyRepository;
    private final LoadingCache<String, Set<String>> cache;

    public ReservedKeyFilter(ReservedKeyRepository reservedKeyRepository, ShortKeyConfig config) {
        this.reservedKeyRepository = requireNonNull(reservedKeyRepository, "reservedKeyRepository");
        requireNonNull(config, "config");
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .refreshAfterWrite(config.getReservedRefresh())
                .build(key -> loadAll());
    }

    public boolean isReserved(String candidate) {
        if (candidate == null) {
            return false;
        }
        return cache.get(ALL).contains(candidate.toLowerCase(Locale.ROOT));
    }

    /**
     * 立即丢弃缓存并重新加载。
     *
     * @return 重新加载后的保留短键数量
     */
    public int reload() {
        cache.invalidate(ALL);
        int size = cache.get(ALL).size();
        log.info("reserved keys reloaded size={}", size);
        return size;
    }

    /**
     * 新增保留短键（先落库再 reload）。
     *
     * @return 是否为新插入
     */
    public boolean addReserved(String value, String reason) {
        String normalized = requireValidIdentifier(value).toLowerCase(Locale.ROOT);
        boolean inserted = reservedKeyRepository.insertIfAbsent(normalized, reason);
        reload();
        return inserted;
    }

    public int size() {
        return cache.get(ALL).size();
    }

    private Set<String> loadAll() {
        Set<String> values = new HashSet<>();
        for (ReservedKey key : reservedKeyRepository.listAll()) {
            values.add(key.getValue().toLowerCase(Locale.ROOT));
        }
        log.debug("reserved keys loaded size={}", values.size());
        return Collections.unmodifiableSet(values);
    }
}
