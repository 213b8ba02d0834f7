package com.hydralog.backend.config;

import com.hydralog.backend.common.kv.CaffeineKeyValueStore;
import com.hydralog.backend.common.kv.FileKeyValueStore;
import com.hydralog.backend.common.kv.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class KeyValueStoreConfig {

    @Bean
    public KeyValueStore keyValueStore(SummaryCacheProperties props) {
        if (props.getStore() == SummaryCacheProperties.StoreType.MEMORY) {
            log.info("local key-value store: memory (maxEntries={})", props.getMemoryMaxEntries());
            return new CaffeineKeyValueStore(props.getMemoryMaxEntries());
        }
        FileKeyValueStore store = new FileKeyValueStore(props.getBaseDir());
        log.info("local key-value store: file ({})", store.getBaseDir());
        return store;
    }
}
