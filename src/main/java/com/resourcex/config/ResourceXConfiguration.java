package com.resourcex.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.resourcex.collection.CollectionComposer;
import com.resourcex.index.FileIndexCache;
import com.resourcex.store.JsonResourceStoreReader;
import com.resourcex.store.ResourceStoreReader;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.List;

/**
 * Application configuration for ResourceX
 */
@Configuration
@EnableConfigurationProperties(ResourceXProperties.class)
public class ResourceXConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(destroyMethod = "close")
    public FileIndexCache indexCache(ResourceXProperties properties) {
        String cacheDir = properties.getCacheDir();
        if (cacheDir == null || cacheDir.isBlank()) {
            return FileIndexCache.temporary();
        }
        return FileIndexCache.inDirectory(Paths.get(cacheDir));
    }

    @Bean
    public JsonResourceStoreReader jsonResourceStoreReader(ObjectMapper objectMapper) {
        return new JsonResourceStoreReader(objectMapper);
    }

    @Bean
    public CollectionComposer collectionComposer(FileIndexCache indexCache, List<ResourceStoreReader> readers,
                                                 ResourceXProperties properties) {
        return new CollectionComposer(indexCache, readers, properties.isValidateShards());
    }
}
