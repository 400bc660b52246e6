package com.tsgate.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Builds the single shared MongoDB client. The container closes it on shutdown.
 */
@Slf4j
@Configuration
public class MongoConfig {

    @Value("${tsgate.mongo.uri:mongodb://localhost:27017}")
    private String uri;

    @Value("${tsgate.mongo.database:telegrafData}")
    private String databaseName;

    @Value("${tsgate.mongo.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${tsgate.mongo.retry-reads:false}")
    private boolean retryReads;

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(uri);
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .retryReads(retryReads)
                .applyToSocketSettings(b -> b.connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(b -> b.serverSelectionTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS))
                .build();
        log.info("Creating MongoDB client (hosts={}, database={})", connectionString.getHosts(), databaseName);
        return MongoClients.create(settings);
    }

    @Bean
    public MongoDatabase metricsDatabase(MongoClient mongoClient) {
        return mongoClient.getDatabase(databaseName);
    }
}
