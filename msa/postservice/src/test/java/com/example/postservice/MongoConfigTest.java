package com.example.postservice;

import com.mongodb.MongoClientSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MongoConfigTest {

    private final MongoConfig mongoConfig = new MongoConfig();

    @Test
    void appliesStoreTimeoutToDriverSettings() {
        MongoClientSettings.Builder builder = MongoClientSettings.builder();
        mongoConfig.storeTimeoutCustomizer(Duration.ofSeconds(5)).customize(builder);
        MongoClientSettings settings = builder.build();

        assertEquals(5000, settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
        assertEquals(5000, settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
        assertEquals(5000L, settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
    }

    @Test
    void rejectsTimeoutBeyondSocketRange() {
        assertThrows(ArithmeticException.class,
                () -> mongoConfig.storeTimeoutCustomizer(Duration.ofDays(30)));
    }
}
