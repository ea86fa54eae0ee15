package com.pitwall.cache;

import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyFactoryTest {

    @Test
    void sessionScopedKeyCarriesDriverAndCategorySegment() {
        FetchParams params = FetchParams.builder().sessionKey(9158).driverNumber(1).build();

        assertEquals("session:9158:driver:1:telemetry", CacheKeyFactory.build(DataCategory.CAR_DATA, params));
    }

    @Test
    void lapNumberIsPartOfSessionKey() {
        FetchParams params = FetchParams.builder().sessionKey(9158).driverNumber(44).lapNumber(12).build();

        assertEquals("session:9158:driver:44:lap:12:laps", CacheKeyFactory.build(DataCategory.LAPS, params));
    }

    @Test
    void remainingFiltersAreSortedAndEncoded() {
        FetchParams params = FetchParams.builder()
                .sessionKey(9158)
                .filter("flag", "YELLOW")
                .filter("category", "Flag")
                .build();

        assertEquals(
                "session:9158:race_control:category=Flag&flag=YELLOW",
                CacheKeyFactory.build(DataCategory.RACE_CONTROL, params)
        );
    }

    @Test
    void nonSessionQueryUsesFingerprintOrAll() {
        assertEquals("sessions:all", CacheKeyFactory.build(DataCategory.SESSIONS, FetchParams.empty()));

        FetchParams params = FetchParams.builder()
                .filter("year", 2023)
                .filter("country_name", "Italy")
                .build();

        assertEquals("sessions:country_name=Italy&year=2023", CacheKeyFactory.build(DataCategory.SESSIONS, params));
    }

    @Test
    void differentDriversNeverCollide() {
        String first = CacheKeyFactory.build(DataCategory.CAR_DATA,
                FetchParams.builder().sessionKey(9158).driverNumber(1).build());
        String second = CacheKeyFactory.build(DataCategory.CAR_DATA,
                FetchParams.builder().sessionKey(9158).driverNumber(16).build());
        String withoutDriver = CacheKeyFactory.build(DataCategory.CAR_DATA, FetchParams.forSession(9158));

        assertNotEquals(first, second);
        assertNotEquals(first, withoutDriver);
    }

    @Test
    void driverWithoutSessionGoesIntoFingerprint() {
        FetchParams params = FetchParams.builder().driverNumber(1).build();

        assertEquals("drivers:driver_number=1", CacheKeyFactory.build(DataCategory.DRIVERS, params));
    }

    @Test
    void everySessionKeySharesTheSessionPrefix() {
        String prefix = CacheKeyFactory.sessionPrefix(9158);

        for (DataCategory category : DataCategory.values()) {
            String key = CacheKeyFactory.build(category,
                    FetchParams.builder().sessionKey(9158).driverNumber(1).build());
            assertTrue(key.startsWith(prefix), key);
        }
        assertFalse(CacheKeyFactory.build(DataCategory.DRIVERS, FetchParams.forSession(91580)).startsWith(prefix));
    }

    @Test
    void identicalParamsProduceIdenticalKeys() {
        FetchParams a = FetchParams.builder().sessionKey(1).filter("b", "2").filter("a", "1").build();
        FetchParams b = FetchParams.builder().sessionKey(1).filter("a", "1").filter("b", "2").build();

        assertEquals(CacheKeyFactory.build(DataCategory.INTERVALS, a), CacheKeyFactory.build(DataCategory.INTERVALS, b));
    }
}
