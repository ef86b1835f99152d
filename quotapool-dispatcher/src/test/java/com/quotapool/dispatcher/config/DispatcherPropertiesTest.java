package com.quotapool.dispatcher.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherPropertiesTest {

    @Test
    void defaultsAreValid() {
        DispatcherProperties properties = new DispatcherProperties();
        assertDoesNotThrow(properties::validate);
        assertEquals(10000, properties.getDailyQuotaLimit());
        assertEquals(8000, properties.getWarnThreshold());
        assertEquals(9500, properties.getEmergencyThreshold());
        assertEquals(3, properties.getMaxConsecutiveErrors());
    }

    @Test
    void warnAboveEmergencyRejected() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setWarnThreshold(9600);
        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void emergencyAboveLimitRejected() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setEmergencyThreshold(12000);
        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void equalThresholdsAllowed() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setWarnThreshold(10000);
        properties.setEmergencyThreshold(10000);
        assertDoesNotThrow(properties::validate);
    }

    @Test
    void zeroErrorLimitRejected() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setMaxConsecutiveErrors(0);
        assertThrows(IllegalStateException.class, properties::validate);
    }
}
