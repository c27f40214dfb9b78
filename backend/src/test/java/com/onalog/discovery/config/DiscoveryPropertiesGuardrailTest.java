package com.onalog.discovery.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscoveryPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBotDefault() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().contains("OnalogLeadBot"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
    }

    @Test
    void schedulerSettingsStayInRange() {
        DiscoveryProperties.Scheduler scheduler = new DiscoveryProperties().getScheduler();
        scheduler.setCooldownMs(-5);
        scheduler.setCreditedPriority(500);
        scheduler.setAnonymousTenant(" ");
        assertEquals(0, scheduler.getCooldownMs());
        assertEquals(100, scheduler.getCreditedPriority());
        assertEquals("anonymous", scheduler.getAnonymousTenant());
    }

    @Test
    void searchDefaultsFallBackWhenUnset() {
        DiscoveryProperties.Search search = new DiscoveryProperties().getSearch();
        search.setScrapeBackoffSeconds(List.of());
        search.setDirectoryCapFloor(20);
        search.setDirectoryCapCeiling(5);
        assertEquals(List.of(30, 60, 120), search.getScrapeBackoffSeconds());
        assertEquals(20, search.getDirectoryCapCeiling());
    }
}
