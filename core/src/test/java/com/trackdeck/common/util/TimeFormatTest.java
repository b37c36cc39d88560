package com.trackdeck.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimeFormatTest {

    @Test
    void testMinutesSeconds() {
        assertEquals("03:05", TimeFormat.minutesSeconds(185));
        assertEquals("00:00", TimeFormat.minutesSeconds(-4));
        assertEquals("61:01", TimeFormat.minutesSeconds(3661), "minutes are not wrapped into hours");
    }

    @Test
    void testHoursMinutesSeconds() {
        assertEquals("01:01:01", TimeFormat.hoursMinutesSeconds(3661));
        assertEquals("00:00:59", TimeFormat.hoursMinutesSeconds(59));
    }

    @Test
    void testParseSeconds() {
        assertEquals(185, TimeFormat.parseSeconds("03:05"));
        assertEquals(3661, TimeFormat.parseSeconds("1:01:01"));
        assertEquals(42, TimeFormat.parseSeconds("42"));
        assertEquals(0, TimeFormat.parseSeconds(""));
        assertEquals(0, TimeFormat.parseSeconds(null));
        assertEquals(5, TimeFormat.parseSeconds("xx:05"), "unparseable parts are skipped");
    }
}
