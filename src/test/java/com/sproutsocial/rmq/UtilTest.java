package com.sproutsocial.rmq;

import org.junit.Test;

import static org.junit.Assert.*;

public class UtilTest {

    @Test
    public void testSizeString() {
        assertEquals("0 bytes", Util.toSizeString(0));
        assertEquals("1023 bytes", Util.toSizeString(1023));
        assertEquals("1 KB", Util.toSizeString(1024));
        assertEquals("1.5 KB", Util.toSizeString(1536));
        assertEquals("2.25 MB", Util.toSizeString(2359296));
        assertEquals("1 GB", Util.toSizeString(1024L * 1024 * 1024));
    }

    @Test
    public void testElapsedTime() {
        assertEquals("0ms", Util.elapsedTimeString(0));
        assertEquals("1s 5ms", Util.elapsedTimeString(1005));
        assertEquals("1m 5s 20ms", Util.elapsedTimeString(65020));
        assertEquals("1h 0ms", Util.elapsedTimeString(3600000));
    }

    @Test
    public void testMessageCount() {
        assertEquals("1 message", Util.messageCountString(1));
        assertEquals("3 messages", Util.messageCountString(3));
        assertEquals("0 messages", Util.messageCountString(0));
    }

}
