package com.clapgrow.tracking.api.classifier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class UserAgentParserTest {

    @Test
    void detectsDeviceTypes() {
        assertEquals("tablet", UserAgentParser.parse(
            "Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X) AppleWebKit/605.1.15").deviceType());
        assertEquals("mobile", UserAgentParser.parse(
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) AppleWebKit/605.1.15 Mobile/15E148").deviceType());
        assertEquals("mobile", UserAgentParser.parse(
            "Mozilla/5.0 (Linux; Android 14; Pixel 8)").deviceType());
        assertEquals("desktop", UserAgentParser.parse(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64)").deviceType());
    }

    @Test
    void detectsMailClients() {
        assertEquals("Outlook", UserAgentParser.parse("Microsoft Outlook 16.0").clientName());
        assertEquals("Thunderbird", UserAgentParser.parse(
            "Mozilla/5.0 (X11; Linux x86_64; rv:115.0) Gecko/20100101 Thunderbird/115.3.1").clientName());
        assertEquals("Apple Mail", UserAgentParser.parse(
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko)").clientName());
        assertEquals("Yahoo Mail", UserAgentParser.parse("YahooMailProxy; https://help.yahoo.com").clientName());
        assertEquals(UserAgentParser.UNKNOWN_CLIENT, UserAgentParser.parse(
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 Version/17.0 Safari/605.1.15").clientName());
    }

    @Test
    void missingUserAgentHasNoDevice() {
        UserAgentParser.ClientInfo info = UserAgentParser.parse(null);

        assertNull(info.deviceType());
        assertEquals(UserAgentParser.UNKNOWN_CLIENT, info.clientName());
    }
}
