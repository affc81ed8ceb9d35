package org.sensitiveword.service.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class FilterConfigTest {

    private static Properties defaults() {
        Properties properties = new Properties();
        properties.setProperty("server.host", "127.0.0.1");
        properties.setProperty("server.port", "3000");
        properties.setProperty("server.max.request.bytes", "10485760");
        properties.setProperty("data.path", "./data");
        properties.setProperty("index.rebuild.on.start", "false");
        properties.setProperty("filter.mask.char", "*");
        return properties;
    }

    @Test
    public void testDefaultsDeriveStoragePaths() {
        FilterConfig config = FilterConfig.from(defaults());

        assertEquals("127.0.0.1", config.server().host());
        assertEquals(3000, config.server().port());
        assertEquals(10485760L, config.server().maxRequestBytes());
        assertEquals('*', config.maskChar());
        assertFalse(config.rebuildOnStart());
        assertEquals(Paths.get("./data/models/source/dic.txt"), config.storage().dictionaryPath());
        assertEquals(Paths.get("./data/models/ac_index.bin"), config.storage().indexPath());
        assertEquals(Paths.get("./data/models/source"), config.storage().sourceDir());
    }

    @Test
    public void testExplicitPathsWin() {
        Properties properties = defaults();
        properties.setProperty("dictionary.path", "/etc/words.txt");
        properties.setProperty("index.path", "/var/cache/words.bin");

        FilterConfig config = FilterConfig.from(properties);

        assertEquals(Paths.get("/etc/words.txt"), config.storage().dictionaryPath());
        assertEquals(Paths.get("/var/cache/words.bin"), config.storage().indexPath());
    }

    @Test
    public void testArgumentsOverrideProperties() {
        Properties properties = defaults();
        FilterConfig.applyArguments(new String[]{
            "--host", "0.0.0.0", "--port", "8080", "--path", "/srv", "--filter.mask.char", "#", "-r"
        }, properties);

        FilterConfig config = FilterConfig.from(properties);

        assertEquals("0.0.0.0", config.server().host());
        assertEquals(8080, config.server().port());
        assertEquals('#', config.maskChar());
        assertTrue(config.rebuildOnStart());
        assertEquals(Paths.get("/srv/models/ac_index.bin"), config.storage().indexPath());
    }

    @Test
    public void testLongRebuildFlag() {
        Properties properties = defaults();
        FilterConfig.applyArguments(new String[]{"--rebuild"}, properties);

        assertTrue(FilterConfig.from(properties).rebuildOnStart());
    }

    @Test
    public void testUnrecognizedArgument() {
        assertThrows(IllegalStateException.class,
            () -> FilterConfig.applyArguments(new String[]{"serve"}, defaults()));
        assertThrows(IllegalStateException.class,
            () -> FilterConfig.applyArguments(new String[]{"--port"}, defaults()));
    }

    @Test
    public void testInvalidValues() {
        Properties badPort = defaults();
        badPort.setProperty("server.port", "70000");
        assertThrows(IllegalStateException.class, () -> FilterConfig.from(badPort));

        Properties notANumber = defaults();
        notANumber.setProperty("server.port", "http");
        assertThrows(IllegalStateException.class, () -> FilterConfig.from(notANumber));

        Properties badMask = defaults();
        badMask.setProperty("filter.mask.char", "**");
        assertThrows(IllegalStateException.class, () -> FilterConfig.from(badMask));

        Properties badFlag = defaults();
        badFlag.setProperty("index.rebuild.on.start", "yes");
        assertThrows(IllegalStateException.class, () -> FilterConfig.from(badFlag));

        Properties zeroLimit = defaults();
        zeroLimit.setProperty("server.max.request.bytes", "0");
        assertThrows(IllegalStateException.class, () -> FilterConfig.from(zeroLimit));
    }

    @Test
    public void testMissingRequiredKey() {
        Properties properties = defaults();
        properties.remove("server.host");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> FilterConfig.from(properties));
        assertTrue(e.getMessage().contains("server.host"));
    }

    @Test
    public void testHelpRequested() {
        assertTrue(FilterConfig.isHelpRequested(new String[]{"--port", "1", "-h"}));
        assertTrue(FilterConfig.isHelpRequested(new String[]{"--help"}));
        assertFalse(FilterConfig.isHelpRequested(new String[]{"--rebuild"}));
    }
}
