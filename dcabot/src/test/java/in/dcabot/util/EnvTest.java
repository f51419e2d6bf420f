package in.dcabot.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    @AfterEach
    void clear() {
        System.clearProperty("DCA_TEST_VALUE");
    }

    @Test
    void fallsBackToSystemPropertyThenDefault() {
        assertEquals("fallback", Env.get("DCA_TEST_VALUE", "fallback"));

        System.setProperty("DCA_TEST_VALUE", "set");
        assertEquals("set", Env.get("DCA_TEST_VALUE", "fallback"));
    }

    @Test
    void malformedNumbersUseDefault() {
        System.setProperty("DCA_TEST_VALUE", "abc");

        assertEquals(7, Env.getInt("DCA_TEST_VALUE", 7));
        assertEquals(Duration.ofSeconds(1), Env.getMillis("DCA_TEST_VALUE", Duration.ofSeconds(1)));
    }

    @Test
    void parsesTypedValues() {
        System.setProperty("DCA_TEST_VALUE", " 250 ");

        assertEquals(250, Env.getInt("DCA_TEST_VALUE", 0));
        assertEquals(Duration.ofMillis(250), Env.getMillis("DCA_TEST_VALUE", Duration.ZERO));
        assertFalse(Env.getBool("DCA_TEST_VALUE", true));

        System.setProperty("DCA_TEST_VALUE", "TRUE");
        assertTrue(Env.getBool("DCA_TEST_VALUE", false));
    }
}
