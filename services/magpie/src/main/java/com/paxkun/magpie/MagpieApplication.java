package com.paxkun.magpie;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Locale;
import java.util.Map;

/**
 * Magpie entry point: archives one comic book per invocation from the command line.
 */
@SpringBootApplication
public class MagpieApplication {
    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MagpieApplication.class);
        // --show-index needs AWT, which only works with a display
        application.setHeadless(!hasDisplay(System.getProperty("os.name", ""), System.getenv()));
        System.exit(SpringApplication.exit(application.run(args)));
    }

    static boolean hasDisplay(String osName, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows") || os.startsWith("mac")) {
            return true;
        }
        return isSet(env.get("DISPLAY")) || isSet(env.get("WAYLAND_DISPLAY"));
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
