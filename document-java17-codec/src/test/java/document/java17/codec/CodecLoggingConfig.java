package document.java17.codec;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Configures JUL for codec tests from `java.util.logging.ConsoleHandler.level`.
public class CodecLoggingConfig {
    @BeforeAll
    public static void enableJulDebug() {
        final var log = Logger.getLogger(CodecLoggingConfig.class.getName());
        Logger root = Logger.getLogger("");
        String levelProp = System.getProperty("java.util.logging.ConsoleHandler.level");
        Level targetLevel = Level.INFO;
        if (levelProp != null) {
            try {
                targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                log.warning(() -> "Unrecognized logging level: " + levelProp);
            }
        }
        if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
            root.setLevel(targetLevel);
        }
        for (Handler handler : root.getHandlers()) {
            Level handlerLevel = handler.getLevel();
            if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
                handler.setLevel(targetLevel);
            }
        }
    }
}
