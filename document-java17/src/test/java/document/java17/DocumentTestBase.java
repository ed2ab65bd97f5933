package document.java17;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for document tests. Emits an INFO banner per test.
public class DocumentTestBase extends DocumentLoggingConfig {

    protected static final Logger LOG = Logger.getLogger("document.java17");

    @BeforeEach
    public void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    protected static Document<String> leaf(String value) {
        return Document.leaf(value);
    }

    protected static Document<Integer> leaf(int value) {
        return Document.leaf(value);
    }
}
