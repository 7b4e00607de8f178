package io.shapeform.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module keeps Jackson as its only JSON stack and leaves the logging
 * backend to the host. Inspects the runtime classpath for the artifact paths of competing JSON
 * libraries and of SLF4J providers other than the test-scoped Logback.
 */
class CoreDependencyTest {

    /** Repository path fragments that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN_ARTIFACTS = List.of(
            "com/google/code/gson", // Gson
            "org/json/json", // org.json
            "jakarta/json", // JSON-P / JSON-B
            "javax/json", // legacy JSON-P
            "org/apache/logging/log4j/log4j-core", // Log4j 2 backend
            "org/slf4j/slf4j-simple", // SLF4J simple provider
            "org/slf4j/slf4j-reload4j" // SLF4J reload4j provider
            );

    @Test
    void coreClasspathCarriesOneJsonStackAndNoBundledLoggingBackend() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();
        classpath = classpath.replace('\\', '/');

        for (String forbidden : FORBIDDEN_ARTIFACTS) {
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbidden)
                    .doesNotContain(forbidden);
        }
    }
}
