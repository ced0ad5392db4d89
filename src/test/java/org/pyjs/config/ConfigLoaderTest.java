package org.pyjs.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.api.Strictness;
import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.api.TargetProfile;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: system properties override the file, which overrides
 * {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("pyjs.compiler.strictness");
        System.clearProperty("pyjs.compiler.docstrings");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadDefaults should return the reference options")
    void loadDefaults_shouldReturnReferenceOptions() {
        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.loadDefaults());

        assertEquals(4, options.indentWidth());
        assertEquals(TargetProfile.ES5, options.targetProfile());
        assertEquals(Strictness.FAIL_FAST, options.strictness());
        assertEquals(HelperLinking.INLINE, options.helperLinking());
        assertFalse(options.docstrings());
        assertTrue(options.allowedGlobals().contains("console"));
    }

    @Test
    @DisplayName("loadFromFile should override only the keys the file sets")
    void loadFromFile_shouldOverrideFileKeys() {
        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.loadFromFile(testResource("test-config.conf")));

        assertEquals(Strictness.BATCH, options.strictness());
        assertEquals(2, options.indentWidth());
        assertEquals(TargetProfile.ES2015, options.targetProfile());
        assertEquals("pyjs_runtime", options.runtimeModuleName());
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("pyjs.compiler.strictness", "fail-fast");
        System.setProperty("pyjs.compiler.docstrings", "true");
        ConfigFactory.invalidateCaches();

        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.loadFromFile(testResource("test-config.conf")));

        assertEquals(Strictness.FAIL_FAST, options.strictness());
        assertTrue(options.docstrings());
        assertEquals(2, options.indentWidth());
    }

    @Test
    @DisplayName("Explicit feature list and substitutions should resolve against the reference defaults")
    void loadFromFile_shouldResolveFeaturesAndSubstitutions() {
        Config config = ConfigLoader.loadFromFile(testResource("features-config.conf"));
        CompilerOptions options = CompilerOptions.fromConfig(config);

        assertTrue(options.targetProfile().supports(TargetFeature.GENERATORS));
        assertTrue(options.targetProfile().supports(TargetFeature.ASYNC));
        assertFalse(options.targetProfile().supports(TargetFeature.BLOCK_SCOPING));
        assertEquals(HelperLinking.EXTERNAL, options.helperLinking());
        assertEquals("rt", options.runtimeModuleName());
        assertEquals(4, options.allowedGlobals().size());
        assertEquals("document", options.allowedGlobals().get(3));
    }

    @Test
    @DisplayName("load should reject a missing explicit file")
    void load_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/pyjs.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("pyjs.conf"));
    }

    @Test
    @DisplayName("load should use an explicit file when given")
    void load_shouldUseExplicitFile() {
        Config config = ConfigLoader.load(testResource("test-config.conf"));

        assertEquals("batch", config.getString("pyjs.compiler.strictness"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
