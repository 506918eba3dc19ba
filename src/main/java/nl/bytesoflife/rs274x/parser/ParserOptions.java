package nl.bytesoflife.rs274x.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Parser settings.
 *
 * <p>Settings can be read from a properties file using the keys {@code rs274x.ignoreInvalid},
 * {@code rs274x.ignoreBlank} and {@code rs274x.reuseOperationCode}. System properties with the
 * same keys take precedence. {@link #defaults()} reads {@code rs274x.properties} from the
 * classpath.
 */
public class ParserOptions {

    private static final Logger log = LoggerFactory.getLogger(ParserOptions.class);

    public static final String IGNORE_INVALID = "rs274x.ignoreInvalid";
    public static final String IGNORE_BLANK = "rs274x.ignoreBlank";
    public static final String REUSE_OPERATION_CODE = "rs274x.reuseOperationCode";

    private static final String DEFAULTS_RESOURCE = "/rs274x.properties";

    private boolean ignoreInvalid;
    private boolean ignoreBlank;
    private boolean reuseOperationCode;

    public boolean isIgnoreInvalid() {
        return ignoreInvalid;
    }

    /**
     * Accept unrecognized function codes and parameters, and operation codes standing alone.
     */
    public ParserOptions setIgnoreInvalid(boolean ignoreInvalid) {
        this.ignoreInvalid = ignoreInvalid;
        return this;
    }

    public boolean isIgnoreBlank() {
        return ignoreBlank;
    }

    /**
     * Leave draws with a zero-size aperture out of the bounding box.
     */
    public ParserOptions setIgnoreBlank(boolean ignoreBlank) {
        this.ignoreBlank = ignoreBlank;
        return this;
    }

    public boolean isReuseOperationCode() {
        return reuseOperationCode;
    }

    /**
     * Let any G-code command with coordinates omit its operation code, not only circular
     * interpolation.
     */
    public ParserOptions setReuseOperationCode(boolean reuseOperationCode) {
        this.reuseOperationCode = reuseOperationCode;
        return this;
    }

    /**
     * Options from the bundled {@code rs274x.properties}, with system property overrides.
     */
    public static ParserOptions defaults() {
        Properties props = new Properties();
        try (InputStream in = ParserOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return fromProperties(props);
    }

    public static ParserOptions load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return fromProperties(props);
    }

    public static ParserOptions fromProperties(Properties props) {
        return new ParserOptions()
                .setIgnoreInvalid(flag(props, IGNORE_INVALID))
                .setIgnoreBlank(flag(props, IGNORE_BLANK))
                .setReuseOperationCode(flag(props, REUSE_OPERATION_CODE));
    }

    private static boolean flag(Properties props, String key) {
        return Boolean.parseBoolean(System.getProperty(key, props.getProperty(key, "false")).trim());
    }

    @Override
    public String toString() {
        return "ParserOptions{ignoreInvalid=" + ignoreInvalid + ", ignoreBlank=" + ignoreBlank
                + ", reuseOperationCode=" + reuseOperationCode + "}";
    }
}
