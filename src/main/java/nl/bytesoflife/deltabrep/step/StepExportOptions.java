package nl.bytesoflife.deltabrep.step;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Options for {@link StepExporter}.
 *
 * <pre>
 * StepExportOptions options = StepExportOptions.defaults()
 *     .withProductName("CRATE 48x40")
 *     .withPmi(false);
 * </pre>
 *
 * Defaults come from the bundled {@code /step-export.properties} resource.
 */
public final class StepExportOptions {

    static final String DEFAULTS_RESOURCE = "/step-export.properties";
    static final String KEY_PRODUCT_NAME = "step.product-name";
    static final String KEY_INCLUDE_PMI = "step.include-pmi";

    private static volatile StepExportOptions cachedDefaults;

    private final String productName;
    private final boolean includePmi;

    public StepExportOptions(String productName, boolean includePmi) {
        this.productName = Objects.requireNonNull(productName, "productName");
        this.includePmi = includePmi;
    }

    public static StepExportOptions defaults() {
        if (cachedDefaults == null) {
            synchronized (StepExportOptions.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = loadDefaults();
                }
            }
        }
        return cachedDefaults;
    }

    public static StepExportOptions fromProperties(Properties props) {
        String name = props.getProperty(KEY_PRODUCT_NAME);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Missing property: " + KEY_PRODUCT_NAME);
        }
        boolean pmi = Boolean.parseBoolean(props.getProperty(KEY_INCLUDE_PMI, "true").trim());
        return new StepExportOptions(name.trim(), pmi);
    }

    private static StepExportOptions loadDefaults() {
        try (InputStream is = StepExportOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + DEFAULTS_RESOURCE);
            Properties props = new Properties();
            props.load(is);
            return fromProperties(props);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load STEP export defaults", e);
        }
    }

    public StepExportOptions withProductName(String productName) {
        return new StepExportOptions(productName, includePmi);
    }

    /**
     * Toggles the overall bounding-box PMI properties on the assembly.
     */
    public StepExportOptions withPmi(boolean includePmi) {
        return new StepExportOptions(productName, includePmi);
    }

    public String getProductName() {
        return productName;
    }

    public boolean isIncludePmi() {
        return includePmi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepExportOptions other)) return false;
        return includePmi == other.includePmi && productName.equals(other.productName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productName, includePmi);
    }

    @Override
    public String toString() {
        return "StepExportOptions[productName=" + productName + ", includePmi=" + includePmi + "]";
    }
}
