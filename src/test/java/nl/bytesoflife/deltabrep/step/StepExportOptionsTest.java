package nl.bytesoflife.deltabrep.step;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class StepExportOptionsTest {

    @Test
    void defaultsComeFromBundledResource() {
        StepExportOptions defaults = StepExportOptions.defaults();
        assertEquals("AUTOCRATE CRATE ASSEMBLY", defaults.getProductName());
        assertTrue(defaults.isIncludePmi());
        assertSame(defaults, StepExportOptions.defaults());
    }

    @Test
    void withersReturnModifiedCopies() {
        StepExportOptions defaults = StepExportOptions.defaults();
        StepExportOptions custom = defaults.withProductName("CRATE 48x40").withPmi(false);

        assertEquals("CRATE 48x40", custom.getProductName());
        assertFalse(custom.isIncludePmi());
        assertEquals("AUTOCRATE CRATE ASSEMBLY", defaults.getProductName());
        assertTrue(defaults.isIncludePmi());
        assertEquals(new StepExportOptions("CRATE 48x40", false), custom);
    }

    @Test
    void fromPropertiesParsesValues() {
        Properties props = new Properties();
        props.setProperty(StepExportOptions.KEY_PRODUCT_NAME, "  SHIPPING CRATE ");
        props.setProperty(StepExportOptions.KEY_INCLUDE_PMI, "false");

        StepExportOptions options = StepExportOptions.fromProperties(props);
        assertEquals("SHIPPING CRATE", options.getProductName());
        assertFalse(options.isIncludePmi());
    }

    @Test
    void fromPropertiesDefaultsPmiToTrue() {
        Properties props = new Properties();
        props.setProperty(StepExportOptions.KEY_PRODUCT_NAME, "X");
        assertTrue(StepExportOptions.fromProperties(props).isIncludePmi());
    }

    @Test
    void missingProductNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StepExportOptions.fromProperties(new Properties()));
        assertThrows(NullPointerException.class, () -> new StepExportOptions(null, true));
    }
}
