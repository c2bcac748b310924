package space.ketterling.marinedata.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class FieldCatalogTest {

    @Test
    void shouldParseMappingProperties() {
        Properties p = new Properties();
        p.setProperty("field.coops.water_level", "coops_realtime, marine_current_water_level, REAL");
        p.setProperty("field.coops.water_level_flags", "coops_realtime,marine_water_level_flags,VARCHAR(20)");
        p.setProperty("field.coops.next_high_level", "archive,marine_next_high_level,REAL");
        p.setProperty("field.ndbc.wave_height", "ndbc_data,marine_wave_height,DOUBLE");

        FieldCatalog catalog = FieldCatalog.fromProperties(p);

        assertThat(catalog.size()).isEqualTo(4);
        assertThat(catalog.lookup(Provider.COOPS, "water_level")).hasValue(new FieldMapping(Provider.COOPS,
                "water_level", "coops_realtime", "marine_current_water_level", FieldMapping.ValueType.REAL));
        assertThat(catalog.lookup(Provider.COOPS, "water_level_flags").map(FieldMapping::type))
                .hasValue(FieldMapping.ValueType.TEXT);
        assertThat(catalog.lookup(Provider.NDBC, "water_level")).isEmpty();
        assertThat(catalog.lookup(Provider.COOPS, "next_high_level").map(FieldMapping::archiveOnly)).hasValue(true);
        assertThat(catalog.columnsByTable())
                .containsOnlyKeys("coops_realtime", "ndbc_data")
                .containsEntry("coops_realtime", Set.of("marine_current_water_level", "marine_water_level_flags"));
    }

    @Test
    void shouldRejectBadMappings() {
        assertThatThrownBy(() -> FieldMapping.parse(Provider.COOPS, "water_level", "coops_realtime,level"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> FieldMapping.parse(Provider.COOPS, "water_level", "coops realtime,level,REAL"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> FieldMapping.parse(Provider.COOPS, "water_level", "t,c,BLOB"))
                .isInstanceOf(ConfigurationException.class);

        Properties unknownProvider = new Properties();
        unknownProvider.setProperty("field.shom.water_level", "t,c,REAL");
        assertThatThrownBy(() -> FieldCatalog.fromProperties(unknownProvider))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectDuplicateFields() {
        FieldMapping a = FieldMapping.parse(Provider.NDBC, "wave_height", "ndbc_data,wvht,REAL");
        FieldMapping b = FieldMapping.parse(Provider.NDBC, "wave_height", "ndbc_data,wave,REAL");

        assertThatThrownBy(() -> new FieldCatalog(List.of(a, b)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }
}
