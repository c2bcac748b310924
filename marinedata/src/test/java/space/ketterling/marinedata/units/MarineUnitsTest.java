package space.ketterling.marinedata.units;

import org.junit.jupiter.api.Test;
import space.ketterling.marinedata.config.ConfigurationException;

import static org.assertj.core.api.Assertions.*;

class MarineUnitsTest {

    @Test
    void shouldConvertMetricReadings() {
        assertThat(MarineUnits.metersToFeet(1.0)).isCloseTo(3.28084, within(1e-5));
        assertThat(MarineUnits.mpsToMph(10.0)).isCloseTo(22.36936, within(1e-5));
        assertThat(MarineUnits.celsiusToFahrenheit(-40.0)).isEqualTo(-40.0);
        assertThat(MarineUnits.hpaToInHg(1013.25)).isCloseTo(29.92, within(1e-2));
    }

    @Test
    void shouldLeavePlainQuantitiesAlone() {
        assertThat(MarineUnits.fromMetric(270.0, MarineUnits.Quantity.PLAIN, UnitSystem.US)).isEqualTo(270.0);
        assertThat(MarineUnits.fromMetric(20.0, MarineUnits.Quantity.TEMPERATURE, UnitSystem.METRIC))
                .isEqualTo(20.0);
    }

    @Test
    void shouldParseUnitSystemAliases() {
        assertThat(UnitSystem.parse("english")).isEqualTo(UnitSystem.US);
        assertThat(UnitSystem.parse("METRICWX")).isEqualTo(UnitSystem.METRIC);
        assertThat(UnitSystem.US.coopsUnits()).isEqualTo("english");
        assertThatThrownBy(() -> UnitSystem.parse("imperial")).isInstanceOf(ConfigurationException.class);
    }
}
