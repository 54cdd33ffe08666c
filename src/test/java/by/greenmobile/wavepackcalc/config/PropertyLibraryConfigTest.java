package by.greenmobile.wavepackcalc.config;

import by.greenmobile.wavepackcalc.entity.LayoutPolicy;
import by.greenmobile.wavepackcalc.service.library.PropertyLibrary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropertyLibraryConfigTest {

    @Configuration
    @EnableConfigurationProperties(WavepackProperties.class)
    static class PropsConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(PropsConfig.class, PropertyLibraryConfig.class);

    @Test
    @DisplayName("Configured fluids and materials are merged over the reference tables")
    void mergesConfiguredEntries() {
        runner.withPropertyValues(
                        "wavepack.fluids.Kerosene.density=810",
                        "wavepack.fluids.Kerosene.viscosity=1.64e-3",
                        "wavepack.fluids.Air.density=1.2",
                        "wavepack.fluids.Air.viscosity=1.8e-5",
                        "wavepack.materials.Nickel.density=8908",
                        "wavepack.materials.Nickel.relative-permeability=100",
                        "wavepack.materials.Nickel.roughness=1.5e-6")
                .run(ctx -> {
                    PropertyLibrary library = ctx.getBean(PropertyLibrary.class);

                    assertEquals(810, library.lookupFluid("Kerosene").getDensity(), 0.0);
                    assertEquals(1.2, library.lookupFluid("Air").getDensity(), 0.0);
                    assertEquals(100, library.lookupMaterial("Nickel").getRelativePermeability(), 0.0);
                    assertEquals(1.0, library.lookupMaterial("Nickel").getRelativePermittivity(), 0.0);
                    assertTrue(library.materialNames().contains("Stainless Steel"));
                });
    }

    @Test
    @DisplayName("Tuning properties bind with relaxed names")
    void bindsTuning() {
        runner.withPropertyValues(
                        "wavepack.layout.policy=truncate",
                        "wavepack.sizing.max-channels=400",
                        "wavepack.temperature.samples=5")
                .run(ctx -> {
                    WavepackProperties props = ctx.getBean(WavepackProperties.class);

                    assertEquals(LayoutPolicy.TRUNCATE, props.getLayout().getPolicy());
                    assertEquals(400, props.getSizing().getMaxChannels());
                    assertEquals(5, props.getTemperature().getSamples());
                    assertEquals(0.1, props.getSizing().getBackPressureMargin(), 0.0);
                });
    }
}
