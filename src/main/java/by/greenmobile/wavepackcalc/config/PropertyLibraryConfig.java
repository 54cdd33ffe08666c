package by.greenmobile.wavepackcalc.config;

import by.greenmobile.wavepackcalc.entity.FluidProperties;
import by.greenmobile.wavepackcalc.entity.MaterialProperties;
import by.greenmobile.wavepackcalc.service.library.PropertyLibrary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the process-wide property library once: reference tables plus whatever
 * {@code wavepack.fluids.*} / {@code wavepack.materials.*} add or override.
 */
@Configuration
@Slf4j
public class PropertyLibraryConfig {

    @Bean
    public PropertyLibrary propertyLibrary(WavepackProperties props) {
        List<FluidProperties> fluids = new ArrayList<>(PropertyLibrary.REFERENCE_FLUIDS);
        props.getFluids().forEach((name, f) ->
                fluids.add(new FluidProperties(name, f.getDensity(), f.getViscosity())));

        List<MaterialProperties> materials = new ArrayList<>(PropertyLibrary.REFERENCE_MATERIALS);
        props.getMaterials().forEach((name, m) ->
                materials.add(new MaterialProperties(name, m.getDensity(),
                        m.getRelativePermittivity(), m.getRelativePermeability(), m.getRoughness())));

        PropertyLibrary library = new PropertyLibrary(fluids, materials);
        log.info("Property library ready: fluids={}, materials={}", library.fluidNames(), library.materialNames());
        return library;
    }
}
