package by.greenmobile.wavepackcalc.service.library;

import by.greenmobile.wavepackcalc.entity.FluidProperties;
import by.greenmobile.wavepackcalc.entity.MaterialProperties;
import by.greenmobile.wavepackcalc.exception.UnknownLookupException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only fluid / material tables.
 *
 * Built once (see PropertyLibraryConfig) and shared by all solves without locking:
 * nothing can mutate the maps after construction. Later entries with the same name
 * override earlier ones, which is how configured entries replace reference values.
 */
public class PropertyLibrary {

    /** ~20°C values: density kg/m³, dynamic viscosity Pa·s. */
    public static final List<FluidProperties> REFERENCE_FLUIDS = List.of(
            new FluidProperties("Air", 1.225, 1.81e-5),
            new FluidProperties("Water", 998, 1.00e-3),
            new FluidProperties("Diesel", 830, 3.50e-3),
            new FluidProperties("Oil", 870, 8.00e-3),
            new FluidProperties("Gasoline", 740, 6.00e-4)
    );

    /** density kg/m³, εr, μr, roughness m. */
    public static final List<MaterialProperties> REFERENCE_MATERIALS = List.of(
            new MaterialProperties("Stainless Steel", 8000, 1.0, 1.05, 1.5e-6),
            new MaterialProperties("Aluminum", 2700, 1.0, 1.0, 1.2e-6),
            new MaterialProperties("Copper", 8960, 1.0, 0.999, 1.0e-6),
            new MaterialProperties("Brass", 8500, 1.0, 1.0, 1.3e-6),
            new MaterialProperties("Titanium", 4500, 1.0, 1.1, 1.7e-6)
    );

    private final Map<String, FluidProperties> fluids;
    private final Map<String, MaterialProperties> materials;

    public PropertyLibrary(Collection<FluidProperties> fluids, Collection<MaterialProperties> materials) {
        Map<String, FluidProperties> f = new LinkedHashMap<>();
        for (FluidProperties p : fluids) f.put(p.getName(), p);

        Map<String, MaterialProperties> m = new LinkedHashMap<>();
        for (MaterialProperties p : materials) m.put(p.getName(), p);

        this.fluids = Collections.unmodifiableMap(f);
        this.materials = Collections.unmodifiableMap(m);
    }

    /** Library with the reference dataset only. */
    public static PropertyLibrary defaults() {
        return new PropertyLibrary(REFERENCE_FLUIDS, REFERENCE_MATERIALS);
    }

    public FluidProperties lookupFluid(String name) {
        FluidProperties p = name == null ? null : fluids.get(name);
        if (p == null) {
            throw new UnknownLookupException("fluid", name,
                    "Unknown fluid '" + name + "'. Known: " + fluids.keySet());
        }
        return p;
    }

    public MaterialProperties lookupMaterial(String name) {
        MaterialProperties p = name == null ? null : materials.get(name);
        if (p == null) {
            throw new UnknownLookupException("material", name,
                    "Unknown material '" + name + "'. Known: " + materials.keySet());
        }
        return p;
    }

    public Set<String> fluidNames() {
        return fluids.keySet();
    }

    public Set<String> materialNames() {
        return materials.keySet();
    }
}
