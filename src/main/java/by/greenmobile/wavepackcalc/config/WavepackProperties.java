package by.greenmobile.wavepackcalc.config;

import by.greenmobile.wavepackcalc.entity.LayoutPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solver tuning knobs. Defaults reproduce the reference Wavepack behaviour,
 * so a plain {@code new WavepackProperties()} is a valid configuration for unit tests.
 */
@Data
@ConfigurationProperties(prefix = "wavepack")
public class WavepackProperties {

    private Sizing sizing = new Sizing();
    private Layout layout = new Layout();
    private Sweep sweep = new Sweep();
    private Temperature temperature = new Temperature();

    /** Extra fluids merged over the built-in library, keyed by display name. */
    private Map<String, Fluid> fluids = new LinkedHashMap<>();

    /** Extra materials merged over the built-in library, keyed by display name. */
    private Map<String, Material> materials = new LinkedHashMap<>();

    @Data
    public static class Sizing {
        /** Share of the pressure budget kept as back-pressure margin in the channel-count heuristic. */
        private double backPressureMargin = 0.1;
        private int maxChannels = 2500;
    }

    @Data
    public static class Layout {
        private LayoutPolicy policy = LayoutPolicy.ROUND_UP;
    }

    @Data
    public static class Sweep {
        /** First decade of the frequency sweep: 10^startDecade Hz. */
        private int startDecade = 5;
        private int endDecade = 10;
    }

    @Data
    public static class Temperature {
        private int samples = 10;
    }

    @Data
    public static class Fluid {
        private double density;
        private double viscosity;
    }

    @Data
    public static class Material {
        private double density;
        private double relativePermittivity = 1.0;
        private double relativePermeability = 1.0;
        private double roughness;
    }
}
