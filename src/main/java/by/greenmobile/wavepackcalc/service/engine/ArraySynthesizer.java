package by.greenmobile.wavepackcalc.service.engine;

import by.greenmobile.wavepackcalc.config.WavepackProperties;
import by.greenmobile.wavepackcalc.entity.GeometrySpec;
import by.greenmobile.wavepackcalc.entity.LayoutPolicy;
import by.greenmobile.wavepackcalc.entity.MaterialProperties;
import by.greenmobile.wavepackcalc.exception.DomainException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Channel count, square layout, envelope and mass of the array.
 *
 * IMPORTANT: the channel count is a sizing heuristic, not a solve:
 *   N = clamp(floor(openRatio · dpLimit / (margin · rho · v²)), 1, maxChannels)
 * with margin = 0.1 (10% back-pressure allowance). It only says how many channels the
 * pressure budget can "pay for"; it does not balance the Darcy–Weisbach drop.
 *
 * Envelope: every channel occupies (a + 2t) × (b + 2t); mass = rho_material · (envelope − voids).
 */
@Component
@Slf4j
public class ArraySynthesizer {

    public static final int HARD_CHANNEL_CAP = 2500;

    private final double backPressureMargin;
    private final int maxChannels;
    private final LayoutPolicy layoutPolicy;

    public ArraySynthesizer(WavepackProperties props) {
        this.backPressureMargin = props.getSizing().getBackPressureMargin();
        this.maxChannels = props.getSizing().getMaxChannels();
        if (maxChannels < 1 || maxChannels > HARD_CHANNEL_CAP) {
            throw new IllegalArgumentException("wavepack.sizing.max-channels must be within 1.."
                    + HARD_CHANNEL_CAP + ", got " + maxChannels);
        }
        this.layoutPolicy = props.getLayout().getPolicy();
    }

    public LayoutPolicy getLayoutPolicy() {
        return layoutPolicy;
    }

    /**
     * Rectangular: 2ab/(a+b) (= 4·area/perimeter). Circular: the diameter.
     */
    public double hydraulicDiameter(GeometrySpec g) {
        requireGeometry(g);
        switch (g.getShape()) {
            case RECTANGULAR:
                return 2.0 * g.getWidth() * g.getHeight() / (g.getWidth() + g.getHeight());
            case CIRCULAR_INLINE:
            case CIRCULAR_STAGGERED:
                return g.getDiameter();
            default:
                throw new IllegalStateException("Unhandled shape " + g.getShape());
        }
    }

    public int requiredChannelCount(double openAreaRatio, double dpLimit, double density, double velocity) {
        if (!(dpLimit >= 0)) throw new DomainException("dp_limit_psi", dpLimit, "Pressure-drop limit must not be negative");
        if (!(density > 0)) throw new DomainException("density", density, "Fluid density must be positive");
        if (!(velocity > 0)) throw new DomainException("vel_target_fts", velocity, "Target velocity must be positive");

        double raw = openAreaRatio * dpLimit / (backPressureMargin * density * velocity * velocity);
        double floored = Math.floor(raw);

        int n;
        if (floored >= maxChannels) {
            n = maxChannels;
        } else if (floored < 1) {
            n = 1;
        } else {
            n = (int) floored;
        }

        log.debug("Channel count: raw={} -> N={} (ratio={}, margin={}, cap={})",
                raw, n, openAreaRatio, backPressureMargin, maxChannels);
        return n;
    }

    public ArrayLayout layout(int requiredChannels) {
        int side = (int) Math.floor(Math.sqrt(requiredChannels));
        // guard against sqrt rounding on large perfect squares
        while ((long) (side + 1) * (side + 1) <= requiredChannels) side++;
        while ((long) side * side > requiredChannels) side--;

        // rounding up must not provision past the configured cap
        if (layoutPolicy == LayoutPolicy.ROUND_UP && (long) side * side < requiredChannels
                && (long) (side + 1) * (side + 1) <= maxChannels) {
            side++;
        }
        side = Math.max(1, side);

        ArrayLayout layout = new ArrayLayout(side, side, requiredChannels);
        if (layout.getShortfall() > 0) {
            log.warn("Square layout {}x{} leaves {} of {} required channels unprovisioned (policy={})",
                    side, side, layout.getShortfall(), requiredChannels, layoutPolicy);
        }
        return layout;
    }

    public ArraySynthesis synthesize(GeometrySpec g, MaterialProperties material, int requiredChannels) {
        requireGeometry(g);
        ArrayLayout layout = layout(requiredChannels);

        double t = g.getWallThickness();
        double envelopeWidth = layout.getColumns() * (g.getWidth() + 2.0 * t);
        double envelopeHeight = layout.getRows() * (g.getHeight() + 2.0 * t);
        double envelopeVolume = envelopeWidth * envelopeHeight * g.getLength();
        double voidVolume = layout.getProvisionedChannels() * g.channelArea() * g.getLength();

        double solid = envelopeVolume - voidVolume;
        if (solid < 0) {
            throw new DomainException("t_in", t,
                    "Void volume exceeds envelope volume (" + voidVolume + " > " + envelopeVolume + " m³)");
        }
        double mass = material.getDensity() * solid;
        if (mass < 0) {
            throw new DomainException("material", material.getName(), "Negative material density gives negative mass");
        }

        log.debug("Array {}x{}: envelope {} x {} x {} m, void={} m³, mass={} kg",
                layout.getRows(), layout.getColumns(), envelopeWidth, envelopeHeight, g.getLength(), voidVolume, mass);
        return new ArraySynthesis(layout, envelopeWidth, envelopeHeight, envelopeVolume, voidVolume, mass);
    }

    private static void requireGeometry(GeometrySpec g) {
        if (!(g.getWidth() > 0)) throw new DomainException("a_in", g.getWidth(), "Channel width/diameter must be positive");
        if (!(g.getHeight() > 0)) throw new DomainException("b_in", g.getHeight(), "Channel height must be positive");
        if (!(g.getWallThickness() > 0)) throw new DomainException("t_in", g.getWallThickness(), "Wall thickness must be positive");
        if (!(g.getLength() > 0)) throw new DomainException("L_in", g.getLength(), "Channel length must be positive");
    }
}
