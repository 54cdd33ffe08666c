package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.config.WavepackProperties;
import by.greenmobile.wavepackcalc.entity.LayoutPolicy;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.service.engine.ArraySynthesizer;
import by.greenmobile.wavepackcalc.service.engine.TemperatureInterpolator;
import by.greenmobile.wavepackcalc.service.library.PropertyLibrary;
import by.greenmobile.wavepackcalc.service.physics.AttenuationModel;
import by.greenmobile.wavepackcalc.service.physics.FlowSolver;

/**
 * Facade wired by hand with the default tables, plus the scenarios used across tests.
 */
public final class WavepackFixtures {

    private WavepackFixtures() {}

    public static WavepackFacade facade() {
        return facade(new WavepackProperties());
    }

    public static WavepackFacade facade(LayoutPolicy policy) {
        WavepackProperties props = new WavepackProperties();
        props.getLayout().setPolicy(policy);
        return facade(props);
    }

    public static WavepackFacade facade(WavepackProperties props) {
        return new WavepackFacade(
                new InputNormalizer(),
                PropertyLibrary.defaults(),
                new TemperatureInterpolator(),
                new FlowSolver(),
                new AttenuationModel(),
                new ArraySynthesizer(props),
                props);
    }

    /** Air / Stainless Steel / Rectangular 2 x 1 x 0.05 x 6 in, 50 ft/s, 5 psi, 32..212 °F. */
    public static WavepackParameters reference() {
        return WavepackParameters.defaults();
    }

    /** Air / Aluminum, 0.5 in circular inline channels, 4 in long. */
    public static WavepackParameters circularInline() {
        return WavepackParameters.builder()
                .widthIn(0.5)
                .heightIn(7.0)
                .wallThicknessIn(0.04)
                .lengthIn(4.0)
                .shape("Circular-Inline")
                .material("Aluminum")
                .fluid("Air")
                .velocityTargetFts(30.0)
                .dpLimitPsi(2.0)
                .minTemperatureF(60.0)
                .maxTemperatureF(120.0)
                .build();
    }

    /** Water / Aluminum, staggered 0.5 in channels. */
    public static WavepackParameters staggeredWater() {
        WavepackParameters p = circularInline();
        p.setShape("Circular-Staggered");
        p.setFluid("Water");
        p.setVelocityTargetFts(2.0);
        p.setDpLimitPsi(5.0);
        return p;
    }
}
